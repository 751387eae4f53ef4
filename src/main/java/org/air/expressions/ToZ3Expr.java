package org.air.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.air.symbolic.Z3SymbolTable;

/**
 * 定义将 AIR 表达式转换为 Z3 表达式的接口。
 */
public interface ToZ3Expr {

    /**
     * 将此对象转换为 Z3 表达式。
     * @param ctx Z3 Context 实例。
     * @param symbols Z3SymbolTable 实例，用于把标识符解析为 Z3 常量、函数和排序。
     * @return 对应的 Z3 Expr。
     */
    Expr toZ3Expr(Context ctx, Z3SymbolTable symbols);
}
