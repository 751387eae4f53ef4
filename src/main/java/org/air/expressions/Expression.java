package org.air.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import org.air.core.AirUsageException;
import org.air.core.Ident;

import java.util.Arrays;
import java.util.List;

/**
 * AIR 纯表达式的公共基类。
 * 所有表达式都是不可变的持久化树，子树在重写时被结构共享而不是深拷贝。
 * 子类只负责构造、结构相等和 S 表达式形式的 toString。
 */
public abstract class Expression implements ToZ3Expr {

    public enum Kind {
        CONSTANT,
        VARIABLE,
        UNARY,
        BINARY,
        MULTI,
        APPLY,
        LABELED
    }

    public abstract Kind getKind();

    /**
     * @return 按从左到右顺序排列的直接子表达式。叶子节点返回空列表。
     */
    public abstract List<Expression> getChildren();

    /**
     * 用新的子表达式重建此节点。
     * 如果每个新子节点都与旧子节点是同一个实例，则返回 this，以保持结构共享。
     * @param children 与 getChildren() 等长的新子节点列表。
     * @return 重建后的表达式。
     */
    public abstract Expression withChildren(List<Expression> children);

    protected static boolean sameChildren(List<Expression> oldChildren, List<Expression> newChildren) {
        if (oldChildren.size() != newChildren.size()) {
            throw new IllegalArgumentException("子节点数量不一致: " + oldChildren.size() + " vs " + newChildren.size());
        }
        for (int i = 0; i < oldChildren.size(); i++) {
            if (oldChildren.get(i) != newChildren.get(i)) {
                return false;
            }
        }
        return true;
    }

    // --- Z3 转换辅助 ---

    protected static BoolExpr asBool(Expr expr, Expression source) {
        if (expr instanceof BoolExpr) {
            return (BoolExpr) expr;
        }
        throw new AirUsageException("期望布尔表达式，实际为 " + expr.getSort() + ": " + source);
    }

    protected static ArithExpr asArith(Expr expr, Expression source) {
        if (expr instanceof ArithExpr) {
            return (ArithExpr) expr;
        }
        throw new AirUsageException("期望整数表达式，实际为 " + expr.getSort() + ": " + source);
    }

    protected static IntExpr asInt(Expr expr, Expression source) {
        if (expr instanceof IntExpr) {
            return (IntExpr) expr;
        }
        throw new AirUsageException("期望整数表达式，实际为 " + expr.getSort() + ": " + source);
    }

    // --- 工厂方法 ---

    public static Expression bool(boolean value) {
        return Constant.of(value);
    }

    public static Expression num(long value) {
        return Constant.of(value);
    }

    public static Expression var(String name) {
        return Variable.of(Ident.of(name));
    }

    public static Expression not(Expression e) {
        return UnaryExpression.of(UnaryOp.NOT, e);
    }

    public static Expression implies(Expression lhs, Expression rhs) {
        return BinaryExpression.of(BinaryOp.IMPLIES, lhs, rhs);
    }

    public static Expression eq(Expression lhs, Expression rhs) {
        return BinaryExpression.of(BinaryOp.EQ, lhs, rhs);
    }

    public static Expression le(Expression lhs, Expression rhs) {
        return BinaryExpression.of(BinaryOp.LE, lhs, rhs);
    }

    public static Expression ge(Expression lhs, Expression rhs) {
        return BinaryExpression.of(BinaryOp.GE, lhs, rhs);
    }

    public static Expression lt(Expression lhs, Expression rhs) {
        return BinaryExpression.of(BinaryOp.LT, lhs, rhs);
    }

    public static Expression gt(Expression lhs, Expression rhs) {
        return BinaryExpression.of(BinaryOp.GT, lhs, rhs);
    }

    public static Expression and(Expression... args) {
        return MultiExpression.of(MultiOp.AND, Arrays.asList(args));
    }

    public static Expression or(Expression... args) {
        return MultiExpression.of(MultiOp.OR, Arrays.asList(args));
    }

    public static Expression add(Expression... args) {
        return MultiExpression.of(MultiOp.ADD, Arrays.asList(args));
    }

    public static Expression sub(Expression... args) {
        return MultiExpression.of(MultiOp.SUB, Arrays.asList(args));
    }

    public static Expression mul(Expression... args) {
        return MultiExpression.of(MultiOp.MUL, Arrays.asList(args));
    }

    public static Expression apply(String function, Expression... args) {
        return Application.of(Ident.of(function), Arrays.asList(args));
    }
}
