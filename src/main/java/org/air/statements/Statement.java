package org.air.statements;

import java.util.List;

/**
 * AIR 命令式语句的公共基类。
 * assign 是唯一有副作用的语句；block 定义赋值和假设的词法嵌套范围。
 * 所有语句都是不可变的。
 */
public abstract class Statement {

    public enum Kind {
        ASSUME,
        ASSERT,
        ASSIGN,
        BLOCK
    }

    public abstract Kind getKind();

    /**
     * @return 直接子语句；只有 block 有子语句。
     */
    public abstract List<Statement> getStatements();

    /**
     * 用新的子语句重建此节点，子语句均未改变时返回 this。
     */
    public abstract Statement withStatements(List<Statement> statements);
}
