package org.air.statements;

import lombok.Getter;
import org.air.expressions.Expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 携带恰好一个表达式、没有子语句的语句 (assume / assert / assign)。
 */
@Getter
public abstract class LeafStatement extends Statement {

    private final Expression expression;

    protected LeafStatement(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "Statement expression cannot be null");
    }

    /**
     * 用新的表达式重建此语句，其余字段保持不变。
     */
    public abstract LeafStatement withExpression(Expression expression);

    @Override
    public List<Statement> getStatements() {
        return Collections.emptyList();
    }

    @Override
    public Statement withStatements(List<Statement> statements) {
        if (!statements.isEmpty()) {
            throw new IllegalArgumentException(getKind() + " 语句没有子语句");
        }
        return this;
    }
}
