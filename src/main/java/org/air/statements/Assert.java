package org.air.statements;

import lombok.Getter;
import org.air.expressions.Expression;

import java.util.Objects;

/**
 * 带标签的断言。标签在一个查询内必须唯一，失败时用于定位反例。
 */
@Getter
public final class Assert extends LeafStatement {

    private final String label;

    private Assert(String label, Expression expression) {
        super(expression);
        this.label = Objects.requireNonNull(label, "Assert label cannot be null");
    }

    public static Assert of(String label, Expression expression) {
        return new Assert(label, expression);
    }

    @Override
    public Kind getKind() {
        return Kind.ASSERT;
    }

    @Override
    public LeafStatement withExpression(Expression expression) {
        return expression == getExpression() ? this : new Assert(label, expression);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Assert that = (Assert) o;
        return label.equals(that.label) && getExpression().equals(that.getExpression());
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, getExpression());
    }

    @Override
    public String toString() {
        return "(assert \"" + label + "\" " + getExpression() + ")";
    }
}
