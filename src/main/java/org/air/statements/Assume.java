package org.air.statements;

import org.air.expressions.Expression;

public final class Assume extends LeafStatement {

    private Assume(Expression expression) {
        super(expression);
    }

    public static Assume of(Expression expression) {
        return new Assume(expression);
    }

    @Override
    public Kind getKind() {
        return Kind.ASSUME;
    }

    @Override
    public LeafStatement withExpression(Expression expression) {
        return expression == getExpression() ? this : new Assume(expression);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return getExpression().equals(((Assume) o).getExpression());
    }

    @Override
    public int hashCode() {
        return getExpression().hashCode() * 31 + 1;
    }

    @Override
    public String toString() {
        return "(assume " + getExpression() + ")";
    }
}
