package org.air.statements;

import lombok.Getter;
import org.air.core.Ident;
import org.air.expressions.Expression;

import java.util.Objects;

/**
 * 对 declare-var 声明的可变变量赋值，唯一的变异语句。
 */
@Getter
public final class Assign extends LeafStatement {

    private final Ident variable;

    private Assign(Ident variable, Expression expression) {
        super(expression);
        this.variable = Objects.requireNonNull(variable, "Assign variable cannot be null");
    }

    public static Assign of(Ident variable, Expression expression) {
        return new Assign(variable, expression);
    }

    public static Assign of(String variable, Expression expression) {
        return new Assign(Ident.of(variable), expression);
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGN;
    }

    @Override
    public LeafStatement withExpression(Expression expression) {
        return expression == getExpression() ? this : new Assign(variable, expression);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Assign that = (Assign) o;
        return variable.equals(that.variable) && getExpression().equals(that.getExpression());
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, getExpression());
    }

    @Override
    public String toString() {
        return "(assign " + variable + " " + getExpression() + ")";
    }
}
