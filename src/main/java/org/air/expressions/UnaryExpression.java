package org.air.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.air.symbolic.Z3SymbolTable;

import java.util.List;
import java.util.Objects;

@Getter
public final class UnaryExpression extends Expression {

    private final UnaryOp op;
    private final Expression arg;

    private UnaryExpression(UnaryOp op, Expression arg) {
        this.op = Objects.requireNonNull(op, "UnaryExpression: op 不能为 null");
        this.arg = Objects.requireNonNull(arg, "UnaryExpression: arg 不能为 null");
    }

    public static UnaryExpression of(UnaryOp op, Expression arg) {
        return new UnaryExpression(op, arg);
    }

    @Override
    public Kind getKind() {
        return Kind.UNARY;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(arg);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        if (sameChildren(getChildren(), children)) {
            return this;
        }
        return new UnaryExpression(op, children.get(0));
    }

    @Override
    public Expr toZ3Expr(Context ctx, Z3SymbolTable symbols) {
        Expr z3Arg = arg.toZ3Expr(ctx, symbols);
        return switch (op) {
            case NOT -> ctx.mkNot(asBool(z3Arg, arg));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnaryExpression that = (UnaryExpression) o;
        return op == that.op && arg.equals(that.arg);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, arg);
    }

    @Override
    public String toString() {
        return "(" + op.getSymbol() + " " + arg + ")";
    }
}
