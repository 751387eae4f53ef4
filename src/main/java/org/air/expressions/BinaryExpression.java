package org.air.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.air.symbolic.Z3SymbolTable;

import java.util.List;
import java.util.Objects;

@Getter
public final class BinaryExpression extends Expression {

    private final BinaryOp op;
    private final Expression lhs;
    private final Expression rhs;

    private BinaryExpression(BinaryOp op, Expression lhs, Expression rhs) {
        this.op = Objects.requireNonNull(op, "BinaryExpression: op 不能为 null");
        this.lhs = Objects.requireNonNull(lhs, "BinaryExpression: lhs 不能为 null");
        this.rhs = Objects.requireNonNull(rhs, "BinaryExpression: rhs 不能为 null");
    }

    public static BinaryExpression of(BinaryOp op, Expression lhs, Expression rhs) {
        return new BinaryExpression(op, lhs, rhs);
    }

    @Override
    public Kind getKind() {
        return Kind.BINARY;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(lhs, rhs);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        if (sameChildren(getChildren(), children)) {
            return this;
        }
        return new BinaryExpression(op, children.get(0), children.get(1));
    }

    // --- Z3 转换 ---
    @Override
    public Expr toZ3Expr(Context ctx, Z3SymbolTable symbols) {
        Expr z3Lhs = lhs.toZ3Expr(ctx, symbols);
        Expr z3Rhs = rhs.toZ3Expr(ctx, symbols);
        return switch (op) {
            case IMPLIES -> ctx.mkImplies(asBool(z3Lhs, lhs), asBool(z3Rhs, rhs));
            case EQ -> ctx.mkEq(z3Lhs, z3Rhs);
            case LE -> ctx.mkLe(asArith(z3Lhs, lhs), asArith(z3Rhs, rhs));
            case GE -> ctx.mkGe(asArith(z3Lhs, lhs), asArith(z3Rhs, rhs));
            case LT -> ctx.mkLt(asArith(z3Lhs, lhs), asArith(z3Rhs, rhs));
            case GT -> ctx.mkGt(asArith(z3Lhs, lhs), asArith(z3Rhs, rhs));
            case DIV -> ctx.mkDiv(asInt(z3Lhs, lhs), asInt(z3Rhs, rhs));
            case MOD -> ctx.mkMod(asInt(z3Lhs, lhs), asInt(z3Rhs, rhs));
        };
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryExpression that = (BinaryExpression) o;
        return op == that.op && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, lhs, rhs);
    }

    @Override
    public String toString() {
        return "(" + op.getSymbol() + " " + lhs + " " + rhs + ")";
    }
}
