package org.air.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.air.symbolic.Z3SymbolTable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * n 元表达式。空的 and 为 true，空的 or 为 false，空的 + 为 0，空的 * 为 1。
 */
@Getter
public final class MultiExpression extends Expression {

    private final MultiOp op;
    private final List<Expression> args;

    private final int hashCode;

    private MultiExpression(MultiOp op, List<Expression> args) {
        this.op = Objects.requireNonNull(op, "MultiExpression: op 不能为 null");
        this.args = List.copyOf(Objects.requireNonNull(args, "MultiExpression: args 不能为 null"));
        if (op == MultiOp.SUB && this.args.isEmpty()) {
            throw new IllegalArgumentException("MultiExpression: '-' 至少需要一个参数");
        }
        this.hashCode = Objects.hash(op, this.args);
    }

    public static MultiExpression of(MultiOp op, List<Expression> args) {
        return new MultiExpression(op, args);
    }

    @Override
    public Kind getKind() {
        return Kind.MULTI;
    }

    @Override
    public List<Expression> getChildren() {
        return args;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        if (sameChildren(args, children)) {
            return this;
        }
        return new MultiExpression(op, children);
    }

    // --- Z3 转换 ---
    @Override
    public Expr toZ3Expr(Context ctx, Z3SymbolTable symbols) {
        List<Expr> z3Args = args.stream()
                .map(a -> a.toZ3Expr(ctx, symbols))
                .collect(Collectors.toList());
        switch (op) {
            case AND:
                return z3Args.isEmpty() ? ctx.mkTrue() : ctx.mkAnd(toBoolArray(z3Args));
            case OR:
                return z3Args.isEmpty() ? ctx.mkFalse() : ctx.mkOr(toBoolArray(z3Args));
            case ADD:
                return z3Args.isEmpty() ? ctx.mkInt(0) : ctx.mkAdd(toArithArray(z3Args));
            case MUL:
                return z3Args.isEmpty() ? ctx.mkInt(1) : ctx.mkMul(toArithArray(z3Args));
            case SUB:
                if (z3Args.size() == 1) {
                    return ctx.mkUnaryMinus(asArith(z3Args.get(0), args.get(0)));
                }
                return ctx.mkSub(toArithArray(z3Args));
            case DISTINCT:
                if (z3Args.size() < 2) {
                    return ctx.mkTrue();
                }
                return ctx.mkDistinct(z3Args.toArray(new Expr[0]));
            default:
                throw new IllegalStateException("未知的 MultiOp: " + op);
        }
    }

    private BoolExpr[] toBoolArray(List<Expr> z3Args) {
        BoolExpr[] result = new BoolExpr[z3Args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = asBool(z3Args.get(i), args.get(i));
        }
        return result;
    }

    private ArithExpr[] toArithArray(List<Expr> z3Args) {
        ArithExpr[] result = new ArithExpr[z3Args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = asArith(z3Args.get(i), args.get(i));
        }
        return result;
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
        MultiExpression that = (MultiExpression) o;
        return op == that.op && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return "(" + op.getSymbol() + ")";
        }
        return "(" + op.getSymbol() + " " +
                args.stream().map(Expression::toString).collect(Collectors.joining(" ")) +
                ")";
    }
}
