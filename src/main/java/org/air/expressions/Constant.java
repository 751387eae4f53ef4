package org.air.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.air.symbolic.Z3SymbolTable;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 常量表达式：布尔常量或任意精度整数常量。
 * 此类是不可变的。
 */
@Getter
public final class Constant extends Expression {

    public static final Constant TRUE = new Constant(Boolean.TRUE, null);
    public static final Constant FALSE = new Constant(Boolean.FALSE, null);

    // 两者恰有一个非空
    private final Boolean boolValue;
    private final BigInteger intValue;

    private Constant(Boolean boolValue, BigInteger intValue) {
        this.boolValue = boolValue;
        this.intValue = intValue;
    }

    public static Constant of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Constant of(long value) {
        return new Constant(null, BigInteger.valueOf(value));
    }

    public static Constant of(BigInteger value) {
        return new Constant(null, Objects.requireNonNull(value, "Integer constant cannot be null"));
    }

    public boolean isBool() {
        return boolValue != null;
    }

    @Override
    public Kind getKind() {
        return Kind.CONSTANT;
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        sameChildren(getChildren(), children);
        return this;
    }

    // --- Z3 转换 ---
    @Override
    public Expr toZ3Expr(Context ctx, Z3SymbolTable symbols) {
        if (isBool()) {
            return ctx.mkBool(boolValue);
        }
        return ctx.mkInt(intValue.toString());
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
        Constant that = (Constant) o;
        return Objects.equals(boolValue, that.boolValue) && Objects.equals(intValue, that.intValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(boolValue, intValue);
    }

    @Override
    public String toString() {
        if (isBool()) {
            return boolValue.toString();
        }
        if (intValue.signum() < 0) {
            return "(- " + intValue.negate() + ")";
        }
        return intValue.toString();
    }
}
