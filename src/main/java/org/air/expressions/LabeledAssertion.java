package org.air.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.air.symbolic.Z3SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * 带标签的断言包装。标签用于在反例中定位失败的断言；
 * 对求解器而言它与被包装的表达式等价。
 */
@Getter
public final class LabeledAssertion extends Expression {

    private final String label;
    private final Expression body;

    private LabeledAssertion(String label, Expression body) {
        this.label = Objects.requireNonNull(label, "LabeledAssertion: label 不能为 null");
        this.body = Objects.requireNonNull(body, "LabeledAssertion: body 不能为 null");
    }

    public static LabeledAssertion of(String label, Expression body) {
        return new LabeledAssertion(label, body);
    }

    @Override
    public Kind getKind() {
        return Kind.LABELED;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(body);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        if (sameChildren(getChildren(), children)) {
            return this;
        }
        return new LabeledAssertion(label, children.get(0));
    }

    @Override
    public Expr toZ3Expr(Context ctx, Z3SymbolTable symbols) {
        return body.toZ3Expr(ctx, symbols);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LabeledAssertion that = (LabeledAssertion) o;
        return label.equals(that.label) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, body);
    }

    @Override
    public String toString() {
        return "(! " + body + " :named \"" + label + "\")";
    }
}
