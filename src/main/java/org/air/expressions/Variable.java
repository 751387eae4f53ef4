package org.air.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.air.core.Ident;
import org.air.symbolic.Z3SymbolTable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 对常量、可变变量或其某一代 (generation) 的引用。
 */
@Getter
public final class Variable extends Expression {

    private final Ident name;

    private Variable(Ident name) {
        this.name = Objects.requireNonNull(name, "Variable name cannot be null");
    }

    public static Variable of(Ident name) {
        return new Variable(name);
    }

    @Override
    public Kind getKind() {
        return Kind.VARIABLE;
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

    @Override
    public Expr toZ3Expr(Context ctx, Z3SymbolTable symbols) {
        return symbols.lookupConst(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name.getName();
    }
}
