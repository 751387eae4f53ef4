package org.air.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import lombok.Getter;
import org.air.core.Ident;
import org.air.symbolic.Z3SymbolTable;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 对 declare-fun 声明的函数的应用 (f e1 ... en)。
 */
@Getter
public final class Application extends Expression {

    private final Ident function;
    private final List<Expression> args;

    private Application(Ident function, List<Expression> args) {
        this.function = Objects.requireNonNull(function, "Application: function 不能为 null");
        this.args = List.copyOf(Objects.requireNonNull(args, "Application: args 不能为 null"));
    }

    public static Application of(Ident function, List<Expression> args) {
        return new Application(function, args);
    }

    @Override
    public Kind getKind() {
        return Kind.APPLY;
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
        return new Application(function, children);
    }

    @Override
    public Expr toZ3Expr(Context ctx, Z3SymbolTable symbols) {
        FuncDecl decl = symbols.lookupFunction(function);
        Expr[] z3Args = args.stream()
                .map(a -> a.toZ3Expr(ctx, symbols))
                .toArray(Expr[]::new);
        return ctx.mkApp(decl, z3Args);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Application that = (Application) o;
        return function.equals(that.function) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, args);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return "(" + function + ")";
        }
        return "(" + function + " " +
                args.stream().map(Expression::toString).collect(Collectors.joining(" ")) +
                ")";
    }
}
