package org.air.core;

import lombok.Getter;
import org.air.expressions.Expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 声明：引入排序、常量、函数、可变变量或公理。
 * declare-var 只允许出现在查询的局部声明中。
 * 此类是不可变的。
 */
@Getter
public final class Declaration {

    public enum Kind {
        SORT,
        CONST,
        FUN,
        VAR,
        AXIOM
    }

    private final Kind kind;
    // AXIOM 时为 null
    private final Ident name;
    // CONST / VAR 的排序、FUN 的返回排序，其余为 null
    private final AirSort sort;
    private final List<AirSort> parameterSorts;
    // 仅 AXIOM 非空
    private final Expression axiom;

    private Declaration(Kind kind, Ident name, AirSort sort, List<AirSort> parameterSorts, Expression axiom) {
        this.kind = kind;
        this.name = name;
        this.sort = sort;
        this.parameterSorts = List.copyOf(parameterSorts);
        this.axiom = axiom;
    }

    // --- 工厂方法 ---
    public static Declaration sort(String name) {
        return new Declaration(Kind.SORT, Ident.of(name), null, Collections.emptyList(), null);
    }

    public static Declaration constant(String name, AirSort sort) {
        return new Declaration(Kind.CONST, Ident.of(name), Objects.requireNonNull(sort, "sort cannot be null"),
                Collections.emptyList(), null);
    }

    public static Declaration constant(Ident name, AirSort sort) {
        return new Declaration(Kind.CONST, Objects.requireNonNull(name, "name cannot be null"),
                Objects.requireNonNull(sort, "sort cannot be null"), Collections.emptyList(), null);
    }

    public static Declaration function(String name, List<AirSort> parameterSorts, AirSort resultSort) {
        return new Declaration(Kind.FUN, Ident.of(name), Objects.requireNonNull(resultSort, "result sort cannot be null"),
                Objects.requireNonNull(parameterSorts, "parameter sorts cannot be null"), null);
    }

    public static Declaration var(String name, AirSort sort) {
        return new Declaration(Kind.VAR, Ident.of(name), Objects.requireNonNull(sort, "sort cannot be null"),
                Collections.emptyList(), null);
    }

    public static Declaration axiom(Expression expression) {
        return new Declaration(Kind.AXIOM, null, null, Collections.emptyList(),
                Objects.requireNonNull(expression, "axiom cannot be null"));
    }

    /**
     * 用新的公理表达式重建 AXIOM 声明；其他种类原样返回。
     */
    public Declaration withAxiom(Expression expression) {
        if (kind != Kind.AXIOM || expression == axiom) {
            return this;
        }
        return axiom(expression);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Declaration that = (Declaration) o;
        return kind == that.kind && Objects.equals(name, that.name) && Objects.equals(sort, that.sort)
                && parameterSorts.equals(that.parameterSorts) && Objects.equals(axiom, that.axiom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, sort, parameterSorts, axiom);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SORT -> "(declare-sort " + name + ")";
            case CONST -> "(declare-const " + name + " " + sort + ")";
            case VAR -> "(declare-var " + name + " " + sort + ")";
            case FUN -> "(declare-fun " + name + " (" +
                    parameterSorts.stream().map(AirSort::toString).collect(Collectors.joining(" ")) +
                    ") " + sort + ")";
            case AXIOM -> "(axiom " + axiom + ")";
        };
    }
}
