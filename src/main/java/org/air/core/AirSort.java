package org.air.core;

import lombok.Getter;

import java.util.Objects;

/**
 * AIR 中的排序 (sort)：内建的 Bool、Int，或通过 declare-sort 声明的未解释排序。
 * 此类是不可变的。
 */
@Getter
public final class AirSort {

    public enum Kind {
        BOOL,
        INT,
        NAMED
    }

    public static final AirSort BOOL = new AirSort(Kind.BOOL, null);
    public static final AirSort INT = new AirSort(Kind.INT, null);

    private final Kind kind;
    // 仅当 kind == NAMED 时非空
    private final Ident name;

    private AirSort(Kind kind, Ident name) {
        this.kind = kind;
        this.name = name;
    }

    /**
     * 引用一个已声明的未解释排序。
     * @param name 排序名。
     * @return 对应的 AirSort。
     */
    public static AirSort named(Ident name) {
        return new AirSort(Kind.NAMED, Objects.requireNonNull(name, "Sort name cannot be null"));
    }

    public static AirSort named(String name) {
        return named(Ident.of(name));
    }

    public boolean isNamed() {
        return kind == Kind.NAMED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AirSort that = (AirSort) o;
        return kind == that.kind && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case BOOL -> "Bool";
            case INT -> "Int";
            case NAMED -> name.getName();
        };
    }
}
