package org.air.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AIR 中的标识符。
 * 所有标识符都经过驻留 (interned)：相同名称总是返回同一个实例，
 * 因此可以直接用 == 比较。
 */
@Getter
public final class Ident implements Comparable<Ident> {

    private static final Logger logger = LoggerFactory.getLogger(Ident.class);

    private static final ConcurrentHashMap<String, Ident> INTERNED = new ConcurrentHashMap<>(256);

    private final String name;

    private final int hashCode;

    private Ident(String name) {
        this.name = name;
        this.hashCode = Objects.hash(name);
        logger.debug("驻留了一个新的 Ident: {}", name);
    }

    /**
     * 获取名称对应的驻留实例。
     * @param name 标识符名称，不能为空。
     * @return 唯一的 Ident 实例。
     */
    public static Ident of(String name) {
        Objects.requireNonNull(name, "Ident name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Ident name cannot be empty");
        }
        return INTERNED.computeIfAbsent(name, Ident::new);
    }

    @Override
    public int compareTo(Ident o) {
        return this.name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Ident) o).name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
