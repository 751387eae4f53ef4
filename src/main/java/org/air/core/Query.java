package org.air.core;

import lombok.Getter;
import org.air.statements.Statement;

import java.util.List;
import java.util.Objects;

/**
 * 一次 check-valid 的内容：局部声明加一棵待检查的语句树。
 * 每个查询恰好产生一个 ValidityResult。
 */
@Getter
public final class Query {

    private final List<Declaration> localDeclarations;
    private final Statement assertion;

    private Query(List<Declaration> localDeclarations, Statement assertion) {
        this.localDeclarations = List.copyOf(Objects.requireNonNull(localDeclarations, "Query declarations cannot be null"));
        this.assertion = Objects.requireNonNull(assertion, "Query assertion cannot be null");
    }

    public static Query of(List<Declaration> localDeclarations, Statement assertion) {
        return new Query(localDeclarations, assertion);
    }

    public static Query of(Statement assertion) {
        return new Query(List.of(), assertion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Query query = (Query) o;
        return localDeclarations.equals(query.localDeclarations) && assertion.equals(query.assertion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localDeclarations, assertion);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(check-valid");
        for (Declaration decl : localDeclarations) {
            sb.append(' ').append(decl);
        }
        sb.append(' ').append(assertion).append(')');
        return sb.toString();
    }
}
