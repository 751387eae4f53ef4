package org.air.statements;


import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 有序语句块。块内的赋值和假设都不会泄漏到块之后的语句。
 */
public final class Block extends Statement {

    private final List<Statement> statements;

    private Block(List<Statement> statements) {
        this.statements = List.copyOf(Objects.requireNonNull(statements, "Block statements cannot be null"));
    }

    public static Block of(List<Statement> statements) {
        return new Block(statements);
    }

    public static Block of(Statement... statements) {
        return new Block(Arrays.asList(statements));
    }

    @Override
    public Kind getKind() {
        return Kind.BLOCK;
    }

    @Override
    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public Statement withStatements(List<Statement> newStatements) {
        if (newStatements.size() == statements.size()) {
            boolean same = true;
            for (int i = 0; i < statements.size() && same; i++) {
                same = statements.get(i) == newStatements.get(i);
            }
            if (same) {
                return this;
            }
        }
        return new Block(newStatements);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return statements.equals(((Block) o).statements);
    }

    @Override
    public int hashCode() {
        return statements.hashCode();
    }

    @Override
    public String toString() {
        if (statements.isEmpty()) {
            return "(block)";
        }
        return "(block " +
                statements.stream().map(Statement::toString).collect(Collectors.joining(" ")) +
                ")";
    }
}
