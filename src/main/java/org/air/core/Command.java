package org.air.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 会话的输入命令，按程序顺序提交。
 */
@Getter
public final class Command {

    public enum Kind {
        PUSH,
        POP,
        SET_OPTION,
        GLOBAL,
        CHECK_VALID
    }

    public static final Command PUSH = new Command(Kind.PUSH, null, null, null, null);
    public static final Command POP = new Command(Kind.POP, null, null, null, null);

    private final Kind kind;
    private final String optionName;
    private final String optionValue;
    private final Declaration declaration;
    private final Query query;

    private Command(Kind kind, String optionName, String optionValue, Declaration declaration, Query query) {
        this.kind = kind;
        this.optionName = optionName;
        this.optionValue = optionValue;
        this.declaration = declaration;
        this.query = query;
    }

    public static Command setOption(String name, String value) {
        return new Command(Kind.SET_OPTION, Objects.requireNonNull(name, "option name cannot be null"),
                Objects.requireNonNull(value, "option value cannot be null"), null, null);
    }

    public static Command global(Declaration declaration) {
        return new Command(Kind.GLOBAL, null, null,
                Objects.requireNonNull(declaration, "declaration cannot be null"), null);
    }

    public static Command checkValid(Query query) {
        return new Command(Kind.CHECK_VALID, null, null, null,
                Objects.requireNonNull(query, "query cannot be null"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Command that = (Command) o;
        return kind == that.kind && Objects.equals(optionName, that.optionName)
                && Objects.equals(optionValue, that.optionValue)
                && Objects.equals(declaration, that.declaration) && Objects.equals(query, that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, optionName, optionValue, declaration, query);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case PUSH -> "(push)";
            case POP -> "(pop)";
            case SET_OPTION -> "(set-option :" + optionName + " " + optionValue + ")";
            case GLOBAL -> declaration.toString();
            case CHECK_VALID -> query.toString();
        };
    }
}
