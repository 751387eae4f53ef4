package org.air.expressions;

/**
 * 二元运算符。DIV 和 MOD 是整数上的欧几里得除法与取模。
 */
public enum BinaryOp {

    IMPLIES("=>"),
    EQ("="),
    LE("<="),
    GE(">="),
    LT("<"),
    GT(">"),
    DIV("div"),
    MOD("mod");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 结果是否为布尔值。
     */
    public boolean isPredicate() {
        return switch (this) {
            case IMPLIES, EQ, LE, GE, LT, GT -> true;
            case DIV, MOD -> false;
        };
    }
}
