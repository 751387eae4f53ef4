package org.air.expressions;

/**
 * n 元运算符。单参数的 SUB 表示取负。
 */
public enum MultiOp {

    AND("and"),
    OR("or"),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DISTINCT("distinct");

    private final String symbol;

    MultiOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
