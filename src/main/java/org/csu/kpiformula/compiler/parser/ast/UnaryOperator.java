package org.csu.kpiformula.compiler.parser.ast;

/**
 * 一元运算符: 负号和正号。
 */
public enum UnaryOperator {
    NEG("-"),
    POS("+");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
