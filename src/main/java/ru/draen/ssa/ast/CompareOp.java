package ru.draen.ssa.ast;

import java.util.Arrays;
import java.util.Optional;

public enum CompareOp {
    GREATER(">"),
    LESS("<"),
    GREATER_EQUALS(">="),
    LESS_EQUALS("<="),
    EQUALS("=="),
    NOT_EQUALS("!=");

    private final String symbol;

    CompareOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<CompareOp> bySymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }

    public static CompareOp fromSymbol(String symbol) {
        return bySymbol(symbol)
                .orElseThrow(() -> new IllegalArgumentException("unknown comparator: " + symbol));
    }
}
