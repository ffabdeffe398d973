package com.modeling.dae.ast;

public enum UnaryOp {
    MINUS("-"),
    PLUS("+"),
    NOT("not");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static UnaryOp fromSymbol(String s) {
        for (UnaryOp op : values())
            if (op.symbol.equals(s) || op.name().equalsIgnoreCase(s))
                return op;
        throw new IllegalArgumentException("Unknown unary operator: " + s);
    }
}
