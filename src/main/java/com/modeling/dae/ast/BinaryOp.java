package com.modeling.dae.ast;

public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    POW("^"),
    ELEM_ADD(".+"),
    ELEM_SUB(".-"),
    ELEM_MUL(".*"),
    ELEM_DIV("./"),
    ELEM_POW(".^"),
    EQ("=="),
    NE("<>"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    AND("and"),
    OR("or");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static BinaryOp fromSymbol(String s) {
        for (BinaryOp op : values())
            if (op.symbol.equals(s) || op.name().equalsIgnoreCase(s))
                return op;
        throw new IllegalArgumentException("Unknown binary operator: " + s);
    }
}
