package org.dynamis.formula.parser;

/**
 * The closed set of parse node kinds a formula can contain.
 */
public enum NodeType {

    TILDE("~"),
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    INTERACT(":"),
    POWER("**"),

    ZERO("0"),
    ONE("1"),
    NUMBER("NUMBER"),
    EXPRESSION("EXPRESSION");

    private final String symbol;

    NodeType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isOperator() {
        return ordinal() <= POWER.ordinal();
    }

    /**
     * @throws IllegalArgumentException if the text is not an operator symbol
     */
    public static NodeType fromOperator(String symbol) {
        for (NodeType type : values()) {
            if (type.isOperator() && type.symbol.equals(symbol)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown formula operator: " + symbol);
    }
}
