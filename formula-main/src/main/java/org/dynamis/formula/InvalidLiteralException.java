package org.dynamis.formula;

import org.dynamis.formula.parser.Origin;

public class InvalidLiteralException extends FormulaEvaluationException {

    private final String literal;

    public InvalidLiteralException(String message, String literal, Origin origin) {
        super(message, origin);
        this.literal = literal;
    }

    public InvalidLiteralException(String message, String literal, Origin origin, Throwable cause) {
        super(message, origin, cause);
        this.literal = literal;
    }

    /**
     * The offending literal text, or {@code null} when the node was not a literal at all.
     */
    public String getLiteral() {
        return literal;
    }
}
