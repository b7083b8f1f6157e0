package org.dynamis.formula;

import org.dynamis.formula.parser.Origin;

public class FormulaParseException extends FormulaException {

    private final Origin origin;

    public FormulaParseException(String message, Origin origin) {
        super(message);
        this.origin = origin;
    }

    public FormulaParseException(String message, Origin origin, Throwable cause) {
        super(message, cause);
        this.origin = origin;
    }

    public Origin getOrigin() {
        return origin;
    }

    public String getFormula() {
        return origin == null ? null : origin.getCode();
    }

    public String caretMessage() {
        return origin == null ? getMessage() : getMessage() + "\n" + origin.caretize(4);
    }
}
