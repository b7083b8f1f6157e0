package org.dynamis.formula;

import org.dynamis.formula.parser.Origin;

/**
 * Base of the errors raised while turning a parse tree into a model description.
 * Each carries the origin of the node that was being evaluated.
 */
public class FormulaEvaluationException extends FormulaException {

    private final Origin origin;

    public FormulaEvaluationException(String message, Origin origin) {
        super(message);
        this.origin = origin;
    }

    public FormulaEvaluationException(String message, Origin origin, Throwable cause) {
        super(message, cause);
        this.origin = origin;
    }

    public Origin getOrigin() {
        return origin;
    }

    public String caretMessage() {
        return origin == null ? getMessage() : getMessage() + "\n" + origin.caretize(4);
    }
}
