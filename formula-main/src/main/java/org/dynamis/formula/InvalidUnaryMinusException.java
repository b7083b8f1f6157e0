package org.dynamis.formula;

import org.dynamis.formula.parser.Origin;

public class InvalidUnaryMinusException extends FormulaEvaluationException {

    public static final String MESSAGE = "Unary minus can only be applied to 1 or 0";

    public InvalidUnaryMinusException(Origin origin) {
        super(MESSAGE, origin);
    }
}
