package org.dynamis.formula;

import org.dynamis.formula.parser.Origin;

public class InterceptInteractionException extends FormulaEvaluationException {

    public static final String MESSAGE = "intercept term cannot interact with anything else";

    public InterceptInteractionException(Origin origin) {
        super(MESSAGE, origin);
    }
}
