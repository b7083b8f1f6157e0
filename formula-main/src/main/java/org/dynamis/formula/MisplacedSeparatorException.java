package org.dynamis.formula;

import org.dynamis.formula.parser.Origin;

public class MisplacedSeparatorException extends FormulaEvaluationException {

    public static final String MESSAGE = "~ can only be used once, and only at the top level";

    public MisplacedSeparatorException(Origin origin) {
        super(MESSAGE, origin);
    }
}
