package org.dynamis.formula;

import org.dynamis.formula.parser.Origin;

public class ContractViolationException extends FormulaEvaluationException {

    public static final String MESSAGE = "custom operator returned an object that I don't know how to handle";

    public ContractViolationException(Origin origin) {
        super(MESSAGE, origin);
    }
}
