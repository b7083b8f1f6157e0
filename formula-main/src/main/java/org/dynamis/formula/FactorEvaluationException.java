package org.dynamis.formula;

public class FactorEvaluationException extends FormulaException {

    private final String factorName;

    public FactorEvaluationException(String message, String factorName) {
        super(message);
        this.factorName = factorName;
    }

    public FactorEvaluationException(String message, String factorName, Throwable cause) {
        super(message, cause);
        this.factorName = factorName;
    }

    public String getFactorName() {
        return factorName;
    }
}
