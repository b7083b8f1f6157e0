package org.dynamis.formula;

/**
 * System properties that tune formula evaluation.
 */
public final class FormulaConfig {

    /**
     * When {@code true}, the evaluator logs every node's intermediate result at TRACE.
     */
    public static final String TRACE_PROPERTY = "dynamis.formula.trace";

    /**
     * When {@code false}, {@code ModelDesc.fromFormula} does not merge the builtin helpers
     * into the caller's environment. Defaults to {@code true}.
     */
    public static final String BUILTINS_PROPERTY = "dynamis.formula.builtins";

    private FormulaConfig() {}

    public static boolean isTraceEnabled() {
        return Boolean.getBoolean(TRACE_PROPERTY);
    }

    public static boolean isBuiltinsEnabled() {
        return Boolean.parseBoolean(System.getProperty(BUILTINS_PROPERTY, "true"));
    }
}
