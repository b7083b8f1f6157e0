package org.dynamis.formula.eval;

import java.util.List;
import java.util.Map;

/**
 * Helpers every formula can use, merged into the evaluation environment as its outermost namespace.
 */
public final class Builtins {

    /**
     * {@code I(x)} returns {@code x} unchanged. It protects an expression from being read as
     * formula syntax: {@code I(a + b)} is one factor, {@code a + b} is two.
     */
    public static final FormulaFunction IDENTITY = Builtins::identity;

    public static final Map<String, Object> NAMESPACE = Map.of("I", IDENTITY);

    private Builtins() {}

    private static Object identity(List<Object> args) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("I() takes exactly one argument, got " + args.size());
        }
        return args.get(0);
    }
}
