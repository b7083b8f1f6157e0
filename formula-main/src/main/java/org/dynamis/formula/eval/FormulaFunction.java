package org.dynamis.formula.eval;

import java.util.List;

/**
 * A function that embedded expressions can call by name, such as {@code I(x)}.
 */
@FunctionalInterface
public interface FormulaFunction {

    Object call(List<Object> args);
}
