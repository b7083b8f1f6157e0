package org.dynamis.formula.factor;

import java.util.Map;

import org.dynamis.formula.parser.Origin;

/**
 * A named source of one column of model data.
 * <p>
 * Factors that need statistics over the whole data set before they can be evaluated (for example
 * to centre a variable) ask for one or more memorization passes. The design matrix builder calls
 * {@link #memorizeChunk} for every chunk of data in each pass, then {@link #memorizeFinish}, and
 * finally {@link #evaluate} with the same state map. Factors with no passes are evaluated directly.
 * <p>
 * Implementations must define {@code equals} and {@code hashCode}: terms compare their factors as sets.
 */
public interface Factor {

    /**
     * The name used for this factor in term names and rendered formulas.
     */
    String name();

    /**
     * Where in the formula this factor came from, or {@code null} if it was built by hand.
     */
    Origin origin();

    /**
     * @return the number of memorization passes this factor needs over the data, possibly zero
     */
    int memorizePassesNeeded(Map<String, Object> state);

    void memorizeChunk(Map<String, Object> state, int whichPass, Map<String, ?> data);

    void memorizeFinish(Map<String, Object> state, int whichPass);

    /**
     * @throws org.dynamis.formula.FactorEvaluationException if the factor cannot be computed from the data
     */
    Object evaluate(Map<String, Object> memorizeState, Map<String, ?> data);
}
