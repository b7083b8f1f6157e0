package org.dynamis.formula.factor;

import java.util.Map;
import java.util.Objects;

import org.dynamis.formula.FactorEvaluationException;
import org.dynamis.formula.parser.Origin;

/**
 * A factor whose name is a data column key. Needs no memorization.
 */
public final class LookupFactor implements Factor {

    private final String name;
    private final Origin origin;

    public LookupFactor(String name) {
        this(name, null);
    }

    public LookupFactor(String name, Origin origin) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.origin = origin;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Origin origin() {
        return origin;
    }

    @Override
    public int memorizePassesNeeded(Map<String, Object> state) {
        return 0;
    }

    @Override
    public void memorizeChunk(Map<String, Object> state, int whichPass, Map<String, ?> data) {
    }

    @Override
    public void memorizeFinish(Map<String, Object> state, int whichPass) {
    }

    @Override
    public Object evaluate(Map<String, Object> memorizeState, Map<String, ?> data) {
        if (!data.containsKey(name)) {
            throw new FactorEvaluationException("No data column named '" + name + "'", name);
        }
        return data.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((LookupFactor) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(LookupFactor.class, name);
    }

    @Override
    public String toString() {
        return "LookupFactor(" + name + ")";
    }
}
