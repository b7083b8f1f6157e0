package org.dynamis.formula.factor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.dynamis.formula.eval.EvalEnvironment;
import org.dynamis.formula.parser.HostExpressions;
import org.dynamis.formula.parser.Origin;

/**
 * A factor computed by evaluating an embedded expression, such as {@code log(x)}, in the
 * environment the formula was written in.
 * <p>
 * Two instances are equal when they have the same code and environment; the origin is
 * only used for error reporting.
 */
public final class EvalFactor implements Factor {

    private final String code;
    private final EvalEnvironment environment;
    private final Origin origin;

    public EvalFactor(String code, EvalEnvironment environment) {
        this(code, environment, null);
    }

    public EvalFactor(String code, EvalEnvironment environment, Origin origin) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.origin = origin;
    }

    @Override
    public String name() {
        return code;
    }

    @Override
    public Origin origin() {
        return origin;
    }

    public EvalEnvironment getEnvironment() {
        return environment;
    }

    /**
     * The variables this factor's expression reads, in order of first appearance.
     */
    public List<String> variableNames() {
        return HostExpressions.variableNames(code);
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
        return environment.eval(code, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EvalFactor that = (EvalFactor) o;
        return code.equals(that.code) && environment.equals(that.environment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(EvalFactor.class, code, environment);
    }

    @Override
    public String toString() {
        return "EvalFactor(" + code + ")";
    }
}
