package org.dynamis.formula.desc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.dynamis.formula.factor.Factor;

/**
 * One effect in a model: the interaction of a set of factors. The empty term is the intercept.
 * <p>
 * Factors keep the order they were first given in, which is used for naming, but two terms are
 * equal whenever they contain the same factors: {@code a:b} equals {@code b:a}.
 */
public final class Term {

    public static final Term INTERCEPT = new Term(List.of());

    static final String INTERCEPT_NAME = "Intercept";

    private final List<Factor> factors;
    private final Set<Factor> factorSet;

    public Term(Collection<? extends Factor> factors) {
        this.factorSet = new LinkedHashSet<>(factors);
        this.factors = List.copyOf(factorSet);
    }

    public static Term of(Factor... factors) {
        return new Term(Arrays.asList(factors));
    }

    /**
     * The distinct factors in order of first appearance.
     */
    public List<Factor> getFactors() {
        return factors;
    }

    public boolean isIntercept() {
        return factors.isEmpty();
    }

    /**
     * A term containing this term's factors followed by {@code other}'s.
     */
    Term concat(Term other) {
        List<Factor> combined = new ArrayList<>(factors);
        combined.addAll(other.factors);
        return new Term(combined);
    }

    public String name() {
        if (factors.isEmpty()) {
            return INTERCEPT_NAME;
        }
        return factors.stream().map(Factor::name).collect(Collectors.joining(":"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return factorSet.equals(((Term) o).factorSet);
    }

    @Override
    public int hashCode() {
        return factorSet.hashCode();
    }

    @Override
    public String toString() {
        return "Term(" + factors + ")";
    }
}
