package org.dynamis.formula.desc;

import java.util.Collection;
import java.util.List;

import org.dynamis.formula.parser.Origin;

/**
 * The value of a formula sub-expression: a list of terms plus a decision about the intercept
 * that has not yet been turned into an {@link Term#INTERCEPT} entry.
 * <p>
 * The intercept is either asked for ({@code intercept}, with the origin of the node that asked),
 * explicitly removed ({@code interceptRemoved}), or neither.
 */
final class IntermediateExpr {

    private final boolean intercept;
    private final Origin interceptOrigin;
    private final boolean interceptRemoved;
    private final List<Term> terms;

    IntermediateExpr(boolean intercept, Origin interceptOrigin, boolean interceptRemoved, Collection<Term> terms) {
        if (intercept && interceptRemoved) {
            throw new IllegalStateException("intercept cannot be both present and removed");
        }
        if (intercept && interceptOrigin == null) {
            throw new IllegalStateException("a present intercept needs an origin");
        }
        this.intercept = intercept;
        this.interceptOrigin = interceptOrigin;
        this.interceptRemoved = interceptRemoved;
        this.terms = Terms.unique(terms);
    }

    static IntermediateExpr withIntercept(Origin origin, Collection<Term> terms) {
        return new IntermediateExpr(true, origin, false, terms);
    }

    static IntermediateExpr withoutIntercept(Collection<Term> terms) {
        return new IntermediateExpr(false, null, true, terms);
    }

    static IntermediateExpr ofTerms(Collection<Term> terms) {
        return new IntermediateExpr(false, null, false, terms);
    }

    /**
     * Same intercept state as this expression, different terms.
     */
    IntermediateExpr withTerms(Collection<Term> newTerms) {
        return new IntermediateExpr(intercept, interceptOrigin, interceptRemoved, newTerms);
    }

    boolean hasIntercept() {
        return intercept;
    }

    Origin getInterceptOrigin() {
        return interceptOrigin;
    }

    boolean isInterceptRemoved() {
        return interceptRemoved;
    }

    List<Term> getTerms() {
        return terms;
    }

    @Override
    public String toString() {
        return "IntermediateExpr{" +
               "intercept=" + intercept +
               ", interceptRemoved=" + interceptRemoved +
               ", terms=" + terms +
               '}';
    }
}
