package org.dynamis.formula.desc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

final class Terms {

    private Terms() {}

    /**
     * The distinct terms in order of first appearance.
     */
    static List<Term> unique(Collection<Term> terms) {
        return List.copyOf(new LinkedHashSet<>(terms));
    }

    @SafeVarargs
    static List<Term> concat(Collection<Term>... parts) {
        List<Term> all = new ArrayList<>();
        for (Collection<Term> part : parts) {
            all.addAll(part);
        }
        return unique(all);
    }

    static List<Term> withInterceptIf(boolean intercept, List<Term> terms) {
        if (!intercept) {
            return terms;
        }
        List<Term> result = new ArrayList<>(terms.size() + 1);
        result.add(Term.INTERCEPT);
        result.addAll(terms);
        return result;
    }
}
