package org.dynamis.formula.desc;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.dynamis.formula.FormulaConfig;
import org.dynamis.formula.eval.Builtins;
import org.dynamis.formula.eval.EvalEnvironment;
import org.dynamis.formula.parser.ParseNode;
import org.dynamis.formula.parser.antlr4.Antlr4FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A model described as the terms on each side of the {@code ~}.
 * <p>
 * Both lists keep the order terms were written in and hold no duplicates. An intercept is
 * present on a side exactly when {@link Term#INTERCEPT} is in its list.
 */
public final class ModelDesc {

    private static final Logger LOG = LoggerFactory.getLogger(ModelDesc.class);

    private final List<Term> lhsTermlist;
    private final List<Term> rhsTermlist;

    public ModelDesc(Collection<Term> lhsTermlist, Collection<Term> rhsTermlist) {
        this.lhsTermlist = Terms.unique(lhsTermlist);
        this.rhsTermlist = Terms.unique(rhsTermlist);
    }

    /**
     * Parses and evaluates a formula such as {@code "y ~ a + b:c"}.
     *
     * @param environment the bindings the formula's embedded expressions will be evaluated in
     * @throws org.dynamis.formula.FormulaParseException      if the text does not parse
     * @throws org.dynamis.formula.FormulaEvaluationException if the formula is not meaningful
     */
    public static ModelDesc fromFormula(String formula, EvalEnvironment environment) {
        return fromFormula(Antlr4FormulaParser.parseFormula(formula), environment);
    }

    public static ModelDesc fromFormula(ParseNode tree, EvalEnvironment environment) {
        if (FormulaConfig.isBuiltinsEnabled()) {
            environment = environment.withOuterNamespace(Builtins.NAMESPACE);
        }
        Object value = new Evaluator(environment).eval(tree, false);
        if (!(value instanceof ModelDesc)) {
            throw new IllegalStateException("Formula root evaluated to " + value + " instead of a model description");
        }
        ModelDesc desc = (ModelDesc) value;
        LOG.debug("Evaluated '{}' as '{}'", tree.getOrigin() == null ? tree : tree.getOrigin().getCode(), desc.describe());
        return desc;
    }

    public List<Term> getLhsTermlist() {
        return lhsTermlist;
    }

    public List<Term> getRhsTermlist() {
        return rhsTermlist;
    }

    /**
     * Renders an equivalent formula in canonical form, e.g. {@code "y ~ a + b + a:b"}. The
     * original spelling is not preserved, but describing the result of parsing the output again
     * gives the same text.
     */
    public String describe() {
        StringBuilder result = new StringBuilder(joinTerms(lhsTermlist));
        result.append(result.length() > 0 ? " ~ " : "~ ");
        if (rhsTermlist.equals(List.of(Term.INTERCEPT))) {
            result.append(termCode(Term.INTERCEPT));
        } else {
            List<String> termNames = new ArrayList<>();
            if (!rhsTermlist.contains(Term.INTERCEPT)) {
                termNames.add("0");
            }
            for (Term term : rhsTermlist) {
                if (!term.isIntercept()) {
                    termNames.add(termCode(term));
                }
            }
            result.append(String.join(" + ", termNames));
        }
        return result.toString();
    }

    private static String joinTerms(List<Term> terms) {
        List<String> names = new ArrayList<>();
        for (Term term : terms) {
            names.add(termCode(term));
        }
        return String.join(" + ", names);
    }

    private static String termCode(Term term) {
        return term.isIntercept() ? "1" : term.name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModelDesc that = (ModelDesc) o;
        return lhsTermlist.equals(that.lhsTermlist) && rhsTermlist.equals(that.rhsTermlist);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhsTermlist, rhsTermlist);
    }

    @Override
    public String toString() {
        return "ModelDesc{" +
               "lhsTermlist=" + lhsTermlist +
               ", rhsTermlist=" + rhsTermlist +
               '}';
    }
}
