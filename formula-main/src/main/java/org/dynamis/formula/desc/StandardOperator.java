package org.dynamis.formula.desc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.dynamis.formula.InterceptInteractionException;
import org.dynamis.formula.InvalidLiteralException;
import org.dynamis.formula.InvalidUnaryMinusException;
import org.dynamis.formula.factor.EvalFactor;
import org.dynamis.formula.factor.Factor;
import org.dynamis.formula.parser.NodeType;
import org.dynamis.formula.parser.ParseNode;

/**
 * The rules of the formula term algebra, one per (node type, arity).
 */
enum StandardOperator implements OperatorEvaluator {

    /**
     * {@code lhs ~ rhs}. Only the right-hand side gets an implicit intercept.
     */
    TILDE(NodeType.TILDE, 2) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr left = evaluator.eval(node.getArg(0));
            IntermediateExpr right = evaluator.eval(node.getArg(1));
            return modelDesc(left, right);
        }
    },

    /**
     * {@code ~ rhs}, read as {@code 0 ~ rhs}.
     */
    ONE_SIDED_TILDE(NodeType.TILDE, 1) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr right = evaluator.eval(node.getArg(0));
            return modelDesc(IntermediateExpr.withoutIntercept(List.of()), right);
        }
    },

    PLUS(NodeType.PLUS, 2) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr left = evaluator.eval(node.getArg(0));
            if (node.getArg(1).is(NodeType.ZERO)) {
                // "x + 0" drops the intercept whatever x said about it
                return IntermediateExpr.withoutIntercept(left.getTerms());
            }
            IntermediateExpr right = evaluator.eval(node.getArg(1));
            List<Term> terms = Terms.concat(left.getTerms(), right.getTerms());
            if (right.hasIntercept()) {
                return IntermediateExpr.withIntercept(right.getInterceptOrigin(), terms);
            }
            return left.withTerms(terms);
        }
    },

    MINUS(NodeType.MINUS, 2) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr left = evaluator.eval(node.getArg(0));
            ParseNode subtrahend = node.getArg(1);
            if (subtrahend.is(NodeType.ZERO)) {
                return IntermediateExpr.withIntercept(subtrahend.getOrigin(), left.getTerms());
            }
            if (subtrahend.is(NodeType.ONE)) {
                return IntermediateExpr.withoutIntercept(left.getTerms());
            }
            IntermediateExpr right = evaluator.eval(subtrahend);
            List<Term> terms = new ArrayList<>(left.getTerms());
            terms.removeAll(right.getTerms());
            if (right.hasIntercept()) {
                return IntermediateExpr.withoutIntercept(terms);
            }
            return left.withTerms(terms);
        }
    },

    /**
     * {@code a * b} is {@code a + b + a:b}.
     */
    TIMES(NodeType.TIMES, 2) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr left = evaluator.eval(node.getArg(0));
            IntermediateExpr right = evaluator.eval(node.getArg(1));
            return IntermediateExpr.ofTerms(
                    Terms.concat(left.getTerms(), right.getTerms(), interaction(left, right).getTerms()));
        }
    },

    /**
     * Nesting distributes to the right, {@code a/(b + c)} is {@code a + a:b + a:c}, but the left
     * side always acts as one group: {@code (a + b)/c} is {@code a + b + a:b:c}. A factor cannot
     * be nested under two different groupings at once.
     */
    DIVIDE(NodeType.DIVIDE, 2) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr left = evaluator.eval(node.getArg(0));
            IntermediateExpr right = evaluator.eval(node.getArg(1));
            checkInteractable(left);
            List<Factor> leftFactors = new ArrayList<>();
            for (Term term : left.getTerms()) {
                leftFactors.addAll(term.getFactors());
            }
            IntermediateExpr combined = IntermediateExpr.ofTerms(List.of(new Term(leftFactors)));
            return IntermediateExpr.ofTerms(Terms.concat(left.getTerms(), interaction(combined, right).getTerms()));
        }
    },

    INTERACT(NodeType.INTERACT, 2) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr left = evaluator.eval(node.getArg(0));
            IntermediateExpr right = evaluator.eval(node.getArg(1));
            return interaction(left, right);
        }
    },

    /**
     * {@code (a + b + c)**n} is every interaction of up to n of the terms.
     */
    POWER(NodeType.POWER, 2) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            IntermediateExpr left = evaluator.eval(node.getArg(0));
            checkInteractable(left);
            // interactions of more terms than there are add nothing new
            int power = positiveInteger(node.getArg(1)).min(BigInteger.valueOf(left.getTerms().size())).intValue();
            List<Term> allTerms = new ArrayList<>(left.getTerms());
            IntermediateExpr product = left;
            for (int i = 1; i < power; i++) {
                product = interaction(left, product);
                allTerms.addAll(product.getTerms());
            }
            return IntermediateExpr.ofTerms(allTerms);
        }
    },

    UNARY_PLUS(NodeType.PLUS, 1) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            return evaluator.eval(node.getArg(0));
        }
    },

    /**
     * Only {@code -0} (add the intercept) and {@code -1} (remove it) mean anything.
     */
    UNARY_MINUS(NodeType.MINUS, 1) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            ParseNode operand = node.getArg(0);
            if (operand.is(NodeType.ZERO)) {
                return IntermediateExpr.withIntercept(node.getOrigin(), List.of());
            }
            if (operand.is(NodeType.ONE)) {
                return IntermediateExpr.withoutIntercept(List.of());
            }
            throw new InvalidUnaryMinusException(node.getOrigin());
        }
    },

    ZERO(NodeType.ZERO, 0) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            return IntermediateExpr.withoutIntercept(List.of());
        }
    },

    ONE(NodeType.ONE, 0) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            return IntermediateExpr.withIntercept(node.getOrigin(), List.of());
        }
    },

    NUMBER(NodeType.NUMBER, 0) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            throw new InvalidLiteralException("numbers besides '0' and '1' are only allowed with **",
                                              node.getLiteral(), node.getOrigin());
        }
    },

    EXPRESSION(NodeType.EXPRESSION, 0) {
        @Override
        public Object evaluate(Evaluator evaluator, ParseNode node) {
            EvalFactor factor = new EvalFactor(node.getLiteral(), evaluator.getEnvironment(), node.getOrigin());
            return IntermediateExpr.ofTerms(List.of(Term.of(factor)));
        }
    };

    private static final String POSITIVE_INTEGER_REQUIRED = "'**' requires a positive integer";

    private final OperatorKey key;

    StandardOperator(NodeType type, int arity) {
        this.key = new OperatorKey(type, arity);
    }

    OperatorKey getKey() {
        return key;
    }

    private static ModelDesc modelDesc(IntermediateExpr left, IntermediateExpr right) {
        return new ModelDesc(Terms.withInterceptIf(left.hasIntercept(), left.getTerms()),
                             Terms.withInterceptIf(!right.isInterceptRemoved(), right.getTerms()));
    }

    private static void checkInteractable(IntermediateExpr expr) {
        if (expr.hasIntercept()) {
            throw new InterceptInteractionException(expr.getInterceptOrigin());
        }
    }

    /**
     * Every left term joined with every right term. Main effects are not included.
     */
    static IntermediateExpr interaction(IntermediateExpr left, IntermediateExpr right) {
        checkInteractable(left);
        checkInteractable(right);
        List<Term> terms = new ArrayList<>();
        for (Term leftTerm : left.getTerms()) {
            for (Term rightTerm : right.getTerms()) {
                terms.add(leftTerm.concat(rightTerm));
            }
        }
        return IntermediateExpr.ofTerms(terms);
    }

    private static BigInteger positiveInteger(ParseNode exponent) {
        if (exponent.is(NodeType.ONE) || exponent.is(NodeType.NUMBER)) {
            BigInteger power;
            try {
                power = new BigInteger(exponent.getLiteral());
            } catch (NumberFormatException e) {
                throw new InvalidLiteralException(POSITIVE_INTEGER_REQUIRED, exponent.getLiteral(), exponent.getOrigin(), e);
            }
            if (power.signum() > 0) {
                return power;
            }
        }
        throw new InvalidLiteralException(POSITIVE_INTEGER_REQUIRED, exponent.getLiteral(), exponent.getOrigin());
    }
}
