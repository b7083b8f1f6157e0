package org.dynamis.formula.desc;

import org.dynamis.formula.parser.ParseNode;

/**
 * The meaning of one (node type, arity) combination. Returns an {@link IntermediateExpr},
 * or a {@link ModelDesc} for the top-level {@code ~}.
 */
@FunctionalInterface
interface OperatorEvaluator {

    Object evaluate(Evaluator evaluator, ParseNode node);
}
