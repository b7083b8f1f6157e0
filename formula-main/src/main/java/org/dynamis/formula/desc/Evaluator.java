package org.dynamis.formula.desc;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.dynamis.formula.ContractViolationException;
import org.dynamis.formula.FormulaConfig;
import org.dynamis.formula.MisplacedSeparatorException;
import org.dynamis.formula.UnknownOperatorException;
import org.dynamis.formula.eval.EvalEnvironment;
import org.dynamis.formula.parser.NodeType;
import org.dynamis.formula.parser.ParseNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a formula parse tree and applies the term algebra to it.
 * <p>
 * Each node is evaluated by the operator registered for its type and argument count. Every
 * node below the root must evaluate to an intermediate expression; only the top-level
 * {@code ~} produces a {@link ModelDesc}. Instances are not shared between evaluations.
 */
public final class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final Map<OperatorKey, OperatorEvaluator> operators = new HashMap<>();
    private final EvalEnvironment environment;
    private final boolean trace;

    public Evaluator(EvalEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.trace = FormulaConfig.isTraceEnabled();
        for (StandardOperator operator : StandardOperator.values()) {
            operators.put(operator.getKey(), operator);
        }
    }

    /**
     * The environment expression factors created by this evaluator will be evaluated in.
     */
    public EvalEnvironment getEnvironment() {
        return environment;
    }

    /**
     * Replaces or adds the meaning of a (node type, arity) combination.
     */
    void addOperator(NodeType type, int arity, OperatorEvaluator evaluator) {
        operators.put(new OperatorKey(type, arity), evaluator);
    }

    /**
     * Evaluates a node.
     *
     * @param requireIntermediate whether the node must produce an intermediate expression, which
     *                            is the case everywhere except at the root
     * @return an intermediate expression, or a {@link ModelDesc} for a top-level {@code ~}
     * @throws UnknownOperatorException     if nothing is registered for the node
     * @throws MisplacedSeparatorException  if a nested node produced a model description
     * @throws ContractViolationException   if an operator returned anything else
     */
    public Object eval(ParseNode node, boolean requireIntermediate) {
        OperatorEvaluator operator = operators.get(new OperatorKey(node.getType(), node.getArgCount()));
        if (operator == null) {
            throw new UnknownOperatorException(node.getType(), node.getArgCount(), node.getOrigin());
        }
        Object result = operator.evaluate(this, node);
        if (requireIntermediate && !(result instanceof IntermediateExpr)) {
            if (result instanceof ModelDesc) {
                throw new MisplacedSeparatorException(node.getOrigin());
            }
            throw new ContractViolationException(node.getOrigin());
        }
        if (trace && LOG.isTraceEnabled()) {
            LOG.trace("{} -> {}", node.getOrigin() == null ? node.getType() : node.getOrigin().relevantCode(), result);
        }
        return result;
    }

    IntermediateExpr eval(ParseNode node) {
        return (IntermediateExpr) eval(node, true);
    }
}
