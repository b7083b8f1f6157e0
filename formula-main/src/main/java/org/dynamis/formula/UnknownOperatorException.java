package org.dynamis.formula;

import org.dynamis.formula.parser.NodeType;
import org.dynamis.formula.parser.Origin;

public class UnknownOperatorException extends FormulaEvaluationException {

    private final NodeType nodeType;
    private final int arity;

    public UnknownOperatorException(NodeType nodeType, int arity, Origin origin) {
        super("I don't know how to evaluate this '" + nodeType.getSymbol() + "' operator", origin);
        this.nodeType = nodeType;
        this.arity = arity;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public int getArity() {
        return arity;
    }
}
