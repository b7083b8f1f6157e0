package org.dynamis.formula.desc;

import org.dynamis.formula.parser.NodeType;

record OperatorKey(NodeType type, int arity) {
}
