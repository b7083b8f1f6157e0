package org.dynamis.formula.parser;

import java.util.List;
import java.util.Objects;

/**
 * An immutable node of a parsed formula.
 * <p>
 * Operator nodes have one or two arguments and no literal. Leaves have no arguments;
 * {@link NodeType#NUMBER}, {@link NodeType#ZERO} and {@link NodeType#ONE} carry their
 * number text and {@link NodeType#EXPRESSION} carries the normalized expression source.
 */
public final class ParseNode {

    private final NodeType type;
    private final List<ParseNode> args;
    private final Origin origin;
    private final String literal;

    public ParseNode(NodeType type, List<ParseNode> args, Origin origin) {
        this(type, args, origin, null);
    }

    public ParseNode(NodeType type, List<ParseNode> args, Origin origin, String literal) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.args = List.copyOf(args);
        this.origin = origin;
        this.literal = literal;
    }

    public static ParseNode leaf(NodeType type, String literal, Origin origin) {
        return new ParseNode(type, List.of(), origin, literal);
    }

    public NodeType getType() {
        return type;
    }

    public List<ParseNode> getArgs() {
        return args;
    }

    public int getArgCount() {
        return args.size();
    }

    public ParseNode getArg(int index) {
        return args.get(index);
    }

    public Origin getOrigin() {
        return origin;
    }

    public String getLiteral() {
        return literal;
    }

    public boolean is(NodeType nodeType) {
        return type == nodeType;
    }

    public ParseNode withOrigin(Origin newOrigin) {
        return new ParseNode(type, args, newOrigin, literal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ParseNode that = (ParseNode) o;
        return type == that.type
               && args.equals(that.args)
               && Objects.equals(origin, that.origin)
               && Objects.equals(literal, that.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, args, origin, literal);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ParseNode(").append(type);
        if (literal != null) {
            sb.append(", '").append(literal).append('\'');
        }
        for (ParseNode arg : args) {
            sb.append(", ").append(arg);
        }
        return sb.append(')').toString();
    }
}
