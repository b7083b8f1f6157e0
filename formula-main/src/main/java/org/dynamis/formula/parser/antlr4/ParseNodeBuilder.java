package org.dynamis.formula.parser.antlr4;

import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.dynamis.formula.parser.HostExpressions;
import org.dynamis.formula.parser.NodeType;
import org.dynamis.formula.parser.Origin;
import org.dynamis.formula.parser.ParseNode;

/**
 * Converts the Antlr parse tree into {@link ParseNode}s, attaching an {@link Origin} to every node.
 */
final class ParseNodeBuilder extends FormulaBaseVisitor<ParseNode> {

    private final String code;

    ParseNodeBuilder(String code) {
        this.code = code;
    }

    @Override
    public ParseNode visitFormula(FormulaParser.FormulaContext ctx) {
        ParseNode root = visit(ctx.expression());
        if (root.is(NodeType.TILDE)) {
            return root;
        }
        // a bare right-hand side, e.g. "a + b", means "~ a + b"
        return new ParseNode(NodeType.TILDE, List.of(root), root.getOrigin());
    }

    @Override
    public ParseNode visitPrimaryExpression(FormulaParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public ParseNode visitBinaryExpression(FormulaParser.BinaryExpressionContext ctx) {
        ParseNode left = visit(ctx.expression(0));
        ParseNode right = visit(ctx.expression(1));
        Origin origin = Origin.combine(left.getOrigin(), originOf(ctx.op), right.getOrigin());
        return new ParseNode(operator(ctx.op), List.of(left, right), origin);
    }

    @Override
    public ParseNode visitUnaryExpression(FormulaParser.UnaryExpressionContext ctx) {
        ParseNode operand = visit(ctx.expression());
        return new ParseNode(operator(ctx.op), List.of(operand), Origin.combine(originOf(ctx.op), operand.getOrigin()));
    }

    @Override
    public ParseNode visitParenthesizedExpression(FormulaParser.ParenthesizedExpressionContext ctx) {
        ParseNode inner = visit(ctx.expression());
        // the parentheses belong to the inner node's span, so errors underline them too
        return inner.withOrigin(Origin.combine(originOf(ctx.LPAREN().getSymbol()), inner.getOrigin(), originOf(ctx.RPAREN().getSymbol())));
    }

    @Override
    public ParseNode visitNumberLiteral(FormulaParser.NumberLiteralContext ctx) {
        String text = ctx.NUMBER().getText();
        NodeType type;
        if (text.equals("0")) {
            type = NodeType.ZERO;
        } else if (text.equals("1")) {
            type = NodeType.ONE;
        } else {
            type = NodeType.NUMBER;
        }
        return ParseNode.leaf(type, text, originOf(ctx));
    }

    @Override
    public ParseNode visitHostExpression(FormulaParser.HostExpressionContext ctx) {
        Origin origin = originOf(ctx);
        return ParseNode.leaf(NodeType.EXPRESSION, HostExpressions.normalize(origin.relevantCode(), origin), origin);
    }

    private static NodeType operator(Token op) {
        return NodeType.fromOperator(op.getText());
    }

    private Origin originOf(Token token) {
        return new Origin(code, token.getStartIndex(), token.getStopIndex() + 1);
    }

    private Origin originOf(ParserRuleContext ctx) {
        return new Origin(code, ctx.getStart().getStartIndex(), ctx.getStop().getStopIndex() + 1);
    }
}
