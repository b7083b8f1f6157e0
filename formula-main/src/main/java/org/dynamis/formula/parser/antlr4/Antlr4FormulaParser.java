package org.dynamis.formula.parser.antlr4;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.dynamis.formula.parser.ParseNode;

/**
 * Entry point for turning formula text into a tree of {@link ParseNode}s.
 * <p>
 * The root of a parsed formula is always a {@code ~} node: blank text reads as {@code "~ 1"}
 * and a formula without {@code ~} is wrapped in a one-sided {@code ~}.
 */
public final class Antlr4FormulaParser {

    private static final String BLANK_FORMULA = "~ 1";

    private Antlr4FormulaParser() {}

    /**
     * @throws org.dynamis.formula.FormulaParseException on a syntax error or an invalid embedded expression
     */
    public static ParseNode parseFormula(String code) {
        if (code.isBlank()) {
            code = BLANK_FORMULA;
        }
        ParseTree tree = parseAsAntlrAST(code, Antlr4ParseStart.FORMULA);
        return new ParseNodeBuilder(code).visit(tree);
    }

    public static ParseTree parseAsAntlrAST(String code, Antlr4ParseStart start) {
        ThrowingErrorListener errorListener = new ThrowingErrorListener(code);

        FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(code));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        FormulaParser parser = new FormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        return start.parse(parser);
    }
}
