package org.dynamis.formula.parser.antlr4;

import org.antlr.v4.runtime.tree.ParseTree;

/**
 * The start production for Antlr.
 * Tells Antlr what piece of formula text it can expect.
 */
@FunctionalInterface
public interface Antlr4ParseStart {

    ParseTree parse(FormulaParser parser);

    Antlr4ParseStart FORMULA = FormulaParser::formula;
    Antlr4ParseStart EXPRESSION = FormulaParser::expression;
}
