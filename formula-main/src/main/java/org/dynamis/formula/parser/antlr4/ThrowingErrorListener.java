package org.dynamis.formula.parser.antlr4;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.dynamis.formula.FormulaParseException;
import org.dynamis.formula.parser.Origin;

/**
 * Turns the first syntax error Antlr reports into a {@link FormulaParseException}.
 * <p>
 * The origin is the offending token, with three exceptions. A bracket that is never closed is
 * reported at the bracket, or at the whole embedded expression it belongs to. Running out of
 * input points at the last token read. An unrecognized character takes the rest of its line
 * with it.
 */
final class ThrowingErrorListener extends BaseErrorListener {

    private final String code;

    ThrowingErrorListener(String code) {
        this.code = code;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        Origin origin;
        if (offendingSymbol instanceof Token && recognizer instanceof Parser) {
            origin = originOf((Token) offendingSymbol, ((Parser) recognizer).getTokenStream());
        } else {
            // lexer errors only know the position
            int offset = offsetOf(line, charPositionInLine);
            origin = new Origin(code, offset, Math.min(offset + 1, code.length()));
        }
        throw new FormulaParseException("Parse error: " + msg, origin, e);
    }

    private Origin originOf(Token offending, TokenStream stream) {
        List<Token> tokens = tokensOf(stream);
        List<Token> unclosed = unclosedBrackets(tokens);
        if (offending.getType() == Token.EOF) {
            if (!unclosed.isEmpty()) {
                return unclosedOrigin(tokens, unclosed.get(0));
            }
            Token last = lastToken(tokens);
            if (last == null) {
                return new Origin(code, code.length(), code.length());
            }
            return new Origin(code, last.getStartIndex(), last.getStopIndex() + 1);
        }
        for (Token bracket : unclosed) {
            if (bracket.getTokenIndex() == offending.getTokenIndex()) {
                return unclosedOrigin(tokens, bracket);
            }
        }
        int start = offending.getStartIndex();
        int end = offending.getStopIndex() + 1;
        if (offending.getType() == FormulaLexer.OTHER) {
            end = endOfLine(start);
        }
        return new Origin(code, start, end);
    }

    /**
     * A grouping parenthesis is reported on its own. Any other bracket opens part of an
     * embedded expression, which is reported from its first token to the end of input.
     */
    private Origin unclosedOrigin(List<Token> tokens, Token bracket) {
        int index = bracket.getTokenIndex();
        if (bracket.getType() == FormulaLexer.LPAREN && !followsExpressionPart(tokens, index)) {
            return new Origin(code, bracket.getStartIndex(), bracket.getStopIndex() + 1);
        }
        Token first = tokens.get(expressionStart(tokens, index));
        return new Origin(code, first.getStartIndex(), lastToken(tokens).getStopIndex() + 1);
    }

    private static List<Token> tokensOf(TokenStream stream) {
        if (stream instanceof BufferedTokenStream) {
            BufferedTokenStream buffered = (BufferedTokenStream) stream;
            buffered.fill();
            return buffered.getTokens();
        }
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < stream.size(); i++) {
            tokens.add(stream.get(i));
        }
        return tokens;
    }

    /**
     * Opening brackets without a matching close, outermost first.
     */
    private static List<Token> unclosedBrackets(List<Token> tokens) {
        Deque<Token> open = new ArrayDeque<>();
        for (Token token : tokens) {
            int type = token.getType();
            if (isOpening(type)) {
                open.push(token);
            } else if (isClosing(type) && !open.isEmpty() && closerOf(open.peek().getType()) == type) {
                open.pop();
            }
        }
        List<Token> outermostFirst = new ArrayList<>(open);
        Collections.reverse(outermostFirst);
        return outermostFirst;
    }

    private static boolean followsExpressionPart(List<Token> tokens, int index) {
        if (index == 0) {
            return false;
        }
        int previous = tokens.get(index - 1).getType();
        return previous == FormulaLexer.IDENTIFIER || previous == FormulaLexer.STRING || previous == FormulaLexer.CHAR
               || isClosing(previous);
    }

    /**
     * Walks back over the atom and trailers that precede the token at {@code index}.
     */
    private static int expressionStart(List<Token> tokens, int index) {
        int first = index;
        while (first > 0) {
            int previous = tokens.get(first - 1).getType();
            if (isClosing(previous)) {
                first = openerIndex(tokens, first - 1);
            } else if (previous == FormulaLexer.IDENTIFIER || previous == FormulaLexer.STRING
                       || previous == FormulaLexer.CHAR || previous == FormulaLexer.DOT) {
                first--;
            } else {
                break;
            }
        }
        return first;
    }

    private static int openerIndex(List<Token> tokens, int closingIndex) {
        int depth = 0;
        for (int i = closingIndex; i >= 0; i--) {
            int type = tokens.get(i).getType();
            if (isClosing(type)) {
                depth++;
            } else if (isOpening(type) && --depth == 0) {
                return i;
            }
        }
        return 0;
    }

    private static Token lastToken(List<Token> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).getType() != Token.EOF) {
                return tokens.get(i);
            }
        }
        return null;
    }

    private static boolean isOpening(int type) {
        return type == FormulaLexer.LPAREN || type == FormulaLexer.LBRACK || type == FormulaLexer.LBRACE;
    }

    private static boolean isClosing(int type) {
        return type == FormulaLexer.RPAREN || type == FormulaLexer.RBRACK || type == FormulaLexer.RBRACE;
    }

    private static int closerOf(int opening) {
        if (opening == FormulaLexer.LPAREN) {
            return FormulaLexer.RPAREN;
        }
        return opening == FormulaLexer.LBRACK ? FormulaLexer.RBRACK : FormulaLexer.RBRACE;
    }

    private int endOfLine(int start) {
        int newline = code.indexOf('\n', start);
        int end = newline < 0 ? code.length() : newline;
        while (end > start + 1 && Character.isWhitespace(code.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private int offsetOf(int line, int charPositionInLine) {
        int offset = 0;
        for (int current = 1; current < line; current++) {
            int newline = code.indexOf('\n', offset);
            if (newline < 0) {
                break;
            }
            offset = newline + 1;
        }
        return Math.min(offset + charPositionInLine, code.length());
    }
}
