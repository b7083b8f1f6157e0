package org.dynamis.formula.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.Printer;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import org.dynamis.formula.FormulaParseException;

/**
 * Handles the Java expressions embedded in a formula as factor leaves, e.g. {@code log(x)}
 * in {@code y ~ log(x) + z}.
 */
public final class HostExpressions {

    private static final Printer PRINTER = new DefaultPrettyPrinter(
            new DefaultPrinterConfiguration().removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS)));

    private HostExpressions() {}

    /**
     * Parses the source and prints it back in canonical form, so that spacing variants of
     * the same expression produce the same text.
     *
     * @throws FormulaParseException if the source is not a Java expression
     */
    public static String normalize(String source, Origin origin) {
        return PRINTER.print(parse(source, origin));
    }

    /**
     * @throws FormulaParseException if the source is not a Java expression
     */
    public static Expression parse(String source, Origin origin) {
        ParseResult<Expression> result = new JavaParser().parseExpression(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getMessage)
                    .collect(Collectors.joining("; "));
            throw new FormulaParseException("Invalid expression '" + source + "': " + problems, origin);
        }
        return result.getResult().get();
    }

    /**
     * The variable names an expression reads, in order of first appearance. Method names are
     * not included; a qualifier such as {@code Math} in {@code Math.abs(x)} is.
     */
    public static List<String> variableNames(String source) {
        Set<String> names = new LinkedHashSet<>();
        for (NameExpr name : parse(source, null).findAll(NameExpr.class)) {
            names.add(name.getNameAsString());
        }
        return new ArrayList<>(names);
    }
}
