package org.dynamis.formula.eval;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;
import org.dynamis.formula.FactorEvaluationException;

/**
 * Walks an embedded expression's JavaParser tree and computes its value. Every node type
 * without a {@code visit} override is rejected.
 */
final class ExpressionInterpreter extends GenericVisitorWithDefaults<Object, Void> {

    private final String code;
    private final Map<String, ?> data;
    private final EvalEnvironment environment;

    ExpressionInterpreter(String code, Map<String, ?> data, EvalEnvironment environment) {
        this.code = code;
        this.data = data;
        this.environment = environment;
    }

    @Override
    public Object defaultAction(Node n, Void arg) {
        throw new FactorEvaluationException("Unsupported expression '" + n + "' in factor '" + code + "'", code);
    }

    @Override
    public Object defaultAction(NodeList n, Void arg) {
        throw new FactorEvaluationException("Unsupported expression list in factor '" + code + "'", code);
    }

    @Override
    public Object visit(NameExpr n, Void arg) {
        return resolve(n.getNameAsString());
    }

    @Override
    public Object visit(EnclosedExpr n, Void arg) {
        return n.getInner().accept(this, arg);
    }

    @Override
    public Object visit(MethodCallExpr n, Void arg) {
        if (n.getScope().isPresent()) {
            throw new FactorEvaluationException("Qualified call '" + n + "' is not supported in factor '" + code + "'", code);
        }
        String name = n.getNameAsString();
        Object target = resolve(name);
        if (!(target instanceof FormulaFunction)) {
            throw new FactorEvaluationException("'" + name + "' is not a function", code);
        }
        List<Object> args = new ArrayList<>();
        for (Expression argument : n.getArguments()) {
            args.add(argument.accept(this, arg));
        }
        try {
            return ((FormulaFunction) target).call(args);
        } catch (RuntimeException e) {
            throw new FactorEvaluationException("Error calling '" + name + "' in factor '" + code + "': " + e.getMessage(), code, e);
        }
    }

    @Override
    public Object visit(IntegerLiteralExpr n, Void arg) {
        return n.asNumber();
    }

    @Override
    public Object visit(LongLiteralExpr n, Void arg) {
        return n.asNumber();
    }

    @Override
    public Object visit(DoubleLiteralExpr n, Void arg) {
        return n.asDouble();
    }

    @Override
    public Object visit(StringLiteralExpr n, Void arg) {
        return n.asString();
    }

    @Override
    public Object visit(CharLiteralExpr n, Void arg) {
        return n.asChar();
    }

    @Override
    public Object visit(BooleanLiteralExpr n, Void arg) {
        return n.getValue();
    }

    @Override
    public Object visit(NullLiteralExpr n, Void arg) {
        return null;
    }

    private Object resolve(String name) {
        if (data.containsKey(name)) {
            return data.get(name);
        }
        return environment.lookup(name)
                .orElseThrow(() -> new FactorEvaluationException("Name '" + name + "' is not defined", code));
    }
}
