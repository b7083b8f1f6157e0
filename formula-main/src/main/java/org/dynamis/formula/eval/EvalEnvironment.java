package org.dynamis.formula.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.dynamis.formula.FactorEvaluationException;
import org.dynamis.formula.parser.HostExpressions;

/**
 * The variable bindings visible to the expressions embedded in a formula: a stack of namespaces
 * searched innermost first. Immutable; {@link #withOuterNamespace} returns an extended copy.
 */
public final class EvalEnvironment {

    private final List<Map<String, Object>> namespaces;
    private final int hashCode;

    private EvalEnvironment(List<Map<String, Object>> namespaces) {
        this.namespaces = Collections.unmodifiableList(namespaces);
        this.hashCode = namespaces.hashCode();
    }

    public static EvalEnvironment empty() {
        return new EvalEnvironment(new ArrayList<>());
    }

    /**
     * Captures a snapshot of the given variables. Later changes to the map are not seen.
     */
    public static EvalEnvironment capture(Map<String, ?> variables) {
        List<Map<String, Object>> namespaces = new ArrayList<>();
        namespaces.add(snapshot(variables));
        return new EvalEnvironment(namespaces);
    }

    /**
     * A copy of this environment that falls back to {@code namespace} for names it does not bind.
     */
    public EvalEnvironment withOuterNamespace(Map<String, ?> namespace) {
        List<Map<String, Object>> extended = new ArrayList<>(namespaces);
        extended.add(snapshot(namespace));
        return new EvalEnvironment(extended);
    }

    public List<Map<String, Object>> getNamespaces() {
        return namespaces;
    }

    public boolean contains(String name) {
        for (Map<String, Object> namespace : namespaces) {
            if (namespace.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The innermost binding for {@code name}. A name bound to {@code null} is reported as absent.
     */
    public Optional<Object> lookup(String name) {
        for (Map<String, Object> namespace : namespaces) {
            if (namespace.containsKey(name)) {
                return Optional.ofNullable(namespace.get(name));
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluates an embedded expression. Names are looked up in {@code data} first, then in this
     * environment. Only names, literals, parentheses and calls to bound {@link FormulaFunction}s
     * are supported; anything needing arithmetic belongs in a function.
     *
     * @throws FactorEvaluationException if the expression cannot be evaluated
     */
    public Object eval(String code, Map<String, ?> data) {
        return HostExpressions.parse(code, null).accept(new ExpressionInterpreter(code, data, this), null);
    }

    private static Map<String, Object> snapshot(Map<String, ?> variables) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EvalEnvironment that = (EvalEnvironment) o;
        return hashCode == that.hashCode && namespaces.equals(that.namespaces);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        List<Object> names = new ArrayList<>();
        for (Map<String, Object> namespace : namespaces) {
            names.add(namespace.keySet());
        }
        return "EvalEnvironment" + names;
    }
}
