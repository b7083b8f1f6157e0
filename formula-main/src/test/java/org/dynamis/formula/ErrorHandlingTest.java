package org.dynamis.formula;

import org.dynamis.formula.desc.ModelDesc;
import org.dynamis.formula.eval.EvalEnvironment;
import org.dynamis.formula.parser.NodeType;
import org.dynamis.formula.parser.Origin;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlingTest {

    // 1. FormulaParseException: invalid syntax
    @Test
    void parseError_carriesFormulaText() {
        String badFormula = "y ~ a + * b";
        assertThatThrownBy(() -> ModelDesc.fromFormula(badFormula, EvalEnvironment.empty()))
            .isInstanceOf(FormulaParseException.class)
            .satisfies(e -> {
                FormulaParseException pe = (FormulaParseException) e;
                assertThat(pe.getFormula()).isEqualTo(badFormula);
                assertThat(pe.getOrigin()).isEqualTo(new Origin(badFormula, 8, 9));
                assertThat(pe.getMessage()).contains("Parse error");
            });
    }

    // 2. UnknownOperatorException: structured fields
    @Test
    void unknownOperator_reportsTypeAndArity() {
        Origin origin = new Origin("a:b", 1, 2);
        UnknownOperatorException ex = new UnknownOperatorException(NodeType.INTERACT, 1, origin);
        assertThat(ex.getNodeType()).isEqualTo(NodeType.INTERACT);
        assertThat(ex.getArity()).isEqualTo(1);
        assertThat(ex.getOrigin()).isEqualTo(origin);
        assertThat(ex.getMessage()).isEqualTo("I don't know how to evaluate this ':' operator");
        assertThat(ex).isInstanceOf(FormulaEvaluationException.class);
        assertThat(ex).isInstanceOf(FormulaException.class);
    }

    // 3. InvalidLiteralException: keeps the literal
    @Test
    void invalidLiteral_carriesLiteralAndOrigin() {
        assertThatThrownBy(() -> ModelDesc.fromFormula("y ~ a + 2", EvalEnvironment.empty()))
            .isInstanceOf(InvalidLiteralException.class)
            .satisfies(e -> {
                InvalidLiteralException ile = (InvalidLiteralException) e;
                assertThat(ile.getLiteral()).isEqualTo("2");
                assertThat(ile.getOrigin()).isEqualTo(new Origin("y ~ a + 2", 8, 9));
                assertThat(ile).hasMessage("numbers besides '0' and '1' are only allowed with **");
            });
    }

    // 4. Exponent parse failure keeps its cause
    @Test
    void invalidExponent_wrapsNumberFormatException() {
        assertThatThrownBy(() -> ModelDesc.fromFormula("(a + b) ** 1.5", EvalEnvironment.empty()))
            .isInstanceOf(InvalidLiteralException.class)
            .hasMessage("'**' requires a positive integer")
            .hasCauseInstanceOf(NumberFormatException.class);
    }

    // 5. caretMessage underlines the origin
    @Test
    void caretMessage_underlinesOrigin() {
        FormulaEvaluationException ex = new InterceptInteractionException(new Origin("a:1", 2, 3));
        assertThat(ex.caretMessage()).isEqualTo(
            "intercept term cannot interact with anything else\n" +
            "    a:1\n" +
            "      ^");
    }

    // 6. Hierarchy: all exceptions extend FormulaException
    @Test
    void exceptionHierarchy_allExtendRoot() {
        assertThat(FormulaException.class).isAssignableFrom(FormulaParseException.class);
        assertThat(FormulaException.class).isAssignableFrom(FormulaEvaluationException.class);
        assertThat(FormulaException.class).isAssignableFrom(FactorEvaluationException.class);
        assertThat(FormulaEvaluationException.class).isAssignableFrom(UnknownOperatorException.class);
        assertThat(FormulaEvaluationException.class).isAssignableFrom(MisplacedSeparatorException.class);
        assertThat(FormulaEvaluationException.class).isAssignableFrom(InvalidLiteralException.class);
        assertThat(FormulaEvaluationException.class).isAssignableFrom(InvalidUnaryMinusException.class);
        assertThat(FormulaEvaluationException.class).isAssignableFrom(InterceptInteractionException.class);
        assertThat(FormulaEvaluationException.class).isAssignableFrom(ContractViolationException.class);
        assertThat(RuntimeException.class).isAssignableFrom(FormulaException.class);
    }

    // 7. catch(FormulaException) catches all subtypes
    @Test
    void catchRoot_catchesAllSubtypes() {
        Origin origin = new Origin("x", 0, 1);
        assertCaughtByRoot(new FormulaParseException("test", origin));
        assertCaughtByRoot(new UnknownOperatorException(NodeType.TILDE, 3, origin));
        assertCaughtByRoot(new MisplacedSeparatorException(origin));
        assertCaughtByRoot(new InvalidLiteralException("test", "2", origin));
        assertCaughtByRoot(new InvalidUnaryMinusException(origin));
        assertCaughtByRoot(new InterceptInteractionException(origin));
        assertCaughtByRoot(new ContractViolationException(origin));
        assertCaughtByRoot(new FactorEvaluationException("test", "x"));
    }

    // 8. Factor evaluation errors name the factor
    @Test
    void factorEvaluationError_namesFactor() {
        ModelDesc desc = ModelDesc.fromFormula("y ~ x", EvalEnvironment.capture(Map.of()));
        assertThatThrownBy(() -> desc.getRhsTermlist().get(1).getFactors().get(0).evaluate(Map.of(), Map.of()))
            .isInstanceOf(FactorEvaluationException.class)
            .satisfies(e -> assertThat(((FactorEvaluationException) e).getFactorName()).isEqualTo("x"));
    }

    private void assertCaughtByRoot(FormulaException ex) {
        try {
            throw ex;
        } catch (FormulaException caught) {
            assertThat(caught).isSameAs(ex);
        }
    }
}
