package org.dynamis.formula.factor;

import java.util.HashMap;
import java.util.Map;

import org.dynamis.formula.FactorEvaluationException;
import org.dynamis.formula.parser.Origin;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LookupFactorTest {

    @Test
    void name_isColumnKey() {
        assertThat(new LookupFactor("a").name()).isEqualTo("a");
    }

    @Test
    void equality_isByNameOnly() {
        LookupFactor a = new LookupFactor("a");
        assertThat(a).isEqualTo(new LookupFactor("a"));
        assertThat(a).hasSameHashCodeAs(new LookupFactor("a"));
        assertThat(a).isNotEqualTo(new LookupFactor("b"));
        assertThat(a).isEqualTo(new LookupFactor("a", new Origin("a", 0, 1)));
    }

    @Test
    void evaluate_readsColumn() {
        LookupFactor a = new LookupFactor("a");
        assertThat(a.evaluate(new HashMap<>(), Map.of("a", 1))).isEqualTo(1);
        assertThat(a.evaluate(new HashMap<>(), Map.of("a", 2, "b", 3))).isEqualTo(2);
    }

    @Test
    void evaluate_missingColumnFails() {
        assertThatThrownBy(() -> new LookupFactor("a").evaluate(new HashMap<>(), Map.of("b", 1)))
                .isInstanceOf(FactorEvaluationException.class)
                .hasMessageContaining("'a'");
    }

    @Test
    void memorization_isNotNeeded() {
        LookupFactor a = new LookupFactor("a");
        Map<String, Object> state = new HashMap<>();
        assertThat(a.memorizePassesNeeded(state)).isZero();
        a.memorizeChunk(state, 0, Map.of("a", 1));
        a.memorizeFinish(state, 0);
        assertThat(state).isEmpty();
    }

    @Test
    void origin_isKept() {
        Origin origin = new Origin("y ~ b", 4, 5);
        assertThat(new LookupFactor("b", origin).origin()).isEqualTo(origin);
        assertThat(new LookupFactor("b").origin()).isNull();
        assertThat(new LookupFactor("b")).hasToString("LookupFactor(b)");
    }
}
