package org.dynamis.formula;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FormulaConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(FormulaConfig.TRACE_PROPERTY);
        System.clearProperty(FormulaConfig.BUILTINS_PROPERTY);
    }

    @Test
    void defaults() {
        assertThat(FormulaConfig.isTraceEnabled()).isFalse();
        assertThat(FormulaConfig.isBuiltinsEnabled()).isTrue();
    }

    @Test
    void propertiesOverrideDefaults() {
        System.setProperty(FormulaConfig.TRACE_PROPERTY, "true");
        System.setProperty(FormulaConfig.BUILTINS_PROPERTY, "false");
        assertThat(FormulaConfig.isTraceEnabled()).isTrue();
        assertThat(FormulaConfig.isBuiltinsEnabled()).isFalse();
    }
}
