package org.dynamis.formula.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OriginTest {

    private static final String CODE = "y ~ a + b";

    @Test
    void relevantCode_isSpannedText() {
        assertThat(new Origin(CODE, 4, 9).relevantCode()).isEqualTo("a + b");
        assertThat(new Origin(CODE, 9, 9).relevantCode()).isEmpty();
    }

    @Test
    void combine_coversAllOrigins() {
        Origin a = new Origin(CODE, 4, 5);
        Origin b = new Origin(CODE, 8, 9);
        Origin y = new Origin(CODE, 0, 1);
        assertThat(Origin.combine(b, a)).isEqualTo(new Origin(CODE, 4, 9));
        assertThat(Origin.combine(a, null, y)).isEqualTo(new Origin(CODE, 0, 5));
    }

    @Test
    void combine_ofNothingIsNull() {
        assertThat(Origin.combine((Origin) null)).isNull();
    }

    @Test
    void combine_rejectsDifferentCode() {
        assertThatThrownBy(() -> Origin.combine(new Origin("a", 0, 1), new Origin("b", 0, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsSpanOutsideCode() {
        assertThatThrownBy(() -> new Origin("ab", 1, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Origin("ab", 2, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void caretize_underlinesSpan() {
        assertThat(new Origin(CODE, 4, 9).caretize(2)).isEqualTo(
                "  y ~ a + b\n" +
                "      ^^^^^");
    }

    @Test
    void caretize_showsOneCaretForEmptySpan() {
        assertThat(new Origin("a +", 3, 3).caretize(0)).isEqualTo("a +\n   ^");
    }

    @Test
    void equality_isBySpanAndCode() {
        assertThat(new Origin(CODE, 0, 1)).isEqualTo(new Origin(CODE, 0, 1));
        assertThat(new Origin(CODE, 0, 1)).hasSameHashCodeAs(new Origin(CODE, 0, 1));
        assertThat(new Origin(CODE, 0, 1)).isNotEqualTo(new Origin(CODE, 0, 2));
        assertThat(new Origin(CODE, 0, 1)).isNotEqualTo(new Origin("y ~ a", 0, 1));
    }
}
