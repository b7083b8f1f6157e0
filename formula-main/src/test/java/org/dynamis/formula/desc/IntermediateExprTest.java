package org.dynamis.formula.desc;

import java.util.List;

import org.dynamis.formula.factor.LookupFactor;
import org.dynamis.formula.parser.Origin;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntermediateExprTest {

    private final Term a = Term.of(new LookupFactor("a"));
    private final Origin one = new Origin("1 + a", 0, 1);

    @Test
    void interceptCannotBeBothPresentAndRemoved() {
        assertThatThrownBy(() -> new IntermediateExpr(true, one, true, List.of()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void presentInterceptNeedsOrigin() {
        assertThatThrownBy(() -> new IntermediateExpr(true, null, false, List.of()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void terms_areDeduplicated() {
        IntermediateExpr expr = IntermediateExpr.ofTerms(List.of(a, a));
        assertThat(expr.getTerms()).containsExactly(a);
        assertThat(expr.hasIntercept()).isFalse();
        assertThat(expr.isInterceptRemoved()).isFalse();
    }

    @Test
    void withTerms_keepsInterceptState() {
        IntermediateExpr expr = IntermediateExpr.withIntercept(one, List.of()).withTerms(List.of(a));
        assertThat(expr.hasIntercept()).isTrue();
        assertThat(expr.getInterceptOrigin()).isEqualTo(one);
        assertThat(expr.getTerms()).containsExactly(a);

        IntermediateExpr removed = IntermediateExpr.withoutIntercept(List.of(a)).withTerms(List.of());
        assertThat(removed.isInterceptRemoved()).isTrue();
        assertThat(removed.getTerms()).isEmpty();
    }
}
