package org.pragmatica.harel.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpaqueExpressionTest {

    @Test
    void fragments_splitIdentifiersNumbersAndOperators() {
        var expression = OpaqueExpression.of("count >= 10 && name == \"x y\"");

        assertThat(expression.fragments())
            .containsExactly("count", ">=", "10", "&&", "name", "==", "\"x y\"");
    }

    @Test
    void fragments_keepBracketsAndCommasApart() {
        assertThat(OpaqueExpression.of("f(a, 1.5)").fragments())
            .containsExactly("f", "(", "a", ",", "1.5", ")");
    }

    @Test
    void fragments_unterminatedString_runsToEnd() {
        assertThat(OpaqueExpression.of("say('hi").fragments())
            .isEqualTo(List.of("say", "(", "'hi"));
    }

    @Test
    void text_isKeptVerbatim() {
        var expression = OpaqueExpression.of("  a  +  b ");

        assertThat(expression.text()).isEqualTo("  a  +  b ");
        assertThat(expression.fragments()).containsExactly("a", "+", "b");
        assertThat(OpaqueExpression.of("   ").isBlank()).isTrue();
    }
}
