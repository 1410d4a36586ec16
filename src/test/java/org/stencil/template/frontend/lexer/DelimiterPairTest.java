package org.stencil.template.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DelimiterPairTest {

    @Test
    void defaultsToDoubleBraces() {
        DelimiterPair pair = new DelimiterPair();

        assertThat(pair.open()).isEqualTo("{{");
        assertThat(pair.close()).isEqualTo("}}");
        assertThat(pair.hasDefaultClose()).isTrue();
    }

    @Test
    void parsesWhitespaceSeparatedPair() {
        DelimiterPair pair = DelimiterPair.parse("  <%\t %>  ");

        assertThat(pair.open()).isEqualTo("<%");
        assertThat(pair.close()).isEqualTo("%>");
        assertThat(pair.hasDefaultClose()).isFalse();
    }

    @Test
    void rejectsMalformedSpecifications() {
        assertThatThrownBy(() -> DelimiterPair.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DelimiterPair.parse("<%")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DelimiterPair.parse("< % >")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DelimiterPair.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsEmptyDelimiters() {
        DelimiterPair pair = new DelimiterPair();

        assertThatThrownBy(() -> pair.redefine("", "}}")).isInstanceOf(IllegalArgumentException.class);
        assertThat(pair.open()).isEqualTo("{{");
    }

    @Test
    void resetRestoresDefaults() {
        DelimiterPair pair = new DelimiterPair("[", "]");

        pair.reset();

        assertThat(pair).hasToString("{{ }}");
    }
}
