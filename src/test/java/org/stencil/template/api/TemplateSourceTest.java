package org.stencil.template.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TemplateSourceTest {

    @Test
    void literalSourceReturnsItsText() {
        assertThat(TemplateSource.of("{{x}}").text()).isEqualTo("{{x}}");
        assertThat(TemplateSource.of("{{x}}")).isInstanceOf(TemplateSource.Literal.class);
    }

    @Test
    void providedSourceAsksItsProvider() {
        TemplateText provider = () -> "from provider";

        TemplateSource source = TemplateSource.of(provider);

        assertThat(source).isInstanceOf(TemplateSource.Provided.class);
        assertThat(source.text()).isEqualTo("from provider");
    }

    @Test
    void providerReturningNullIsRejected() {
        TemplateSource source = TemplateSource.of((TemplateText) () -> null);

        assertThatThrownBy(source::text).isInstanceOf(NullPointerException.class);
    }
}
