package org.stencil.template.api;

import java.util.Objects;

/**
 * The input accepted by the tokenizer: either a raw string or a {@link TemplateText} provider.
 */
public sealed interface TemplateSource permits TemplateSource.Literal, TemplateSource.Provided {

    /**
     * Resolves this source to the text to be scanned.
     * @return The template text.
     */
    String text();

    /**
     * Creates a source from a raw string.
     * @param text The template text.
     * @return A literal source.
     */
    static TemplateSource of(String text) {
        return new Literal(text);
    }

    /**
     * Creates a source from a text provider.
     * @param provider The provider of the template text.
     * @return A provided source.
     */
    static TemplateSource of(TemplateText provider) {
        return new Provided(provider);
    }

    /**
     * Raw template text.
     * @param value The text.
     */
    record Literal(String value) implements TemplateSource {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String text() {
            return value;
        }
    }

    /**
     * Template text obtained from a provider.
     * @param provider The provider.
     */
    record Provided(TemplateText provider) implements TemplateSource {
        public Provided {
            Objects.requireNonNull(provider, "provider");
        }

        @Override
        public String text() {
            return Objects.requireNonNull(provider.getText(), "provider returned null text");
        }
    }
}
