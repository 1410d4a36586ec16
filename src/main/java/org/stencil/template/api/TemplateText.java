package org.stencil.template.api;

/**
 * A provider of template source text, e.g. a wrapper around a string that
 * was loaded or pre-processed elsewhere.
 */
@FunctionalInterface
public interface TemplateText {

    /**
     * Returns the underlying template text.
     * @return The text, never null.
     */
    String getText();
}
