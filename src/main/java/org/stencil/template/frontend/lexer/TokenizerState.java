package org.stencil.template.frontend.lexer;

/**
 * The modes of the {@link Tokenizer} state machine.
 */
public enum TokenizerState {
    /** Collecting plain text; looking for the open delimiter. */
    TEXT,
    /** Just matched an open delimiter; determining the tag kind from the sigil. */
    TAG_SNIFF,
    /** Collecting the tag body; looking for the close delimiter. */
    IN_TAG
}
