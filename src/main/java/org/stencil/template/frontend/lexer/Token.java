package org.stencil.template.frontend.lexer;

/**
 * Represents a single token extracted from the template source by the {@link Tokenizer}.
 *
 * @param kind The kind of the token, {@link TagKind#TEXT} for plain text.
 * @param name The trimmed tag name, or the literal text for text tokens.
 * @param openDelimiter The open delimiter active when the tag was scanned ({@code null} for text).
 * @param closeDelimiter The close delimiter active when the tag was scanned ({@code null} for text).
 * @param sourceIndex For {@link TagKind#END_SECTION} the offset of the tag's open delimiter,
 *                    for other tags the offset right after the close delimiter,
 *                    {@link #NO_INDEX} for text.
 * @param indent The leading whitespace of a standalone partial, otherwise {@code null}.
 * @param args The raw parameter text for kinds that accept arguments, otherwise {@code null}.
 * @param value The raw text of a text token, otherwise {@code null}.
 */
public record Token(
        TagKind kind,
        String name,
        String openDelimiter,
        String closeDelimiter,
        int sourceIndex,
        String indent,
        String args,
        String value
) {
    /** The source index of tokens that do not carry one. */
    public static final int NO_INDEX = -1;

    /**
     * Creates a plain text token.
     * @param text The literal text.
     * @return The token.
     */
    public static Token text(String text) {
        return new Token(TagKind.TEXT, text, null, null, NO_INDEX, null, null, text);
    }

    /**
     * Creates a tag token.
     * @param kind The tag kind.
     * @param name The trimmed name.
     * @param delimiters The delimiters active for this tag.
     * @param sourceIndex See {@link #sourceIndex()}.
     * @param args The arguments, or {@code null} if the kind takes none.
     * @return The token.
     */
    public static Token tag(TagKind kind, String name, DelimiterPair delimiters, int sourceIndex, String args) {
        return new Token(kind, name, delimiters.open(), delimiters.close(), sourceIndex, null, args, null);
    }

    /**
     * @return {@code true} if this is a tag token.
     */
    public boolean isTag() {
        return kind.isTag();
    }

    /**
     * Returns a copy of this token with the given indentation.
     * @param newIndent The indentation.
     * @return The new token.
     */
    public Token withIndent(String newIndent) {
        return new Token(kind, name, openDelimiter, closeDelimiter, sourceIndex, newIndent, args, value);
    }

    /**
     * Returns a copy of this token with the given name.
     * @param newName The name.
     * @return The new token.
     */
    public Token withName(String newName) {
        return new Token(kind, newName, openDelimiter, closeDelimiter, sourceIndex, indent, args, value);
    }
}
