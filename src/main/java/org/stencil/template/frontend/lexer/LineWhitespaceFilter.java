package org.stencil.template.frontend.lexer;

import java.util.List;
import java.util.ListIterator;

/**
 * Applies standalone-tag trimming to each completed source line.
 * <p>
 * A line whose tags are all non-interpolating and whose text is all whitespace loses its
 * text tokens entirely (including the newline); whitespace directly in front of a partial
 * is kept as that partial's indentation. Any other line gets a single {@code "\n"} text token.
 * <p>
 * Tokens are removed from the stream, so positions in the stream are not stable across calls.
 */
final class LineWhitespaceFilter {

    private static final String NEWLINE = "\n";

    private final List<Token> tokens;
    private int lineStart;
    private boolean tagSeen;

    LineWhitespaceFilter(List<Token> tokens) {
        this.tokens = tokens;
    }

    void reset() {
        lineStart = 0;
        tagSeen = false;
    }

    /**
     * Records that a tag (including a delimiter change) occurred on the current line.
     */
    void markTagSeen() {
        tagSeen = true;
    }

    /**
     * Finishes the current line. The pending text buffer must have been flushed already.
     * @param endOfInput {@code true} for the final line, which never gets a newline token.
     */
    void endLine(boolean endOfInput) {
        if (tagSeen && isWhitespaceOnly()) {
            removeLineText();
        } else if (!endOfInput) {
            tokens.add(Token.text(NEWLINE));
        }
        tagSeen = false;
        lineStart = tokens.size();
    }

    private boolean isWhitespaceOnly() {
        for (int i = lineStart; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isTag()) {
                if (token.kind().isInterpolating()) return false;
            } else if (!token.value().isBlank()) {
                return false;
            }
        }
        return true;
    }

    private void removeLineText() {
        ListIterator<Token> it = tokens.listIterator(lineStart);
        while (it.hasNext()) {
            Token token = it.next();
            if (token.isTag()) continue;
            it.remove();
            if (it.hasNext()) {
                Token next = it.next();
                if (next.kind().isPartial()) {
                    it.set(next.withIndent(token.value()));
                }
                it.previous();
            }
        }
    }
}
