package org.stencil.template.frontend.lexer;

/**
 * A read position over the template source with single-character and match-ahead lookahead.
 */
final class SourceCursor {

    private final String source;
    private int position;

    SourceCursor(String source) {
        this.source = source;
    }

    boolean isAtEnd() {
        return position >= source.length();
    }

    int position() {
        return position;
    }

    /**
     * @return {@code true} if at least {@code count} characters remain, counting the current one.
     */
    boolean hasAhead(int count) {
        return position + count <= source.length();
    }

    char peek() {
        return source.charAt(position);
    }

    char peek(int offset) {
        return source.charAt(position + offset);
    }

    void advance() {
        advance(1);
    }

    /**
     * Moves forward, never past the end of the source.
     */
    void advance(int count) {
        position = Math.min(source.length(), position + count);
    }

    void moveTo(int newPosition) {
        position = Math.min(source.length(), newPosition);
    }

    /**
     * @return {@code true} if the source continues with exactly {@code sequence} at the current position.
     */
    boolean matches(String sequence) {
        return source.startsWith(sequence, position);
    }

    int indexOf(String sequence, int from) {
        return source.indexOf(sequence, from);
    }

    String slice(int from, int to) {
        return source.substring(from, to);
    }
}
