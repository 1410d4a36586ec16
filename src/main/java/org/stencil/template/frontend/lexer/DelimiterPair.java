package org.stencil.template.frontend.lexer;

/**
 * Holds the open and close delimiters currently in effect during a scan.
 * <p>
 * The pair is mutable because templates may redefine their delimiters mid-scan.
 * Both delimiters are always non-empty.
 */
public final class DelimiterPair {

    /** The default open delimiter. */
    public static final String DEFAULT_OPEN = "{{";
    /** The default close delimiter. */
    public static final String DEFAULT_CLOSE = "}}";

    private String open;
    private String close;

    /**
     * Creates a pair holding the default delimiters.
     */
    public DelimiterPair() {
        reset();
    }

    /**
     * Creates a pair holding the given delimiters.
     * @param open The open delimiter.
     * @param close The close delimiter.
     * @throws IllegalArgumentException if either delimiter is null or empty.
     */
    public DelimiterPair(String open, String close) {
        redefine(open, close);
    }

    /**
     * Parses an {@code "OPEN CLOSE"} specification.
     * @param specification The delimiters separated by whitespace.
     * @return The parsed pair.
     * @throws IllegalArgumentException if the specification does not name exactly two delimiters.
     */
    public static DelimiterPair parse(String specification) {
        String[] parts = specification == null ? new String[0] : specification.trim().split("\\s+");
        if (parts.length != 2 || parts[0].isEmpty()) {
            throw new IllegalArgumentException(
                    "Delimiters must be given as 'OPEN CLOSE', got: '" + specification + "'");
        }
        return new DelimiterPair(parts[0], parts[1]);
    }

    /**
     * Restores the default delimiters.
     */
    public void reset() {
        this.open = DEFAULT_OPEN;
        this.close = DEFAULT_CLOSE;
    }

    /**
     * Replaces both delimiters.
     * @param newOpen The new open delimiter.
     * @param newClose The new close delimiter.
     * @throws IllegalArgumentException if either delimiter is null or empty.
     */
    public void redefine(String newOpen, String newClose) {
        if (newOpen == null || newOpen.isEmpty() || newClose == null || newClose.isEmpty()) {
            throw new IllegalArgumentException("Delimiters must not be empty");
        }
        this.open = newOpen;
        this.close = newClose;
    }

    /**
     * Copies the delimiters of another pair into this one.
     * @param other The pair to copy.
     */
    public void redefine(DelimiterPair other) {
        redefine(other.open, other.close);
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    /**
     * @return {@code true} if the close delimiter is the default {@code }}}.
     */
    public boolean hasDefaultClose() {
        return DEFAULT_CLOSE.equals(close);
    }

    /**
     * Tests whether this pair holds the same delimiters as the given token.
     * @param token A tag token.
     * @return {@code true} if both delimiters match.
     */
    public boolean matches(Token token) {
        return open.equals(token.openDelimiter()) && close.equals(token.closeDelimiter());
    }

    @Override
    public String toString() {
        return open + " " + close;
    }
}
