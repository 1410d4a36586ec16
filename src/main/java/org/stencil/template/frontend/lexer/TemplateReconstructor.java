package org.stencil.template.frontend.lexer;

import java.util.List;

/**
 * Renders a token stream back into template source.
 * <p>
 * Scanning the result reproduces the same token kinds, names, arguments, text and delimiters
 * as long as the original stream had no standalone lines (their trimmed whitespace is not part
 * of the stream). Source indices may shift where escapes are written differently than in the
 * original source.
 * <p>
 * Text that the scanner would read as an open delimiter is escaped with {@link Tokenizer#ESCAPE_CHAR}.
 * Delimiter changes are written out as {@code =OPEN CLOSE=} directives in front of the first tag
 * that uses the new pair, or between two text runs that a change split apart.
 */
public final class TemplateReconstructor {

    private static final String NEWLINE = "\n";

    private TemplateReconstructor() {}

    /**
     * Reconstructs template source from tokens that were scanned starting with the default delimiters.
     * @param tokens The tokens.
     * @return The template source.
     */
    public static String reconstruct(List<Token> tokens) {
        return reconstruct(tokens, new DelimiterPair());
    }

    /**
     * Reconstructs template source from tokens.
     * @param tokens The tokens.
     * @param initial The delimiters in effect at the start of the scan.
     * @return The template source.
     */
    public static String reconstruct(List<Token> tokens, DelimiterPair initial) {
        DelimiterPair current = new DelimiterPair(initial.open(), initial.close());
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.isTag()) {
                if (i > 0 && splitByDelimiterChange(tokens.get(i - 1), token)) {
                    changeDelimiters(out, current, nextTagDelimiters(tokens, i, current));
                }
                appendText(out, token.value(), current.open());
                continue;
            }
            if (!current.matches(token)) {
                changeDelimiters(out, current, new DelimiterPair(token.openDelimiter(), token.closeDelimiter()));
            }
            if (token.indent() != null) {
                out.append(token.indent());
            }
            appendTag(out, token);
        }
        return out.toString();
    }

    /**
     * Two text runs on the same line are only flushed separately when a delimiter change sat between them.
     */
    private static boolean splitByDelimiterChange(Token previous, Token token) {
        return !previous.isTag() && !NEWLINE.equals(previous.value()) && !NEWLINE.equals(token.value());
    }

    private static DelimiterPair nextTagDelimiters(List<Token> tokens, int from, DelimiterPair current) {
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isTag()) {
                return new DelimiterPair(token.openDelimiter(), token.closeDelimiter());
            }
        }
        return new DelimiterPair(current.open(), current.close());
    }

    private static void changeDelimiters(StringBuilder out, DelimiterPair current, DelimiterPair target) {
        out.append(current.open()).append('=')
                .append(target.open()).append(' ').append(target.close())
                .append('=').append(current.close());
        current.redefine(target);
    }

    /**
     * Writes text so that it scans back as text under the given open delimiter.
     * The first delimiter character is escaped where it starts a full delimiter, where it follows
     * a literal escape character, and where the text ends in a prefix of the delimiter that the
     * following output could complete.
     */
    private static void appendText(StringBuilder out, String text, String open) {
        char first = open.charAt(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == first && (text.startsWith(open, i)
                    || (i > 0 && text.charAt(i - 1) == Tokenizer.ESCAPE_CHAR)
                    || open.startsWith(text.substring(i)))) {
                out.append(Tokenizer.ESCAPE_CHAR);
            }
            out.append(c);
        }
    }

    private static void appendTag(StringBuilder out, Token token) {
        out.append(token.openDelimiter());
        if (token.kind() == TagKind.NGETTEXT) {
            out.append(TagKind.NGETTEXT_KEYWORD).append(' ');
        } else if (token.kind() == TagKind.GETTEXT) {
            out.append(token.kind().sigil()).append(' ');
        } else if (token.kind().sigil() != null) {
            out.append(token.kind().sigil());
        } else if (token.kind() == TagKind.ESCAPED && startsWithSigil(token.name())) {
            // keeps a name like "#x" from being read as a section
            out.append(' ');
        }
        out.append(token.name());
        if (token.args() != null && !token.args().isEmpty()) {
            out.append(' ').append(token.args());
        }
        if (token.kind() == TagKind.UNESCAPED) {
            // third brace with default delimiters, the trimmed trailing brace otherwise
            out.append('}');
        }
        out.append(token.closeDelimiter());
    }

    private static boolean startsWithSigil(String name) {
        return !name.isEmpty() && TagKind.sigils(true).containsKey(name.charAt(0));
    }
}
