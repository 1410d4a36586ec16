package org.stencil.template.frontend.lexer;

import java.util.regex.Pattern;

/**
 * Turns the buffered body of a closed tag into a {@link Token}.
 * <p>
 * Splits the body of argument-taking tags into name and arguments and recognizes
 * sigil-less plural translation tags when the translation extension is enabled.
 */
final class TokenBuilder {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NGETTEXT_PREFIX = Pattern.compile(TagKind.NGETTEXT_KEYWORD + "\\s+");

    private final boolean translationEnabled;

    TokenBuilder(boolean translationEnabled) {
        this.translationEnabled = translationEnabled;
    }

    /**
     * Builds the token for a closed tag.
     *
     * @param body The raw text between the sigil and the close delimiter.
     * @param detectedKind The kind determined from the sigil.
     * @param delimiters The delimiters active for this tag.
     * @param tagOpenIndex The offset of the tag's open delimiter.
     * @param closeIndex The offset of the matched close delimiter.
     * @return The token.
     */
    Token build(String body, TagKind detectedKind, DelimiterPair delimiters, int tagOpenIndex, int closeIndex) {
        TagKind kind = detectedKind;
        String content = body.trim();

        if (translationEnabled && kind == TagKind.ESCAPED) {
            var matcher = NGETTEXT_PREFIX.matcher(content);
            if (matcher.lookingAt()) {
                kind = TagKind.NGETTEXT;
                content = content.substring(matcher.end());
            }
        }

        String name = content;
        String args = null;
        if (kind.acceptsArguments()) {
            String[] parts = WHITESPACE.split(content, 2);
            name = parts[0];
            args = parts.length == 2 ? parts[1] : "";
        }

        int sourceIndex = kind == TagKind.END_SECTION
                ? tagOpenIndex
                : closeIndex + delimiters.close().length();

        return Token.tag(kind, name.trim(), delimiters, sourceIndex, args);
    }
}
