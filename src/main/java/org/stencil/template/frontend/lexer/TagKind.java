package org.stencil.template.frontend.lexer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Defines the kinds of tokens that the {@link Tokenizer} can produce.
 */
public enum TagKind {
    // Interpolation.
    /** A plain (escaped) interpolation such as {@code {{name}}}. Has no sigil. */
    ESCAPED(null),
    /** An unescaped interpolation written with a third brace, {@code {{{name}}}}. */
    UNESCAPED('{'),
    /** An unescaped interpolation written with an ampersand, {@code {{&name}}}. */
    UNESCAPED_AMPERSAND('&'),

    // Blocks.
    /** Opens a section, {@code {{#name args}}}. */
    SECTION('#'),
    /** Opens an inverted section, {@code {{^name}}}. */
    INVERTED('^'),
    /** Closes a section, {@code {{/name}}}. */
    END_SECTION('/'),

    // Miscellaneous.
    /** A comment, {@code {{! text}}}. */
    COMMENT('!'),
    /** A partial, {@code {{>name args}}}. */
    PARTIAL('>'),
    /** The alternative partial spelling, {@code {{<name args}}}. */
    PARTIAL_ALT('<'),
    /** Redefines the delimiters, {@code {{=<% %>=}}}. Never emitted as a token. */
    DELIMITER_CHANGE('='),

    // Translation extension.
    /** A singular translatable message, {@code {{_ text}}}. */
    GETTEXT('_'),
    /** A plural translatable message, {@code {{ngettext singular plural}}}. Recognized by keyword. */
    NGETTEXT(null),

    /** Plain text between tags. */
    TEXT(null);

    /** The keyword that marks a plural translation tag. */
    public static final String NGETTEXT_KEYWORD = "ngettext";

    private static final Set<TagKind> INTERPOLATING =
            Collections.unmodifiableSet(EnumSet.of(ESCAPED, UNESCAPED, UNESCAPED_AMPERSAND, GETTEXT, NGETTEXT));
    private static final Set<TagKind> ARGUMENT_TAKING =
            Collections.unmodifiableSet(EnumSet.of(SECTION, PARTIAL, PARTIAL_ALT, NGETTEXT));

    private static final Map<Character, TagKind> BASE_SIGILS = sigilTable(false);
    private static final Map<Character, TagKind> EXTENDED_SIGILS = sigilTable(true);

    private final Character sigil;

    TagKind(Character sigil) {
        this.sigil = sigil;
    }

    /**
     * @return The sigil character of this kind, or {@code null} if it has none.
     */
    public Character sigil() {
        return sigil;
    }

    /**
     * @return {@code true} if tags of this kind produce output (and so prevent standalone trimming).
     */
    public boolean isInterpolating() {
        return INTERPOLATING.contains(this);
    }

    /**
     * @return {@code true} if tags of this kind split their body into a name and arguments.
     */
    public boolean acceptsArguments() {
        return ARGUMENT_TAKING.contains(this);
    }

    /**
     * @return {@code true} if this kind is a partial in either spelling.
     */
    public boolean isPartial() {
        return this == PARTIAL || this == PARTIAL_ALT;
    }

    /**
     * @return {@code true} for all kinds except {@link #TEXT}.
     */
    public boolean isTag() {
        return this != TEXT;
    }

    /**
     * Returns the sigil lookup table.
     * @param translationEnabled Whether the translation extension sigils are included.
     * @return An unmodifiable map from sigil character to kind.
     */
    public static Map<Character, TagKind> sigils(boolean translationEnabled) {
        return translationEnabled ? EXTENDED_SIGILS : BASE_SIGILS;
    }

    private static Map<Character, TagKind> sigilTable(boolean translationEnabled) {
        Map<Character, TagKind> table = new LinkedHashMap<>();
        for (TagKind kind : values()) {
            if (kind.sigil == null) continue;
            if (kind == GETTEXT && !translationEnabled) continue;
            table.put(kind.sigil, kind);
        }
        return Collections.unmodifiableMap(table);
    }
}
