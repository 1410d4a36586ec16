package org.stencil.template.frontend.lexer;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

/**
 * Construction-time options of the {@link Tokenizer}.
 * <p>
 * <strong>Configuration Example:</strong>
 * <pre>
 * stencil.tokenizer {
 *   enable-gettext = true   # recognize {{_ ...}} and {{ngettext ...}} tags
 *   delimiters = "&lt;% %&gt;"    # optional initial delimiters
 * }
 * </pre>
 *
 * @param enableGettext Whether the translation tags are recognized.
 * @param delimiters The initial delimiter override in {@code "OPEN CLOSE"} form, or {@code null}.
 */
public record TokenizerOptions(boolean enableGettext, String delimiters) {

    /** The options key that toggles the translation extension. */
    public static final String ENABLE_GETTEXT_KEY = "enable-gettext";
    /** The options key of the initial delimiter override. */
    public static final String DELIMITERS_KEY = "delimiters";

    /** Translation extension disabled, default delimiters. */
    public static final TokenizerOptions DEFAULTS = new TokenizerOptions(false, null);

    public TokenizerOptions {
        if (delimiters != null && delimiters.isBlank()) {
            delimiters = null;
        }
        if (delimiters != null) {
            DelimiterPair.parse(delimiters);
        }
    }

    /**
     * Reads the options from a configuration block (typically {@code stencil.tokenizer}).
     * Missing keys fall back to {@link #DEFAULTS}.
     *
     * @param config The configuration block.
     * @return The options.
     * @throws IllegalArgumentException if {@code enable-gettext} is not a boolean
     *                                  or {@code delimiters} is not a valid pair.
     */
    public static TokenizerOptions fromConfig(Config config) {
        boolean enableGettext = false;
        if (config.hasPath(ENABLE_GETTEXT_KEY)) {
            // getBoolean would also accept "yes", "on" and the like
            ConfigValue value = config.getValue(ENABLE_GETTEXT_KEY);
            if (value.valueType() != ConfigValueType.BOOLEAN) {
                throw new IllegalArgumentException(
                        "Tokenizer option '" + ENABLE_GETTEXT_KEY + "' must be a boolean, got "
                                + value.valueType() + ": " + value.render());
            }
            enableGettext = (Boolean) value.unwrapped();
        }
        String delimiters = config.hasPath(DELIMITERS_KEY) ? config.getString(DELIMITERS_KEY) : null;
        return new TokenizerOptions(enableGettext, delimiters);
    }
}
