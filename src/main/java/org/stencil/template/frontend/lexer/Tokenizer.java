package org.stencil.template.frontend.lexer;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.template.api.MalformedTemplateException;
import org.stencil.template.api.TemplateErrorCode;
import org.stencil.template.api.TemplateSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The Tokenizer (also known as Scanner) converts template source text into a
 * sequence of tokens for the template parser.
 * <p>
 * It is a three-state machine ({@link TokenizerState}) that walks the source once,
 * honoring escaped open delimiters, delimiter changes and standalone-line trimming.
 * <p>
 * An instance resets its state at the start of every scan and may be reused
 * sequentially. It is not thread-safe.
 */
public class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    /** Escapes an open delimiter: {@code \{{x}}} is plain text. */
    public static final char ESCAPE_CHAR = '\\';

    private static final String DELIMITER_CHANGE_MARKER = "=";

    private final TokenizerOptions options;
    private final Map<Character, TagKind> sigils;
    private final TokenBuilder tokenBuilder;

    private final List<Token> tokens = new ArrayList<>();
    private final LineWhitespaceFilter lineFilter = new LineWhitespaceFilter(tokens);
    private final DelimiterPair delimiters = new DelimiterPair();
    private final StringBuilder buffer = new StringBuilder();
    private TokenizerState state;
    private TagKind tagKind;
    private int tagOpenIndex;

    /**
     * Creates a tokenizer with the translation extension disabled.
     */
    public Tokenizer() {
        this(TokenizerOptions.DEFAULTS);
    }

    /**
     * Creates a tokenizer with the given options.
     * @param options The tokenizer options.
     */
    public Tokenizer(TokenizerOptions options) {
        this.options = options;
        this.sigils = TagKind.sigils(options.enableGettext());
        this.tokenBuilder = new TokenBuilder(options.enableGettext());
    }

    /**
     * Creates a tokenizer from a configuration block.
     * @param config The configuration block, see {@link TokenizerOptions#fromConfig(Config)}.
     * @return The tokenizer.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public static Tokenizer fromConfig(Config config) {
        return new Tokenizer(TokenizerOptions.fromConfig(config));
    }

    public TokenizerOptions getOptions() {
        return options;
    }

    /**
     * Scans a template using the configured initial delimiters.
     * @param source The template text.
     * @return The tokens in source order.
     * @throws MalformedTemplateException if a tag or delimiter change is not terminated.
     */
    public List<Token> scan(String source) throws MalformedTemplateException {
        return scan(TemplateSource.of(source), options.delimiters());
    }

    /**
     * Scans a template with an initial delimiter override.
     * @param source The template text.
     * @param initialDelimiters {@code "OPEN CLOSE"}, or {@code null}/blank for the configured delimiters.
     * @return The tokens in source order.
     * @throws MalformedTemplateException if a tag or delimiter change is not terminated.
     */
    public List<Token> scan(String source, String initialDelimiters) throws MalformedTemplateException {
        return scan(TemplateSource.of(source), initialDelimiters);
    }

    /**
     * Scans a template.
     * @param source The template, either literal text or a text provider.
     * @param initialDelimiters {@code "OPEN CLOSE"}, or {@code null}/blank for the configured delimiters.
     *                          Delimiter-change tags in the template still take effect.
     * @return An unmodifiable list of tokens in source order.
     * @throws MalformedTemplateException if a tag or delimiter change is not terminated.
     * @throws IllegalArgumentException if {@code initialDelimiters} is not a valid pair.
     */
    public List<Token> scan(TemplateSource source, String initialDelimiters) throws MalformedTemplateException {
        String text = source.text();
        reset();
        if (initialDelimiters != null && !initialDelimiters.isBlank()) {
            delimiters.redefine(DelimiterPair.parse(initialDelimiters));
        } else if (options.delimiters() != null) {
            delimiters.redefine(DelimiterPair.parse(options.delimiters()));
        }

        SourceCursor cursor = new SourceCursor(text);
        while (!cursor.isAtEnd()) {
            switch (state) {
                case TEXT -> scanText(cursor);
                case TAG_SNIFF -> sniffTag(cursor);
                case IN_TAG -> scanTagBody(cursor);
            }
        }

        if (state != TokenizerState.TEXT) {
            throw new MalformedTemplateException(TemplateErrorCode.UNTERMINATED_TAG,
                    "Tag opened with '" + delimiters.open() + "' is never closed with '" + delimiters.close() + "'",
                    tagOpenIndex);
        }

        flushBuffer();
        lineFilter.endLine(true);

        LOG.debug("Scanned {} tokens from {} characters", tokens.size(), text.length());
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    private void reset() {
        state = TokenizerState.TEXT;
        tagKind = null;
        tagOpenIndex = 0;
        buffer.setLength(0);
        tokens.clear();
        lineFilter.reset();
        delimiters.reset();
    }

    private void scanText(SourceCursor cursor) {
        char c = cursor.peek();
        if (c == ESCAPE_CHAR && cursor.hasAhead(2) && cursor.peek(1) == delimiters.open().charAt(0)) {
            buffer.append(cursor.peek(1));
            cursor.advance(2);
            return;
        }

        if (cursor.matches(delimiters.open())) {
            flushBuffer();
            tagOpenIndex = cursor.position();
            state = TokenizerState.TAG_SNIFF;
            return;
        }

        if (c == '\n') {
            flushBuffer();
            lineFilter.endLine(false);
        } else {
            buffer.append(c);
        }
        cursor.advance();
    }

    private void sniffTag(SourceCursor cursor) throws MalformedTemplateException {
        cursor.advance(delimiters.open().length());
        lineFilter.markTagSeen();

        TagKind kind = cursor.isAtEnd() ? null : sigils.get(cursor.peek());
        if (kind == TagKind.DELIMITER_CHANGE) {
            cursor.moveTo(changeDelimiters(cursor));
            state = TokenizerState.TEXT;
            return;
        }

        if (kind != null) {
            cursor.advance();
        } else {
            kind = TagKind.ESCAPED;
        }
        tagKind = kind;
        state = TokenizerState.IN_TAG;
    }

    /**
     * Reads {@code =NEWOPEN NEWCLOSE=} followed by the current close delimiter.
     * The cursor is positioned on the leading {@code =}.
     * @return The offset right after the terminator.
     */
    private int changeDelimiters(SourceCursor cursor) throws MalformedTemplateException {
        int bodyStart = cursor.position() + DELIMITER_CHANGE_MARKER.length();
        String terminator = DELIMITER_CHANGE_MARKER + delimiters.close();
        int terminatorIndex = cursor.indexOf(terminator, bodyStart);
        if (terminatorIndex < 0) {
            throw new MalformedTemplateException(TemplateErrorCode.UNTERMINATED_DELIMITER_CHANGE,
                    "Delimiter change is missing its terminator '" + terminator + "'", tagOpenIndex);
        }

        String body = cursor.slice(bodyStart, terminatorIndex);
        try {
            delimiters.redefine(DelimiterPair.parse(body));
        } catch (IllegalArgumentException e) {
            throw new MalformedTemplateException(TemplateErrorCode.INVALID_DELIMITERS,
                    "Invalid delimiter change '" + body.trim() + "'", tagOpenIndex);
        }
        LOG.trace("Delimiters changed to '{}' at offset {}", delimiters, tagOpenIndex);
        return terminatorIndex + terminator.length();
    }

    private void scanTagBody(SourceCursor cursor) {
        if (!cursor.matches(delimiters.close())) {
            buffer.append(cursor.peek());
            cursor.advance();
            return;
        }

        Token token = tokenBuilder.build(buffer.toString(), tagKind, delimiters, tagOpenIndex, cursor.position());
        buffer.setLength(0);
        cursor.advance(delimiters.close().length());

        if (tagKind == TagKind.UNESCAPED) {
            if (delimiters.hasDefaultClose()) {
                // the sigil consumed only one of the three opening braces
                cursor.advance();
            } else if (token.name().endsWith("}")) {
                String name = token.name();
                token = token.withName(name.substring(0, name.length() - 1).trim());
            }
        }

        tokens.add(token);
        state = TokenizerState.TEXT;
    }

    private void flushBuffer() {
        if (buffer.length() > 0) {
            tokens.add(Token.text(buffer.toString()));
            buffer.setLength(0);
        }
    }
}
