package org.stencil.template.api;

/**
 * Defines unique, testable error codes for malformed templates.
 * This decouples callers and tests from the exact error messages.
 */
public enum TemplateErrorCode {
    /** A tag was opened but its close delimiter never appeared. */
    UNTERMINATED_TAG,
    /** A delimiter-change tag is missing its {@code =} + close delimiter terminator. */
    UNTERMINATED_DELIMITER_CHANGE,
    /** A delimiter-change tag does not name exactly two non-empty delimiters. */
    INVALID_DELIMITERS
}
