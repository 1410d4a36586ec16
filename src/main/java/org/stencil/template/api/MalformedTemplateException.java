package org.stencil.template.api;

/**
 * Thrown when the template source cannot be tokenized, e.g. because a tag is never closed.
 * <p>
 * The exception is recoverable: the tokenizer instance that threw it can be used for further scans.
 */
public class MalformedTemplateException extends Exception {

    private final TemplateErrorCode errorCode;
    private final int sourceIndex;

    /**
     * Constructs a new exception.
     * @param errorCode The error code identifying the problem.
     * @param message The detail message.
     * @param sourceIndex The offset in the source where the offending construct starts.
     */
    public MalformedTemplateException(TemplateErrorCode errorCode, String message, int sourceIndex) {
        super(String.format("%s at offset %d", message, sourceIndex));
        this.errorCode = errorCode;
        this.sourceIndex = sourceIndex;
    }

    public TemplateErrorCode getErrorCode() {
        return errorCode;
    }

    public int getSourceIndex() {
        return sourceIndex;
    }
}
