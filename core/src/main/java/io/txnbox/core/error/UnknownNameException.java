package io.txnbox.core.error;

/** Thrown when a directive, extractor, modifier, hook or key path segment is not known. */
public final class UnknownNameException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public UnknownNameException(String message) {
        super(message, Category.LOOKUP);
    }

    public UnknownNameException(String message, Throwable cause) {
        super(message, cause, Category.LOOKUP);
    }
}
