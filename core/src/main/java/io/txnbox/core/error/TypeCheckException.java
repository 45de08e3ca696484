package io.txnbox.core.error;

/** Thrown when an expression's static type or capture references are invalid where it is used. */
public final class TypeCheckException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public TypeCheckException(String message) {
        super(message, Category.TYPE);
    }

    public TypeCheckException(String message, Throwable cause) {
        super(message, cause, Category.TYPE);
    }
}
