package io.txnbox.core.error;

/** Thrown for malformed argument brackets, format specifiers, patterns or YAML text. */
public final class ConfigSyntaxException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public ConfigSyntaxException(String message) {
        super(message, Category.SYNTAX);
    }

    public ConfigSyntaxException(String message, Throwable cause) {
        super(message, cause, Category.SYNTAX);
    }
}
