package io.txnbox.core.error;

/** Thrown when a YAML node does not have the shape required at its position. */
public final class ConfigStructureException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public ConfigStructureException(String message) {
        super(message, Category.STRUCTURE);
    }

    public ConfigStructureException(String message, Throwable cause) {
        super(message, cause, Category.STRUCTURE);
    }
}
