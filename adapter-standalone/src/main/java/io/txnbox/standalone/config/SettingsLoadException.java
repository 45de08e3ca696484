package io.txnbox.standalone.config;

/**
 * Thrown when the checker settings cannot be loaded: unreadable settings
 * file, invalid YAML, bad command line or a missing required setting.
 */
public class SettingsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SettingsLoadException(String message) {
        super(message);
    }

    public SettingsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
