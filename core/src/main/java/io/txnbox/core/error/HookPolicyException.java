package io.txnbox.core.error;

/** Thrown when a directive is used on a hook its type does not allow. */
public final class HookPolicyException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public HookPolicyException(String message) {
        super(message, Category.POLICY);
    }

    public HookPolicyException(String message, Throwable cause) {
        super(message, cause, Category.POLICY);
    }
}
