package io.txnbox.core.model;

/**
 * Base value kinds a {@link Feature} can take. An {@link ActiveType} is a set of these plus a
 * compile-time-constant flag.
 */
public enum ValueType {
    NIL("nil"),
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    IP_ADDR("ip-addr"),
    LIST("list"),
    TUPLE("tuple");

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    /** Name used in diagnostics. */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
