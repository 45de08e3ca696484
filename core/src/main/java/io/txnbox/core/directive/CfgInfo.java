package io.txnbox.core.directive;

/**
 * Per-configuration runtime record of a directive type: the shared type description, how many
 * instances this configuration compiled, and optional state the type initializer left for the
 * type's instances.
 *
 * <p>Written only during the compile pass of its configuration.
 */
public final class CfgInfo {

    private final DirectiveType type;
    private int count;
    private Object state;

    public CfgInfo(DirectiveType type) {
        this.type = type;
    }

    public DirectiveType type() {
        return type;
    }

    /** Number of instances of this type loaded so far in this configuration. */
    public int count() {
        return count;
    }

    /**
     * Counts one more use.
     *
     * @return {@code true} if this was the first use
     */
    public boolean recordUse() {
        return count++ == 0;
    }

    /** Per-configuration type state, cast to {@code kind}; {@code null} if none was set. */
    public <T> T state(Class<T> kind) {
        return state == null ? null : kind.cast(state);
    }

    public void setState(Object state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return "CfgInfo[" + type.name() + ", count=" + count + "]";
    }
}
