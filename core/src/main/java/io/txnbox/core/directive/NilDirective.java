package io.txnbox.core.directive;

/** Does nothing. Produced for an empty directive node. */
public final class NilDirective extends Directive {

    @Override
    public String typeName() {
        return "nil";
    }
}
