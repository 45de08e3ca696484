package io.txnbox.core.model;

import java.net.InetAddress;
import java.util.List;
import java.util.Objects;

/**
 * A concrete value matching one variant of {@link ActiveType}. Constant features are materialized
 * while a configuration is compiled and embedded in the compiled tree; all others are produced by
 * the host at request time.
 *
 * <p>All variants are immutable. Text variants hold a {@link CharSequence} so that configuration
 * text can be a view into the compiler's arena.
 */
public sealed interface Feature {

    /** The nil feature. */
    Feature NIL = new Nil();

    /** Base type of this value. */
    ValueType valueType();

    /** The type of this value as an embedded constant. */
    default ActiveType activeType() {
        return ActiveType.of(valueType()).asCfgConst();
    }

    static Feature of(long value) {
        return new IntegerValue(value);
    }

    static Feature of(boolean value) {
        return new BooleanValue(value);
    }

    static Feature of(InetAddress value) {
        return new IpAddr(value);
    }

    /** Text that came from an expression and may be further interpreted by consumers. */
    static Feature text(CharSequence text) {
        return new Text(text, false);
    }

    /** Text explicitly marked literal in the configuration. */
    static Feature literal(CharSequence text) {
        return new Text(text, true);
    }

    record Nil() implements Feature {
        @Override
        public ValueType valueType() {
            return ValueType.NIL;
        }

        @Override
        public String toString() {
            return "nil";
        }
    }

    record IntegerValue(long value) implements Feature {
        @Override
        public ValueType valueType() {
            return ValueType.INTEGER;
        }
    }

    record BooleanValue(boolean value) implements Feature {
        @Override
        public ValueType valueType() {
            return ValueType.BOOLEAN;
        }
    }

    record IpAddr(InetAddress address) implements Feature {
        public IpAddr {
            Objects.requireNonNull(address, "address must not be null");
        }

        @Override
        public ValueType valueType() {
            return ValueType.IP_ADDR;
        }
    }

    /**
     * @param text    the text, usually an arena view
     * @param literal {@code true} if the text was tagged literal and must not be reinterpreted
     */
    record Text(CharSequence text, boolean literal) implements Feature {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public ValueType valueType() {
            return ValueType.STRING;
        }
    }

    record ListValue(List<Feature> items) implements Feature {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public ValueType valueType() {
            return ValueType.LIST;
        }

        @Override
        public ActiveType activeType() {
            ActiveType elements = ActiveType.none();
            for (Feature item : items) {
                elements = elements.union(ActiveType.of(item.valueType()));
            }
            return ActiveType.listOf(elements).asCfgConst();
        }
    }
}
