package io.txnbox.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statically inferred result type of an expression: the set of base {@link ValueType}s the value
 * may have, the element types when the value may be a {@link ValueType#LIST} or
 * {@link ValueType#TUPLE}, and whether the value is known at configuration load time.
 *
 * <p>Immutable. {@link #union(ActiveType)} plays the role of {@code |=} by returning a new
 * instance.
 */
public final class ActiveType {

    private static final ActiveType EMPTY = new ActiveType(EnumSet.noneOf(ValueType.class), EnumSet.noneOf(ValueType.class), false);

    private final Set<ValueType> baseTypes;
    private final Set<ValueType> elementTypes;
    private final boolean cfgConst;

    private ActiveType(Set<ValueType> baseTypes, Set<ValueType> elementTypes, boolean cfgConst) {
        this.baseTypes = Collections.unmodifiableSet(baseTypes);
        this.elementTypes = Collections.unmodifiableSet(elementTypes);
        this.cfgConst = cfgConst;
    }

    /** The empty type set, used as the seed when combining alternatives. */
    public static ActiveType none() {
        return EMPTY;
    }

    /** A type that may be any of the given base types. */
    public static ActiveType of(ValueType first, ValueType... rest) {
        return new ActiveType(EnumSet.of(first, rest), EnumSet.noneOf(ValueType.class), false);
    }

    /** A tuple whose elements may be any of the base types of {@code elements}. */
    public static ActiveType tupleOf(ActiveType elements) {
        return new ActiveType(EnumSet.of(ValueType.TUPLE), copy(elements.baseTypes), false);
    }

    /** A homogeneous list whose elements may be any of the base types of {@code elements}. */
    public static ActiveType listOf(ActiveType elements) {
        return new ActiveType(EnumSet.of(ValueType.LIST), copy(elements.baseTypes), false);
    }

    /** Returns this type flagged as computable at configuration load time. */
    public ActiveType asCfgConst() {
        return cfgConst ? this : new ActiveType(copy(baseTypes), copy(elementTypes), true);
    }

    /** Returns this type without the configuration-constant flag. */
    public ActiveType asRuntime() {
        return cfgConst ? new ActiveType(copy(baseTypes), copy(elementTypes), false) : this;
    }

    /**
     * Union of two type sets. The result is constant only if both sides are constant; an empty
     * side does not affect constancy.
     */
    public ActiveType union(ActiveType that) {
        Objects.requireNonNull(that, "that must not be null");
        if (this.isEmpty()) {
            return that;
        }
        if (that.isEmpty()) {
            return this;
        }
        Set<ValueType> base = copy(baseTypes);
        base.addAll(that.baseTypes);
        Set<ValueType> elements = copy(elementTypes);
        elements.addAll(that.elementTypes);
        return new ActiveType(base, elements, cfgConst && that.cfgConst);
    }

    /** Returns this type with {@code type} removed from the base types. */
    public ActiveType without(ValueType type) {
        Set<ValueType> base = copy(baseTypes);
        base.remove(type);
        return new ActiveType(base, copy(elementTypes), cfgConst);
    }

    public boolean isCfgConst() {
        return cfgConst;
    }

    public boolean isEmpty() {
        return baseTypes.isEmpty();
    }

    /** {@code true} if a value of this type may be of the base type {@code type}. */
    public boolean canBe(ValueType type) {
        return baseTypes.contains(type);
    }

    /** {@code true} if every base type of this type is one of {@code allowed}. */
    public boolean isSubsetOf(Set<ValueType> allowed) {
        return allowed.containsAll(baseTypes);
    }

    public Set<ValueType> baseTypes() {
        return baseTypes;
    }

    public Set<ValueType> elementTypes() {
        return elementTypes;
    }

    private static Set<ValueType> copy(Set<ValueType> types) {
        return types.isEmpty() ? EnumSet.noneOf(ValueType.class) : EnumSet.copyOf(types);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveType that)) return false;
        return cfgConst == that.cfgConst && baseTypes.equals(that.baseTypes) && elementTypes.equals(that.elementTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseTypes, elementTypes, cfgConst);
    }

    @Override
    public String toString() {
        String base = baseTypes.stream()
                .map(t -> (t == ValueType.LIST || t == ValueType.TUPLE) && !elementTypes.isEmpty()
                        ? t.label() + elementTypes.stream().map(ValueType::label).collect(Collectors.joining(",", "[", "]"))
                        : t.label())
                .collect(Collectors.joining("|"));
        if (base.isEmpty()) {
            base = "none";
        }
        return cfgConst ? base + " (const)" : base;
    }
}
