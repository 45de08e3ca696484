package io.txnbox.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import org.junit.jupiter.api.Test;

class ActiveTypeTest {

    @Test
    void unionCombinesBaseTypes() {
        ActiveType t = ActiveType.of(ValueType.STRING).union(ActiveType.of(ValueType.INTEGER));

        assertThat(t.baseTypes()).containsExactlyInAnyOrder(ValueType.STRING, ValueType.INTEGER);
        assertThat(t.canBe(ValueType.BOOLEAN)).isFalse();
    }

    @Test
    void unionIsConstantOnlyIfBothSidesAre() {
        ActiveType constant = ActiveType.of(ValueType.STRING).asCfgConst();
        ActiveType runtime = ActiveType.of(ValueType.INTEGER);

        assertThat(constant.union(constant).isCfgConst()).isTrue();
        assertThat(constant.union(runtime).isCfgConst()).isFalse();
    }

    @Test
    void emptySideDoesNotAffectConstancy() {
        ActiveType constant = ActiveType.of(ValueType.STRING).asCfgConst();

        assertThat(ActiveType.none().union(constant)).isEqualTo(constant);
        assertThat(constant.union(ActiveType.none())).isEqualTo(constant);
    }

    @Test
    void unionLeavesOperandsUnchanged() {
        ActiveType a = ActiveType.of(ValueType.STRING);
        a.union(ActiveType.of(ValueType.NIL));

        assertThat(a.baseTypes()).containsExactly(ValueType.STRING);
    }

    @Test
    void tupleRecordsElementTypes() {
        ActiveType elements = ActiveType.of(ValueType.STRING, ValueType.INTEGER);
        ActiveType tuple = ActiveType.tupleOf(elements);

        assertThat(tuple.baseTypes()).containsExactly(ValueType.TUPLE);
        assertThat(tuple.elementTypes()).containsExactlyInAnyOrder(ValueType.STRING, ValueType.INTEGER);
        assertThat(tuple.toString()).isEqualTo("tuple[string,integer]");
    }

    @Test
    void withoutRemovesOneBaseType() {
        ActiveType t = ActiveType.of(ValueType.STRING, ValueType.NIL).without(ValueType.NIL);

        assertThat(t.baseTypes()).containsExactly(ValueType.STRING);
        assertThat(t.isSubsetOf(EnumSet.of(ValueType.STRING))).isTrue();
    }

    @Test
    void asRuntimeClearsConstantFlag() {
        ActiveType t = ActiveType.of(ValueType.BOOLEAN).asCfgConst();

        assertThat(t.toString()).isEqualTo("boolean (const)");
        assertThat(t.asRuntime().isCfgConst()).isFalse();
        assertThat(t.asRuntime().baseTypes()).containsExactly(ValueType.BOOLEAN);
    }

    @Test
    void featureReportsConstantType() {
        assertThat(Feature.of(12).activeType()).isEqualTo(ActiveType.of(ValueType.INTEGER).asCfgConst());
        assertThat(Feature.NIL.activeType().canBe(ValueType.NIL)).isTrue();
    }
}
