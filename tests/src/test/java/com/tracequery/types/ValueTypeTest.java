package com.tracequery.types;

import com.tracequery.test.TestBase;
import com.tracequery.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ValueType equality.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ValueType Tests")
public class ValueTypeTest extends TestBase {

    @Test
    @DisplayName("Equal components give equal values")
    void testStructuralEquality() {
        ValueType a = ValueType.create(Int64Type.get(), SemanticType.ST_BYTES);
        ValueType b = ValueType.create(Int64Type.get(), SemanticType.ST_BYTES);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }

    @Test
    @DisplayName("Either component distinguishes values")
    void testInequality() {
        ValueType base = ValueType.create(Int64Type.get(), SemanticType.ST_BYTES);

        assertThat(base).isNotEqualTo(ValueType.create(Float64Type.get(), SemanticType.ST_BYTES));
        assertThat(base).isNotEqualTo(ValueType.create(Int64Type.get(), SemanticType.ST_PERCENT));
    }

    @Test
    @DisplayName("of() leaves the semantic type unspecified")
    void testOf() {
        ValueType value = ValueType.of(StringType.get());

        assertThat(value.dataType()).isEqualTo(StringType.get());
        assertThat(value.semanticType()).isEqualTo(SemanticType.ST_UNSPECIFIED);
        assertThat(value).isEqualTo(ValueType.create(StringType.get(), SemanticType.ST_UNSPECIFIED));
    }

    @Test
    @DisplayName("Null components are rejected")
    void testNulls() {
        assertThatThrownBy(() -> ValueType.create(null, SemanticType.ST_BYTES))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> ValueType.create(Int64Type.get(), null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("toString shows both components")
    void testToString() {
        assertThat(ValueType.create(Int64Type.get(), SemanticType.ST_BYTES))
            .hasToString("ValueType(int64, ST_BYTES)");
    }

    @Test
    @DisplayName("Column exposes its value type")
    void testColumnValueType() {
        Column column = new Column("upid", UInt128Type.get(), SemanticType.ST_UPID, null);

        assertThat(column.valueType()).isEqualTo(ValueType.create(UInt128Type.get(), SemanticType.ST_UPID));
        assertThat(column.description()).isEmpty();
        assertThat(column).hasToString("upid: uint128 [ST_UPID]");
    }
}
