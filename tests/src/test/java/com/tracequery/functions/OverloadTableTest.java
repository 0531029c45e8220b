package com.tracequery.functions;

import com.tracequery.config.DuplicatePolicy;
import com.tracequery.descriptor.ScalarUdfSpec;
import com.tracequery.descriptor.UdaSpec;
import com.tracequery.exception.FunctionNotFoundException;
import com.tracequery.exception.InvalidDescriptorException;
import com.tracequery.exception.SignatureMismatchException;
import com.tracequery.test.TestBase;
import com.tracequery.test.TestCategories;
import com.tracequery.types.BooleanType;
import com.tracequery.types.DataType;
import com.tracequery.types.Float64Type;
import com.tracequery.types.Int64Type;
import com.tracequery.types.StringType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for exact-match overload resolution.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("OverloadTable Tests")
public class OverloadTableTest extends TestBase {

    private static final DataType INT64 = Int64Type.get();
    private static final DataType FLOAT64 = Float64Type.get();
    private static final DataType STRING = StringType.get();

    private OverloadTable<ScalarUdfSpec> table;

    @BeforeEach
    void setUp() {
        table = new OverloadTable<>("scalar UDF", DuplicatePolicy.REJECT);
        table.register(new ScalarUdfSpec("add", List.of(INT64, INT64), INT64));
        table.register(new ScalarUdfSpec("add", List.of(FLOAT64, FLOAT64), FLOAT64));
        table.register(new ScalarUdfSpec("length", List.of(STRING), INT64));
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Each overload resolves by its own argument types")
        void testOverloads() {
            assertThat(table.resolve("add", List.of(INT64, INT64))).isEqualTo(INT64);
            assertThat(table.resolve("add", List.of(FLOAT64, FLOAT64))).isEqualTo(FLOAT64);
            assertThat(table.resolve("length", List.of(STRING))).isEqualTo(INT64);
        }

        @Test
        @DisplayName("Mixed argument types do not resolve")
        void testMixedTypes() {
            assertThatThrownBy(() -> table.resolve("add", List.of(INT64, FLOAT64)))
                .isInstanceOf(SignatureMismatchException.class)
                .hasMessageContaining("add")
                .hasMessageContaining("int64, float64");
        }

        @Test
        @DisplayName("Arity is part of the signature")
        void testArity() {
            assertThatThrownBy(() -> table.resolve("add", List.of(INT64)))
                .isInstanceOf(SignatureMismatchException.class);
            assertThatThrownBy(() -> table.resolve("add", List.of(INT64, INT64, INT64)))
                .isInstanceOf(SignatureMismatchException.class);
        }

        @Test
        @DisplayName("Mismatch reports every candidate signature")
        void testMismatchCandidates() {
            assertThatThrownBy(() -> table.resolve("add", List.of(BooleanType.get())))
                .isInstanceOfSatisfying(SignatureMismatchException.class, e -> {
                    assertThat(e.getFunctionName()).isEqualTo("add");
                    assertThat(e.getArgumentTypes()).containsExactly(BooleanType.get());
                    assertThat(e.getCandidates()).containsExactly(
                        List.of(INT64, INT64), List.of(FLOAT64, FLOAT64));
                });
        }

        @Test
        @DisplayName("Unknown name is not found rather than a mismatch")
        void testNotFound() {
            assertThatThrownBy(() -> table.resolve("sub", List.of(INT64, INT64)))
                .isInstanceOf(FunctionNotFoundException.class)
                .hasMessage("Scalar UDF not found: sub");
        }

        @Test
        @DisplayName("Resolved signature carries its metadata")
        void testResolveSignature() {
            OverloadTable<UdaSpec> udas = new OverloadTable<>("UDA", DuplicatePolicy.REJECT);
            udas.register(new UdaSpec("count", List.of(INT64), INT64, true));

            assertThat(udas.resolveSignature("count", List.of(INT64)).supportsPartial()).isTrue();
            assertThatThrownBy(() -> udas.resolve("sum", List.of(INT64)))
                .hasMessage("UDA not found: sum");
        }
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Names and overloads keep registration order")
        void testNamesAndOverloads() {
            assertThat(table.names()).containsExactly("add", "length");
            assertThat(table.overloads("add")).extracting(ScalarUdfSpec::returnType)
                .containsExactly(INT64, FLOAT64);
            assertThat(table.overloads("missing")).isEmpty();
            assertThat(table.size()).isEqualTo(3);
            assertThat(table.contains("length")).isTrue();
            assertThat(table.contains("missing")).isFalse();
        }

        @Test
        @DisplayName("Duplicate signature is rejected under the reject policy")
        void testDuplicateRejected() {
            assertThatThrownBy(() -> table.register(new ScalarUdfSpec("add", List.of(INT64, INT64), STRING)))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("Duplicate scalar UDF signature");
            assertThat(table.resolve("add", List.of(INT64, INT64))).isEqualTo(INT64);
        }

        @Test
        @DisplayName("Duplicate signature replaces the earlier one under the replace policy")
        void testDuplicateReplaced() {
            OverloadTable<ScalarUdfSpec> replacing = new OverloadTable<>("scalar UDF", DuplicatePolicy.REPLACE);
            replacing.register(new ScalarUdfSpec("add", List.of(INT64, INT64), INT64));
            replacing.register(new ScalarUdfSpec("add", List.of(INT64, INT64), STRING));

            assertThat(replacing.size()).isEqualTo(1);
            assertThat(replacing.resolve("add", List.of(INT64, INT64))).isEqualTo(STRING);
        }

        @Test
        @DisplayName("Frozen table rejects registration")
        void testFrozen() {
            table.freeze();

            assertThatThrownBy(() -> table.register(new ScalarUdfSpec("neg", List.of(INT64), INT64)))
                .isInstanceOf(IllegalStateException.class);
            assertThat(table.resolve("length", List.of(STRING))).isEqualTo(INT64);
        }
    }
}
