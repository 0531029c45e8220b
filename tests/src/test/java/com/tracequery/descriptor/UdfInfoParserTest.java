package com.tracequery.descriptor;

import com.tracequery.exception.InvalidDescriptorException;
import com.tracequery.test.RegistryFixtures;
import com.tracequery.test.TestBase;
import com.tracequery.test.TestCategories;
import com.tracequery.types.BooleanType;
import com.tracequery.types.Float64Type;
import com.tracequery.types.Int64Type;
import com.tracequery.types.Relation;
import com.tracequery.types.StringType;
import com.tracequery.types.Time64NsType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.tracequery.types.SemanticType.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for reading and writing JSON descriptor sets.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("UdfInfoParser Tests")
public class UdfInfoParserTest extends TestBase {

    @Nested
    @DisplayName("Standard Descriptor Set")
    class StandardDescriptorSet {

        @Test
        @DisplayName("Scalar UDFs keep their types and executor")
        void testScalarUdfs() {
            UdfInfo info = RegistryFixtures.standardUdfInfo();

            assertThat(info.scalarUdfs()).containsExactly(
                new ScalarUdfSpec("add", List.of(Float64Type.get(), Float64Type.get()), Float64Type.get()),
                new ScalarUdfSpec("scalar1", List.of(BooleanType.get(), Int64Type.get()), Int64Type.get(),
                    UdfSourceExecutor.UDF_PEM));
        }

        @Test
        @DisplayName("UDAs keep their partial aggregation flag")
        void testUdas() {
            UdfInfo info = RegistryFixtures.standardUdfInfo();

            assertThat(info.udas()).containsExactly(
                new UdaSpec("uda1", List.of(Int64Type.get()), Int64Type.get(), true));
        }

        @Test
        @DisplayName("UDTF relation columns are parsed in order")
        void testUdtfRelation() {
            UdfInfo info = RegistryFixtures.standardUdfInfo();

            UdtfSpec udtf = info.udtfs().get(0);
            Relation relation = udtf.relation();
            assertThat(relation.columns()).extracting(c -> c.name()).containsExactly("time_", "fd", "name");
            assertThat(relation.columnByName("time_").dataType()).isEqualTo(Time64NsType.get());
            assertThat(relation.columnIndex("name")).isEqualTo(2);
        }

        @Test
        @DisplayName("Semantic rules carry their function kind")
        void testRules() {
            UdfInfo info = RegistryFixtures.standardUdfInfo();

            assertThat(info.semanticTypeRules()).containsExactly(
                new SemanticTypeRule("add", UdfExecType.SCALAR_UDF, List.of(ST_BYTES, ST_BYTES), ST_BYTES),
                new SemanticTypeRule("uda1", UdfExecType.UDA, List.of(ST_BYTES), ST_BYTES));
        }

        @Test
        @DisplayName("Written JSON parses back to the same descriptor set")
        void testToJsonRoundTrip() {
            UdfInfo info = RegistryFixtures.standardUdfInfo();

            String json = UdfInfoParser.toJson(info);

            assertThat(json).contains("\"scalar_udfs\"", "\"update_arg_types\"", "\"column_semantic_type\"");
            assertThat(UdfInfoParser.parse(json)).isEqualTo(info);
        }
    }

    @Nested
    @DisplayName("Lenient Forms")
    class LenientForms {

        @Test
        @DisplayName("Missing top-level lists are empty")
        void testEmptyObject() {
            assertThat(UdfInfoParser.parse("{}")).isEqualTo(UdfInfo.EMPTY);
        }

        @Test
        @DisplayName("A single type name is accepted in place of a list")
        void testSingleTypeName() {
            UdfInfo info = UdfInfoParser.parse("""
                {"udas": [{"name": "count", "update_arg_types": "INT64", "finalize_type": "INT64"}]}
                """);

            UdaSpec uda = info.udas().get(0);
            assertThat(uda.updateArgTypes()).containsExactly(Int64Type.get());
            assertThat(uda.supportsPartial()).isFalse();
        }

        @Test
        @DisplayName("Omitted executor and arg types take defaults")
        void testDefaults() {
            UdfInfo info = UdfInfoParser.parse("""
                {"scalar_udfs": [{"name": "pi", "return_type": "float64"}],
                 "udtfs": [{"name": "Agents"}]}
                """);

            ScalarUdfSpec udf = info.scalarUdfs().get(0);
            assertThat(udf.execArgTypes()).isEmpty();
            assertThat(udf.executor()).isEqualTo(UdfSourceExecutor.UDF_ALL);

            UdtfSpec udtf = info.udtfs().get(0);
            assertThat(udtf.executor()).isEqualTo(UdtfExecutor.UDTF_UNSPECIFIED);
            assertThat(udtf.relation()).isEqualTo(Relation.EMPTY);
        }

        @Test
        @DisplayName("Rule kind is inferred from the pattern field when omitted")
        void testRuleKindInferred() {
            UdfInfo info = UdfInfoParser.parse("""
                {"semantic_type_rules": [
                  {"name": "sum", "update_arg_types": ["BYTES"], "output_type": "BYTES"},
                  {"name": "div", "exec_arg_types": ["ST_BYTES", "ST_DURATION_NS"],
                   "output_type": "ST_THROUGHPUT_BYTES_PER_NS"}
                ]}
                """);

            assertThat(info.semanticTypeRules()).extracting(SemanticTypeRule::udfExecType)
                .containsExactly(UdfExecType.UDA, UdfExecType.SCALAR_UDF);
            assertThat(info.semanticTypeRules().get(0).argTypes()).containsExactly(ST_BYTES);
        }

        @Test
        @DisplayName("Column semantic type and description are optional")
        void testOptionalColumnFields() {
            UdfInfo info = UdfInfoParser.parse("""
                {"udtfs": [{"name": "T", "relation": {"columns": [
                  {"column_name": "s", "column_type": "STRING", "column_desc": "a string"},
                  {"column_name": "n", "column_type": "INT64"}
                ]}}]}
                """);

            Relation relation = info.udtfs().get(0).relation();
            assertThat(relation.columnAt(0).dataType()).isEqualTo(StringType.get());
            assertThat(relation.columnAt(0).description()).isEqualTo("a string");
            assertThat(relation.columnAt(1).semanticType()).isEqualTo(ST_UNSPECIFIED);
            assertThat(relation.columnAt(1).description()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Malformed Input")
    class MalformedInput {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Blank input is rejected")
        void testBlank(String json) {
            assertThatThrownBy(() -> UdfInfoParser.parse(json))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("null or empty");
        }

        @Test
        @DisplayName("Invalid JSON is rejected with the parser error as cause")
        void testInvalidJson() {
            assertThatThrownBy(() -> UdfInfoParser.parse("{\"udas\": ["))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageStartingWith("Failed to parse descriptor set")
                .hasCauseInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class);
        }

        @Test
        @DisplayName("Non-object root is rejected")
        void testArrayRoot() {
            assertThatThrownBy(() -> UdfInfoParser.parse("[]"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("JSON object");
        }

        @Test
        @DisplayName("Non-array list field is rejected")
        void testListNotArray() {
            assertThatThrownBy(() -> UdfInfoParser.parse("{\"scalar_udfs\": {}}"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessage("'scalar_udfs' must be an array");
        }

        @Test
        @DisplayName("Unknown data type names the offending function")
        void testUnknownDataType() {
            assertThatThrownBy(() -> UdfInfoParser.parse(
                "{\"scalar_udfs\": [{\"name\": \"f\", \"exec_arg_types\": [\"INT32\"], \"return_type\": \"INT64\"}]}"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("INT32")
                .hasMessageContaining("'f'");
        }

        @Test
        @DisplayName("Unknown semantic type is rejected")
        void testUnknownSemanticType() {
            assertThatThrownBy(() -> UdfInfoParser.parse(
                "{\"semantic_type_rules\": [{\"name\": \"f\", \"exec_arg_types\": [\"ST_COLOR\"], \"output_type\": \"ST_BYTES\"}]}"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("ST_COLOR");
        }

        @Test
        @DisplayName("Unknown executor is rejected")
        void testUnknownExecutor() {
            assertThatThrownBy(() -> UdfInfoParser.parse(
                "{\"scalar_udfs\": [{\"name\": \"f\", \"return_type\": \"INT64\", \"executor\": \"UDF_GPU\"}]}"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("UDF_GPU");
        }

        @Test
        @DisplayName("Unknown rule kind is rejected")
        void testUnknownExecType() {
            assertThatThrownBy(() -> UdfInfoParser.parse(
                "{\"semantic_type_rules\": [{\"name\": \"f\", \"udf_exec_type\": \"UDTF\", \"output_type\": \"ST_BYTES\"}]}"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageContaining("udf_exec_type");
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "{\"udtfs\": [{\"name\": \"T\", \"args\": \"upid\"}]}",
            "{\"udtfs\": [{\"name\": \"T\", \"relation\": {\"columns\": {}}}]}",
            "{\"udtfs\": [{\"name\": \"T\", \"relation\": \"fd\"}]}"
        })
        @DisplayName("Non-array UDTF args or columns are rejected rather than dropped")
        void testUdtfListsNotArrays(String json) {
            assertThatThrownBy(() -> UdfInfoParser.parse(json))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessageEndingWith("in 'T'");
        }

        @Test
        @DisplayName("Missing return type is reported with its function")
        void testMissingField() {
            assertThatThrownBy(() -> UdfInfoParser.parse("{\"scalar_udfs\": [{\"name\": \"f\"}]}"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessage("Missing required field 'return_type' in 'f'");
        }

        @Test
        @DisplayName("Missing name is reported with its list")
        void testMissingName() {
            assertThatThrownBy(() -> UdfInfoParser.parse("{\"udas\": [{\"finalize_type\": \"INT64\"}]}"))
                .isInstanceOf(InvalidDescriptorException.class)
                .hasMessage("Missing required field 'name' in 'udas'");
        }
    }

    @Nested
    @DisplayName("Streams and Files")
    class StreamsAndFiles {

        @Test
        @DisplayName("Empty stream is rejected")
        void testEmptyStream() {
            assertThatThrownBy(() -> UdfInfoParser.parse(new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(InvalidDescriptorException.class);
        }

        @Test
        @DisplayName("File is read as UTF-8 JSON")
        void testFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("udfs.json");
            Files.writeString(file, UdfInfoParser.toJson(RegistryFixtures.standardUdfInfo()), StandardCharsets.UTF_8);

            assertThat(UdfInfoParser.parse(file)).isEqualTo(RegistryFixtures.standardUdfInfo());
        }
    }
}
