package com.tracequery.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tracequery.exception.InvalidDescriptorException;
import com.tracequery.types.Column;
import com.tracequery.types.DataType;
import com.tracequery.types.DataTypes;
import com.tracequery.types.Relation;
import com.tracequery.types.SemanticType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Parses UDF descriptor sets from JSON into {@link UdfInfo}, and writes them back.
 *
 * <p>Expected format:
 * <pre>
 * {
 *   "scalar_udfs": [
 *     {"name": "add", "exec_arg_types": ["FLOAT64", "FLOAT64"], "return_type": "FLOAT64",
 *      "executor": "UDF_ALL"}
 *   ],
 *   "udas": [
 *     {"name": "count", "update_arg_types": ["INT64"], "finalize_type": "INT64",
 *      "supports_partial": true}
 *   ],
 *   "udtfs": [
 *     {"name": "OpenNetworkConnections",
 *      "args": [{"name": "upid", "arg_type": "UINT128", "semantic_type": "ST_UPID"}],
 *      "executor": "UDTF_SUBSET_PEM",
 *      "relation": {"columns": [{"column_name": "fd", "column_type": "INT64"}]}}
 *   ],
 *   "semantic_type_rules": [
 *     {"name": "add", "udf_exec_type": "SCALAR_UDF",
 *      "exec_arg_types": ["ST_BYTES", "ST_BYTES"], "output_type": "ST_BYTES"}
 *   ]
 * }
 * </pre>
 *
 * <p>Every top-level list is optional. A type list may also be given as a single string.
 * Semantic type rules carry their pattern in {@code exec_arg_types} (scalar UDFs) or
 * {@code update_arg_types} (UDAs).
 */
public final class UdfInfoParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private UdfInfoParser() {}

    /**
     * Parses a JSON descriptor set.
     *
     * @param json the descriptor set
     * @return the parsed descriptor set
     * @throws InvalidDescriptorException if the JSON is malformed or names unknown types
     */
    public static UdfInfo parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidDescriptorException("Descriptor set cannot be null or empty");
        }
        try {
            return parseRoot(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidDescriptorException("Failed to parse descriptor set: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON descriptor set from a stream. The stream is not closed.
     */
    public static UdfInfo parse(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new InvalidDescriptorException("Failed to parse descriptor set: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new InvalidDescriptorException("Descriptor set cannot be null or empty");
        }
        return parseRoot(root);
    }

    /**
     * Parses a JSON descriptor set from a file.
     */
    public static UdfInfo parse(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        }
    }

    /**
     * Writes a descriptor set as JSON in the format accepted by {@link #parse(String)}.
     *
     * @param info the descriptor set
     * @return pretty-printed JSON
     */
    public static String toJson(UdfInfo info) {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode scalars = root.putArray("scalar_udfs");
        for (ScalarUdfSpec udf : info.scalarUdfs()) {
            ObjectNode node = scalars.addObject();
            node.put("name", udf.name());
            writeDataTypes(node.putArray("exec_arg_types"), udf.execArgTypes());
            node.put("return_type", DataTypes.descriptorName(udf.returnType()));
            node.put("executor", udf.executor().name());
        }

        ArrayNode udas = root.putArray("udas");
        for (UdaSpec uda : info.udas()) {
            ObjectNode node = udas.addObject();
            node.put("name", uda.name());
            writeDataTypes(node.putArray("update_arg_types"), uda.updateArgTypes());
            node.put("finalize_type", DataTypes.descriptorName(uda.finalizeType()));
            node.put("supports_partial", uda.supportsPartial());
        }

        ArrayNode udtfs = root.putArray("udtfs");
        for (UdtfSpec udtf : info.udtfs()) {
            ObjectNode node = udtfs.addObject();
            node.put("name", udtf.name());
            ArrayNode args = node.putArray("args");
            for (UdtfArg arg : udtf.args()) {
                args.addObject()
                    .put("name", arg.name())
                    .put("arg_type", DataTypes.descriptorName(arg.argType()))
                    .put("semantic_type", arg.semanticType().name());
            }
            node.put("executor", udtf.executor().name());
            ArrayNode columns = node.putObject("relation").putArray("columns");
            for (Column column : udtf.relation().columns()) {
                ObjectNode columnNode = columns.addObject()
                    .put("column_name", column.name())
                    .put("column_type", DataTypes.descriptorName(column.dataType()))
                    .put("column_semantic_type", column.semanticType().name());
                if (!column.description().isEmpty()) {
                    columnNode.put("column_desc", column.description());
                }
            }
        }

        ArrayNode rules = root.putArray("semantic_type_rules");
        for (SemanticTypeRule rule : info.semanticTypeRules()) {
            ObjectNode node = rules.addObject();
            node.put("name", rule.name());
            node.put("udf_exec_type", rule.udfExecType().name());
            ArrayNode pattern = node.putArray(
                rule.udfExecType() == UdfExecType.UDA ? "update_arg_types" : "exec_arg_types");
            rule.argTypes().forEach(t -> pattern.add(t.name()));
            node.put("output_type", rule.outputType().name());
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize descriptor set", e);
        }
    }

    // ==================== Parsing ====================

    private static UdfInfo parseRoot(JsonNode root) {
        if (!root.isObject()) {
            throw new InvalidDescriptorException("Descriptor set must be a JSON object");
        }
        return new UdfInfo(
            parseList(root, "scalar_udfs", UdfInfoParser::parseScalarUdf),
            parseList(root, "udas", UdfInfoParser::parseUda),
            parseList(root, "udtfs", UdfInfoParser::parseUdtf),
            parseList(root, "semantic_type_rules", UdfInfoParser::parseRule));
    }

    private static <T> List<T> parseList(JsonNode root, String field, Function<JsonNode, T> parser) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new InvalidDescriptorException("'" + field + "' must be an array");
        }
        List<T> result = new ArrayList<>();
        for (JsonNode element : node) {
            result.add(parser.apply(element));
        }
        return result;
    }

    private static ScalarUdfSpec parseScalarUdf(JsonNode node) {
        String name = requiredText(node, "name", "scalar_udfs");
        return new ScalarUdfSpec(
            name,
            parseDataTypes(node.get("exec_arg_types"), name),
            parseDataType(requiredText(node, "return_type", name), name),
            parseEnum(node, "executor", UdfSourceExecutor.class, UdfSourceExecutor.UDF_ALL, name));
    }

    private static UdaSpec parseUda(JsonNode node) {
        String name = requiredText(node, "name", "udas");
        JsonNode partial = node.get("supports_partial");
        return new UdaSpec(
            name,
            parseDataTypes(node.get("update_arg_types"), name),
            parseDataType(requiredText(node, "finalize_type", name), name),
            partial != null && partial.asBoolean(false));
    }

    private static UdtfSpec parseUdtf(JsonNode node) {
        String name = requiredText(node, "name", "udtfs");

        List<UdtfArg> args = new ArrayList<>();
        JsonNode argsNode = node.get("args");
        if (isArray(argsNode, "args", name)) {
            for (JsonNode argNode : argsNode) {
                args.add(new UdtfArg(
                    requiredText(argNode, "name", name),
                    parseDataType(requiredText(argNode, "arg_type", name), name),
                    parseSemanticType(optionalText(argNode, "semantic_type"), name)));
            }
        }

        List<Column> columns = new ArrayList<>();
        JsonNode relationNode = node.get("relation");
        if (relationNode != null && !relationNode.isNull() && !relationNode.isObject()) {
            throw new InvalidDescriptorException("'relation' must be an object in '" + name + "'");
        }
        JsonNode columnsNode = node.path("relation").get("columns");
        if (isArray(columnsNode, "columns", name)) {
            for (JsonNode columnNode : columnsNode) {
                columns.add(new Column(
                    requiredText(columnNode, "column_name", name),
                    parseDataType(requiredText(columnNode, "column_type", name), name),
                    parseSemanticType(optionalText(columnNode, "column_semantic_type"), name),
                    optionalText(columnNode, "column_desc")));
            }
        }

        return new UdtfSpec(
            name,
            args,
            parseEnum(node, "executor", UdtfExecutor.class, UdtfExecutor.UDTF_UNSPECIFIED, name),
            new Relation(columns));
    }

    private static SemanticTypeRule parseRule(JsonNode node) {
        String name = requiredText(node, "name", "semantic_type_rules");
        JsonNode execArgs = node.get("exec_arg_types");
        JsonNode updateArgs = node.get("update_arg_types");

        UdfExecType execType;
        String execTypeName = optionalText(node, "udf_exec_type");
        if (execTypeName != null) {
            execType = parseExecType(execTypeName, name);
        } else {
            execType = updateArgs != null && execArgs == null ? UdfExecType.UDA : UdfExecType.SCALAR_UDF;
        }

        JsonNode patternNode = execType == UdfExecType.UDA ? updateArgs : execArgs;
        if (patternNode == null) {
            // Tolerate the pattern being filed under the other kind's field.
            patternNode = execType == UdfExecType.UDA ? execArgs : updateArgs;
        }

        List<SemanticType> pattern = new ArrayList<>();
        for (String typeName : textValues(patternNode, name)) {
            pattern.add(parseSemanticType(typeName, name));
        }

        return new SemanticTypeRule(
            name,
            execType,
            pattern,
            parseSemanticType(requiredText(node, "output_type", name), name));
    }

    // ==================== Helpers ====================

    /**
     * Whether an optional nested list is present; a present value that is not an array is
     * rejected.
     */
    private static boolean isArray(JsonNode node, String field, String context) {
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isArray()) {
            throw new InvalidDescriptorException("'" + field + "' must be an array in '" + context + "'");
        }
        return true;
    }

    private static List<DataType> parseDataTypes(JsonNode node, String context) {
        List<DataType> types = new ArrayList<>();
        for (String typeName : textValues(node, context)) {
            types.add(parseDataType(typeName, context));
        }
        return types;
    }

    private static List<String> textValues(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new InvalidDescriptorException("Expected a type name or array of type names in '" + context + "'");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.asText());
        }
        return values;
    }

    private static DataType parseDataType(String typeName, String context) {
        try {
            return DataTypes.fromName(typeName);
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptorException(e.getMessage() + " in '" + context + "'", e);
        }
    }

    private static SemanticType parseSemanticType(String typeName, String context) {
        if (typeName == null) {
            return SemanticType.ST_UNSPECIFIED;
        }
        try {
            return SemanticType.fromName(typeName);
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptorException(e.getMessage() + " in '" + context + "'", e);
        }
    }

    private static UdfExecType parseExecType(String value, String context) {
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "SCALAR_UDF", "UDF" -> UdfExecType.SCALAR_UDF;
            case "UDA" -> UdfExecType.UDA;
            default -> throw new InvalidDescriptorException(
                "Unknown udf_exec_type '" + value + "' in '" + context + "'");
        };
    }

    private static <E extends Enum<E>> E parseEnum(JsonNode node, String field, Class<E> type,
                                                  E defaultValue, String context) {
        String value = optionalText(node, field);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptorException(
                "Unknown " + field + " '" + value + "' in '" + context + "'", e);
        }
    }

    private static String requiredText(JsonNode node, String field, String context) {
        String value = optionalText(node, field);
        if (value == null) {
            throw new InvalidDescriptorException("Missing required field '" + field + "' in '" + context + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static void writeDataTypes(ArrayNode array, List<DataType> types) {
        types.forEach(t -> array.add(DataTypes.descriptorName(t)));
    }
}
