package com.tracequery.descriptor;

import com.tracequery.config.DuplicatePolicy;
import com.tracequery.types.Column;
import com.tracequery.types.DataType;
import com.tracequery.types.SemanticType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural validation of a descriptor set before it is loaded into a registry.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Every scalar UDF, UDA, UDTF and UDTF column has a non-blank name</li>
 *   <li>Function, UDTF and rule names carry no leading or trailing whitespace; names are
 *       compared exactly as registered</li>
 *   <li>No name is registered as both a scalar UDF and a UDA</li>
 *   <li>Under {@link DuplicatePolicy#REJECT}, no overload and no rule pattern is declared twice</li>
 *   <li>UDTF names are unique</li>
 *   <li>A semantic type rule targets a function registered with the kind the rule names</li>
 * </ul>
 *
 * <p>Errors are returned as short codes ({@code "uda.duplicate:count(int64)"}), all of
 * them, so a descriptor set can be fixed in one pass.
 */
public final class UdfInfoValidator {

    private UdfInfoValidator() {}

    /** Runs validation and returns a list of human-readable errors. */
    public static List<String> validate(UdfInfo info, DuplicatePolicy policy) {
        List<String> errors = new ArrayList<>();
        if (info == null) {
            errors.add("descriptor.null");
            return errors;
        }

        Set<String> udfNames = validateSignatures("udf", info.scalarUdfs(), policy, errors);
        Set<String> udaNames = validateSignatures("uda", info.udas(), policy, errors);
        for (String name : udfNames) {
            if (udaNames.contains(name)) {
                errors.add("function.kind.conflict:" + name);
            }
        }

        validateUdtfs(info.udtfs(), errors);
        validateRules(info.semanticTypeRules(), udfNames, udaNames, policy, errors);
        return errors;
    }

    // ==================== Signatures ====================

    private static Set<String> validateSignatures(String prefix, List<? extends FunctionSignature> signatures,
                                                  DuplicatePolicy policy, List<String> errors) {
        Set<String> names = new HashSet<>();
        Set<Map.Entry<String, List<DataType>>> seen = new HashSet<>();

        for (FunctionSignature signature : signatures) {
            String name = signature.name();
            if (!checkName(prefix, name, errors)) {
                continue;
            }
            names.add(name);

            if (!seen.add(Map.entry(name, signature.argTypes())) && policy == DuplicatePolicy.REJECT) {
                errors.add(prefix + ".duplicate:" + name + renderTypes(signature.argTypes()));
            }
        }
        return names;
    }

    // ==================== Table functions ====================

    private static void validateUdtfs(List<UdtfSpec> udtfs, List<String> errors) {
        Set<String> names = new HashSet<>();
        for (UdtfSpec udtf : udtfs) {
            String name = udtf.name();
            if (!checkName("udtf", name, errors)) {
                continue;
            }
            if (!names.add(name)) {
                errors.add("udtf.duplicate:" + name);
            }
            for (UdtfArg arg : udtf.args()) {
                if (isBlank(arg.name())) {
                    errors.add("udtf.arg.name.required:" + name);
                }
            }
            for (Column column : udtf.relation().columns()) {
                if (isBlank(column.name())) {
                    errors.add("udtf.column.name.required:" + name);
                }
            }
        }
    }

    // ==================== Semantic rules ====================

    private static void validateRules(List<SemanticTypeRule> rules, Set<String> udfNames, Set<String> udaNames,
                                      DuplicatePolicy policy, List<String> errors) {
        Set<Map.Entry<String, List<SemanticType>>> seen = new HashSet<>();

        for (SemanticTypeRule rule : rules) {
            String name = rule.name();
            if (!checkName("rule", name, errors)) {
                continue;
            }

            boolean isUdf = udfNames.contains(name);
            boolean isUda = udaNames.contains(name);
            if (!isUdf && !isUda) {
                errors.add("rule.function.unknown:" + name);
            } else if (rule.udfExecType() == UdfExecType.SCALAR_UDF && !isUdf
                || rule.udfExecType() == UdfExecType.UDA && !isUda) {
                errors.add("rule.kind.mismatch:" + name + ":" + rule.udfExecType());
            }

            if (!seen.add(Map.entry(name, rule.argTypes())) && policy == DuplicatePolicy.REJECT) {
                errors.add("rule.duplicate:" + name + rule.argTypes());
            }
        }
    }

    // ==================== Helpers ====================

    private static String renderTypes(List<DataType> types) {
        return types.stream().map(DataType::typeName).collect(Collectors.joining(", ", "(", ")"));
    }

    /** Returns false, after recording the error, when the name cannot be registered. */
    private static boolean checkName(String prefix, String name, List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add(prefix + ".name.required");
            return false;
        }
        if (!name.equals(name.strip())) {
            errors.add(prefix + ".name.invalid:'" + name + "'");
            return false;
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
