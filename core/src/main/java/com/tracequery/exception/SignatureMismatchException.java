package com.tracequery.exception;

import com.tracequery.types.DataType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a function exists but none of its overloads takes exactly the given
 * argument types.
 *
 * <p>Resolution is exact: no numeric promotion or widening is attempted, so
 * {@code f(INT64)} does not satisfy a call with a FLOAT64 argument.
 */
public class SignatureMismatchException extends RegistryException {

    private final List<DataType> argumentTypes;
    private final List<List<DataType>> candidates;

    /**
     * Creates a signature mismatch exception.
     *
     * @param functionName the function that was called
     * @param argumentTypes the argument types of the call
     * @param candidates argument types of every registered overload
     */
    public SignatureMismatchException(String functionName, List<DataType> argumentTypes,
                                      List<List<DataType>> candidates) {
        super("No overload of '" + functionName + "' matches argument types "
            + render(argumentTypes), functionName);
        this.argumentTypes = List.copyOf(argumentTypes);
        this.candidates = candidates.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    public List<DataType> getArgumentTypes() {
        return argumentTypes;
    }

    /**
     * Returns the argument types of every overload registered under the function name.
     */
    public List<List<DataType>> getCandidates() {
        return candidates;
    }

    @Override
    public String getUserMessage() {
        String available = candidates.stream()
            .map(c -> getFunctionName() + render(c))
            .collect(Collectors.joining(", "));
        return "Function '" + getFunctionName() + "' cannot be called with arguments "
            + render(argumentTypes) + ". Available signatures: " + available;
    }

    @Override
    public String getTechnicalMessage() {
        return super.getTechnicalMessage()
            + "Arguments: " + render(argumentTypes) + "\n"
            + "Candidates: " + candidates + "\n";
    }

    private static String render(List<DataType> types) {
        return types.stream().map(DataType::typeName).collect(Collectors.joining(", ", "(", ")"));
    }
}
