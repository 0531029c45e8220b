package com.tracequery.exception;

import java.util.List;

/**
 * Thrown when a UDF descriptor set cannot be parsed or fails validation.
 *
 * <p>Validation failures carry every error found, not only the first, so a bad
 * descriptor set can be fixed in one pass.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Malformed JSON or unknown data/semantic type names</li>
 *   <li>The same signature registered twice under the reject policy</li>
 *   <li>A name registered as both a scalar UDF and a UDA</li>
 * </ul>
 */
public class InvalidDescriptorException extends RegistryException {

    private final List<String> errors;

    public InvalidDescriptorException(String message) {
        this(message, List.of());
    }

    /**
     * Creates an exception for a descriptor set that failed validation.
     *
     * @param message the error message
     * @param errors the validation error codes
     */
    public InvalidDescriptorException(String message, List<String> errors) {
        super(errors.isEmpty() ? message : message + ": " + String.join(", ", errors), null);
        this.errors = List.copyOf(errors);
    }

    public InvalidDescriptorException(String message, Throwable cause) {
        super(message, cause, null);
        this.errors = List.of();
    }

    /**
     * Returns the validation errors.
     *
     * @return the error codes, empty if the failure was not a validation failure
     */
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String getUserMessage() {
        if (errors.isEmpty()) {
            return "Invalid UDF descriptor set: " + getMessage();
        }
        return "Invalid UDF descriptor set (" + errors.size() + " error"
            + (errors.size() == 1 ? "" : "s") + "): " + String.join("; ", errors);
    }
}
