package com.tracequery.exception;

/**
 * Thrown when a function name is unknown to the table or rule registry being queried.
 */
public class FunctionNotFoundException extends RegistryException {

    /**
     * Creates a not-found exception.
     *
     * @param message the error message
     * @param functionName the function that was looked up
     */
    public FunctionNotFoundException(String message, String functionName) {
        super(message, functionName);
    }

    /**
     * Creates a not-found exception with the default message.
     *
     * @param functionName the function that was looked up
     */
    public FunctionNotFoundException(String functionName) {
        this("Function not found: " + functionName, functionName);
    }

    @Override
    public String getUserMessage() {
        return "Unknown function '" + getFunctionName() + "'. "
            + "Check the function name against the registered UDFs and UDAs.";
    }
}
