package com.tracequery.exception;

/**
 * Base class for failures raised by the function registry.
 *
 * <p>Every registry failure names the function it concerns (when there is one) and
 * offers two renderings: {@link #getUserMessage()} for compile diagnostics shown at the
 * offending call site, and {@link #getTechnicalMessage()} for logs.
 *
 * @see FunctionNotFoundException
 * @see SignatureMismatchException
 * @see InvalidDescriptorException
 */
public abstract class RegistryException extends RuntimeException {

    private final String functionName;

    protected RegistryException(String message, String functionName) {
        super(message);
        this.functionName = functionName;
    }

    protected RegistryException(String message, Throwable cause, String functionName) {
        super(message, cause);
        this.functionName = functionName;
    }

    /**
     * Returns the function the failure concerns.
     *
     * @return the function name, or null if the failure is not tied to one function
     */
    public String getFunctionName() {
        return functionName;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return message suitable for a compile diagnostic
     */
    public abstract String getUserMessage();

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (functionName != null) {
            sb.append("Function: ").append(functionName).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
