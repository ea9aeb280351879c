package com.ttennebkram.enhancer.engine;

/**
 * A parameter could not be coerced to its type, or its value is outside the
 * operation's domain.
 */
public class InvalidParameterException extends EnhancementException {

    private final String operation;
    private final String parameter;
    private final String value;

    public InvalidParameterException(String operation, String parameter, String value, String reason) {
        super("Invalid value for '" + parameter + "' in " + operation + ": '" + value + "' (" + reason + ")");
        this.operation = operation;
        this.parameter = parameter;
        this.value = value;
    }

    public String getOperation() {
        return operation;
    }

    public String getParameter() {
        return parameter;
    }

    /** The raw value as received. */
    public String getValue() {
        return value;
    }
}
