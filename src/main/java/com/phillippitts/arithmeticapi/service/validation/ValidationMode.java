package com.phillippitts.arithmeticapi.service.validation;

/**
 * Operand validation policy, selected with {@code arithmetic.validation-mode}.
 */
public enum ValidationMode {

    /**
     * Rejects only an absent payload or missing keys, then converts each operand to a double.
     * Numeric strings such as {@code "12.5"} are accepted.
     */
    PERMISSIVE("Missing num1 or num2 in JSON payload", "Invalid input type"),

    /**
     * Accepts only native JSON numbers. Integers stay exact.
     */
    STRICT("Invalid input, please provide numbers.", "Invalid input, please provide numbers.");

    private final String missingMessage;
    private final String invalidMessage;

    ValidationMode(String missingMessage, String invalidMessage) {
        this.missingMessage = missingMessage;
        this.invalidMessage = invalidMessage;
    }

    public String getMissingMessage() {
        return missingMessage;
    }

    public String getInvalidMessage() {
        return invalidMessage;
    }
}
