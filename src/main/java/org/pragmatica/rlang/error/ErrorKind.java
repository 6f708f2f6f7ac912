package org.pragmatica.rlang.error;

/**
 * Stable message kinds of parser diagnostics.
 */
public enum ErrorKind {
    /**
     * A token appears where no grammar rule can consume it.
     */
    UNEXPECTED_TOKEN("R001"),

    /**
     * A required token is absent; reported on the last consumed token.
     */
    MISSING_EXPECTED_TOKEN("R002"),

    /**
     * A condition or operand does not parse as an expression.
     */
    MALFORMED_EXPRESSION("R003");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
