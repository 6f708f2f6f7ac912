package org.pragmatica.rlang.error;

/**
 * What a {@link ParseError.MissingExpectedToken} was waiting for.
 */
public enum ExpectedToken {
    CLOSE_BRACE("'}'"),
    CLOSE_PAREN("')'"),
    OPEN_PAREN("'('"),
    CLOSE_BRACKET("']'"),
    EXPRESSION("expression"),
    IDENTIFIER("identifier"),
    IN("'in'");

    private final String display;

    ExpectedToken(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
