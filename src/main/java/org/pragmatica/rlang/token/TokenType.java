package org.pragmatica.rlang.token;

/**
 * Token types produced by {@link RTokenizer} and consumed by the parser.
 */
public enum TokenType {
    IDENTIFIER("identifier"),
    NUMBER("number"),
    STRING("string"),
    KEYWORD("keyword"),
    OPERATOR("operator"),
    OPEN_PAREN("'('"),
    CLOSE_PAREN("')'"),
    OPEN_BRACE("'{'"),
    CLOSE_BRACE("'}'"),
    OPEN_BRACKET("'['"),
    OPEN_DOUBLE_BRACKET("'[['"),
    CLOSE_BRACKET("']'"),
    COMMA("','"),
    SEMICOLON("';'"),
    UNKNOWN("unknown character"),
    END_OF_STREAM("end of input");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
