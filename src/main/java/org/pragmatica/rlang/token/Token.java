package org.pragmatica.rlang.token;

import org.pragmatica.rlang.tree.SourceSpan;

import java.util.Set;

/**
 * A single lexical token of R source.
 *
 * @param type            Token type tag
 * @param text            Exact source text of the token (empty for end of stream)
 * @param span            Half-open source range of the token
 * @param lineBreakBefore Whether a line break separates this token from the previous one
 */
public record Token(TokenType type, String text, SourceSpan span, boolean lineBreakBefore) {

    static final Set<String> KEYWORDS = Set.of(
        "if", "else", "repeat", "while", "function", "for", "in", "next", "break",
        "TRUE", "FALSE", "NULL", "Inf", "NaN", "NA",
        "NA_integer_", "NA_real_", "NA_character_", "NA_complex_");

    private static final Set<String> CONSTANTS = Set.of(
        "TRUE", "FALSE", "NULL", "Inf", "NaN", "NA",
        "NA_integer_", "NA_real_", "NA_character_", "NA_complex_");

    public static Token endOfStream(SourceSpan span, boolean lineBreakBefore) {
        return new Token(TokenType.END_OF_STREAM, "", span, lineBreakBefore);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }

    /**
     * Keyword constants such as {@code TRUE} or {@code NA_integer_}.
     */
    public boolean isConstant() {
        return type == TokenType.KEYWORD && CONSTANTS.contains(text);
    }

    public boolean isEndOfStream() {
        return type == TokenType.END_OF_STREAM;
    }

    public Token withLineBreakBefore(boolean lineBreak) {
        return new Token(type, text, span, lineBreak);
    }

    /**
     * Human-readable description for diagnostics.
     */
    public String description() {
        return switch (type) {
            case IDENTIFIER -> "identifier '" + text + "'";
            case NUMBER -> "number " + text;
            case STRING -> "string " + text;
            case KEYWORD -> "'" + text + "'";
            case OPERATOR -> "operator '" + text + "'";
            case UNKNOWN -> "character '" + text + "'";
            default -> type.display();
        };
    }

    @Override
    public String toString() {
        return type + "(" + text + ")" + span;
    }
}
