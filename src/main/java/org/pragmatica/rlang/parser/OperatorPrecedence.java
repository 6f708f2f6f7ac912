package org.pragmatica.rlang.parser;

import org.pragmatica.rlang.token.Token;
import org.pragmatica.rlang.token.TokenType;

import java.util.Optional;
import java.util.Set;

/**
 * R operator precedence levels, lowest first. Accessors ({@code $ @ :: :::}) and
 * postfix calls/indexing bind tighter than every level here and are handled separately.
 */
enum OperatorPrecedence {
    HELP(1, false, "?"),
    EQUALS_ASSIGNMENT(2, true, "="),
    LEFT_ASSIGNMENT(3, true, "<-", "<<-"),
    RIGHT_ASSIGNMENT(4, false, "->", "->>"),
    FORMULA(5, false, "~"),
    OR(6, false, "||", "|"),
    AND(7, false, "&&", "&"),
    NOT(8, false),
    COMPARISON(9, false, "==", "!=", "<", ">", "<=", ">="),
    ADDITIVE(10, false, "+", "-"),
    MULTIPLICATIVE(11, false, "*", "/"),
    SPECIAL(12, false, "|>"),
    SEQUENCE(13, false, ":"),
    SIGN(14, false),
    POWER(15, true, "^");

    private static final Set<String> ACCESSORS = Set.of("$", "@", "::", ":::");

    private final int level;
    private final boolean rightAssociative;
    private final Set<String> operators;

    OperatorPrecedence(int level, boolean rightAssociative, String... operators) {
        this.level = level;
        this.rightAssociative = rightAssociative;
        this.operators = Set.of(operators);
    }

    int level() {
        return level;
    }

    /**
     * Minimum level for the right operand of a binary operator at this level.
     */
    int rightOperandLevel() {
        return rightAssociative ? level : level + 1;
    }

    static Optional<OperatorPrecedence> binary(Token token) {
        if (!token.is(TokenType.OPERATOR)) {
            return Optional.empty();
        }
        // %in%, %*%, %>% and friends
        if (token.text().length() >= 2 && token.text().startsWith("%") && token.text().endsWith("%")) {
            return Optional.of(SPECIAL);
        }
        for (var precedence : values()) {
            if (precedence.operators.contains(token.text())) {
                return Optional.of(precedence);
            }
        }
        return Optional.empty();
    }

    /**
     * Level at which the operand of a prefix operator is parsed.
     */
    static Optional<Integer> unaryOperandLevel(Token token) {
        if (!token.is(TokenType.OPERATOR)) {
            return Optional.empty();
        }
        switch (token.text()) {
            case "-":
            case "+":
                return Optional.of(SIGN.level);
            case "!":
                return Optional.of(NOT.level);
            case "~":
                return Optional.of(FORMULA.level + 1);
            case "?":
                return Optional.of(HELP.level + 1);
            default:
                return Optional.empty();
        }
    }

    static boolean isAccessor(Token token) {
        return token.is(TokenType.OPERATOR) && ACCESSORS.contains(token.text());
    }
}
