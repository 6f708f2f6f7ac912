package org.pragmatica.rlang.token;

import org.pragmatica.rlang.tree.SourceLocation;
import org.pragmatica.rlang.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for R source text.
 * Whitespace and comments are dropped; a line break between two tokens is recorded
 * on the second token as {@link Token#lineBreakBefore()}.
 */
public final class RTokenizer {
    private static final int MAX_INPUT_SIZE = 16_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 256;

    private static final String[] OPERATORS = {
        "<<-", "->>", ":::",
        "<-", "->", "<=", ">=", "==", "!=", "&&", "||", "::", "|>",
        "<", ">", "!", "&", "|", "~", "?", ":", "=", "+", "-", "*", "/", "^", "$", "@"
    };

    private final String input;
    private int pos;
    private int line;
    private int column;
    private boolean lineBreakSeen;

    private RTokenizer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        if (input == null) {
            throw new IllegalArgumentException("R source must not be null");
        }
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "R source exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new RTokenizer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>(Math.min(DEFAULT_TOKEN_CAPACITY, input.length() + 1));
        skipWhitespaceAndComments();
        while (!isAtEnd()) {
            boolean lineBreak = lineBreakSeen && !tokens.isEmpty();
            lineBreakSeen = false;
            tokens.add(nextToken().withLineBreakBefore(lineBreak));
            skipWhitespaceAndComments();
        }
        tokens.add(Token.endOfStream(SourceSpan.at(currentLocation()), lineBreakSeen && !tokens.isEmpty()));
        return List.copyOf(tokens);
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
            return scanNumber(start);
        }
        if (isIdentifierStart(peekCodePoint())) {
            return scanIdentifier(start);
        }
        if (c == '"' || c == '\'') {
            return scanString(start);
        }
        if (c == '`') {
            return scanQuotedIdentifier(start);
        }
        if (c == '%') {
            return scanSpecialOperator(start);
        }
        return scanPunctuationOrOperator(start);
    }

    private Token scanNumber(SourceLocation start) {
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X')) {
            advance();
            advance();
            while (!isAtEnd() && isHexDigit(peek())) {
                advance();
            }
        } else {
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
            if (!isAtEnd() && peek() == '.') {
                advance();
                while (!isAtEnd() && isDigit(peek())) {
                    advance();
                }
            }
            if (!isAtEnd() && (peek() == 'e' || peek() == 'E')
                && (isDigit(peekAt(1)) || ((peekAt(1) == '+' || peekAt(1) == '-') && isDigit(peekAt(2))))) {
                advance();
                if (peek() == '+' || peek() == '-') {
                    advance();
                }
                while (!isAtEnd() && isDigit(peek())) {
                    advance();
                }
            }
        }
        // integer and complex suffixes
        if (!isAtEnd() && (peek() == 'L' || peek() == 'i')) {
            advance();
        }
        return token(TokenType.NUMBER, start);
    }

    private Token scanIdentifier(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peekCodePoint())) {
            advance();
        }
        var text = input.substring(start.offset(), pos);
        var type = Token.KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        return new Token(type, text, span(start), false);
    }

    private Token scanString(SourceLocation start) {
        int quote = advance();
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            return token(TokenType.UNKNOWN, start);
        }
        advance();
        return token(TokenType.STRING, start);
    }

    private Token scanQuotedIdentifier(SourceLocation start) {
        advance();
        while (!isAtEnd() && peek() != '`') {
            advance();
        }
        if (isAtEnd()) {
            return token(TokenType.UNKNOWN, start);
        }
        advance();
        return token(TokenType.IDENTIFIER, start);
    }

    private Token scanSpecialOperator(SourceLocation start) {
        advance();
        while (!isAtEnd() && peek() != '%' && peek() != '\n') {
            advance();
        }
        if (isAtEnd() || peek() != '%') {
            return token(TokenType.UNKNOWN, start);
        }
        advance();
        return token(TokenType.OPERATOR, start);
    }

    private Token scanPunctuationOrOperator(SourceLocation start) {
        char c = peek();
        switch (c) {
            case '(':
                advance();
                return token(TokenType.OPEN_PAREN, start);
            case ')':
                advance();
                return token(TokenType.CLOSE_PAREN, start);
            case '{':
                advance();
                return token(TokenType.OPEN_BRACE, start);
            case '}':
                advance();
                return token(TokenType.CLOSE_BRACE, start);
            case '[':
                advance();
                if (!isAtEnd() && peek() == '[') {
                    advance();
                    return token(TokenType.OPEN_DOUBLE_BRACKET, start);
                }
                return token(TokenType.OPEN_BRACKET, start);
            case ']':
                advance();
                return token(TokenType.CLOSE_BRACKET, start);
            case ',':
                advance();
                return token(TokenType.COMMA, start);
            case ';':
                advance();
                return token(TokenType.SEMICOLON, start);
            default:
                break;
        }
        for (var operator : OPERATORS) {
            if (input.startsWith(operator, pos)) {
                for (int i = 0; i < operator.length(); i++) {
                    advance();
                }
                return token(TokenType.OPERATOR, start);
            }
        }
        advance();
        return token(TokenType.UNKNOWN, start);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u00A0') {
                advance();
            } else if (c == '\n') {
                advance();
                lineBreakSeen = true;
            } else if (c == '#') {
                // line comment, the terminating newline is handled above
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private int peekCodePoint() {
        return input.codePointAt(pos);
    }

    /**
     * Consume one code point; a surrogate pair counts as a single column.
     */
    private int advance() {
        int codePoint = input.codePointAt(pos);
        pos += Character.charCount(codePoint);
        if (codePoint == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return codePoint;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private Token token(TokenType type, SourceLocation start) {
        return new Token(type, input.substring(start.offset(), pos), span(start), false);
    }

    private boolean isIdentifierStart(int codePoint) {
        return Character.isLetter(codePoint) || codePoint == '.';
    }

    private boolean isIdentifierPart(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '.' || codePoint == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
