package org.pragmatica.rlang.token;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RTokenizerTest {

    private static List<TokenType> types(String source) {
        return RTokenizer.tokenize(source).stream()
                         .map(Token::type)
                         .toList();
    }

    private static List<String> texts(String source) {
        return RTokenizer.tokenize(source).stream()
                         .filter(token -> !token.isEndOfStream())
                         .map(Token::text)
                         .toList();
    }

    @Test
    void emptyInput_yieldsOnlyEndOfStream() {
        var tokens = RTokenizer.tokenize("");

        assertEquals(1, tokens.size());
        assertTrue(tokens.get(0).isEndOfStream());
        assertEquals(0, tokens.get(0).span().startOffset());
    }

    @Test
    void nullInput_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> RTokenizer.tokenize(null));
    }

    @Test
    void assignment_usesLongestOperator() {
        assertEquals(List.of("x", "<<-", "1"), texts("x<<-1"));
        assertEquals(List.of("x", "<", "-", "1"), texts("x < -1"));
        assertEquals(List.of("a", "<=", "b", "->>", "c"), texts("a<=b->>c"));
    }

    @Test
    void keywordsAndIdentifiers() {
        var tokens = RTokenizer.tokenize("if .x else my_var.2 TRUE");

        assertTrue(tokens.get(0).isKeyword("if"));
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertTrue(tokens.get(2).isKeyword("else"));
        assertEquals("my_var.2", tokens.get(3).text());
        assertTrue(tokens.get(4).isConstant());
    }

    @Test
    void numbers() {
        assertEquals(List.of("1e-3", "0x1F", "10L", ".5", "2i", "3.14"), texts("1e-3 0x1F 10L .5 2i 3.14"));
        assertTrue(types("1e-3 0x1F").stream().limit(2).allMatch(type -> type == TokenType.NUMBER));
    }

    @Test
    void strings_keepQuotesAndEscapes() {
        var tokens = RTokenizer.tokenize("\"a \\\" b\" 'c'");

        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("\"a \\\" b\"", tokens.get(0).text());
        assertEquals("'c'", tokens.get(1).text());
    }

    @Test
    void unterminatedString_isUnknown() {
        assertEquals(TokenType.UNKNOWN, RTokenizer.tokenize("\"abc").get(0).type());
    }

    @Test
    void backtickName_isIdentifier() {
        var token = RTokenizer.tokenize("`my var`").get(0);

        assertEquals(TokenType.IDENTIFIER, token.type());
        assertEquals("`my var`", token.text());
    }

    @Test
    void specialOperators() {
        assertEquals(List.of("x", "%in%", "y", "%%", "2"), texts("x %in% y %% 2"));
    }

    @Test
    void brackets_distinguishDoubleOpening() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.OPEN_DOUBLE_BRACKET, TokenType.NUMBER,
                             TokenType.CLOSE_BRACKET, TokenType.CLOSE_BRACKET, TokenType.END_OF_STREAM),
                     types("x[[1]]"));
    }

    @Test
    void comments_areSkipped() {
        assertEquals(List.of("x", "y"), texts("x # comment with if ( {\ny"));
    }

    @Test
    void lineBreaks_areRecordedOnFollowingToken() {
        var tokens = RTokenizer.tokenize("\n\na\n# note\nb c\n");

        assertFalse(tokens.get(0).lineBreakBefore());
        assertTrue(tokens.get(1).lineBreakBefore());
        assertFalse(tokens.get(2).lineBreakBefore());
        assertTrue(tokens.get(3).isEndOfStream());
        assertTrue(tokens.get(3).lineBreakBefore());
    }

    @Test
    void locations_trackLinesAndColumns() {
        var tokens = RTokenizer.tokenize("x <- 1\n  else");
        var elseToken = tokens.get(3);

        assertEquals(2, elseToken.span().start().line());
        assertEquals(3, elseToken.span().start().column());
        assertEquals(9, elseToken.span().startOffset());
        assertEquals(13, elseToken.span().endOffset());
    }

    @Test
    void unknownCharacter_isSingleToken() {
        var token = RTokenizer.tokenize("\\").get(0);

        assertEquals(TokenType.UNKNOWN, token.type());
        assertEquals("character '\\'", token.description());
    }

    @Test
    void supplementaryCharacter_isNotSplit() {
        var tokens = RTokenizer.tokenize("x <- \uD83D\uDE00 y");

        assertEquals(5, tokens.size());
        var unknown = tokens.get(2);
        assertEquals(TokenType.UNKNOWN, unknown.type());
        assertEquals("\uD83D\uDE00", unknown.text());
        assertEquals(2, unknown.span().length());
        assertEquals(8, tokens.get(3).span().start().column());
    }

    @Test
    void supplementaryLetter_continuesIdentifier() {
        // U+1D49C MATHEMATICAL SCRIPT CAPITAL A
        var tokens = RTokenizer.tokenize("a\uD835\uDC9Cb <- 1");

        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("a\uD835\uDC9Cb", tokens.get(0).text());
        assertEquals("<-", tokens.get(1).text());
    }
}
