package org.pragmatica.rlang.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.rlang.error.ErrorKind;
import org.pragmatica.rlang.error.ExpectedToken;
import org.pragmatica.rlang.error.ParseError;
import org.pragmatica.rlang.error.RecoveryStrategy;
import org.pragmatica.rlang.parser.ParsingContext.Enclosure;
import org.pragmatica.rlang.token.TokenStream;
import org.pragmatica.rlang.token.TokenType;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParsingContext state management.
 */
class ParsingContextTest {

    private static ParsingContext context(String source) {
        return ParsingContext.create(TokenStream.tokenize(source), ParserConfig.DEFAULT);
    }

    // === Enclosures ===

    @Test
    void globalLevel_isLineBreakSensitiveAndNotEnclosed() {
        var ctx = context("x");

        assertTrue(ctx.lineBreaksSignificant());
        assertFalse(ctx.isEnclosed());
        assertFalse(ctx.insideBlock());
    }

    @Test
    void parentheses_makeLineBreaksInsignificant() {
        var ctx = context("x");

        ctx.enter(Enclosure.BRACE);
        assertTrue(ctx.lineBreaksSignificant());
        assertTrue(ctx.insideBlock());

        ctx.enter(Enclosure.PAREN);
        assertFalse(ctx.lineBreaksSignificant());
        assertTrue(ctx.isEnclosed());

        ctx.exit();
        ctx.exit();
        assertFalse(ctx.isEnclosed());
        assertFalse(ctx.insideBlock());
    }

    // === Token access ===

    @Test
    void lastConsumedSpan_fallsBackToCurrentToken() {
        var ctx = context("a b");

        assertEquals(0, ctx.lastConsumedSpan().startOffset());

        ctx.advance();
        ctx.advance();
        assertTrue(ctx.isAtEnd());
        assertEquals(2, ctx.lastConsumedSpan().startOffset());
    }

    @Test
    void advance_wrapsTokenAsTerminal() {
        var ctx = context("if (a)");

        assertTrue(ctx.atKeyword("if"));
        assertEquals("if", ctx.advance().text());
        assertTrue(ctx.at(TokenType.OPEN_PAREN));
        assertEquals("if", ctx.lastConsumedSpan().extract("if (a)"));
    }

    // === Nesting guard ===

    @Test
    void descend_stopsAtConfiguredLimit() {
        var ctx = ParsingContext.create(TokenStream.tokenize(""), new ParserConfig(RecoveryStrategy.ADVANCED, 2));

        assertTrue(ctx.descend());
        assertTrue(ctx.descend());
        assertFalse(ctx.descend());

        ctx.ascend();
        assertTrue(ctx.descend());
        assertEquals(1, ctx.nestingOverflows());
    }

    @Test
    void invalidConfig_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(RecoveryStrategy.NONE, 0));
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(null, 10));
    }

    // === Diagnostics ===

    @Test
    void report_collectsErrorsInOrder() {
        var ctx = context("a b");

        assertTrue(ctx.diagnostics().isEmpty());
        ctx.report(new ParseError.MissingExpectedToken(ctx.current().span(), ExpectedToken.CLOSE_BRACE));
        ctx.advance();
        ctx.report(new ParseError.MalformedExpression(ctx.current().span(), "bad"));

        assertEquals(2, ctx.diagnostics().size());
        assertEquals(ErrorKind.MISSING_EXPECTED_TOKEN, ctx.diagnostics().get(0).kind());
        assertEquals(ErrorKind.MALFORMED_EXPRESSION, ctx.diagnostics().get(1).kind());
    }

    @Test
    void halt_isSticky() {
        var ctx = context("a");

        assertFalse(ctx.isHalted());
        ctx.halt();
        assertTrue(ctx.isHalted());
    }
}
