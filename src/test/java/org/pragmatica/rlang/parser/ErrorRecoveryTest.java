package org.pragmatica.rlang.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.rlang.RParser;
import org.pragmatica.rlang.error.ErrorKind;
import org.pragmatica.rlang.error.RecoveryStrategy;
import org.pragmatica.rlang.tree.AstNode.BlockScope;
import org.pragmatica.rlang.tree.AstNode.EmptyStatement;
import org.pragmatica.rlang.tree.AstNode.ErrorStatement;
import org.pragmatica.rlang.tree.AstNode.ExpressionStatement;
import org.pragmatica.rlang.tree.AstNode.ForLoop;
import org.pragmatica.rlang.tree.AstNode.InlineScope;
import org.pragmatica.rlang.tree.NodeKind;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for error recovery and diagnostic reporting on malformed input.
 */
class ErrorRecoveryTest {

    @Test
    void emptyInput_producesEmptyTreeWithoutDiagnostics() {
        var result = RParser.parse("");

        assertTrue(result.root().statements().isEmpty());
        assertTrue(result.diagnostics().isEmpty());
        assertEquals(0, result.root().scope().span().length());
    }

    @Test
    void commentsOnly_produceNoStatements() {
        var result = RParser.parse("# just a comment\n   \n# another\n");

        assertTrue(result.root().statements().isEmpty());
        assertTrue(result.isSuccess());
    }

    @Test
    void loneOpeningBrace_reportsMissingBraceAtBrace() {
        var result = RParser.parse("{");

        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(ErrorKind.MISSING_EXPECTED_TOKEN, diagnostic.kind());
        assertEquals(0, diagnostic.span().startOffset());
        assertEquals("'}' expected", diagnostic.message());

        var block = (BlockScope) result.root().statements().get(0);
        assertTrue(block.close().isEmpty());
        assertTrue(block.statements().isEmpty());
    }

    @Test
    void strayClosingBrace_isSkipped() {
        var result = RParser.parse("}\nx");

        assertEquals(1, result.errorCount());
        assertInstanceOf(ErrorStatement.class, result.root().statements().get(0));
        assertInstanceOf(ExpressionStatement.class, result.root().statements().get(1));
    }

    @Test
    void missingOperand_atEndOfInput_reportedOnOperator() {
        var source = "x <- ";
        var result = RParser.parse(source);

        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(ErrorKind.MISSING_EXPECTED_TOKEN, diagnostic.kind());
        assertEquals("<-", diagnostic.span().extract(source));

        var error = (ErrorStatement) result.root().statements().get(0);
        assertEquals(2, error.tokens().size());
    }

    @Test
    void unclosedCall_reportsMissingParenthesis() {
        var source = "f(1, 2";
        var result = RParser.parse(source);

        assertEquals(1, result.diagnostics().size());
        assertEquals("')' expected", result.diagnostics().get(0).message());
        assertEquals("2", result.diagnostics().get(0).span().extract(source));
    }

    @Test
    void trailingGarbage_isSkippedToEndOfLine() {
        var result = RParser.parse("x <- 1 2 3\ny <- 3");

        assertEquals(1, result.diagnostics().size());
        assertEquals(ErrorKind.UNEXPECTED_TOKEN, result.diagnostics().get(0).kind());

        var statements = result.root().statements();
        assertEquals(3, statements.size());
        assertInstanceOf(ExpressionStatement.class, statements.get(0));
        assertEquals(2, ((ErrorStatement) statements.get(1)).tokens().size());
        assertInstanceOf(ExpressionStatement.class, statements.get(2));
    }

    @Test
    void failureInsideBlock_recoversAtSeparator() {
        var result = RParser.parse("{ x <- ; y }");

        assertEquals(1, result.diagnostics().size());
        assertEquals(ErrorKind.MALFORMED_EXPRESSION, result.diagnostics().get(0).kind());

        var block = (BlockScope) result.root().statements().get(0);
        assertTrue(block.close().isPresent());
        assertEquals(3, block.statements().size());
        assertInstanceOf(ErrorStatement.class, block.statements().get(0));
        assertInstanceOf(EmptyStatement.class, block.statements().get(1));
        assertInstanceOf(ExpressionStatement.class, block.statements().get(2));
    }

    @Test
    void failureInsideBlock_doesNotConsumeClosingBrace() {
        var result = RParser.parse("f <- function() {\n  x <- )\n}\ng()");

        assertEquals(1, result.errorCount());
        assertEquals(2, result.root().statements().size());
        assertTrue(result.root().nodesOfKind(NodeKind.BLOCK_SCOPE).stream()
                         .map(BlockScope.class::cast)
                         .allMatch(block -> block.close().isPresent()));
    }

    @Test
    void multipleErrors_areCollectedInSourceOrder() {
        var result = RParser.parse("x <- )\ny <- 1\nz <- ]\n");

        assertEquals(2, result.errorCount());
        assertTrue(result.diagnostics().get(0).span().startOffset()
                   < result.diagnostics().get(1).span().startOffset());
        assertEquals(3, result.root().statements().size());
    }

    @Test
    void unterminatedString_isMalformed() {
        var result = RParser.parse("x <- \"abc");

        assertEquals(1, result.diagnosticsOfKind(ErrorKind.MALFORMED_EXPRESSION).size());
    }

    @Test
    void recoveryDisabled_stopsAtFirstError() {
        var parser = RParser.builder()
                            .recovery(RecoveryStrategy.NONE)
                            .build();

        var result = parser.parse("x <- )\ny <- 1\nz <- ]");

        assertEquals(1, result.diagnostics().size());
        assertEquals(1, result.root().statements().size());
        var error = (ErrorStatement) result.root().statements().get(0);
        assertEquals("]", error.tokens().get(error.tokens().size() - 1).text());
    }

    @Test
    void recoveryDisabled_insideBlock_doesNotReportMissingBrace() {
        var parser = RParser.builder()
                            .recovery(RecoveryStrategy.NONE)
                            .build();

        var result = parser.parse("{\n  x <- )\n}\ny");

        assertEquals(1, result.diagnostics().size());
        assertEquals(ErrorKind.MALFORMED_EXPRESSION, result.diagnostics().get(0).kind());
    }

    @Test
    void failedLoopBody_keepsLoop() {
        var source = "for (i in x) )\ny";
        var result = RParser.parse(source);

        assertEquals(1, result.diagnostics().size());
        var loop = (ForLoop) result.root().statements().get(0);
        var body = (InlineScope) loop.body().orElseThrow();
        assertEquals(")", body.statement().span().extract(source));
        assertInstanceOf(ExpressionStatement.class, result.root().statements().get(1));
    }

    @Test
    void recoveryDisabled_failedScopeFailsWholeStatement() {
        var parser = RParser.builder()
                            .recovery(RecoveryStrategy.NONE)
                            .build();

        var result = parser.parse("if (a) 1 else )\nb");

        assertEquals(1, result.diagnostics().size());
        assertEquals(1, result.root().statements().size());
        assertInstanceOf(ErrorStatement.class, result.root().statements().get(0));
    }

    @Test
    void deepNesting_isReportedInsteadOfOverflowing() {
        var source = "(".repeat(5000) + "1" + ")".repeat(5000);

        var result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> RParser.parse(source));

        assertEquals(1, result.diagnostics().size());
        assertEquals(ErrorKind.MALFORMED_EXPRESSION, result.diagnostics().get(0).kind());
        assertTrue(result.diagnostics().get(0).message().contains("nesting"));
    }

    @Test
    void deeplyNestedBlocks_areReportedOnce() {
        var source = "{".repeat(2000);

        var result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> RParser.parse(source));

        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).message().contains("nesting"));
        assertEquals(1, result.root().statements().size());
        assertEquals(1, result.root().nodesOfKind(NodeKind.ERROR_STATEMENT).size());
    }

    @Test
    void deeplyNestedBlocks_withClosingBraces_resumeAfterThem() {
        var source = "{".repeat(2000) + "}".repeat(2000) + "\nx <- 1";

        var result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> RParser.parse(source));

        assertEquals(1, result.diagnostics().size());
        var statements = result.root().statements();
        assertEquals(2, statements.size());
        assertInstanceOf(BlockScope.class, statements.get(0));
        assertInstanceOf(ExpressionStatement.class, statements.get(1));
        assertTrue(result.root().nodesOfKind(NodeKind.BLOCK_SCOPE).stream()
                         .map(BlockScope.class::cast)
                         .allMatch(block -> block.close().isPresent()));
    }

    @Test
    void deepNesting_acrossLines_isSkippedAsOneStatement() {
        var source = "(\n".repeat(1000) + "1" + "\n)".repeat(1000) + "\ny";

        var result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> RParser.parse(source));

        assertEquals(1, result.diagnostics().size());
        var statements = result.root().statements();
        assertEquals(2, statements.size());
        assertInstanceOf(ErrorStatement.class, statements.get(0));
        assertEquals("y", ((ExpressionStatement) statements.get(1)).expression().span().extract(source));
    }

    @Test
    void moderateNesting_parsesWithinDefaultLimit() {
        var source = "(".repeat(100) + "1" + ")".repeat(100);

        assertTrue(RParser.parse(source).isSuccess());
    }

    @Test
    void nestingLimit_isConfigurable() {
        var parser = RParser.builder()
                            .maxNestingDepth(8)
                            .build();

        assertTrue(parser.parse("((1))").isSuccess());
        assertTrue(parser.parse("((((((((((1))))))))))").hasErrors());
    }

    @Test
    void garbageInput_alwaysTerminates() {
        var inputs = List.of(
            "else else else",
            "}}}{{{",
            ")))(((",
            "if if if (((",
            "function function(",
            ", , , ; ; ;",
            "x[[[[[]]",
            "for (in in in) while",
            "@@@ ### $$$",
            "{if (x > 1)\n x <- 1\nelse\n",
            "f(a = , b = , = c)",
            "`unterminated",
            "'unterminated"
        );

        for (var input : inputs) {
            var result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> RParser.parse(input), input);
            assertNotNull(result.root(), input);
            assertFalse(result.diagnostics().isEmpty(), input);
            var scopeSpan = result.root().scope().span();
            assertTrue(result.root().stream().allMatch(node -> scopeSpan.contains(node.span())), input);
        }
    }
}
