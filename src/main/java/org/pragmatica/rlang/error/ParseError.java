package org.pragmatica.rlang.error;

import org.pragmatica.rlang.tree.SourceSpan;

import java.util.Optional;

/**
 * Parse error with kind, location and context information.
 */
public sealed interface ParseError {
    /**
     * Minimal contributing range: the offending token, or the last consumed token
     * when an expected token is absent.
     */
    SourceSpan span();

    ErrorKind kind();

    String message();

    /**
     * Convert to an error diagnostic for the sink.
     */
    default Diagnostic toDiagnostic() {
        return Diagnostic.error(kind(), message(), span());
    }

    /**
     * Token no rule can consume at this point.
     *
     * @param hint how to fix the input, when the token has a typical cause
     */
    record UnexpectedToken(SourceSpan span, String found, Optional<String> hint) implements ParseError {
        public UnexpectedToken(SourceSpan span, String found) {
            this(span, found, Optional.empty());
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.UNEXPECTED_TOKEN;
        }

        @Override
        public String message() {
            return "unexpected " + found;
        }

        @Override
        public Diagnostic toDiagnostic() {
            var diagnostic = Diagnostic.error(kind(), message(), span)
                                       .withLabel("unexpected here");
            return hint.map(diagnostic::withHelp)
                       .orElse(diagnostic);
        }
    }

    /**
     * Required token absent at the point it should have appeared.
     *
     * @param opening the delimiter a missing closing token would have matched
     */
    record MissingExpectedToken(SourceSpan span, ExpectedToken expected, Optional<SourceSpan> opening) implements ParseError {
        public MissingExpectedToken(SourceSpan span, ExpectedToken expected) {
            this(span, expected, Optional.empty());
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.MISSING_EXPECTED_TOKEN;
        }

        @Override
        public String message() {
            return expected.display() + " expected";
        }

        @Override
        public Diagnostic toDiagnostic() {
            var diagnostic = Diagnostic.error(kind(), message(), span)
                                       .withLabel("expected " + expected.display() + " after this");
            return opening.filter(open -> !open.equals(span))
                          .map(open -> diagnostic.withRelated(open, "opened here"))
                          .orElse(diagnostic);
        }
    }

    /**
     * Operand or condition that is not a valid expression.
     */
    record MalformedExpression(SourceSpan span, String reason) implements ParseError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.MALFORMED_EXPRESSION;
        }

        @Override
        public String message() {
            return "malformed expression: " + reason;
        }
    }
}
