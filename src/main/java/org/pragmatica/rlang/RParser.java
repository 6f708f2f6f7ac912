package org.pragmatica.rlang;

import org.pragmatica.rlang.error.RecoveryStrategy;
import org.pragmatica.rlang.parser.ParseResultWithDiagnostics;
import org.pragmatica.rlang.parser.Parser;
import org.pragmatica.rlang.parser.ParserConfig;
import org.pragmatica.rlang.parser.ParserEngine;

/**
 * Entry point for parsing R source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = RParser.parse("""
 *     if (x < y) {
 *         x <- x + 1
 *     } else {
 *         x <- x + 2
 *     }
 *     """);
 *
 * if (result.hasErrors()) {
 *     System.err.println(result.formatDiagnostics("script.R"));
 * }
 * }</pre>
 */
public final class RParser {
    private RParser() {}

    /**
     * Parse source text with the default configuration.
     */
    public static ParseResultWithDiagnostics parse(String source) {
        return create().parse(source);
    }

    public static Parser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static Parser create(ParserConfig config) {
        return ParserEngine.create(config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RecoveryStrategy recoveryStrategy = ParserConfig.DEFAULT.recoveryStrategy();
        private int maxNestingDepth = ParserConfig.DEFAULT.maxNestingDepth();

        private Builder() {}

        public Builder recovery(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(recoveryStrategy, maxNestingDepth));
        }
    }
}
