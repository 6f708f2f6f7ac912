package org.pragmatica.rlang.parser;

import org.pragmatica.rlang.error.RecoveryStrategy;

/**
 * Parser configuration options.
 *
 * @param recoveryStrategy How to continue after a failed statement
 * @param maxNestingDepth  Deepest statement/expression nesting accepted before the
 *                         construct is reported as malformed
 */
public record ParserConfig(
    RecoveryStrategy recoveryStrategy,
    int maxNestingDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        RecoveryStrategy.ADVANCED,
        500
    );

    public ParserConfig {
        if (recoveryStrategy == null) {
            throw new IllegalArgumentException("Recovery strategy must not be null");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be positive, got " + maxNestingDepth);
        }
    }

    public boolean isRecoveryEnabled() {
        return recoveryStrategy == RecoveryStrategy.ADVANCED;
    }
}
