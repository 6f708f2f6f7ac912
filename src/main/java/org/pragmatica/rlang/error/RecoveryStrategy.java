package org.pragmatica.rlang.error;

/**
 * Error recovery strategy configuration.
 */
public enum RecoveryStrategy {
    /**
     * Stop at the first failed statement; the rest of the input becomes one error statement.
     */
    NONE,

    /**
     * Resynchronize after each failed statement and keep collecting diagnostics.
     */
    ADVANCED
}
