package org.pragmatica.rlang.token;

import java.util.Optional;

/**
 * Read-only, rewindable cursor over an ordered token sequence.
 * The sequence always ends with an {@link TokenType#END_OF_STREAM} sentinel,
 * and the cursor never moves past it.
 */
public interface TokenSource {

    /**
     * The token at the cursor, without consuming it.
     */
    Token current();

    /**
     * Consume the current token and move forward. Returns the consumed token.
     */
    Token advance();

    /**
     * The most recently consumed token, if any.
     */
    Optional<Token> previous();

    /**
     * Opaque cursor mark for {@link #seek(int)}.
     */
    int position();

    /**
     * Restore a cursor saved with {@link #position()}.
     */
    void seek(int mark);

    default boolean isAtEnd() {
        return current().isEndOfStream();
    }
}
