package org.pragmatica.rlang.parser;

import org.pragmatica.rlang.token.TokenSource;

/**
 * Parser interface - turns R source into a syntax tree plus diagnostics.
 * Parsing never fails as a whole: malformed input yields a partial tree and errors.
 */
public interface Parser {

    /**
     * Tokenize and parse source text.
     */
    ParseResultWithDiagnostics parse(String source);

    /**
     * Parse an already produced token stream.
     *
     * @param tokens Token stream ending with an end-of-stream sentinel
     * @param source The text the tokens were derived from, used only to render diagnostics
     */
    ParseResultWithDiagnostics parse(TokenSource tokens, String source);
}
