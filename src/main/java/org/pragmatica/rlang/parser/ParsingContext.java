package org.pragmatica.rlang.parser;

import org.pragmatica.rlang.error.Diagnostic;
import org.pragmatica.rlang.error.ParseError;
import org.pragmatica.rlang.token.Token;
import org.pragmatica.rlang.token.TokenSource;
import org.pragmatica.rlang.token.TokenType;
import org.pragmatica.rlang.tree.AstNode;
import org.pragmatica.rlang.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable state of a single parse: token cursor, enclosure stack, nesting guard
 * and the diagnostic sink. Never shared between parses.
 */
public final class ParsingContext {

    /**
     * Syntactic container the parser is currently inside.
     */
    public enum Enclosure {
        /**
         * Top level of the unit. Line breaks end statements and strand a following {@code else}.
         */
        GLOBAL,

        /**
         * Inside {@code { }}. Line breaks end statements but a following {@code else} still binds.
         */
        BRACE,

        /**
         * Inside {@code ( )} or {@code [ ]}. Line breaks are insignificant.
         */
        PAREN
    }

    private final TokenSource tokens;
    private final ParserConfig config;
    private final Deque<Enclosure> enclosures;

    // Diagnostic sink, in the order reported
    private final List<Diagnostic> diagnostics;

    private int nestingDepth;
    private int nestingOverflows;
    private int braceDepth;
    private boolean halted;

    private ParsingContext(TokenSource tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.enclosures = new ArrayDeque<>();
        this.enclosures.push(Enclosure.GLOBAL);
        this.diagnostics = new ArrayList<>();
        this.nestingDepth = 0;
        this.nestingOverflows = 0;
        this.braceDepth = 0;
        this.halted = false;
    }

    public static ParsingContext create(TokenSource tokens, ParserConfig config) {
        return new ParsingContext(tokens, config);
    }

    // === Token Access ===

    public Token current() {
        return tokens.current();
    }

    /**
     * Consume the current token, wrapped as a tree leaf.
     */
    public AstNode.Terminal advance() {
        return new AstNode.Terminal(tokens.advance());
    }

    public boolean at(TokenType type) {
        return tokens.current().is(type);
    }

    public boolean atKeyword(String keyword) {
        return tokens.current().isKeyword(keyword);
    }

    public boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    public int position() {
        return tokens.position();
    }

    public void seek(int mark) {
        tokens.seek(mark);
    }

    /**
     * Span of the last consumed token, where missing tokens are reported.
     * Falls back to the current token when nothing was consumed yet.
     */
    public SourceSpan lastConsumedSpan() {
        return tokens.previous()
                     .map(Token::span)
                     .orElseGet(() -> tokens.current().span());
    }

    // === Enclosures ===

    public void enter(Enclosure enclosure) {
        enclosures.push(enclosure);
        if (enclosure == Enclosure.BRACE) {
            braceDepth++;
        }
    }

    public void exit() {
        var left = enclosures.pop();
        if (left == Enclosure.BRACE) {
            braceDepth--;
        }
    }

    /**
     * Whether a line break before a binary operator or postfix bracket ends the expression.
     */
    public boolean lineBreaksSignificant() {
        return enclosures.peek() != Enclosure.PAREN;
    }

    /**
     * Whether the parser is inside any brace, parenthesis or argument list.
     */
    public boolean isEnclosed() {
        return enclosures.peek() != Enclosure.GLOBAL;
    }

    /**
     * Whether some enclosing brace block is still open; that block reports a truncated input.
     */
    public boolean insideBlock() {
        return braceDepth > 0;
    }

    // === Nesting Guard ===

    /**
     * Enter one nesting level. Returns false, without entering, once the configured limit is reached.
     */
    public boolean descend() {
        if (nestingDepth >= config.maxNestingDepth()) {
            nestingOverflows++;
            return false;
        }
        nestingDepth++;
        return true;
    }

    public void ascend() {
        nestingDepth--;
    }

    /**
     * Number of refused {@link #descend()} calls so far. Recovery compares snapshots of it to tell
     * a nesting failure from a syntax error.
     */
    public int nestingOverflows() {
        return nestingOverflows;
    }

    // === Diagnostic Collection ===

    public void report(ParseError error) {
        diagnostics.add(error.toDiagnostic());
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    // === Recovery State ===

    /**
     * Stop parsing; used when recovery is disabled and a statement failed.
     */
    public void halt() {
        halted = true;
    }

    public boolean isHalted() {
        return halted;
    }

    public ParserConfig config() {
        return config;
    }
}
