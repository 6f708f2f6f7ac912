package org.pragmatica.rlang.token;

import org.pragmatica.rlang.tree.SourceLocation;
import org.pragmatica.rlang.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * List-backed {@link TokenSource}. A missing end-of-stream sentinel is appended on creation.
 */
public final class TokenStream implements TokenSource {

    private final List<Token> tokens;
    private int pos;

    private TokenStream(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    public static TokenStream of(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).isEndOfStream()) {
            return new TokenStream(List.copyOf(tokens));
        }
        var terminated = new ArrayList<>(tokens);
        var end = tokens.isEmpty()
                  ? SourceLocation.START
                  : tokens.get(tokens.size() - 1).span().end();
        terminated.add(Token.endOfStream(SourceSpan.at(end), false));
        return new TokenStream(List.copyOf(terminated));
    }

    public static TokenStream tokenize(String source) {
        return new TokenStream(RTokenizer.tokenize(source));
    }

    @Override
    public Token current() {
        return tokens.get(pos);
    }

    @Override
    public Token advance() {
        var token = tokens.get(pos);
        if (!token.isEndOfStream()) {
            pos++;
        }
        return token;
    }

    @Override
    public Optional<Token> previous() {
        return pos == 0 ? Optional.empty() : Optional.of(tokens.get(pos - 1));
    }

    @Override
    public int position() {
        return pos;
    }

    @Override
    public void seek(int mark) {
        if (mark < 0 || mark >= tokens.size()) {
            throw new IllegalArgumentException("Token position " + mark + " out of range 0.." + (tokens.size() - 1));
        }
        this.pos = mark;
    }

    public int size() {
        return tokens.size();
    }

    public List<Token> tokens() {
        return tokens;
    }
}
