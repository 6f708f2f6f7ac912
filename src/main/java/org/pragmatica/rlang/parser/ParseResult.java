package org.pragmatica.rlang.parser;

import org.pragmatica.rlang.error.ParseError;

import java.util.function.Function;

/**
 * Outcome of a single grammar rule - either a node or the error that stopped it.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    static <T> ParseResult<T> success(T node) {
        return new Success<>(node);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    /**
     * The node of a successful result.
     *
     * @throws IllegalStateException on failure
     */
    T unwrap();

    /**
     * The error of a failed result.
     *
     * @throws IllegalStateException on success
     */
    ParseError error();

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper);

    /**
     * Re-type a failure so it can be propagated by a rule producing a different node type.
     *
     * @throws IllegalStateException on success
     */
    default <R> ParseResult<R> asFailure() {
        return failure(error());
    }

    /**
     * Rule matched and produced a node.
     */
    record Success<T>(T node) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return node;
        }

        @Override
        public ParseError error() {
            throw new IllegalStateException("Successful parse result has no error");
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(node));
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper) {
            return mapper.apply(node);
        }
    }

    /**
     * Rule failed; the cursor is left at the point of failure.
     */
    record Failure<T>(ParseError error) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Parse failed: " + error.message());
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper) {
            return new Failure<>(error);
        }
    }
}
