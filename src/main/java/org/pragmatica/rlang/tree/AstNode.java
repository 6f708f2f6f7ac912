package org.pragmatica.rlang.tree;

import org.pragmatica.rlang.token.Token;

import java.util.List;
import java.util.Optional;

/**
 * Abstract Syntax Tree node for R source.
 *
 * <p>Nodes are immutable. Ownership flows from parent to child only; parent lookup
 * is provided by {@link AstRoot}. Every composite span runs from the start of the first
 * child to the end of the last one and is computed once, in the factory methods.
 */
public sealed interface AstNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * Variant tag of this node.
     */
    NodeKind kind();

    /**
     * Children in source order. Absent optional parts are omitted.
     */
    List<AstNode> children();

    /**
     * Body of a scope-bearing construct.
     */
    sealed interface Scope extends AstNode {}

    sealed interface Statement extends AstNode {}

    /**
     * Value-producing subtree.
     */
    sealed interface Expression extends AstNode {}

    /**
     * Leaf wrapping exactly one token.
     */
    record Terminal(Token token) implements AstNode {
        @Override
        public SourceSpan span() {
            return token.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TERMINAL;
        }

        @Override
        public List<AstNode> children() {
            return List.of();
        }

        public String text() {
            return token.text();
        }
    }

    /**
     * Top-level container owning all top-level statements.
     */
    record GlobalScope(SourceSpan span, List<Statement> statements) implements AstNode {
        public static GlobalScope of(SourceSpan span, List<Statement> statements) {
            return new GlobalScope(span, List.copyOf(statements));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GLOBAL_SCOPE;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(statements);
        }
    }

    /**
     * Brace-delimited scope. The closing brace is absent when the source ends inside the block.
     */
    record BlockScope(
    SourceSpan span,
    Terminal open,
    List<Statement> statements,
    Optional<Terminal> close) implements Scope, Statement, Expression {
        public static BlockScope of(Terminal open, List<Statement> statements, Optional<Terminal> close) {
            return new BlockScope(Children.span(open, statements, close), open, List.copyOf(statements), close);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BLOCK_SCOPE;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(open, statements, close);
        }
    }

    /**
     * Brace-free scope holding a single statement; its span is exactly the statement's span.
     */
    record InlineScope(Statement statement) implements Scope {
        @Override
        public SourceSpan span() {
            return statement.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INLINE_SCOPE;
        }

        @Override
        public List<AstNode> children() {
            return List.of(statement);
        }
    }

    record ExpressionStatement(Expression expression) implements Statement {
        @Override
        public SourceSpan span() {
            return expression.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPRESSION_STATEMENT;
        }

        @Override
        public List<AstNode> children() {
            return List.of(expression);
        }
    }

    /**
     * A lone {@code ;} separator.
     */
    record EmptyStatement(Terminal separator) implements Statement {
        @Override
        public SourceSpan span() {
            return separator.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EMPTY_STATEMENT;
        }

        @Override
        public List<AstNode> children() {
            return List.of(separator);
        }
    }

    /**
     * {@code break} or {@code next}.
     */
    record KeywordStatement(Terminal keyword) implements Statement {
        @Override
        public SourceSpan span() {
            return keyword.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.KEYWORD_STATEMENT;
        }

        @Override
        public List<AstNode> children() {
            return List.of(keyword);
        }
    }

    /**
     * Tokens consumed or skipped while recovering from a failed statement.
     */
    record ErrorStatement(SourceSpan span, List<Terminal> tokens) implements Statement {
        public static ErrorStatement of(List<Terminal> tokens) {
            return new ErrorStatement(Children.span(tokens), List.copyOf(tokens));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ERROR_STATEMENT;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(tokens);
        }
    }

    /**
     * {@code if (condition) then [else ...]}, either as a statement or as an inline value.
     *
     * @param thenScope   Absent only when the source ends right after the condition
     * @param elseClause  Present when an {@code else} bound to this conditional
     * @param inline      Whether the conditional appeared in an operand position
     */
    record Conditional(
    SourceSpan span,
    Terminal ifKeyword,
    Terminal open,
    Expression condition,
    Terminal close,
    Optional<Scope> thenScope,
    Optional<ElseClause> elseClause,
    boolean inline) implements Statement, Expression {
        public static Conditional of(Terminal ifKeyword,
                                     Terminal open,
                                     Expression condition,
                                     Terminal close,
                                     Optional<Scope> thenScope,
                                     Optional<ElseClause> elseClause,
                                     boolean inline) {
            return new Conditional(Children.span(ifKeyword, close, thenScope, elseClause),
                                   ifKeyword, open, condition, close, thenScope, elseClause, inline);
        }

        /**
         * True iff the then-branch is not brace-delimited, which makes a line break
         * before a following {@code else} significant.
         */
        public boolean lineBreakSensitive() {
            return thenScope.map(scope -> scope instanceof InlineScope).orElse(false);
        }

        public Conditional withElse(ElseClause clause) {
            return of(ifKeyword, open, condition, close, thenScope, Optional.of(clause), inline);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CONDITIONAL;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(ifKeyword, open, condition, close, thenScope, elseClause);
        }
    }

    /**
     * {@code else} followed by its own scope. The scope is absent when the source ends after {@code else}.
     */
    record ElseClause(SourceSpan span, Terminal elseKeyword, Optional<Scope> scope) implements AstNode {
        public static ElseClause of(Terminal elseKeyword, Optional<Scope> scope) {
            return new ElseClause(Children.span(elseKeyword, scope), elseKeyword, scope);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ELSE_CLAUSE;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(elseKeyword, scope);
        }
    }

    record ForLoop(
    SourceSpan span,
    Terminal forKeyword,
    Terminal open,
    Terminal variable,
    Terminal inKeyword,
    Expression sequence,
    Terminal close,
    Optional<Scope> body) implements Statement {
        public static ForLoop of(Terminal forKeyword,
                                 Terminal open,
                                 Terminal variable,
                                 Terminal inKeyword,
                                 Expression sequence,
                                 Terminal close,
                                 Optional<Scope> body) {
            return new ForLoop(Children.span(forKeyword, close, body),
                               forKeyword, open, variable, inKeyword, sequence, close, body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FOR_LOOP;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(forKeyword, open, variable, inKeyword, sequence, close, body);
        }
    }

    record WhileLoop(
    SourceSpan span,
    Terminal whileKeyword,
    Terminal open,
    Expression condition,
    Terminal close,
    Optional<Scope> body) implements Statement {
        public static WhileLoop of(Terminal whileKeyword,
                                   Terminal open,
                                   Expression condition,
                                   Terminal close,
                                   Optional<Scope> body) {
            return new WhileLoop(Children.span(whileKeyword, close, body), whileKeyword, open, condition, close, body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.WHILE_LOOP;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(whileKeyword, open, condition, close, body);
        }
    }

    record RepeatLoop(SourceSpan span, Terminal repeatKeyword, Optional<Scope> body) implements Statement {
        public static RepeatLoop of(Terminal repeatKeyword, Optional<Scope> body) {
            return new RepeatLoop(Children.span(repeatKeyword, body), repeatKeyword, body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.REPEAT_LOOP;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(repeatKeyword, body);
        }
    }

    record Variable(Terminal name) implements Expression {
        @Override
        public SourceSpan span() {
            return name.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.VARIABLE;
        }

        @Override
        public List<AstNode> children() {
            return List.of(name);
        }
    }

    /**
     * Number, string or constant keyword such as {@code TRUE} or {@code NULL}.
     */
    record Literal(Terminal value) implements Expression {
        @Override
        public SourceSpan span() {
            return value.span();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LITERAL;
        }

        @Override
        public List<AstNode> children() {
            return List.of(value);
        }
    }

    record Binary(SourceSpan span, Expression left, Terminal operator, Expression right) implements Expression {
        public static Binary of(Expression left, Terminal operator, Expression right) {
            return new Binary(Children.span(left, right), left, operator, right);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BINARY;
        }

        @Override
        public List<AstNode> children() {
            return List.of(left, operator, right);
        }
    }

    record Unary(SourceSpan span, Terminal operator, Expression operand) implements Expression {
        public static Unary of(Terminal operator, Expression operand) {
            return new Unary(Children.span(operator, operand), operator, operand);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNARY;
        }

        @Override
        public List<AstNode> children() {
            return List.of(operator, operand);
        }
    }

    record Group(SourceSpan span, Terminal open, Expression inner, Terminal close) implements Expression {
        public static Group of(Terminal open, Expression inner, Terminal close) {
            return new Group(Children.span(open, close), open, inner, close);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GROUP;
        }

        @Override
        public List<AstNode> children() {
            return List.of(open, inner, close);
        }
    }

    record Call(
    SourceSpan span,
    Expression function,
    Terminal open,
    ArgumentList arguments,
    Terminal close) implements Expression {
        public static Call of(Expression function, Terminal open, ArgumentList arguments, Terminal close) {
            return new Call(Children.span(function, close), function, open, arguments, close);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL;
        }

        @Override
        public List<AstNode> children() {
            return List.of(function, open, arguments, close);
        }
    }

    /**
     * {@code x[...]} or {@code x[[...]]}; the double form carries two closing brackets.
     */
    record Index(
    SourceSpan span,
    Expression target,
    Terminal open,
    ArgumentList arguments,
    List<Terminal> close) implements Expression {
        public static Index of(Expression target, Terminal open, ArgumentList arguments, List<Terminal> close) {
            return new Index(Children.span(target, close), target, open, arguments, List.copyOf(close));
        }

        public boolean isDouble() {
            return close.size() == 2;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INDEX;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(target, open, arguments, close);
        }
    }

    /**
     * Arguments between call or index delimiters. An empty list has a zero-length span
     * right after the opening delimiter.
     */
    record ArgumentList(SourceSpan span, List<Argument> arguments) implements AstNode {
        public static ArgumentList of(Terminal open, List<Argument> arguments) {
            var span = arguments.isEmpty()
                       ? SourceSpan.at(open.span().end())
                       : Children.span(arguments);
            return new ArgumentList(span, List.copyOf(arguments));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARGUMENT_LIST;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(arguments);
        }
    }

    /**
     * Positional ({@code value}), named ({@code name = value}) or empty ({@code ,}) argument.
     */
    record Argument(
    SourceSpan span,
    Optional<Terminal> name,
    Optional<Terminal> equals,
    Optional<Expression> value,
    Optional<Terminal> comma) implements AstNode {
        public static Argument of(Optional<Terminal> name,
                                  Optional<Terminal> equals,
                                  Optional<Expression> value,
                                  Optional<Terminal> comma) {
            return new Argument(Children.span(name, equals, value, comma), name, equals, value, comma);
        }

        public boolean isNamed() {
            return name.isPresent();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARGUMENT;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(name, equals, value, comma);
        }
    }

    record FunctionDefinition(
    SourceSpan span,
    Terminal functionKeyword,
    Terminal open,
    List<Parameter> parameters,
    Terminal close,
    Optional<Scope> body) implements Expression {
        public static FunctionDefinition of(Terminal functionKeyword,
                                            Terminal open,
                                            List<Parameter> parameters,
                                            Terminal close,
                                            Optional<Scope> body) {
            return new FunctionDefinition(Children.span(functionKeyword, close, body),
                                          functionKeyword, open, List.copyOf(parameters), close, body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION_DEFINITION;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(functionKeyword, open, parameters, close, body);
        }
    }

    record Parameter(
    SourceSpan span,
    Terminal name,
    Optional<Terminal> equals,
    Optional<Expression> defaultValue,
    Optional<Terminal> comma) implements AstNode {
        public static Parameter of(Terminal name,
                                   Optional<Terminal> equals,
                                   Optional<Expression> defaultValue,
                                   Optional<Terminal> comma) {
            return new Parameter(Children.span(name, equals, defaultValue, comma), name, equals, defaultValue, comma);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PARAMETER;
        }

        @Override
        public List<AstNode> children() {
            return Children.of(name, equals, defaultValue, comma);
        }
    }
}
