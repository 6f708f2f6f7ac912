package org.pragmatica.rlang.parser;

import org.pragmatica.rlang.error.ExpectedToken;
import org.pragmatica.rlang.error.ParseError;
import org.pragmatica.rlang.parser.ParsingContext.Enclosure;
import org.pragmatica.rlang.token.Token;
import org.pragmatica.rlang.token.TokenSource;
import org.pragmatica.rlang.token.TokenStream;
import org.pragmatica.rlang.token.TokenType;
import org.pragmatica.rlang.tree.AstNode.Argument;
import org.pragmatica.rlang.tree.AstNode.ArgumentList;
import org.pragmatica.rlang.tree.AstNode.Binary;
import org.pragmatica.rlang.tree.AstNode.BlockScope;
import org.pragmatica.rlang.tree.AstNode.Call;
import org.pragmatica.rlang.tree.AstNode.Conditional;
import org.pragmatica.rlang.tree.AstNode.ElseClause;
import org.pragmatica.rlang.tree.AstNode.EmptyStatement;
import org.pragmatica.rlang.tree.AstNode.ErrorStatement;
import org.pragmatica.rlang.tree.AstNode.Expression;
import org.pragmatica.rlang.tree.AstNode.ExpressionStatement;
import org.pragmatica.rlang.tree.AstNode.ForLoop;
import org.pragmatica.rlang.tree.AstNode.FunctionDefinition;
import org.pragmatica.rlang.tree.AstNode.GlobalScope;
import org.pragmatica.rlang.tree.AstNode.Group;
import org.pragmatica.rlang.tree.AstNode.Index;
import org.pragmatica.rlang.tree.AstNode.InlineScope;
import org.pragmatica.rlang.tree.AstNode.KeywordStatement;
import org.pragmatica.rlang.tree.AstNode.Literal;
import org.pragmatica.rlang.tree.AstNode.Parameter;
import org.pragmatica.rlang.tree.AstNode.RepeatLoop;
import org.pragmatica.rlang.tree.AstNode.Scope;
import org.pragmatica.rlang.tree.AstNode.Statement;
import org.pragmatica.rlang.tree.AstNode.Terminal;
import org.pragmatica.rlang.tree.AstNode.Unary;
import org.pragmatica.rlang.tree.AstNode.Variable;
import org.pragmatica.rlang.tree.AstNode.WhileLoop;
import org.pragmatica.rlang.tree.AstRoot;
import org.pragmatica.rlang.tree.SourceLocation;
import org.pragmatica.rlang.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent grammar engine for R.
 *
 * <p>Every rule takes the {@link ParsingContext} of the current parse and either returns a node
 * or a {@link ParseResult.Failure}. Failures propagate up to the statement-list driver, which
 * reports the error, skips to a resynchronization point and continues with the next statement.
 * The engine itself is stateless and may be shared between threads.
 */
public final class ParserEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(ParserEngine.class);

    private final ParserConfig config;

    private ParserEngine(ParserConfig config) {
        this.config = config;
    }

    public static ParserEngine create(ParserConfig config) {
        return new ParserEngine(config);
    }

    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResultWithDiagnostics parse(String source) {
        return parse(TokenStream.tokenize(source), source);
    }

    @Override
    public ParseResultWithDiagnostics parse(TokenSource tokens, String source) {
        var ctx = ParsingContext.create(tokens, config);
        var statements = parseStatementList(ctx, false);
        var end = ctx.current().span().end();
        var scope = GlobalScope.of(SourceSpan.of(SourceLocation.START, end), statements);
        var result = ParseResultWithDiagnostics.of(AstRoot.of(scope), ctx.diagnostics(), source);
        log.debug("Parsed {} top-level statements with {} diagnostics", statements.size(), result.diagnostics().size());
        return result;
    }

    // === Statement Lists and Recovery ===

    /**
     * Statement-list driver shared by the global scope and brace blocks.
     * Stops at end of input, or at a closing brace when {@code inBlock}.
     */
    private List<Statement> parseStatementList(ParsingContext ctx, boolean inBlock) {
        var statements = new ArrayList<Statement>();
        while (!ctx.isHalted() && !ctx.isAtEnd() && !(inBlock && ctx.at(TokenType.CLOSE_BRACE))) {
            int start = ctx.position();
            int overflows = ctx.nestingOverflows();
            var result = parseStatement(ctx);

            if (result.isFailure()) {
                ctx.report(result.error());
                recover(ctx, start, inBlock, false, ctx.nestingOverflows() > overflows, statements);
                continue;
            }

            var statement = result.unwrap();
            statements.add(statement);
            // a separator already ends the statement it follows
            if (!(statement instanceof EmptyStatement) && !isStatementEnd(ctx, inBlock)) {
                var token = ctx.current();
                ctx.report(new ParseError.UnexpectedToken(token.span(), token.description()));
                recover(ctx, ctx.position(), inBlock, true, false, statements);
            }
        }
        return statements;
    }

    private static boolean isStatementEnd(ParsingContext ctx, boolean inBlock) {
        var token = ctx.current();
        return token.isEndOfStream()
               || token.lineBreakBefore()
               || token.is(TokenType.SEMICOLON)
               || (inBlock && token.is(TokenType.CLOSE_BRACE));
    }

    /**
     * Turn the tokens of a failed statement into an {@link ErrorStatement} and move to a
     * resynchronization point. A statement that failed on its first token loses just that token;
     * otherwise skipping continues up to a line break, a separator, a closing brace of an open
     * block or the end of input. After a nesting failure the skipped region also spans every
     * delimiter opened in it, so the rest of an over-deep construct is dropped as one statement.
     */
    private void recover(ParsingContext ctx, int start, boolean inBlock, boolean resynchronize, boolean tooDeep,
                         List<Statement> statements) {
        int failedAt = ctx.position();
        var skipped = new ArrayList<Terminal>();
        ctx.seek(start);

        if (!config.isRecoveryEnabled()) {
            while (!ctx.isAtEnd()) {
                skipped.add(ctx.advance());
            }
            ctx.halt();
        } else {
            while (ctx.position() < failedAt) {
                skipped.add(ctx.advance());
            }
            if (skipped.isEmpty() && !ctx.isAtEnd()) {
                skipped.add(ctx.advance());
            }
            if (tooDeep) {
                skipPastOpenDelimiters(ctx, inBlock, skipped);
            } else if (resynchronize || failedAt > start) {
                skipToResynchronizationPoint(ctx, inBlock, skipped);
            }
        }

        if (!skipped.isEmpty()) {
            statements.add(ErrorStatement.of(skipped));
            log.trace("Recovered at {}: skipped {} tokens", ctx.current().span(), skipped.size());
        }
    }

    private static void skipToResynchronizationPoint(ParsingContext ctx, boolean inBlock, List<Terminal> skipped) {
        while (!ctx.isAtEnd()) {
            var token = ctx.current();
            if (token.lineBreakBefore()
                || token.is(TokenType.SEMICOLON)
                || (inBlock && token.is(TokenType.CLOSE_BRACE))) {
                return;
            }
            skipped.add(ctx.advance());
        }
    }

    private static void skipPastOpenDelimiters(ParsingContext ctx, boolean inBlock, List<Terminal> skipped) {
        int open = 0;
        for (var terminal : skipped) {
            open = Math.max(0, open + delimiterBalance(terminal.token()));
        }
        while (!ctx.isAtEnd()) {
            var token = ctx.current();
            if (open == 0 && (token.lineBreakBefore()
                              || token.is(TokenType.SEMICOLON)
                              || (inBlock && token.is(TokenType.CLOSE_BRACE)))) {
                return;
            }
            open = Math.max(0, open + delimiterBalance(token));
            skipped.add(ctx.advance());
        }
    }

    private static int delimiterBalance(Token token) {
        if (token.is(TokenType.OPEN_PAREN) || token.is(TokenType.OPEN_BRACKET) || token.is(TokenType.OPEN_BRACE)) {
            return 1;
        }
        if (token.is(TokenType.OPEN_DOUBLE_BRACKET)) {
            return 2;
        }
        if (token.is(TokenType.CLOSE_PAREN) || token.is(TokenType.CLOSE_BRACKET) || token.is(TokenType.CLOSE_BRACE)) {
            return -1;
        }
        return 0;
    }

    // === Statements ===

    private ParseResult<Statement> parseStatement(ParsingContext ctx) {
        if (!ctx.descend()) {
            return nestingTooDeep(ctx);
        }
        try {
            var token = ctx.current();

            if (token.isKeyword("if")) {
                return parseConditional(ctx, false).map(conditional -> conditional);
            }
            if (token.isKeyword("for")) {
                return parseFor(ctx);
            }
            if (token.isKeyword("while")) {
                return parseWhile(ctx);
            }
            if (token.isKeyword("repeat")) {
                return parseRepeat(ctx);
            }
            if (token.isKeyword("break") || token.isKeyword("next")) {
                return ParseResult.success(new KeywordStatement(ctx.advance()));
            }
            if (token.is(TokenType.OPEN_BRACE)) {
                return ParseResult.success(parseBlock(ctx));
            }
            if (token.is(TokenType.SEMICOLON)) {
                return ParseResult.success(new EmptyStatement(ctx.advance()));
            }
            if (canStartExpression(token)) {
                return parseExpression(ctx).map(ExpressionStatement::new);
            }
            if (token.isKeyword("else")) {
                return ParseResult.failure(new ParseError.UnexpectedToken(token.span(), token.description(), Optional.of(
                    "an 'else' must follow the body of its 'if' on the same line, or directly after a closing '}'")));
            }
            return ParseResult.failure(new ParseError.UnexpectedToken(token.span(), token.description()));
        } finally {
            ctx.ascend();
        }
    }

    /**
     * Scope rule: a brace block, otherwise a single statement as an inline scope.
     * At end of input no scope is produced; the missing body is reported here unless an
     * enclosing unterminated block will report the truncation itself.
     *
     * <p>With recovery enabled a body that fails to parse does not fail the construct owning it.
     * The error is reported here and the scope becomes an {@link ErrorStatement} over the
     * skipped tokens, or is left empty when the body failed on a token that closes the
     * enclosing block, argument list or parenthesis.
     */
    private ParseResult<Optional<Scope>> parseScope(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            if (!ctx.insideBlock()) {
                ctx.report(new ParseError.MissingExpectedToken(ctx.lastConsumedSpan(), ExpectedToken.EXPRESSION));
            }
            return ParseResult.success(Optional.empty());
        }
        if (ctx.at(TokenType.OPEN_BRACE)) {
            return ParseResult.success(Optional.of(parseBlock(ctx)));
        }

        int start = ctx.position();
        var result = parseStatement(ctx);
        if (result.isSuccess()) {
            return ParseResult.success(Optional.of(new InlineScope(result.unwrap())));
        }
        if (!config.isRecoveryEnabled()) {
            return result.asFailure();
        }
        ctx.report(result.error());
        return ParseResult.success(recoverScope(ctx, start));
    }

    private static Optional<Scope> recoverScope(ParsingContext ctx, int start) {
        int failedAt = ctx.position();
        var skipped = new ArrayList<Terminal>();
        ctx.seek(start);
        while (ctx.position() < failedAt) {
            skipped.add(ctx.advance());
        }
        if (skipped.isEmpty() && !ctx.isAtEnd() && !closesEnclosure(ctx)) {
            skipped.add(ctx.advance());
        }
        while (!ctx.isAtEnd() && !endsScope(ctx)) {
            skipped.add(ctx.advance());
        }

        if (skipped.isEmpty()) {
            return Optional.empty();
        }
        log.trace("Recovered scope at {}: skipped {} tokens", ctx.current().span(), skipped.size());
        return Optional.of(new InlineScope(ErrorStatement.of(skipped)));
    }

    // Closing token the construct around a failed scope will consume
    private static boolean closesEnclosure(ParsingContext ctx) {
        var token = ctx.current();
        if (ctx.lineBreaksSignificant()) {
            return ctx.insideBlock() && token.is(TokenType.CLOSE_BRACE);
        }
        return token.is(TokenType.CLOSE_PAREN) || token.is(TokenType.CLOSE_BRACKET) || token.is(TokenType.COMMA);
    }

    private static boolean endsScope(ParsingContext ctx) {
        var token = ctx.current();
        return closesEnclosure(ctx)
               || token.is(TokenType.SEMICOLON)
               || (token.lineBreakBefore() && ctx.lineBreaksSignificant());
    }

    private BlockScope parseBlock(ParsingContext ctx) {
        var open = ctx.advance();
        int overflows = ctx.nestingOverflows();
        List<Statement> statements;
        ctx.enter(Enclosure.BRACE);
        try {
            statements = parseStatementList(ctx, true);
        } finally {
            ctx.exit();
        }

        Optional<Terminal> close = Optional.empty();
        if (ctx.at(TokenType.CLOSE_BRACE)) {
            close = Optional.of(ctx.advance());
        } else if (!ctx.isHalted() && ctx.nestingOverflows() == overflows) {
            // a nesting failure inside already accounts for the truncation
            ctx.report(new ParseError.MissingExpectedToken(ctx.lastConsumedSpan(), ExpectedToken.CLOSE_BRACE,
                                                           Optional.of(open.span())));
        }
        return BlockScope.of(open, statements, close);
    }

    // === Conditionals ===

    /**
     * {@code if (condition) then-scope [else else-scope]}.
     *
     * <p>An {@code else} on the same line always binds. An {@code else} after a line break binds
     * when the then-scope is a brace block, or when the conditional sits inside braces,
     * parentheses or an argument list. At global level a brace-free then-scope ends the
     * conditional at the line break and the {@code else} is left to start the next statement.
     */
    private ParseResult<Conditional> parseConditional(ParsingContext ctx, boolean inline) {
        var ifKeyword = ctx.advance();
        if (!ctx.at(TokenType.OPEN_PAREN)) {
            return ParseResult.failure(new ParseError.MissingExpectedToken(ifKeyword.span(), ExpectedToken.OPEN_PAREN));
        }
        var open = ctx.advance();

        Expression condition;
        Terminal close;
        ctx.enter(Enclosure.PAREN);
        try {
            var conditionResult = parseExpression(ctx);
            if (conditionResult.isFailure()) {
                return conditionResult.asFailure();
            }
            condition = conditionResult.unwrap();
            var closeResult = expectClosing(ctx, open, TokenType.CLOSE_PAREN, ExpectedToken.CLOSE_PAREN);
            if (closeResult.isFailure()) {
                return closeResult.asFailure();
            }
            close = closeResult.unwrap();
        } finally {
            ctx.exit();
        }

        var thenResult = parseScope(ctx);
        if (thenResult.isFailure()) {
            return thenResult.asFailure();
        }
        var thenScope = thenResult.unwrap();
        var conditional = Conditional.of(ifKeyword, open, condition, close, thenScope, Optional.empty(), inline);

        if (thenScope.isEmpty() || !bindsElse(ctx, thenScope.get())) {
            return ParseResult.success(conditional);
        }

        var elseKeyword = ctx.advance();
        var elseResult = parseScope(ctx);
        if (elseResult.isFailure()) {
            return elseResult.asFailure();
        }
        return ParseResult.success(conditional.withElse(ElseClause.of(elseKeyword, elseResult.unwrap())));
    }

    private static boolean bindsElse(ParsingContext ctx, Scope thenScope) {
        Token next = ctx.current();
        if (!next.isKeyword("else")) {
            return false;
        }
        if (!next.lineBreakBefore()) {
            return true;
        }
        return thenScope instanceof BlockScope || ctx.isEnclosed();
    }

    // === Loops ===

    private ParseResult<Statement> parseFor(ParsingContext ctx) {
        var forKeyword = ctx.advance();
        if (!ctx.at(TokenType.OPEN_PAREN)) {
            return ParseResult.failure(new ParseError.MissingExpectedToken(forKeyword.span(), ExpectedToken.OPEN_PAREN));
        }
        var open = ctx.advance();

        Terminal variable;
        Terminal inKeyword;
        Expression sequence;
        Terminal close;
        ctx.enter(Enclosure.PAREN);
        try {
            if (!ctx.at(TokenType.IDENTIFIER)) {
                return ParseResult.failure(new ParseError.MissingExpectedToken(ctx.lastConsumedSpan(), ExpectedToken.IDENTIFIER));
            }
            variable = ctx.advance();
            if (!ctx.atKeyword("in")) {
                return ParseResult.failure(new ParseError.MissingExpectedToken(ctx.lastConsumedSpan(), ExpectedToken.IN));
            }
            inKeyword = ctx.advance();
            var sequenceResult = parseExpression(ctx);
            if (sequenceResult.isFailure()) {
                return sequenceResult.asFailure();
            }
            sequence = sequenceResult.unwrap();
            var closeResult = expectClosing(ctx, open, TokenType.CLOSE_PAREN, ExpectedToken.CLOSE_PAREN);
            if (closeResult.isFailure()) {
                return closeResult.asFailure();
            }
            close = closeResult.unwrap();
        } finally {
            ctx.exit();
        }

        return parseScope(ctx).map(body -> ForLoop.of(forKeyword, open, variable, inKeyword, sequence, close, body));
    }

    private ParseResult<Statement> parseWhile(ParsingContext ctx) {
        var whileKeyword = ctx.advance();
        if (!ctx.at(TokenType.OPEN_PAREN)) {
            return ParseResult.failure(new ParseError.MissingExpectedToken(whileKeyword.span(), ExpectedToken.OPEN_PAREN));
        }
        var open = ctx.advance();

        Expression condition;
        Terminal close;
        ctx.enter(Enclosure.PAREN);
        try {
            var conditionResult = parseExpression(ctx);
            if (conditionResult.isFailure()) {
                return conditionResult.asFailure();
            }
            condition = conditionResult.unwrap();
            var closeResult = expectClosing(ctx, open, TokenType.CLOSE_PAREN, ExpectedToken.CLOSE_PAREN);
            if (closeResult.isFailure()) {
                return closeResult.asFailure();
            }
            close = closeResult.unwrap();
        } finally {
            ctx.exit();
        }

        return parseScope(ctx).map(body -> WhileLoop.of(whileKeyword, open, condition, close, body));
    }

    private ParseResult<Statement> parseRepeat(ParsingContext ctx) {
        var repeatKeyword = ctx.advance();
        return parseScope(ctx).map(body -> RepeatLoop.of(repeatKeyword, body));
    }

    // === Expressions ===

    private ParseResult<Expression> parseExpression(ParsingContext ctx) {
        return parseBinary(ctx, 0);
    }

    /**
     * Precedence climbing over {@link OperatorPrecedence}. Only operators at or above
     * {@code minLevel} are consumed at this depth.
     */
    private ParseResult<Expression> parseBinary(ParsingContext ctx, int minLevel) {
        if (!ctx.descend()) {
            return nestingTooDeep(ctx);
        }
        try {
            var leftResult = parseUnary(ctx);
            if (leftResult.isFailure()) {
                return leftResult;
            }
            var left = leftResult.unwrap();

            while (true) {
                var token = ctx.current();
                var precedence = OperatorPrecedence.binary(token);
                if (precedence.isEmpty() || precedence.get().level() < minLevel) {
                    break;
                }
                if (token.lineBreakBefore() && ctx.lineBreaksSignificant()) {
                    break;
                }
                var operator = ctx.advance();
                var rightResult = parseBinary(ctx, precedence.get().rightOperandLevel());
                if (rightResult.isFailure()) {
                    return rightResult;
                }
                left = Binary.of(left, operator, rightResult.unwrap());
            }
            return ParseResult.success(left);
        } finally {
            ctx.ascend();
        }
    }

    private ParseResult<Expression> parseUnary(ParsingContext ctx) {
        var operandLevel = OperatorPrecedence.unaryOperandLevel(ctx.current());
        if (operandLevel.isEmpty()) {
            return parsePostfix(ctx);
        }
        var operator = ctx.advance();
        return parseBinary(ctx, operandLevel.get()).map(operand -> Unary.of(operator, operand));
    }

    /**
     * Primary followed by any number of calls, index operations and accessors.
     */
    private ParseResult<Expression> parsePostfix(ParsingContext ctx) {
        var primaryResult = parsePrimary(ctx);
        if (primaryResult.isFailure()) {
            return primaryResult;
        }
        var expression = primaryResult.unwrap();

        while (true) {
            var token = ctx.current();
            boolean postfix = token.is(TokenType.OPEN_PAREN)
                              || token.is(TokenType.OPEN_BRACKET)
                              || token.is(TokenType.OPEN_DOUBLE_BRACKET)
                              || OperatorPrecedence.isAccessor(token);
            if (!postfix || (token.lineBreakBefore() && ctx.lineBreaksSignificant())) {
                break;
            }

            ParseResult<Expression> next;
            if (token.is(TokenType.OPEN_PAREN)) {
                next = parseCall(ctx, expression);
            } else if (token.is(TokenType.OPEN_BRACKET) || token.is(TokenType.OPEN_DOUBLE_BRACKET)) {
                next = parseIndex(ctx, expression);
            } else {
                next = parseAccessor(ctx, expression);
            }
            if (next.isFailure()) {
                return next;
            }
            expression = next.unwrap();
        }
        return ParseResult.success(expression);
    }

    private ParseResult<Expression> parsePrimary(ParsingContext ctx) {
        var token = ctx.current();

        if (token.is(TokenType.IDENTIFIER)) {
            return ParseResult.success(new Variable(ctx.advance()));
        }
        if (token.is(TokenType.NUMBER) || token.is(TokenType.STRING) || token.isConstant()) {
            return ParseResult.success(new Literal(ctx.advance()));
        }
        if (token.is(TokenType.OPEN_PAREN)) {
            return parseGroup(ctx);
        }
        if (token.is(TokenType.OPEN_BRACE)) {
            return ParseResult.success(parseBlock(ctx));
        }
        if (token.isKeyword("function")) {
            return parseFunction(ctx);
        }
        if (token.isKeyword("if")) {
            return parseConditional(ctx, true).map(conditional -> conditional);
        }
        return operandExpected(ctx);
    }

    private ParseResult<Expression> parseGroup(ParsingContext ctx) {
        var open = ctx.advance();
        ctx.enter(Enclosure.PAREN);
        try {
            var innerResult = parseExpression(ctx);
            if (innerResult.isFailure()) {
                return innerResult;
            }
            return expectClosing(ctx, open, TokenType.CLOSE_PAREN, ExpectedToken.CLOSE_PAREN)
                .map(close -> Group.of(open, innerResult.unwrap(), close));
        } finally {
            ctx.exit();
        }
    }

    private ParseResult<Expression> parseCall(ParsingContext ctx, Expression function) {
        var open = ctx.advance();
        ctx.enter(Enclosure.PAREN);
        try {
            var argumentsResult = parseArguments(ctx, open, TokenType.CLOSE_PAREN);
            if (argumentsResult.isFailure()) {
                return argumentsResult.asFailure();
            }
            return expectClosing(ctx, open, TokenType.CLOSE_PAREN, ExpectedToken.CLOSE_PAREN)
                .map(close -> Call.of(function, open, argumentsResult.unwrap(), close));
        } finally {
            ctx.exit();
        }
    }

    private ParseResult<Expression> parseIndex(ParsingContext ctx, Expression target) {
        var open = ctx.advance();
        int closers = open.token().is(TokenType.OPEN_DOUBLE_BRACKET) ? 2 : 1;
        ctx.enter(Enclosure.PAREN);
        try {
            var argumentsResult = parseArguments(ctx, open, TokenType.CLOSE_BRACKET);
            if (argumentsResult.isFailure()) {
                return argumentsResult.asFailure();
            }
            var close = new ArrayList<Terminal>(closers);
            for (int i = 0; i < closers; i++) {
                var closeResult = expectClosing(ctx, open, TokenType.CLOSE_BRACKET, ExpectedToken.CLOSE_BRACKET);
                if (closeResult.isFailure()) {
                    return closeResult.asFailure();
                }
                close.add(closeResult.unwrap());
            }
            return ParseResult.success(Index.of(target, open, argumentsResult.unwrap(), close));
        } finally {
            ctx.exit();
        }
    }

    /**
     * {@code x$name}, {@code x@slot}, {@code pkg::name}. The right side is a name or a string.
     */
    private ParseResult<Expression> parseAccessor(ParsingContext ctx, Expression target) {
        var operator = ctx.advance();
        var token = ctx.current();
        if (token.is(TokenType.IDENTIFIER)) {
            return ParseResult.success(Binary.of(target, operator, new Variable(ctx.advance())));
        }
        if (token.is(TokenType.STRING)) {
            return ParseResult.success(Binary.of(target, operator, new Literal(ctx.advance())));
        }
        if (token.isEndOfStream()) {
            return ParseResult.failure(new ParseError.MissingExpectedToken(operator.span(), ExpectedToken.IDENTIFIER));
        }
        return ParseResult.failure(new ParseError.MalformedExpression(
            token.span(), "name expected after '" + operator.text() + "', found " + token.description()));
    }

    /**
     * Arguments up to, not including, the closing delimiter. Names are detected speculatively:
     * a name candidate not followed by {@code =} is rewound and parsed as a value.
     */
    private ParseResult<ArgumentList> parseArguments(ParsingContext ctx, Terminal open, TokenType closeType) {
        var arguments = new ArrayList<Argument>();
        while (!ctx.at(closeType) && !ctx.isAtEnd()) {
            Optional<Terminal> name = Optional.empty();
            Optional<Terminal> equals = Optional.empty();
            int mark = ctx.position();
            if (isArgumentName(ctx.current())) {
                var candidate = ctx.advance();
                if (ctx.current().isOperator("=")) {
                    name = Optional.of(candidate);
                    equals = Optional.of(ctx.advance());
                } else {
                    ctx.seek(mark);
                }
            }

            Optional<Expression> value = Optional.empty();
            if (!ctx.at(TokenType.COMMA) && !ctx.at(closeType)) {
                var valueResult = parseExpression(ctx);
                if (valueResult.isFailure()) {
                    return valueResult.asFailure();
                }
                value = Optional.of(valueResult.unwrap());
            }

            Optional<Terminal> comma = ctx.at(TokenType.COMMA)
                                       ? Optional.of(ctx.advance())
                                       : Optional.empty();
            if (name.isEmpty() && value.isEmpty() && comma.isEmpty()) {
                break;
            }
            arguments.add(Argument.of(name, equals, value, comma));
            if (comma.isEmpty()) {
                break;
            }
        }
        return ParseResult.success(ArgumentList.of(open, arguments));
    }

    private static boolean isArgumentName(Token token) {
        return token.is(TokenType.IDENTIFIER) || token.is(TokenType.STRING) || token.isKeyword("NULL");
    }

    private ParseResult<Expression> parseFunction(ParsingContext ctx) {
        var functionKeyword = ctx.advance();
        if (!ctx.at(TokenType.OPEN_PAREN)) {
            return ParseResult.failure(new ParseError.MissingExpectedToken(functionKeyword.span(), ExpectedToken.OPEN_PAREN));
        }
        var open = ctx.advance();

        var parameters = new ArrayList<Parameter>();
        Terminal close;
        ctx.enter(Enclosure.PAREN);
        try {
            while (!ctx.at(TokenType.CLOSE_PAREN) && !ctx.isAtEnd()) {
                if (!ctx.at(TokenType.IDENTIFIER)) {
                    return ParseResult.failure(new ParseError.MissingExpectedToken(ctx.lastConsumedSpan(), ExpectedToken.IDENTIFIER));
                }
                var name = ctx.advance();
                Optional<Terminal> equals = Optional.empty();
                Optional<Expression> defaultValue = Optional.empty();
                if (ctx.current().isOperator("=")) {
                    equals = Optional.of(ctx.advance());
                    var defaultResult = parseExpression(ctx);
                    if (defaultResult.isFailure()) {
                        return defaultResult;
                    }
                    defaultValue = Optional.of(defaultResult.unwrap());
                }
                Optional<Terminal> comma = ctx.at(TokenType.COMMA)
                                           ? Optional.of(ctx.advance())
                                           : Optional.empty();
                parameters.add(Parameter.of(name, equals, defaultValue, comma));
                if (comma.isEmpty()) {
                    break;
                }
            }
            var closeResult = expectClosing(ctx, open, TokenType.CLOSE_PAREN, ExpectedToken.CLOSE_PAREN);
            if (closeResult.isFailure()) {
                return closeResult.asFailure();
            }
            close = closeResult.unwrap();
        } finally {
            ctx.exit();
        }

        return parseScope(ctx).map(body -> FunctionDefinition.of(functionKeyword, open, parameters, close, body));
    }

    // === Helpers ===

    private static boolean canStartExpression(Token token) {
        return token.is(TokenType.IDENTIFIER)
               || token.is(TokenType.NUMBER)
               || token.is(TokenType.STRING)
               || token.is(TokenType.OPEN_PAREN)
               || token.is(TokenType.OPEN_BRACE)
               || token.isConstant()
               || token.isKeyword("function")
               || token.isKeyword("if")
               || OperatorPrecedence.unaryOperandLevel(token).isPresent();
    }

    /**
     * Consume the delimiter closing {@code open}, or fail pointing at the last consumed token.
     */
    private static ParseResult<Terminal> expectClosing(ParsingContext ctx, Terminal open, TokenType type, ExpectedToken expected) {
        if (ctx.at(type)) {
            return ParseResult.success(ctx.advance());
        }
        return ParseResult.failure(new ParseError.MissingExpectedToken(ctx.lastConsumedSpan(), expected, Optional.of(open.span())));
    }

    private static <T> ParseResult<T> operandExpected(ParsingContext ctx) {
        var token = ctx.current();
        if (token.isEndOfStream()) {
            return ParseResult.failure(new ParseError.MissingExpectedToken(ctx.lastConsumedSpan(), ExpectedToken.EXPRESSION));
        }
        return ParseResult.failure(new ParseError.MalformedExpression(
            token.span(), "expected an operand, found " + token.description()));
    }

    private static <T> ParseResult<T> nestingTooDeep(ParsingContext ctx) {
        return ParseResult.failure(new ParseError.MalformedExpression(
            ctx.current().span(), "nesting deeper than " + ctx.config().maxNestingDepth() + " levels"));
    }
}
