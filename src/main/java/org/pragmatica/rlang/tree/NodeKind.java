package org.pragmatica.rlang.tree;

/**
 * Tag identifying each concrete {@link AstNode} variant.
 */
public enum NodeKind {
    TERMINAL("Terminal"),
    GLOBAL_SCOPE("GlobalScope"),
    BLOCK_SCOPE("BlockScope"),
    INLINE_SCOPE("InlineScope"),
    EXPRESSION_STATEMENT("ExpressionStatement"),
    EMPTY_STATEMENT("EmptyStatement"),
    KEYWORD_STATEMENT("KeywordStatement"),
    ERROR_STATEMENT("ErrorStatement"),
    CONDITIONAL("Conditional"),
    ELSE_CLAUSE("ElseClause"),
    FOR_LOOP("ForLoop"),
    WHILE_LOOP("WhileLoop"),
    REPEAT_LOOP("RepeatLoop"),
    VARIABLE("Variable"),
    LITERAL("Literal"),
    BINARY("Binary"),
    UNARY("Unary"),
    GROUP("Group"),
    CALL("Call"),
    INDEX("Index"),
    ARGUMENT_LIST("ArgumentList"),
    ARGUMENT("Argument"),
    FUNCTION_DEFINITION("FunctionDefinition"),
    PARAMETER("Parameter");

    private final String display;

    NodeKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
