package com.svformatter.plugins.systemverilog.render;

/**
 * Semantic category of a syntax node, as seen by the renderer.
 *
 * <p>Several grammar symbols may share one kind; a symbol without a mapping is {@link #UNKNOWN}.
 */
public enum Kind {
    SOURCE_FILE,
    COMMENT,
    ERROR,

    FUNCTION_DECLARATION,
    FUNCTION_BODY,
    RETURN_TYPE,
    FUNCTION_IDENTIFIER,
    PORT_LIST,
    PORT_ITEM,

    STATEMENT,
    JUMP_STATEMENT,
    OPERATOR_ASSIGNMENT,
    VARIABLE_LVALUE,

    EXPRESSION,
    PARENTHESIZED_EXPRESSION,
    UNARY_EXPRESSION,
    CONDITIONAL_EXPRESSION,
    BIT_SELECT,
    PACKED_DIMENSION,
    ARGUMENT_LIST,

    DATA_TYPE,
    DATA_DECLARATION,
    VARIABLE_DECL_LIST,
    VARIABLE_DECL_ASSIGNMENT,

    CLASS_DECLARATION,
    CLASS_ITEM,
    CLASS_METHOD,
    CLASS_PROPERTY,

    // leaves
    QUALIFIER,
    IDENTIFIER,
    LITERAL,
    TYPE_KEYWORD,
    OPERATOR,
    FUNCTION_KEYWORD,
    ENDFUNCTION_KEYWORD,
    CLASS_KEYWORD,
    ENDCLASS_KEYWORD,
    EXTENDS_KEYWORD,
    SEMICOLON,
    COLON,
    KEYWORD,
    PUNCTUATION,

    UNKNOWN
}
