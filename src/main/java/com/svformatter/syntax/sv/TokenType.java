package com.svformatter.syntax.sv;

public enum TokenType {
    IDENTIFIER,
    SYSTEM_IDENTIFIER,
    KEYWORD,
    NUMBER,
    STRING,
    OPERATOR,
    COMMENT,
    UNKNOWN, // unlexable character, unterminated string or comment
    EOF
}
