package com.pbxguard.parser;

public enum TokenType {
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    EQUALS,
    SEMI,
    COMMA,
    STRING,
    BAREWORD,
    COMMENT,
    EOF
}
