package com.sqlvalidator.scanner;

/**
 * 粗粒度 token 类型
 */
public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    STRING_LITERAL,
    NUMERIC_LITERAL,
    OPERATOR,
    PUNCTUATION
}
