package com.sqlvalidator.scanner;

import java.util.Locale;
import java.util.Set;

/**
 * 扫描得到的单个 token
 *
 * @param type   token 类型
 * @param text   原始文本（关键字保持原始大小写）
 * @param offset 在 SQL 文本中的起始偏移
 * @param depth  所处的括号深度；左括号记外层深度，右括号记闭合后的深度
 */
public record Token(TokenType type, String text, int offset, int depth) {

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equalsIgnoreCase(keyword);
    }

    public boolean isKeywordIn(Set<String> keywords) {
        return type == TokenType.KEYWORD && keywords.contains(upper());
    }

    public boolean isIdentifier() {
        return type == TokenType.IDENTIFIER;
    }

    public boolean isPunctuation(char c) {
        return type == TokenType.PUNCTUATION && text.length() == 1 && text.charAt(0) == c;
    }

    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    /**
     * 标识符名称：去掉双引号或反引号
     */
    public String identifierName() {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`')) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    public boolean isQuotedIdentifier() {
        return type == TokenType.IDENTIFIER && !text.isEmpty()
                && (text.charAt(0) == '"' || text.charAt(0) == '`');
    }
}
