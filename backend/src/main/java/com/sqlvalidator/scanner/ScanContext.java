package com.sqlvalidator.scanner;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 一次扫描的结果：括号/引号平衡状态、结尾分号以及粗粒度 token 序列
 * <p>
 * 创建后不可变，同一次校验中所有检查器只读共享。
 */
public final class ScanContext {

    private final int unclosedParens;
    private final int strayCloseParens;
    private final int unmatchedQuotes;
    private final boolean trailingSemicolon;
    private final List<Token> tokens;
    private final int[] lineStarts;

    ScanContext(int unclosedParens, int strayCloseParens, int unmatchedQuotes,
                boolean trailingSemicolon, List<Token> tokens, int[] lineStarts) {
        this.unclosedParens = unclosedParens;
        this.strayCloseParens = strayCloseParens;
        this.unmatchedQuotes = unmatchedQuotes;
        this.trailingSemicolon = trailingSemicolon;
        this.tokens = List.copyOf(tokens);
        this.lineStarts = lineStarts.clone();
    }

    /** 未闭合的 '(' 数量 */
    public int unclosedParens() {
        return unclosedParens;
    }

    /** 没有对应 '(' 的 ')' 数量 */
    public int strayCloseParens() {
        return strayCloseParens;
    }

    public int unmatchedParenCount() {
        return unclosedParens + strayCloseParens;
    }

    /** 文本在字符串字面量内部结束时为 1，否则为 0 */
    public int unmatchedQuoteCount() {
        return unmatchedQuotes;
    }

    public boolean hasTrailingSemicolon() {
        return trailingSemicolon;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Optional<Token> firstToken() {
        return tokens.isEmpty() ? Optional.empty() : Optional.of(tokens.get(0));
    }

    /**
     * 语句类型：首个 token 为关键字时返回其大写形式，否则为 UNKNOWN
     */
    public String statementType() {
        return firstToken()
                .filter(t -> t.type() == TokenType.KEYWORD)
                .map(Token::upper)
                .orElse("UNKNOWN");
    }

    public boolean startsWith(String keyword) {
        return firstToken().map(t -> t.isKeyword(keyword)).orElse(false);
    }

    /**
     * 从 from 开始查找指定深度上的关键字，找不到返回 -1
     */
    public int indexOfKeyword(String keyword, int from, int depth) {
        for (int i = Math.max(from, 0); i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.depth() == depth && t.isKeyword(keyword)) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasKeywordAtDepth(String keyword, int depth) {
        return indexOfKeyword(keyword, 0, depth) >= 0;
    }

    public boolean hasKeyword(String keyword) {
        return tokens.stream().anyMatch(t -> t.isKeyword(keyword));
    }

    /** 是否存在嵌套在括号内的 SELECT（子查询） */
    public boolean hasSubquery() {
        return tokens.stream().anyMatch(t -> t.depth() > 0 && t.isKeyword("SELECT"));
    }

    /**
     * 越界时返回 null，便于检查器向前/向后探查
     */
    public Token tokenAt(int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * 偏移是否落在字符串字面量内部：包含开引号和内容，不含闭引号
     */
    public boolean isInsideStringLiteral(int offset) {
        for (Token t : tokens) {
            if (t.offset() > offset) {
                return false;
            }
            if (t.type() != TokenType.STRING_LITERAL) {
                continue;
            }
            String text = t.text();
            boolean closed = text.length() >= 2 && text.charAt(text.length() - 1) == '\'';
            int end = t.offset() + (closed ? text.length() - 1 : text.length());
            if (offset < end) {
                return true;
            }
        }
        return false;
    }

    /**
     * 偏移所在行号，从 1 开始
     */
    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }
}
