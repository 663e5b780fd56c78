package com.sqlvalidator.scanner;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * SQL 文本扫描器
 * <p>
 * 单遍扫描原始字符，统计括号与单引号的平衡状态，判断结尾分号，并切分出粗粒度 token。
 * 这不是完整的词法分析器：无法识别的片段按不透明标识符处理，任何输入都不会抛出异常。
 */
@Component
public class SqlScanner {

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
            "<=", ">=", "<>", "!=", "||", "::", "->", "<<", ">>", "=>", "!~", "~*", "@>", "<@");

    private static final String OPERATOR_CHARS = "=<>!+-*/%|&^~:?@#";

    private static final String PUNCTUATION_CHARS = ",;.[]{}";

    public ScanContext scan(String sql) {
        String text = sql == null ? "" : sql;
        int n = text.length();

        List<Token> tokens = new ArrayList<>();
        List<Integer> lineStarts = new ArrayList<>();
        lineStarts.add(0);

        int depth = 0;
        int strayClose = 0;
        int unmatchedQuotes = 0;

        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : 0;

            if (c == '\n') {
                lineStarts.add(i + 1);
                i++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            // 单引号字符串，'' 为转义
            if (c == '\'') {
                int j = i + 1;
                boolean closed = false;
                while (j < n) {
                    char ch = text.charAt(j);
                    if (ch == '\n') {
                        lineStarts.add(j + 1);
                    }
                    if (ch == '\'') {
                        if (j + 1 < n && text.charAt(j + 1) == '\'') {
                            j += 2;
                            continue;
                        }
                        j++;
                        closed = true;
                        break;
                    }
                    j++;
                }
                if (!closed) {
                    unmatchedQuotes = 1;
                }
                tokens.add(new Token(TokenType.STRING_LITERAL, text.substring(i, j), i, depth));
                i = j;
                continue;
            }

            // 行注释
            if (c == '-' && next == '-') {
                while (i < n && text.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }

            // 块注释，未闭合时吞掉剩余文本
            if (c == '/' && next == '*') {
                int j = i + 2;
                while (j < n && !(text.charAt(j) == '*' && j + 1 < n && text.charAt(j + 1) == '/')) {
                    if (text.charAt(j) == '\n') {
                        lineStarts.add(j + 1);
                    }
                    j++;
                }
                i = Math.min(j + 2, n);
                continue;
            }

            if (c == '(') {
                tokens.add(new Token(TokenType.PUNCTUATION, "(", i, depth));
                depth++;
                i++;
                continue;
            }
            if (c == ')') {
                if (depth > 0) {
                    depth--;
                } else {
                    strayClose++;
                }
                tokens.add(new Token(TokenType.PUNCTUATION, ")", i, depth));
                i++;
                continue;
            }

            // 带引号的标识符
            if (c == '"' || c == '`') {
                int end = text.indexOf(c, i + 1);
                int j = end < 0 ? n : end + 1;
                tokens.add(new Token(TokenType.IDENTIFIER, text.substring(i, j), i, depth));
                i = j;
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && Character.isDigit(next))) {
                int j = scanNumber(text, i);
                tokens.add(new Token(TokenType.NUMERIC_LITERAL, text.substring(i, j), i, depth));
                i = j;
                continue;
            }

            if (PUNCTUATION_CHARS.indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.PUNCTUATION, String.valueOf(c), i, depth));
                i++;
                continue;
            }

            if (OPERATOR_CHARS.indexOf(c) >= 0) {
                String two = i + 1 < n ? text.substring(i, i + 2) : "";
                String op = TWO_CHAR_OPERATORS.contains(two) ? two : String.valueOf(c);
                tokens.add(new Token(TokenType.OPERATOR, op, i, depth));
                i += op.length();
                continue;
            }

            if (isWordStart(c)) {
                int j = i + 1;
                while (j < n && isWordPart(text.charAt(j))) {
                    j++;
                }
                String word = text.substring(i, j);
                TokenType type = SqlKeywords.isKeyword(word.toUpperCase(Locale.ROOT))
                        ? TokenType.KEYWORD
                        : TokenType.IDENTIFIER;
                tokens.add(new Token(type, word, i, depth));
                i = j;
                continue;
            }

            // 无法识别的片段：读到下一个空白或已知边界为止，按不透明标识符处理
            int j = i + 1;
            while (j < n && !isBoundary(text.charAt(j))) {
                j++;
            }
            tokens.add(new Token(TokenType.IDENTIFIER, text.substring(i, j), i, depth));
            i = j;
        }

        int[] starts = lineStarts.stream().mapToInt(Integer::intValue).toArray();
        // 注释不产生 token，结尾注释不影响分号判断
        boolean trailingSemicolon = !tokens.isEmpty() && tokens.get(tokens.size() - 1).isPunctuation(';');
        return new ScanContext(depth, strayClose, unmatchedQuotes, trailingSemicolon, tokens, starts);
    }

    private int scanNumber(String text, int start) {
        int n = text.length();
        int j = start;
        while (j < n && Character.isDigit(text.charAt(j))) {
            j++;
        }
        if (j < n && text.charAt(j) == '.' && j + 1 < n && Character.isDigit(text.charAt(j + 1))) {
            j++;
            while (j < n && Character.isDigit(text.charAt(j))) {
                j++;
            }
        }
        if (j + 1 < n && (text.charAt(j) == 'e' || text.charAt(j) == 'E')) {
            int k = j + 1;
            if (text.charAt(k) == '+' || text.charAt(k) == '-') {
                k++;
            }
            if (k < n && Character.isDigit(text.charAt(k))) {
                j = k;
                while (j < n && Character.isDigit(text.charAt(j))) {
                    j++;
                }
            }
        }
        return j;
    }

    private boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private boolean isBoundary(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '\'' || c == '"' || c == '`'
                || PUNCTUATION_CHARS.indexOf(c) >= 0 || OPERATOR_CHARS.indexOf(c) >= 0;
    }
}
