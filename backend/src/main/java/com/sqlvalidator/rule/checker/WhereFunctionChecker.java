package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.SqlKeywords;
import com.sqlvalidator.scanner.Token;
import com.sqlvalidator.scanner.TokenType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 不建议 WHERE/ON 条件中对列使用函数后再比较（导致索引失效）
 * <p>
 * 形如 {@code LOWER(name) = 'x'}、{@code DATE(created_at) >= ...}。
 */
@Component
@Order(320)
public class WhereFunctionChecker implements SqlChecker {

    private static final Set<String> COMPARISONS = Set.of("=", "<", ">", "<=", ">=", "<>", "!=");

    private static final Set<String> FUNCTION_KEYWORDS = Set.of("LEFT", "RIGHT", "CAST", "EXTRACT", "REPLACE");

    private static final Set<String> AGGREGATES = Set.of("COUNT", "SUM", "AVG", "MIN", "MAX");

    @Override
    public String name() {
        return "WHERE_FUNCTION";
    }

    @Override
    public Category category() {
        return Category.PERFORMANCE;
    }

    @Override
    public String description() {
        return "WHERE/ON 条件左侧的列不应包裹函数";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        List<Finding> findings = new ArrayList<>();
        List<Token> tokens = context.tokens();
        Map<Integer, Boolean> inPredicate = new HashMap<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            int depth = t.depth();

            if (t.isPunctuation('(')) {
                inPredicate.put(depth + 1, inPredicate.getOrDefault(depth, false));
                continue;
            }
            if (t.isKeyword("WHERE") || t.isKeyword("ON")) {
                inPredicate.put(depth, true);
                continue;
            }
            if (t.isKeywordIn(SqlKeywords.CLAUSE_KEYWORDS) && !isCall(context, i)) {
                inPredicate.put(depth, false);
                continue;
            }
            if (!inPredicate.getOrDefault(depth, false) || !isFunctionName(t)) {
                continue;
            }
            Token open = context.tokenAt(i + 1);
            if (open == null || !open.isPunctuation('(') || !startsWithColumn(context, i + 2)) {
                continue;
            }
            int close = matchingClose(context, i + 1);
            Token op = context.tokenAt(close + 1);
            if (close > 0 && op != null && op.type() == TokenType.OPERATOR && COMPARISONS.contains(op.text())) {
                findings.add(finding(Severity.WARNING, context, t.offset())
                        .message("条件中对列使用了函数 " + t.text() + "(...) 后再比较，可能导致索引失效")
                        .suggestion("把函数移到常量一侧，或为该表达式建立函数索引")
                        .build());
            }
        }
        return findings;
    }

    /** LEFT(...) / RIGHT(...) 是函数调用而不是 JOIN */
    private boolean isCall(ScanContext context, int index) {
        Token next = context.tokenAt(index + 1);
        return next != null && next.isPunctuation('(');
    }

    private boolean isFunctionName(Token t) {
        if (t.type() == TokenType.IDENTIFIER) {
            return !t.isQuotedIdentifier() && !AGGREGATES.contains(t.upper());
        }
        return t.isKeywordIn(FUNCTION_KEYWORDS);
    }

    /**
     * 第一个参数是否为（可带限定符的）列引用
     */
    private boolean startsWithColumn(ScanContext context, int index) {
        int i = index;
        Token t = context.tokenAt(i);
        if (t == null || !t.isIdentifier()) {
            return false;
        }
        while (true) {
            Token next = context.tokenAt(i + 1);
            if (next == null) {
                return false;
            }
            if (next.isPunctuation('.')) {
                Token part = context.tokenAt(i + 2);
                if (part == null || !part.isIdentifier()) {
                    return false;
                }
                i += 2;
                continue;
            }
            return next.isPunctuation(')') || next.isPunctuation(',') || next.type() == TokenType.KEYWORD;
        }
    }

    private int matchingClose(ScanContext context, int openIndex) {
        int depth = context.tokenAt(openIndex).depth();
        List<Token> tokens = context.tokens();
        for (int i = openIndex + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isPunctuation(')') && t.depth() == depth) {
                return i;
            }
        }
        return -1;
    }
}
