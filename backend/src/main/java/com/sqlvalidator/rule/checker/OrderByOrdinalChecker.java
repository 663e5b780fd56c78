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
import java.util.List;
import java.util.Set;

/**
 * ORDER BY 不应使用列序号（查询列调整后排序会悄悄改变）
 */
@Component
@Order(330)
public class OrderByOrdinalChecker implements SqlChecker {

    private static final Set<String> ITEM_SUFFIXES = Set.of("ASC", "DESC", "NULLS");

    @Override
    public String name() {
        return "ORDER_BY_ORDINAL";
    }

    @Override
    public Category category() {
        return Category.PERFORMANCE;
    }

    @Override
    public String description() {
        return "ORDER BY 应使用列名而不是列序号";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        List<Finding> findings = new ArrayList<>();
        List<Token> tokens = context.tokens();
        for (int i = 0; i + 1 < tokens.size(); i++) {
            if (!tokens.get(i).isKeyword("ORDER") || !tokens.get(i + 1).isKeyword("BY")) {
                continue;
            }
            int depth = tokens.get(i).depth();
            boolean itemStart = true;
            for (int j = i + 2; j < tokens.size(); j++) {
                Token t = tokens.get(j);
                if (t.depth() < depth || (t.depth() == depth && isClauseEnd(t))) {
                    break;
                }
                if (t.depth() == depth && t.isPunctuation(',')) {
                    itemStart = true;
                    continue;
                }
                if (itemStart && isOrdinal(context, j)) {
                    findings.add(finding(Severity.WARNING, context, t.offset())
                            .message("ORDER BY 使用了列序号 " + t.text() + "，查询列调整后排序含义会随之改变")
                            .suggestion("改为按列名或别名排序，例如 ORDER BY name")
                            .build());
                }
                itemStart = false;
            }
        }
        return findings;
    }

    private boolean isOrdinal(ScanContext context, int index) {
        Token t = context.tokenAt(index);
        if (t.type() != TokenType.NUMERIC_LITERAL || !t.text().chars().allMatch(Character::isDigit)) {
            return false;
        }
        Token next = context.tokenAt(index + 1);
        return next == null
                || next.depth() < t.depth()
                || next.isPunctuation(',')
                || next.isPunctuation(';')
                || next.isKeywordIn(ITEM_SUFFIXES)
                || next.isKeywordIn(SqlKeywords.CLAUSE_KEYWORDS);
    }

    private boolean isClauseEnd(Token t) {
        return t.isPunctuation(';') || t.isKeywordIn(SqlKeywords.CLAUSE_KEYWORDS);
    }
}
