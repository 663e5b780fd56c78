package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import com.sqlvalidator.scanner.TokenType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * LIKE 模式不应以 % 开头（导致全表扫描）
 */
@Component
@Order(310)
public class LikeLeadingWildcardChecker implements SqlChecker {

    @Override
    public String name() {
        return "LIKE_LEADING_WILDCARD";
    }

    @Override
    public Category category() {
        return Category.PERFORMANCE;
    }

    @Override
    public String description() {
        return "LIKE 模式的首字符不应是 %";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        List<Finding> findings = new ArrayList<>();
        List<Token> tokens = context.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.isKeyword("LIKE") && !t.isKeyword("ILIKE")) {
                continue;
            }
            Token pattern = patternLiteral(context, i + 1);
            if (pattern != null && pattern.text().startsWith("'%")) {
                findings.add(finding(Severity.WARNING, context, t.offset())
                        .message("LIKE 模式 " + pattern.text() + " 以 % 开头，无法利用索引，将导致全表扫描")
                        .suggestion("优先使用前缀匹配（如 'abc%'）；确需模糊搜索时考虑全文索引")
                        .build());
            }
        }
        return findings;
    }

    /**
     * LIKE 之后的字面量，兼容 CONCAT('%', ?) 写法
     */
    private Token patternLiteral(ScanContext context, int index) {
        Token next = context.tokenAt(index);
        if (next == null) {
            return null;
        }
        if (next.type() == TokenType.STRING_LITERAL) {
            return next;
        }
        Token paren = context.tokenAt(index + 1);
        Token first = context.tokenAt(index + 2);
        if (next.isIdentifier() && paren != null && paren.isPunctuation('(')
                && first != null && first.type() == TokenType.STRING_LITERAL) {
            return first;
        }
        return null;
    }
}
