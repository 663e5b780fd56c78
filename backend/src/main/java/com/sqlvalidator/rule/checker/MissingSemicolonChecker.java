package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 检查语句是否以分号结尾
 */
@Component
@Order(120)
public class MissingSemicolonChecker implements SqlChecker {

    @Override
    public String name() {
        return "MISSING_SEMICOLON";
    }

    @Override
    public Category category() {
        return Category.SYNTAX;
    }

    @Override
    public String description() {
        return "语句建议以分号结尾";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        if (context.hasTrailingSemicolon()) {
            return List.of();
        }
        List<Token> tokens = context.tokens();
        int offset = tokens.isEmpty() ? sql.stripTrailing().length() : endOf(tokens.get(tokens.size() - 1));
        return List.of(finding(Severity.INFO, context, offset)
                .message("语句末尾缺少分号")
                .suggestion("在语句末尾补充 ';'，符合 SQL 标准写法")
                .build());
    }

    private int endOf(Token last) {
        return last.offset() + last.text().length();
    }
}
