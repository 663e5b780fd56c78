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
 * 检查顶层 SELECT 语句是否有 LIMIT 限制
 */
@Component
@Order(340)
public class RequireLimitChecker implements SqlChecker {

    @Override
    public String name() {
        return "MISSING_LIMIT";
    }

    @Override
    public Category category() {
        return Category.PERFORMANCE;
    }

    @Override
    public String description() {
        return "SELECT 查询建议添加 LIMIT 限制";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        if (!context.startsWith("SELECT") || !context.hasKeywordAtDepth("FROM", 0)) {
            return List.of();
        }
        // 跳过 count 查询与 SELECT ... INTO
        if (isCountQuery(context) || context.hasKeywordAtDepth("INTO", 0)) {
            return List.of();
        }
        if (context.hasKeywordAtDepth("LIMIT", 0) || context.hasKeywordAtDepth("FETCH", 0)
                || context.hasKeywordAtDepth("TOP", 0)) {
            return List.of();
        }
        return List.of(finding(Severity.INFO, context, context.tokens().get(0).offset())
                .message("SELECT 查询没有 LIMIT 限制，可能返回大量数据")
                .suggestion("为查询增加分页条件（如 LIMIT ? OFFSET ?），并搭配稳定排序")
                .build());
    }

    private boolean isCountQuery(ScanContext context) {
        Token fn = context.tokenAt(1);
        Token paren = context.tokenAt(2);
        return fn != null && paren != null && fn.isIdentifier()
                && "COUNT".equals(fn.upper()) && paren.isPunctuation('(');
    }
}
