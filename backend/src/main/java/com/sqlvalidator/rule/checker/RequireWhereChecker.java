package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 检查 UPDATE/DELETE 语句是否有 WHERE 子句
 */
@Component
@Order(350)
public class RequireWhereChecker implements SqlChecker {

    @Override
    public String name() {
        return "MISSING_WHERE";
    }

    @Override
    public Category category() {
        return Category.PERFORMANCE;
    }

    @Override
    public String description() {
        return "UPDATE/DELETE 语句必须包含 WHERE 子句";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        String type = context.statementType();
        if (!"UPDATE".equals(type) && !"DELETE".equals(type)) {
            return List.of();
        }
        if (context.hasKeywordAtDepth("WHERE", 0)) {
            return List.of();
        }
        String suggestion = "DELETE".equals(type)
                ? "补充 WHERE 条件限定删除范围；若确实要清空整表，改用 TRUNCATE TABLE"
                : "补充 WHERE 条件限定更新范围，执行前先用 SELECT 确认影响行数";
        return List.of(finding(Severity.WARNING, context, context.tokens().get(0).offset())
                .message(type + " 语句缺少 WHERE 子句，将作用于全表")
                .suggestion(suggestion)
                .build());
    }
}
