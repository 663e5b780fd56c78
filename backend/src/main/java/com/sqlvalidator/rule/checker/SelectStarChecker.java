package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 检查是否使用了 SELECT *（基于 token，字符串中的 * 不计）
 */
@Component
@Order(300)
public class SelectStarChecker implements SqlChecker {

    @Override
    public String name() {
        return "SELECT_STAR";
    }

    @Override
    public Category category() {
        return Category.PERFORMANCE;
    }

    @Override
    public String description() {
        return "禁止使用 SELECT *，应明确列出需要的列";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        List<Finding> findings = new ArrayList<>();
        List<Token> tokens = context.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            if (!tokens.get(i).isKeyword("SELECT")) {
                continue;
            }
            int j = i + 1;
            while (j < tokens.size() && (tokens.get(j).isKeyword("DISTINCT") || tokens.get(j).isKeyword("ALL"))) {
                j++;
            }
            Token star = context.tokenAt(j);
            if (star != null && star.isOperator("*")) {
                findings.add(finding(Severity.WARNING, context, tokens.get(i).offset())
                        .message("使用了 SELECT *，会读取多余的列，表结构变更时也容易出错")
                        .suggestion("将 SELECT * 改为显式列名，例如 SELECT id, name FROM ...")
                        .build());
            }
        }
        return findings;
    }
}
