package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import com.sqlvalidator.scanner.TokenType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 检查单引号字符串是否闭合（'' 视为转义）
 */
@Component
@Order(110)
public class UnbalancedQuotesChecker implements SqlChecker {

    @Override
    public String name() {
        return "UNBALANCED_QUOTES";
    }

    @Override
    public Category category() {
        return Category.SYNTAX;
    }

    @Override
    public String description() {
        return "字符串字面量必须闭合";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        if (context.unmatchedQuoteCount() == 0) {
            return List.of();
        }
        int offset = 0;
        List<Token> tokens = context.tokens();
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).type() == TokenType.STRING_LITERAL) {
                offset = tokens.get(i).offset();
                break;
            }
        }
        return List.of(finding(Severity.ERROR, context, offset)
                .message("单引号不匹配：字符串字面量未闭合")
                .suggestion("确认所有单引号都已闭合；字符串内部的单引号请写成两个单引号 ''")
                .build());
    }
}
