package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 检查括号是否配对（字符串字面量与注释中的括号不计）
 */
@Component
@Order(100)
public class UnbalancedParenthesesChecker implements SqlChecker {

    @Override
    public String name() {
        return "UNBALANCED_PARENTHESES";
    }

    @Override
    public Category category() {
        return Category.SYNTAX;
    }

    @Override
    public String description() {
        return "括号必须成对出现";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        if (context.unmatchedParenCount() == 0) {
            return List.of();
        }
        return List.of(finding(Severity.ERROR, context, firstUnmatchedOffset(context))
                .message(String.format("括号不匹配：%d 个 '(' 未闭合，%d 个 ')' 没有对应的 '('",
                        context.unclosedParens(), context.strayCloseParens()))
                .suggestion("检查每个左括号是否都有对应的右括号，尤其是子查询和函数调用")
                .build());
    }

    private int firstUnmatchedOffset(ScanContext context) {
        Deque<Integer> open = new ArrayDeque<>();
        for (Token t : context.tokens()) {
            if (t.isPunctuation('(')) {
                open.push(t.offset());
            } else if (t.isPunctuation(')')) {
                if (open.isEmpty()) {
                    return t.offset();
                }
                open.pop();
            }
        }
        return open.isEmpty() ? 0 : open.peekLast();
    }
}
