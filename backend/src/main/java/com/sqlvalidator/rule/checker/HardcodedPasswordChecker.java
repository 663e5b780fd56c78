package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 检查密码列是否与字符串常量直接比较（硬编码凭据）
 */
@Component
@Order(210)
public class HardcodedPasswordChecker implements SqlChecker {

    private static final Pattern PASSWORD_LITERAL = Pattern.compile(
            "[\"`]?\\b(password|passwd|pwd)\\b[\"`]?\\s*=\\s*'[^']*'",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "HARDCODED_PASSWORD";
    }

    @Override
    public Category category() {
        return Category.SECURITY;
    }

    @Override
    public String description() {
        return "不得在 SQL 中硬编码密码";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        Matcher matcher = PASSWORD_LITERAL.matcher(sql);
        if (!matcher.find()) {
            return List.of();
        }
        return List.of(finding(Severity.WARNING, context, matcher.start())
                .message("疑似硬编码密码：列 '" + matcher.group(1) + "' 与字符串常量直接比较")
                .suggestion("敏感数据请通过参数绑定传入，并只比较哈希值")
                .build());
    }
}
