package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.rule.InjectionSignatures;
import com.sqlvalidator.rule.InjectionSignatures.Signature;
import com.sqlvalidator.scanner.ScanContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * 检查 SQL 注入特征：恒真条件、堆叠语句、注释截断、UNION 拼接等
 */
@Component
@Order(200)
public class SqlInjectionChecker implements SqlChecker {

    private static final int MAX_MATCHED_TEXT = 60;

    @Override
    public String name() {
        return "SQL_INJECTION";
    }

    @Override
    public Category category() {
        return Category.SECURITY;
    }

    @Override
    public String description() {
        return "SQL 文本中不得出现常见注入特征";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        List<Finding> findings = new ArrayList<>();
        for (Signature signature : InjectionSignatures.ALL) {
            Matcher matcher = signature.pattern().matcher(sql);
            if (find(matcher, signature, context)) {
                findings.add(finding(Severity.ERROR, context, matcher.start())
                        .message("存在 SQL 注入风险：" + signature.name() + "（匹配内容: " + abbreviate(matcher.group()) + "）")
                        .suggestion("使用参数化查询绑定变量，禁止直接拼接外部输入")
                        .build());
            }
        }
        return findings;
    }

    /**
     * 查找第一个有效命中，跳过起点在字符串字面量内部的匹配
     */
    private boolean find(Matcher matcher, Signature signature, ScanContext context) {
        while (matcher.find()) {
            if (!signature.literalAware() || !context.isInsideStringLiteral(matcher.start())) {
                return true;
            }
        }
        return false;
    }

    private String abbreviate(String text) {
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() > MAX_MATCHED_TEXT ? oneLine.substring(0, MAX_MATCHED_TEXT) + "..." : oneLine;
    }
}
