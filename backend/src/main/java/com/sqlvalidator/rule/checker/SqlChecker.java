package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;

import java.util.List;

/**
 * SQL 规则检查器接口
 * <p>
 * 每个实现都是纯函数：只读取扫描结果与原始文本，不依赖其他检查器，也不持有可变状态。
 */
public interface SqlChecker {

    /**
     * 检查器名称，同时作为 Finding.ruleId
     */
    String name();

    /**
     * 所属检查器族
     */
    Category category();

    /**
     * 检查内容说明
     */
    String description();

    /**
     * 检查 SQL，返回零到多条发现；通过时返回空列表
     */
    List<Finding> check(ScanContext context, String sql);

    /**
     * 预填名称、分类、等级与位置的 Finding 构建器
     */
    default Finding.FindingBuilder finding(Severity severity, ScanContext context, int offset) {
        return Finding.builder()
                .ruleId(name())
                .category(category())
                .severity(severity)
                .location(offset)
                .line(context.lineOf(offset));
    }
}
