package com.sqlvalidator.model;

import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单条 SQL 的校验结果
 */
@Value
@Builder
@Jacksonized
public class ValidationResult {

    /** 不存在 ERROR 级别发现时为 true */
    boolean valid;

    /** 全部发现，按检查器族的固定顺序排列 */
    List<Finding> findings;

    int errorCount;

    int warningCount;

    int infoCount;

    /**
     * 根据发现列表构建结果，计数与有效性在此一次性算好
     */
    public static ValidationResult of(List<Finding> findings) {
        List<Finding> copy = List.copyOf(findings);
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Finding finding : copy) {
            counts.merge(finding.getSeverity(), 1, Integer::sum);
        }
        int errors = counts.getOrDefault(Severity.ERROR, 0);
        return ValidationResult.builder()
                .valid(errors == 0)
                .findings(copy)
                .errorCount(errors)
                .warningCount(counts.getOrDefault(Severity.WARNING, 0))
                .infoCount(counts.getOrDefault(Severity.INFO, 0))
                .build();
    }

    /**
     * 按分类分组（分类按枚举顺序，组内保持原有顺序）
     */
    public Map<Category, List<Finding>> findingsByCategory() {
        Map<Category, List<Finding>> grouped = new EnumMap<>(Category.class);
        for (Finding finding : findings) {
            grouped.computeIfAbsent(finding.getCategory(), k -> new ArrayList<>()).add(finding);
        }
        return new LinkedHashMap<>(grouped);
    }

    public List<Finding> findingsWithSeverity(Severity severity) {
        return findings.stream()
                .filter(f -> f.getSeverity() == severity)
                .toList();
    }

    public List<Finding> findingsOfRule(String ruleId) {
        return findings.stream()
                .filter(f -> ruleId.equals(f.getRuleId()))
                .toList();
    }

    public int totalCount() {
        return findings.size();
    }
}
