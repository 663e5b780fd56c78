package com.sqlvalidator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单条校验发现
 * <p>
 * 分类与严重等级由产生它的检查器在创建时确定，汇总阶段不会再改写。
 */
@Value
@Builder
@Jacksonized
public class Finding {

    /** 产生该发现的检查器名称（如 SELECT_STAR） */
    String ruleId;

    /** 发现分类 */
    Category category;

    /** 严重等级 */
    Severity severity;

    /** 问题描述 */
    String message;

    /** 修复建议，可为空 */
    String suggestion;

    /** 在原始 SQL 中的字符偏移（尽力而为，可为空） */
    Integer location;

    /** 所在行号，从 1 开始（可为空） */
    Integer line;

    public enum Category {
        SYNTAX("语法"),
        SECURITY("安全"),
        PERFORMANCE("性能"),
        NAMING("命名"),
        EXISTENCE("存在性");

        private final String label;

        Category(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /**
     * 严重等级，声明顺序即严重程度：ERROR > WARNING > INFO
     */
    public enum Severity {
        ERROR("✗"),
        WARNING("⚠"),
        INFO("ℹ");

        private final String symbol;

        Severity(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isMoreSevereThan(Severity other) {
            return this.ordinal() < other.ordinal();
        }
    }
}
