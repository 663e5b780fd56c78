package com.sqlvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SQL 脚本校验报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScriptValidationReport {

    /** 脚本名称 */
    private String scriptName;

    /** 校验时间 */
    private LocalDateTime validatedAt;

    /** 语句总数 */
    private int totalStatements;

    /** ERROR 级别发现数 */
    private int errorCount;

    /** WARNING 级别发现数 */
    private int warningCount;

    /** INFO 级别发现数 */
    private int infoCount;

    /** 所有语句均无 ERROR 时为 true */
    private boolean valid;

    /** 逐条语句的校验结果 */
    private List<StatementResult> statements;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatementResult {

        private SqlStatement statement;

        private ValidationResult result;
    }
}
