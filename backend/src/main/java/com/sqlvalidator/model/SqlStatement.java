package com.sqlvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 从 SQL 脚本中拆分出的单条语句
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SqlStatement {

    /** 语句文本（保留结尾分号） */
    private String sqlText;

    /** 语句在脚本中的起始行号 */
    private int lineNumber;

    /** 语句类型: SELECT, INSERT, UPDATE, DELETE ... */
    private String statementType;
}
