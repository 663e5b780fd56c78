package com.sqlvalidator.rule.existence;

import java.util.List;

/**
 * 从语句中提取出的表/列引用
 *
 * @param tables  需要校验存在性的表引用（按出现顺序去重）
 * @param columns 所属表可以唯一确定的列引用
 */
public record StatementReferences(List<TableRef> tables, List<ColumnRef> columns) {

    public record TableRef(String name, int offset) {
    }

    /**
     * @param table 列所属表（书写形式，可带 schema 前缀）
     */
    public record ColumnRef(String table, String column, int offset) {
    }
}
