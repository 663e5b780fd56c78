package com.sqlvalidator.scanner;

import java.util.Set;

/**
 * 扫描器识别为关键字的单词表（大写）
 * <p>
 * 表/列存在性检查依赖这张表区分关键字与列名，漏掉的关键字会被当成列名查询。
 */
public final class SqlKeywords {

    public static final Set<String> KEYWORDS = Set.of(
            "ADD", "ALL", "ALTER", "AND", "ANY", "AS", "ASC", "BEGIN", "BETWEEN", "BOTH", "BY",
            "CASCADE", "CASE", "CAST", "CHECK", "COLLATE", "COLUMN", "COMMIT", "CONSTRAINT",
            "CREATE", "CROSS", "CURRENT", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP",
            "CURRENT_USER", "DEFAULT", "DELETE", "DESC", "DISTINCT", "DROP", "ELSE", "END",
            "ESCAPE", "EXCEPT", "EXEC", "EXECUTE", "EXISTS", "EXPLAIN", "EXTRACT", "FALSE",
            "FETCH", "FIRST", "FOR", "FOREIGN", "FROM", "FULL", "GRANT", "GROUP", "HAVING", "IF",
            "ILIKE", "IN", "INDEX", "INNER", "INSERT", "INTERSECT", "INTERVAL", "INTO", "IS",
            "JOIN", "KEY", "LAST", "LATERAL", "LEADING", "LEFT", "LIKE", "LIMIT", "LOCALTIME",
            "LOCALTIMESTAMP", "LOCK", "MERGE", "NATURAL", "NEXT", "NOT", "NULL", "NULLS", "OF",
            "OFFSET", "ON", "ONLY", "OR", "ORDER", "OUTER", "OVER", "PARTITION", "PRIMARY",
            "RECURSIVE", "REFERENCES", "RENAME", "REPLACE", "RESTRICT", "RETURNING", "REVOKE",
            "RIGHT", "ROLLBACK", "ROW", "ROWS", "SELECT", "SESSION_USER", "SET", "SIMILAR",
            "SOME", "TABLE", "TEMP", "TEMPORARY", "THEN", "TIES", "TO", "TOP", "TRAILING",
            "TRUE", "TRUNCATE", "UNION", "UNIQUE", "UNKNOWN", "UPDATE", "USING", "VALUES",
            "VIEW", "WHEN", "WHERE", "WINDOW", "WITH");

    /** 子句起始关键字，用于界定 WHERE/ORDER BY 等区段的结束 */
    public static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET", "FETCH",
            "UNION", "INTERSECT", "EXCEPT", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS",
            "NATURAL", "ON", "USING", "SET", "VALUES", "RETURNING", "WINDOW", "FOR", "INTO");

    private SqlKeywords() {
    }

    public static boolean isKeyword(String upperWord) {
        return KEYWORDS.contains(upperWord);
    }
}
