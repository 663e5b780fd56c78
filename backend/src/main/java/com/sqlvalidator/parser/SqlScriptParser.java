package com.sqlvalidator.parser;

import com.sqlvalidator.model.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL 脚本拆分器
 * <p>
 * 将多语句脚本按分号拆分为独立语句，字符串与注释中的分号不作为分隔符。
 * 每条语句保留结尾分号与其中的注释，便于逐条校验时的定位与分号检查。
 */
@Component
public class SqlScriptParser {

    private static final Logger log = LoggerFactory.getLogger(SqlScriptParser.class);

    private static final Pattern STATEMENT_TYPE_PATTERN = Pattern.compile(
            "^\\s*(SELECT|INSERT|UPDATE|DELETE|CREATE|ALTER|DROP|TRUNCATE|MERGE|REPLACE|WITH|GRANT|REVOKE)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_COMMENTS = Pattern.compile("^(\\s*(--[^\\n]*(\\n|$)|/\\*.*?\\*/))*\\s*",
            Pattern.DOTALL);

    /**
     * 拆分 SQL 脚本
     *
     * @param script     完整脚本内容，可为空
     * @param scriptName 脚本名称（仅用于日志）
     * @return 按出现顺序排列的语句
     */
    public List<SqlStatement> parse(String script, String scriptName) {
        List<SqlStatement> statements = new ArrayList<>();
        if (script == null || script.isBlank()) {
            return statements;
        }
        for (StatementEntry entry : splitStatements(script)) {
            statements.add(SqlStatement.builder()
                    .sqlText(entry.sql())
                    .lineNumber(entry.line())
                    .statementType(detectStatementType(entry.sql()))
                    .build());
        }
        log.info("从 {} 中解析出 {} 条 SQL 语句", scriptName, statements.size());
        return statements;
    }

    /**
     * 按分号拆分，正确处理注释、字符串与带引号标识符中的分号
     */
    private List<StatementEntry> splitStatements(String content) {
        List<StatementEntry> result = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        int lineNumber = 1;
        int stmtStartLine = 1;
        boolean hasCode = false;
        boolean inLineComment = false;
        boolean inBlockComment = false;
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            char next = (i + 1 < content.length()) ? content.charAt(i + 1) : 0;

            if (inLineComment) {
                sb.append(c);
                if (c == '\n') {
                    lineNumber++;
                    inLineComment = false;
                }
                continue;
            }
            if (inBlockComment) {
                sb.append(c);
                if (c == '\n') {
                    lineNumber++;
                } else if (c == '*' && next == '/') {
                    sb.append(next);
                    i++;
                    inBlockComment = false;
                }
                continue;
            }
            if (c == '\n') {
                lineNumber++;
            }

            if (!inSingleQuote && !inDoubleQuote) {
                if (c == '-' && next == '-') {
                    inLineComment = true;
                    sb.append(c);
                    continue;
                }
                if (c == '/' && next == '*') {
                    inBlockComment = true;
                    sb.append(c).append(next);
                    i++;
                    continue;
                }
                if (c == ';') {
                    sb.append(c);
                    if (hasCode) {
                        result.add(new StatementEntry(sb.toString().trim(), stmtStartLine));
                    }
                    sb.setLength(0);
                    hasCode = false;
                    continue;
                }
            }

            // '' 转义会连续翻转两次，状态保持不变
            if (!inDoubleQuote && c == '\'') {
                inSingleQuote = !inSingleQuote;
            } else if (!inSingleQuote && c == '"') {
                inDoubleQuote = !inDoubleQuote;
            }

            if (!hasCode && !Character.isWhitespace(c)) {
                hasCode = true;
                stmtStartLine = lineNumber;
            }
            sb.append(c);
        }

        // 最后一条没有分号的语句
        if (hasCode) {
            result.add(new StatementEntry(sb.toString().trim(), stmtStartLine));
        }
        return result;
    }

    private String detectStatementType(String sql) {
        Matcher comments = LEADING_COMMENTS.matcher(sql);
        String body = comments.lookingAt() ? sql.substring(comments.end()) : sql;
        Matcher matcher = STATEMENT_TYPE_PATTERN.matcher(body);
        if (matcher.find()) {
            return matcher.group(1).toUpperCase(Locale.ROOT);
        }
        return "UNKNOWN";
    }

    private record StatementEntry(String sql, int line) {
    }
}
