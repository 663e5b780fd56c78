package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 检查新定义的标识符是否符合 snake_case 命名
 * <p>
 * 覆盖 CREATE TABLE 表名与列定义、ADD COLUMN、RENAME ... TO、CREATE INDEX/VIEW 名称。
 */
@Component
@Order(400)
public class SnakeCaseNamingChecker implements SqlChecker {

    private static final Pattern SNAKE_CASE = Pattern.compile("[a-z0-9_]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9_]+");

    private static final Set<String> CREATE_MODIFIERS = Set.of("TEMP", "TEMPORARY", "UNIQUE", "OR", "REPLACE");
    private static final Set<String> IF_NOT_EXISTS = Set.of("IF", "NOT", "EXISTS");
    private static final Set<String> ADD_COLUMN_PREFIX = Set.of("COLUMN", "IF", "NOT", "EXISTS");

    @Override
    public String name() {
        return "NAMING_CONVENTION";
    }

    @Override
    public Category category() {
        return Category.NAMING;
    }

    @Override
    public String description() {
        return "表名、列名、索引名等应使用小写字母、数字与下划线（snake_case）";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        List<Token> defined = new ArrayList<>();
        List<Token> tokens = context.tokens();

        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isKeyword("CREATE")) {
                collectCreate(context, i + 1, defined);
            } else if (t.isKeyword("ADD")) {
                int j = skipKeywords(context, i + 1, ADD_COLUMN_PREFIX);
                collectName(context, j, defined);
            } else if (t.isKeyword("RENAME")) {
                int to = indexOfKeywordWithin(context, i + 1, "TO", 6);
                if (to > 0) {
                    collectName(context, to + 1, defined);
                }
            }
        }

        List<Finding> findings = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        for (Token token : defined) {
            String name = token.identifierName();
            if (SNAKE_CASE.matcher(name).matches() || !reported.add(name)) {
                continue;
            }
            String snake = toSnakeCase(name);
            findings.add(finding(Severity.INFO, context, token.offset())
                    .message("标识符 '" + name + "' 不符合 snake_case 命名规范")
                    .suggestion(snake.isEmpty()
                            ? "仅使用小写字母、数字和下划线命名"
                            : "建议改为 " + snake)
                    .build());
        }
        return findings;
    }

    static String toSnakeCase(String name) {
        String s = CAMEL_BOUNDARY.matcher(name).replaceAll("$1_$2");
        s = ACRONYM_BOUNDARY.matcher(s).replaceAll("$1_$2");
        s = INVALID_CHARS.matcher(s.toLowerCase(Locale.ROOT)).replaceAll("_");
        s = s.replaceAll("_+", "_");
        return s.replaceAll("^_|_$", "");
    }

    private void collectCreate(ScanContext context, int index, List<Token> defined) {
        int i = skipKeywords(context, index, CREATE_MODIFIERS);
        Token kind = context.tokenAt(i);
        if (kind == null) {
            return;
        }
        if (kind.isKeyword("TABLE")) {
            int nameStart = skipKeywords(context, i + 1, IF_NOT_EXISTS);
            int after = collectName(context, nameStart, defined);
            Token open = context.tokenAt(after);
            if (open != null && open.isPunctuation('(')) {
                collectColumnDefinitions(context, after, defined);
            }
        } else if (kind.isKeyword("INDEX") || kind.isKeyword("VIEW")) {
            int nameStart = skipKeywords(context, i + 1, IF_NOT_EXISTS);
            collectName(context, nameStart, defined);
        }
    }

    /**
     * 列定义：左括号后与每个同层逗号后的第一个标识符；CONSTRAINT 之后的约束名也一并检查
     */
    private void collectColumnDefinitions(ScanContext context, int openIndex, List<Token> defined) {
        int depth = context.tokenAt(openIndex).depth() + 1;
        boolean itemStart = true;
        for (int i = openIndex + 1; i < context.tokens().size(); i++) {
            Token t = context.tokenAt(i);
            if (t.depth() < depth) {
                return;
            }
            if (t.depth() != depth) {
                continue;
            }
            if (t.isPunctuation(',')) {
                itemStart = true;
                continue;
            }
            if (itemStart) {
                if (t.isIdentifier()) {
                    defined.add(t);
                } else if (t.isKeyword("CONSTRAINT")) {
                    collectName(context, i + 1, defined);
                }
            }
            itemStart = false;
        }
    }

    /**
     * 收集（可带 schema 前缀的）名称的各个部分，返回名称之后的位置
     */
    private int collectName(ScanContext context, int index, List<Token> defined) {
        int i = index;
        Token t = context.tokenAt(i);
        while (t != null && t.isIdentifier()) {
            defined.add(t);
            Token dot = context.tokenAt(i + 1);
            if (dot == null || !dot.isPunctuation('.')) {
                return i + 1;
            }
            i += 2;
            t = context.tokenAt(i);
        }
        return i;
    }

    private int skipKeywords(ScanContext context, int index, Set<String> keywords) {
        int i = index;
        while (context.tokenAt(i) != null && context.tokenAt(i).isKeywordIn(keywords)) {
            i++;
        }
        return i;
    }

    private int indexOfKeywordWithin(ScanContext context, int from, String keyword, int window) {
        for (int i = from; i < from + window && context.tokenAt(i) != null; i++) {
            if (context.tokenAt(i).isKeyword(keyword)) {
                return i;
            }
        }
        return -1;
    }
}
