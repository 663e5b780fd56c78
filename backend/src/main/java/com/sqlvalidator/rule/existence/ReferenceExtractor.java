package com.sqlvalidator.rule.existence;

import com.sqlvalidator.rule.existence.StatementReferences.ColumnRef;
import com.sqlvalidator.rule.existence.StatementReferences.TableRef;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import com.sqlvalidator.scanner.TokenType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 基于 token 序列提取表与列引用
 * <p>
 * 表来自 FROM/JOIN/INTO/UPDATE/DROP|ALTER|TRUNCATE TABLE/REFERENCES；CREATE TABLE 的目标表是新建对象，不做校验。
 * 列来自 SELECT 列表与 WHERE/ON/GROUP BY/ORDER BY 子句，以及 INSERT 列清单和 UPDATE SET 目标列。
 * 无限定符的列只有在语句只涉及一张表、且没有子查询/派生表/CTE/集合运算时才归属到该表；
 * 带限定符的列按别名解析，解析不了就跳过。宁可漏检，不可误报。
 */
public class ReferenceExtractor {

    private static final Set<String> COLUMN_REGION_START = Set.of("SELECT", "WHERE", "ON", "BY");

    private static final Set<String> COLUMN_REGION_END = Set.of(
            "FROM", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL", "LIMIT", "OFFSET", "FETCH",
            "UNION", "INTERSECT", "EXCEPT", "VALUES", "RETURNING", "INTO", "USING", "HAVING", "WINDOW", "FOR",
            "SET", "TABLE");

    private static final Set<String> SELECT_LIST_END = Set.of("WHERE", "GROUP", "ORDER");

    private static final Set<String> SET_OPERATORS = Set.of("UNION", "INTERSECT", "EXCEPT");

    private static final Set<String> PSEUDO_COLUMNS = Set.of(
            "SYSDATE", "SYSTIMESTAMP", "ROWNUM", "ROWID", "LEVEL", "USER", "CURRENT_SCHEMA",
            "YEAR", "MONTH", "DAY", "HOUR", "MINUTE", "SECOND", "EPOCH", "DOW", "DOY", "WEEK", "QUARTER");

    private static final Set<String> CREATE_MODIFIERS = Set.of("TEMP", "TEMPORARY", "GLOBAL", "LOCAL", "UNLOGGED");

    public StatementReferences extract(ScanContext context) {
        return new Extraction(context).run();
    }

    private static final class Extraction {

        private final ScanContext ctx;
        private final List<Token> tokens;
        private final boolean[] consumed;

        private final Map<String, TableRef> checkedTables = new LinkedHashMap<>();
        private final Set<String> sourceTables = new LinkedHashSet<>();
        private final Set<String> cteNames = new HashSet<>();
        private final Map<String, String> aliases = new HashMap<>();
        private final Set<String> opaqueQualifiers = new HashSet<>();
        private final Set<String> selectAliases = new HashSet<>();
        private final List<ColumnRef> columns = new ArrayList<>();
        private boolean opaqueSources;

        Extraction(ScanContext ctx) {
            this.ctx = ctx;
            this.tokens = ctx.tokens();
            this.consumed = new boolean[tokens.size()];
        }

        StatementReferences run() {
            collectCtes();
            collectTables();
            collectSelectAliases();
            collectColumns();
            return new StatementReferences(List.copyOf(checkedTables.values()), List.copyOf(columns));
        }

        // ---------- CTE ----------

        private void collectCtes() {
            if (!ctx.startsWith("WITH")) {
                return;
            }
            boolean expectName = true;
            for (int i = 1; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.depth() != 0) {
                    continue;
                }
                if (t.isKeyword("SELECT") || t.isKeyword("INSERT") || t.isKeyword("UPDATE")
                        || t.isKeyword("DELETE") || t.isKeyword("MERGE")) {
                    return;
                }
                if (t.isPunctuation(',')) {
                    expectName = true;
                } else if (expectName && t.isIdentifier()) {
                    cteNames.add(lower(t.identifierName()));
                    expectName = false;
                }
            }
        }

        // ---------- 表 ----------

        private void collectTables() {
            scanTables(0, tokens.size());
        }

        /**
         * 扫描 [from, to) 区间内的表引用，派生表内部递归进入
         */
        private void scanTables(int from, int to) {
            Map<Integer, Boolean> queryOpen = new HashMap<>();
            for (int i = from; i < to; i++) {
                Token t = tokens.get(i);
                int depth = t.depth();
                Token prev = ctx.tokenAt(i - 1);

                if (t.isPunctuation('(')) {
                    queryOpen.put(depth + 1, false);
                } else if (t.isKeyword("SELECT") || t.isKeyword("DELETE")) {
                    queryOpen.put(depth, true);
                } else if (t.isKeyword("FROM") && queryOpen.getOrDefault(depth, false)) {
                    i = parseTableList(i + 1) - 1;
                } else if (t.isKeyword("JOIN")) {
                    i = parseTableRef(i + 1, true) - 1;
                } else if (t.isKeyword("INTO") && prev != null && (prev.isKeyword("INSERT") || prev.isKeyword("MERGE"))) {
                    i = parseInsertTarget(i + 1) - 1;
                } else if (t.isKeyword("UPDATE") && (prev == null || prev.isPunctuation(')'))) {
                    queryOpen.put(depth, true);
                    i = parseUpdateTarget(i + 1) - 1;
                } else if (t.isKeyword("TABLE")) {
                    i = parseTableStatementTarget(i) - 1;
                } else if (t.isKeyword("TRUNCATE")) {
                    Token next = ctx.tokenAt(i + 1);
                    if (next != null && next.isIdentifier()) {
                        i = parseTableRef(i + 1, true) - 1;
                    }
                } else if (t.isKeyword("REFERENCES")) {
                    int after = parseTableRef(i + 1, true);
                    collectColumnList(after, lastCheckedTable());
                    i = after - 1;
                } else if (t.isKeyword("INDEX") && isCreateIndex(i)) {
                    int on = ctx.indexOfKeyword("ON", i, depth);
                    if (on > 0) {
                        int after = parseTableRef(on + 1, true);
                        collectColumnList(after, lastCheckedTable());
                        i = after - 1;
                    }
                }
            }
        }

        private int parseTableList(int index) {
            int i = parseTableRef(index, true);
            while (ctx.tokenAt(i) != null && ctx.tokenAt(i).isPunctuation(',')) {
                i = parseTableRef(i + 1, true);
            }
            return i;
        }

        private int parseInsertTarget(int index) {
            int after = parseTableRef(index, true);
            Token open = ctx.tokenAt(after);
            Token first = ctx.tokenAt(after + 1);
            if (open != null && open.isPunctuation('(') && first != null && !first.isKeyword("SELECT")) {
                return collectColumnList(after, lastCheckedTable());
            }
            return after;
        }

        private int parseUpdateTarget(int index) {
            int after = parseTableRef(index, true);
            String target = lastCheckedTable();
            int set = ctx.indexOfKeyword("SET", after, 0);
            if (set < 0 || target == null) {
                return after;
            }
            boolean itemStart = true;
            for (int i = set + 1; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.depth() == 0 && (t.isKeyword("WHERE") || t.isKeyword("FROM") || t.isKeyword("RETURNING"))) {
                    break;
                }
                if (t.depth() != 0) {
                    continue;
                }
                if (t.isPunctuation(',')) {
                    itemStart = true;
                    continue;
                }
                if (itemStart && t.isIdentifier()) {
                    int last = i;
                    while (isDot(i + 1) && isIdentifier(i + 2)) {
                        i += 2;
                        last = i;
                    }
                    Token column = tokens.get(last);
                    addColumn(target, column);
                    for (int k = set + 1; k <= last; k++) {
                        consumed[k] = true;
                    }
                }
                itemStart = false;
            }
            return after;
        }

        /**
         * CREATE/DROP/ALTER TABLE：新建目标不校验，带 IF EXISTS 的删除也不校验
         */
        private int parseTableStatementTarget(int tableIndex) {
            int k = tableIndex - 1;
            while (ctx.tokenAt(k) != null && CREATE_MODIFIERS.contains(ctx.tokenAt(k).upper())) {
                k--;
            }
            Token verb = ctx.tokenAt(k);
            if (verb == null) {
                return tableIndex + 1;
            }
            if (verb.isKeyword("CREATE")) {
                int nameIndex = skipIfExists(tableIndex + 1);
                return parseTableRef(nameIndex, false);
            }
            if (verb.isKeyword("DROP") || verb.isKeyword("ALTER") || verb.isKeyword("TRUNCATE")
                    || verb.isKeyword("LOCK")) {
                Token next = ctx.tokenAt(tableIndex + 1);
                if (next != null && next.isKeyword("IF")) {
                    return skipIfExists(tableIndex + 1);
                }
                int after = parseTableRef(tableIndex + 1, true);
                if (verb.isKeyword("DROP")) {
                    while (ctx.tokenAt(after) != null && ctx.tokenAt(after).isPunctuation(',')) {
                        after = parseTableRef(after + 1, true);
                    }
                }
                return after;
            }
            return tableIndex + 1;
        }

        /**
         * 解析单个表引用（含别名），返回其后的位置
         */
        private int parseTableRef(int index, boolean checked) {
            int i = index;
            while (ctx.tokenAt(i) != null && (ctx.tokenAt(i).isKeyword("ONLY") || ctx.tokenAt(i).isKeyword("LATERAL"))) {
                i++;
            }
            Token t = ctx.tokenAt(i);
            if (t == null) {
                return i;
            }
            if (t.isPunctuation('(')) {
                opaqueSources = true;
                int close = matchingClose(i);
                scanTables(i + 1, close);
                return parseAlias(close + 1, null);
            }
            if (!t.isIdentifier()) {
                return i;
            }
            List<Token> parts = new ArrayList<>();
            parts.add(t);
            consumed[i] = true;
            while (isDot(i + 1) && isIdentifier(i + 2)) {
                consumed[i + 1] = true;
                consumed[i + 2] = true;
                i += 2;
                parts.add(tokens.get(i));
            }
            Token next = ctx.tokenAt(i + 1);
            if (next != null && next.isPunctuation('(') && checked && !isDdlColumnList(index)) {
                // 表函数
                opaqueSources = true;
                return parseAlias(matchingClose(i + 1) + 1, null);
            }

            String name = joinParts(parts);
            String lastPart = lower(parts.get(parts.size() - 1).identifierName());
            if (parts.size() == 1 && cteNames.contains(lastPart)) {
                opaqueSources = true;
                opaqueQualifiers.add(lastPart);
                return parseAlias(i + 1, null);
            }
            if (checked) {
                checkedTables.putIfAbsent(lower(name), new TableRef(name, t.offset()));
                sourceTables.add(lower(name));
                registerAlias(lastPart, name);
                registerAlias(lower(name), name);
            }
            return parseAlias(i + 1, checked ? name : null);
        }

        /**
         * @param table 别名指向的表；为空表示别名指向无法解析的数据源
         */
        private int parseAlias(int index, String table) {
            Token t = ctx.tokenAt(index);
            int aliasIndex = -1;
            if (t != null && t.isKeyword("AS") && isIdentifier(index + 1)) {
                aliasIndex = index + 1;
            } else if (t != null && t.isIdentifier()) {
                aliasIndex = index;
            }
            if (aliasIndex < 0) {
                return index;
            }
            consumed[aliasIndex] = true;
            String alias = lower(tokens.get(aliasIndex).identifierName());
            if (table == null) {
                opaqueQualifiers.add(alias);
            } else {
                registerAlias(alias, table);
            }
            int after = aliasIndex + 1;
            // 别名后的列清单，如 AS t(a, b)
            Token open = ctx.tokenAt(after);
            if (open != null && open.isPunctuation('(') && table == null) {
                return matchingClose(after) + 1;
            }
            return after;
        }

        /**
         * 同一别名在不同查询块里指向不同的表时无法判断列归属，按不透明处理
         */
        private void registerAlias(String alias, String table) {
            if (opaqueQualifiers.contains(alias)) {
                return;
            }
            String existing = aliases.get(alias);
            if (existing != null && !existing.equalsIgnoreCase(table)) {
                aliases.remove(alias);
                opaqueQualifiers.add(alias);
                return;
            }
            aliases.put(alias, table);
        }

        /**
         * 收集紧跟在表名之后的列清单 (a, b, ...)，返回清单之后的位置
         */
        private int collectColumnList(int openIndex, String table) {
            Token open = ctx.tokenAt(openIndex);
            if (open == null || !open.isPunctuation('(')) {
                return openIndex;
            }
            int close = matchingClose(openIndex);
            int end = close < 0 ? tokens.size() : close;
            for (int i = openIndex + 1; i < end; i++) {
                consumed[i] = true;
                Token t = tokens.get(i);
                if (table != null && t.isIdentifier() && t.depth() == open.depth() + 1) {
                    addColumn(table, t);
                }
            }
            return close < 0 ? tokens.size() : close + 1;
        }

        private boolean isCreateIndex(int indexPos) {
            int k = indexPos - 1;
            while (ctx.tokenAt(k) != null && ctx.tokenAt(k).isKeyword("UNIQUE")) {
                k--;
            }
            return ctx.tokenAt(k) != null && ctx.tokenAt(k).isKeyword("CREATE");
        }

        /**
         * CREATE TABLE t (...) 中表名后的括号是列定义而不是函数调用
         */
        private boolean isDdlColumnList(int nameIndex) {
            Token before = ctx.tokenAt(nameIndex - 1);
            return before != null && (before.isKeyword("TABLE") || before.isKeyword("REFERENCES")
                    || before.isKeyword("INTO") || before.isKeyword("ON") || before.isKeyword("EXISTS"));
        }

        private int skipIfExists(int index) {
            int i = index;
            while (ctx.tokenAt(i) != null
                    && (ctx.tokenAt(i).isKeyword("IF") || ctx.tokenAt(i).isKeyword("NOT") || ctx.tokenAt(i).isKeyword("EXISTS"))) {
                i++;
            }
            return i;
        }

        private String lastCheckedTable() {
            String last = null;
            for (TableRef ref : checkedTables.values()) {
                last = ref.name();
            }
            return last;
        }

        // ---------- 列 ----------

        private void collectSelectAliases() {
            Map<Integer, Boolean> selectList = new HashMap<>();
            for (int i = 1; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                Token prev = tokens.get(i - 1);
                if (t.isIdentifier() && prev.isKeyword("AS")) {
                    selectAliases.add(lower(t.identifierName()));
                    continue;
                }
                if (t.type() == TokenType.KEYWORD) {
                    Token next = ctx.tokenAt(i + 1);
                    boolean call = next != null && next.isPunctuation('(');
                    if (t.isKeyword("SELECT")) {
                        selectList.put(t.depth(), true);
                    } else if (!call && (COLUMN_REGION_END.contains(t.upper()) || SELECT_LIST_END.contains(t.upper()))) {
                        selectList.put(t.depth(), false);
                    }
                    continue;
                }
                if (selectList.getOrDefault(t.depth(), false) && isImplicitAlias(i)) {
                    selectAliases.add(lower(t.identifierName()));
                }
            }
        }

        /**
         * 查询列表中紧跟在表达式之后的标识符，如 name n、count(*) total
         */
        private boolean isImplicitAlias(int index) {
            Token t = tokens.get(index);
            if (!t.isIdentifier() || isDot(index + 1)) {
                return false;
            }
            Token next = ctx.tokenAt(index + 1);
            if (next != null && next.isPunctuation('(')) {
                return false;
            }
            Token prev = tokens.get(index - 1);
            if (prev.depth() != t.depth()) {
                return false;
            }
            return prev.type() == TokenType.IDENTIFIER || prev.type() == TokenType.STRING_LITERAL
                    || prev.type() == TokenType.NUMERIC_LITERAL || prev.isPunctuation(')') || prev.isKeyword("END");
        }

        private void collectColumns() {
            String singleTable = resolvableSingleTable();
            Map<Integer, Boolean> region = new HashMap<>();
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                int depth = t.depth();
                if (t.isPunctuation('(')) {
                    region.put(depth + 1, region.getOrDefault(depth, false));
                    continue;
                }
                if (t.type() == TokenType.KEYWORD) {
                    if (COLUMN_REGION_START.contains(t.upper())) {
                        region.put(depth, true);
                    } else if (COLUMN_REGION_END.contains(t.upper())) {
                        region.put(depth, false);
                    }
                    continue;
                }
                if (consumed[i] || !region.getOrDefault(depth, false) || !t.isIdentifier()) {
                    continue;
                }
                i = visitColumnCandidate(i, singleTable);
            }
        }

        /**
         * 处理从 index 开始的标识符链，返回链的最后位置
         */
        private int visitColumnCandidate(int index, String singleTable) {
            List<Token> parts = new ArrayList<>();
            parts.add(tokens.get(index));
            int i = index;
            while (isDot(i + 1) && isIdentifier(i + 2)) {
                i += 2;
                parts.add(tokens.get(i));
            }
            Token next = ctx.tokenAt(i + 1);
            if (next != null && (next.isPunctuation('(') || next.isPunctuation('.')
                    || next.type() == TokenType.STRING_LITERAL)) {
                return i;
            }
            Token prev = ctx.tokenAt(index - 1);
            if (prev != null && (prev.isKeyword("AS") || prev.isOperator("::") || prev.isOperator(":")
                    || prev.isOperator("@") || prev.isPunctuation('.')
                    || prev.type() == TokenType.IDENTIFIER || prev.type() == TokenType.STRING_LITERAL
                    || prev.type() == TokenType.NUMERIC_LITERAL || prev.isPunctuation(')'))) {
                return i;
            }
            Token columnToken = parts.get(parts.size() - 1);
            if (!isPlainName(columnToken)) {
                return i;
            }
            if (parts.size() == 1) {
                String name = lower(columnToken.identifierName());
                if (singleTable != null && !selectAliases.contains(name)
                        && !PSEUDO_COLUMNS.contains(name.toUpperCase(Locale.ROOT))) {
                    addColumn(singleTable, columnToken);
                }
                return i;
            }
            String qualifier = lower(parts.get(parts.size() - 2).identifierName());
            if (opaqueQualifiers.contains(qualifier)) {
                return i;
            }
            String table = parts.size() > 2
                    ? aliases.get(lower(joinParts(parts.subList(0, parts.size() - 1))))
                    : aliases.get(qualifier);
            if (table != null) {
                addColumn(table, columnToken);
            }
            return i;
        }

        private String resolvableSingleTable() {
            if (sourceTables.size() != 1 || opaqueSources || ctx.hasSubquery()) {
                return null;
            }
            for (Token t : tokens) {
                if (t.isKeywordIn(SET_OPERATORS)) {
                    return null;
                }
            }
            String type = ctx.statementType();
            if (!Set.of("SELECT", "UPDATE", "DELETE", "INSERT").contains(type)) {
                return null;
            }
            return checkedTables.get(sourceTables.iterator().next()).name();
        }

        private void addColumn(String table, Token column) {
            columns.add(new ColumnRef(table, column.identifierName(), column.offset()));
        }

        // ---------- 工具 ----------

        private boolean isDot(int index) {
            Token t = ctx.tokenAt(index);
            return t != null && t.isPunctuation('.');
        }

        private boolean isIdentifier(int index) {
            Token t = ctx.tokenAt(index);
            return t != null && t.isIdentifier();
        }

        private boolean isPlainName(Token t) {
            if (t.isQuotedIdentifier()) {
                return !t.identifierName().isEmpty();
            }
            String text = t.text();
            return !text.isEmpty() && (Character.isLetter(text.charAt(0)) || text.charAt(0) == '_');
        }

        private int matchingClose(int openIndex) {
            Token open = ctx.tokenAt(openIndex);
            if (open == null) {
                return tokens.size() - 1;
            }
            for (int i = openIndex + 1; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.isPunctuation(')') && t.depth() == open.depth()) {
                    return i;
                }
            }
            return tokens.size() - 1;
        }

        private static String joinParts(List<Token> parts) {
            StringBuilder sb = new StringBuilder();
            for (Token part : parts) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(part.identifierName());
            }
            return sb.toString();
        }

        private static String lower(String s) {
            return s.toLowerCase(Locale.ROOT);
        }
    }
}
