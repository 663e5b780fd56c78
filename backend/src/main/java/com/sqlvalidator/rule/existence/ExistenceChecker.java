package com.sqlvalidator.rule.existence;

import com.sqlvalidator.catalog.SchemaCatalog;
import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.rule.existence.StatementReferences.ColumnRef;
import com.sqlvalidator.rule.existence.StatementReferences.TableRef;
import com.sqlvalidator.scanner.ScanContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 表/列存在性检查
 * <p>
 * 只读访问目录。目录不可用时不抛出异常，而是返回一条 INFO 说明已跳过检查。
 */
@Component
public class ExistenceChecker {

    private static final Logger log = LoggerFactory.getLogger(ExistenceChecker.class);

    public static final String MISSING_TABLE = "TABLE_NOT_FOUND";
    public static final String MISSING_COLUMN = "COLUMN_NOT_FOUND";
    public static final String CHECK_SKIPPED = "EXISTENCE_CHECK_SKIPPED";

    private final ReferenceExtractor extractor = new ReferenceExtractor();

    public List<Finding> check(ScanContext context, SchemaCatalog catalog) {
        StatementReferences refs = extractor.extract(context);
        try {
            return lookup(context, refs, catalog);
        } catch (RuntimeException e) {
            log.warn("数据库目录访问失败，跳过存在性检查: {}", e.getMessage());
            return List.of(Finding.builder()
                    .ruleId(CHECK_SKIPPED)
                    .category(Category.EXISTENCE)
                    .severity(Severity.INFO)
                    .message("无法访问数据库目录，已跳过表/列存在性检查：" + e.getMessage())
                    .suggestion("检查数据库连接配置后重试")
                    .build());
        }
    }

    private List<Finding> lookup(ScanContext context, StatementReferences refs, SchemaCatalog catalog) {
        List<Finding> findings = new ArrayList<>();
        Map<String, Boolean> tableCache = new HashMap<>();

        for (TableRef table : refs.tables()) {
            if (!tableExists(catalog, tableCache, table.name())) {
                findings.add(Finding.builder()
                        .ruleId(MISSING_TABLE)
                        .category(Category.EXISTENCE)
                        .severity(Severity.ERROR)
                        .message("表 " + table.name() + " 不存在")
                        .suggestion("确认表名拼写及所属 schema")
                        .location(table.offset())
                        .line(context.lineOf(table.offset()))
                        .build());
            }
        }

        Set<String> reported = new HashSet<>();
        for (ColumnRef column : refs.columns()) {
            // 表本身不存在时只报表
            if (!tableExists(catalog, tableCache, column.table())) {
                continue;
            }
            String key = (column.table() + "." + column.column()).toLowerCase(Locale.ROOT);
            if (reported.contains(key) || catalog.columnExists(column.table(), column.column())) {
                continue;
            }
            reported.add(key);
            findings.add(Finding.builder()
                    .ruleId(MISSING_COLUMN)
                    .category(Category.EXISTENCE)
                    .severity(Severity.ERROR)
                    .message("列 " + column.table() + "." + column.column() + " 不存在")
                    .suggestion("确认列名拼写，或检查别名指向的表")
                    .location(column.offset())
                    .line(context.lineOf(column.offset()))
                    .build());
        }
        log.debug("存在性检查完成: {} 张表, {} 个列引用, {} 条发现",
                refs.tables().size(), refs.columns().size(), findings.size());
        return findings;
    }

    private boolean tableExists(SchemaCatalog catalog, Map<String, Boolean> cache, String table) {
        return cache.computeIfAbsent(table.toLowerCase(Locale.ROOT), k -> catalog.tableExists(table));
    }
}
