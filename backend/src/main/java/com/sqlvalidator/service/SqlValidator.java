package com.sqlvalidator.service;

import com.sqlvalidator.catalog.SchemaCatalog;
import com.sqlvalidator.config.ValidatorProperties;
import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.model.ValidationOptions;
import com.sqlvalidator.model.ValidationResult;
import com.sqlvalidator.rule.CheckerRegistry;
import com.sqlvalidator.rule.checker.SqlChecker;
import com.sqlvalidator.rule.existence.ExistenceChecker;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.SqlScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * SQL 校验编排服务
 * <p>
 * 流程：空语句短路 → 扫描一次 → 语法/安全/性能/命名四个检查器族按固定顺序执行 → 可选的存在性检查 → 汇总。
 * 任何输入都返回结果，检查器族内部异常被隔离为一条 INFO 发现。
 */
@Service
public class SqlValidator {

    private static final Logger log = LoggerFactory.getLogger(SqlValidator.class);

    public static final String EMPTY_STATEMENT = "EMPTY_STATEMENT";
    public static final String DETECTOR_FAILURE = "DETECTOR_FAILURE";
    public static final String CATALOG_MISSING = "CATALOG_MISSING";

    private final SqlScanner scanner;
    private final CheckerRegistry registry;
    private final ExistenceChecker existenceChecker;
    private final SchemaCatalog defaultCatalog;
    private final boolean parallelFamilies;

    @Autowired
    public SqlValidator(SqlScanner scanner, CheckerRegistry registry, ExistenceChecker existenceChecker,
                        ObjectProvider<SchemaCatalog> catalogProvider, ValidatorProperties properties) {
        this(scanner, registry, existenceChecker, catalogProvider.getIfAvailable(), properties.isParallelFamilies());
    }

    /**
     * @param defaultCatalog 请求未携带 catalog 时使用的目录，可为空
     */
    public SqlValidator(SqlScanner scanner, CheckerRegistry registry, ExistenceChecker existenceChecker,
                        SchemaCatalog defaultCatalog, boolean parallelFamilies) {
        this.scanner = scanner;
        this.registry = registry;
        this.existenceChecker = existenceChecker;
        this.defaultCatalog = defaultCatalog;
        this.parallelFamilies = parallelFamilies;
    }

    public ValidationResult validate(String sql) {
        return validate(sql, ValidationOptions.defaults());
    }

    public ValidationResult validate(String sql, ValidationOptions options) {
        ValidationOptions effective = options != null ? options : ValidationOptions.defaults();
        if (sql == null || sql.isBlank()) {
            return ValidationResult.of(List.of(Finding.builder()
                    .ruleId(EMPTY_STATEMENT)
                    .category(Category.SYNTAX)
                    .severity(Severity.ERROR)
                    .message("SQL 语句为空")
                    .suggestion("请提供需要校验的 SQL 语句")
                    .build()));
        }

        ScanContext context = scanner.scan(sql);
        List<Finding> findings = new ArrayList<>(runFamilies(context, sql));

        if (effective.isCheckExistence()) {
            findings.addAll(runExistenceCheck(context, effective));
        }

        ValidationResult result = ValidationResult.of(findings);
        log.debug("SQL 校验完成: valid={}, 错误 {}, 警告 {}, 提示 {}",
                result.isValid(), result.getErrorCount(), result.getWarningCount(), result.getInfoCount());
        return result;
    }

    public boolean isParallelFamilies() {
        return parallelFamilies;
    }

    private List<Finding> runFamilies(ScanContext context, String sql) {
        List<Finding> findings = new ArrayList<>();
        if (parallelFamilies) {
            List<CompletableFuture<List<Finding>>> futures = new ArrayList<>();
            for (Category family : CheckerRegistry.FAMILY_ORDER) {
                futures.add(CompletableFuture.supplyAsync(() -> runFamily(family, context, sql)));
            }
            // 按族顺序合并，与线程完成顺序无关
            for (CompletableFuture<List<Finding>> future : futures) {
                findings.addAll(future.join());
            }
        } else {
            for (Category family : CheckerRegistry.FAMILY_ORDER) {
                findings.addAll(runFamily(family, context, sql));
            }
        }
        return findings;
    }

    private List<Finding> runFamily(Category family, ScanContext context, String sql) {
        List<Finding> findings = new ArrayList<>();
        try {
            for (SqlChecker checker : registry.family(family)) {
                findings.addAll(checker.check(context, sql));
            }
            return findings;
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("检查器族 {} 执行失败", family, e);
            return List.of(Finding.builder()
                    .ruleId(DETECTOR_FAILURE)
                    .category(family)
                    .severity(Severity.INFO)
                    .message("检查器族 " + family.label() + " 执行失败：" + e)
                    .suggestion("该类检查结果不完整，请人工复核")
                    .build());
        }
    }

    private List<Finding> runExistenceCheck(ScanContext context, ValidationOptions options) {
        SchemaCatalog catalog = options.getCatalog() != null ? options.getCatalog() : defaultCatalog;
        if (catalog == null) {
            return List.of(Finding.builder()
                    .ruleId(CATALOG_MISSING)
                    .category(Category.EXISTENCE)
                    .severity(Severity.ERROR)
                    .message("已开启存在性检查，但未提供数据库目录")
                    .suggestion("配置 sql-validator.catalog.url，或在调用时传入 catalog")
                    .build());
        }
        try {
            return existenceChecker.check(context, catalog);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("存在性检查执行失败", e);
            return List.of(Finding.builder()
                    .ruleId(DETECTOR_FAILURE)
                    .category(Category.EXISTENCE)
                    .severity(Severity.INFO)
                    .message("检查器族 " + Category.EXISTENCE.label() + " 执行失败：" + e)
                    .suggestion("存在性检查结果不完整，请人工复核")
                    .build());
        }
    }
}
