package com.sqlvalidator.service;

import com.sqlvalidator.CheckerFixtures;
import com.sqlvalidator.catalog.CatalogAccessException;
import com.sqlvalidator.catalog.InMemorySchemaCatalog;
import com.sqlvalidator.catalog.SchemaCatalog;
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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SqlValidatorTest {

    private static final List<String> CORPUS = List.of(
            "SELECT * FROM users WHERE id = 1 OR '1'='1'",
            "SELECT id FROM users WHERE (id = 1",
            "SELECT id, name FROM users ORDER BY 1",
            "DELETE FROM orders",
            "INSERT INTO t (s) VALUES ('it''s fine')",
            "CREATE TABLE UserAccount (id INT, firstName VARCHAR(50));",
            "SELECT id FROM users WHERE LOWER(email) = 'a@b.com' AND name LIKE '%x'",
            "SELECT name WHERE id = 1",
            "SELECT * FROM t WHERE id = 1; DROP TABLE users");

    private final SqlValidator validator = CheckerFixtures.validator();

    @Test
    void shouldFlagInjectionAndSelectStar() {
        ValidationResult result = validator.validate("SELECT * FROM users WHERE id = 1 OR '1'='1'");

        assertFalse(result.isValid());
        assertTrue(result.getFindings().stream().anyMatch(f -> f.getCategory() == Category.SECURITY
                && f.getSeverity() == Severity.ERROR && f.getMessage().contains("OR 恒真条件注入")));
        assertTrue(result.getFindings().stream().anyMatch(f -> f.getCategory() == Category.PERFORMANCE
                && f.getSeverity() == Severity.WARNING && "SELECT_STAR".equals(f.getRuleId())));
    }

    @Test
    void shouldFlagUnmatchedParenthesis() {
        ValidationResult result = validator.validate("SELECT id FROM users WHERE (id = 1");

        assertFalse(result.isValid());
        List<Finding> parens = result.findingsOfRule("UNBALANCED_PARENTHESES");
        assertEquals(1, parens.size());
        assertEquals(Category.SYNTAX, parens.get(0).getCategory());
        assertEquals(Severity.ERROR, parens.get(0).getSeverity());
    }

    @Test
    void shouldWarnOnOrdinalOrderByWithoutFailing() {
        ValidationResult result = validator.validate("SELECT id, name FROM users ORDER BY 1");

        assertTrue(result.isValid());
        assertEquals(0, result.getErrorCount());
        assertEquals(Severity.WARNING, result.findingsOfRule("ORDER_BY_ORDINAL").get(0).getSeverity());
    }

    @Test
    void shouldWarnOnDeleteWithoutWhere() {
        ValidationResult result = validator.validate("DELETE FROM orders");

        assertTrue(result.isValid());
        Finding finding = result.findingsOfRule("MISSING_WHERE").get(0);
        assertEquals(Category.PERFORMANCE, finding.getCategory());
        assertEquals(Severity.WARNING, finding.getSeverity());
    }

    @Test
    void shouldReportMissingTableWhenExistenceCheckEnabled() {
        ValidationResult result = validator.validate("SELECT * FROM users",
                ValidationOptions.withCatalog(InMemorySchemaCatalog.empty()));

        assertFalse(result.isValid());
        Finding finding = result.findingsOfRule(ExistenceChecker.MISSING_TABLE).get(0);
        assertEquals(Category.EXISTENCE, finding.getCategory());
        assertEquals(Severity.ERROR, finding.getSeverity());
        assertTrue(finding.getMessage().contains("users"));
    }

    @Test
    void shouldNotTreatEscapedQuoteAsImbalance() {
        ValidationResult result = validator.validate("INSERT INTO t (s) VALUES ('it''s fine')");

        assertTrue(result.findingsOfRule("UNBALANCED_QUOTES").isEmpty());
        assertTrue(result.isValid());
    }

    @Test
    void shouldShortCircuitEmptyStatement() {
        for (String sql : new String[]{"", "   \n\t", null}) {
            ValidationResult result = validator.validate(sql);

            assertFalse(result.isValid());
            assertEquals(1, result.totalCount());
            Finding finding = result.getFindings().get(0);
            assertEquals(SqlValidator.EMPTY_STATEMENT, finding.getRuleId());
            assertEquals(Category.SYNTAX, finding.getCategory());
            assertEquals(Severity.ERROR, finding.getSeverity());
        }
    }

    @Test
    void shouldSkipExistenceCheckByDefault() {
        ValidationResult result = validator.validate("SELECT id FROM ghosts;");

        assertTrue(result.getFindings().stream().noneMatch(f -> f.getCategory() == Category.EXISTENCE));
    }

    @Test
    void shouldReportMissingCatalogAsError() {
        ValidationResult result = validator.validate("SELECT id FROM users LIMIT 1;",
                ValidationOptions.builder().checkExistence(true).build());

        assertFalse(result.isValid());
        assertEquals(1, result.findingsOfRule(SqlValidator.CATALOG_MISSING).size());
    }

    @Test
    void shouldFallBackToDefaultCatalog() {
        SchemaCatalog catalog = InMemorySchemaCatalog.builder().table("users", "id").build();
        SqlValidator withCatalog = CheckerFixtures.validator(catalog, false);

        ValidationResult ok = withCatalog.validate("SELECT id FROM users LIMIT 1;",
                ValidationOptions.builder().checkExistence(true).build());
        ValidationResult missing = withCatalog.validate("SELECT id FROM orders LIMIT 1;",
                ValidationOptions.builder().checkExistence(true).build());

        assertTrue(ok.isValid());
        assertEquals(1, missing.findingsOfRule(ExistenceChecker.MISSING_TABLE).size());
    }

    @Test
    void shouldKeepOtherFindingsWhenCatalogFails() {
        SchemaCatalog broken = new SchemaCatalog() {
            @Override
            public boolean tableExists(String name) {
                throw new CatalogAccessException("timeout");
            }

            @Override
            public boolean columnExists(String table, String column) {
                throw new CatalogAccessException("timeout");
            }
        };

        ValidationResult result = validator.validate("SELECT * FROM users", ValidationOptions.withCatalog(broken));

        assertTrue(result.isValid());
        assertEquals(1, result.findingsOfRule(ExistenceChecker.CHECK_SKIPPED).size());
        assertEquals(1, result.findingsOfRule("SELECT_STAR").size());
    }

    @Test
    void shouldOrderFindingsByFamily() {
        for (String sql : CORPUS) {
            List<Finding> findings = validator.validate(sql).getFindings();
            int last = -1;
            for (Finding finding : findings) {
                int index = CheckerRegistry.FAMILY_ORDER.indexOf(finding.getCategory());
                assertTrue(index >= last, "发现顺序错误: " + sql);
                last = index;
            }
        }
    }

    @Test
    void shouldComputeCountsAndVerdict() {
        ValidationResult result = validator.validate("SELECT * FROM users WHERE id = 1 OR '1'='1'");

        assertEquals(result.findingsWithSeverity(Severity.ERROR).size(), result.getErrorCount());
        assertEquals(result.findingsWithSeverity(Severity.WARNING).size(), result.getWarningCount());
        assertEquals(result.findingsWithSeverity(Severity.INFO).size(), result.getInfoCount());
        assertEquals(result.totalCount(),
                result.getErrorCount() + result.getWarningCount() + result.getInfoCount());
        assertEquals(result.getErrorCount() == 0, result.isValid());
    }

    @Test
    void shouldBeDeterministic() {
        SchemaCatalog catalog = InMemorySchemaCatalog.builder().table("users", "id", "name").build();
        for (String sql : CORPUS) {
            ValidationOptions options = ValidationOptions.withCatalog(catalog);
            assertEquals(validator.validate(sql, options), validator.validate(sql, options));
        }
    }

    @Test
    void shouldProduceSameReportWhenFamiliesRunInParallel() {
        SqlValidator parallel = CheckerFixtures.validator(null, true);
        for (String sql : CORPUS) {
            assertEquals(validator.validate(sql), parallel.validate(sql));
        }
    }

    @Test
    void shouldIsolateFailingFamily() {
        List<SqlChecker> checkers = new ArrayList<>(CheckerFixtures.builtInCheckers());
        checkers.add(new ExplodingChecker(Category.PERFORMANCE, new IllegalStateException("boom")));
        checkers.add(new ExplodingChecker(Category.NAMING, new StackOverflowError()));
        SqlValidator fragile = new SqlValidator(new SqlScanner(), new CheckerRegistry(checkers),
                new ExistenceChecker(), null, false);

        ValidationResult result = fragile.validate("SELECT * FROM users WHERE id = 1 OR '1'='1'");

        List<Finding> failures = result.findingsOfRule(SqlValidator.DETECTOR_FAILURE);
        assertEquals(2, failures.size());
        assertEquals(Category.PERFORMANCE, failures.get(0).getCategory());
        assertEquals(Category.NAMING, failures.get(1).getCategory());
        assertTrue(failures.stream().allMatch(f -> f.getSeverity() == Severity.INFO));
        // 其他族不受影响
        assertFalse(result.findingsOfRule("SQL_INJECTION").isEmpty());
        assertFalse(result.findingsOfRule("MISSING_SEMICOLON").isEmpty());
    }

    @Test
    void shouldNeverThrowOnArbitraryInput() {
        Random random = new Random(42);
        String alphabet = "SELECT FROM WHERE()'\";-*/#`%=<>.,_\n\t abcXYZ0123456789\\$${}:@";
        for (int round = 0; round < 500; round++) {
            StringBuilder sb = new StringBuilder();
            int length = random.nextInt(200);
            for (int i = 0; i < length; i++) {
                if (random.nextInt(10) == 0) {
                    sb.append((char) random.nextInt(0xFFFF));
                } else {
                    sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
                }
            }
            String sql = sb.toString();
            ValidationResult result = assertDoesNotThrow(() -> validator.validate(sql,
                    ValidationOptions.withCatalog(InMemorySchemaCatalog.empty())));
            assertNotNull(result);
        }
    }

    @Test
    void shouldSurvivePathologicalNesting() {
        String deep = "SELECT " + "(".repeat(5000) + "1" + ")".repeat(4000);
        String quotes = "SELECT '" + "''".repeat(5000);

        ValidationResult nested = validator.validate(deep);
        ValidationResult unterminated = validator.validate(quotes);

        assertEquals(1, nested.findingsOfRule("UNBALANCED_PARENTHESES").size());
        assertEquals(1, unterminated.findingsOfRule("UNBALANCED_QUOTES").size());
    }

    private static final class ExplodingChecker implements SqlChecker {

        private final Category category;
        private final Throwable failure;

        ExplodingChecker(Category category, Throwable failure) {
            this.category = category;
            this.failure = failure;
        }

        @Override
        public String name() {
            return "EXPLODING_" + category.name();
        }

        @Override
        public Category category() {
            return category;
        }

        @Override
        public String description() {
            return "always fails";
        }

        @Override
        public List<Finding> check(ScanContext context, String sql) {
            if (failure instanceof RuntimeException e) {
                throw e;
            }
            throw (Error) failure;
        }
    }

    @Test
    void shouldPassBenignStatementsWithoutErrors() {
        SchemaCatalog catalog = InMemorySchemaCatalog.builder()
                .table("users", "id", "name", "status")
                .table("orders", "id", "user_id", "amount")
                .table("tasks", "id", "label")
                .build();
        SqlValidator withCatalog = CheckerFixtures.validator(catalog, false);
        ValidationOptions options = ValidationOptions.builder().checkExistence(true).build();

        List<String> statements = List.of(
                "SELECT a.name FROM users a WHERE EXISTS (SELECT 1 FROM orders a WHERE a.amount > 0) LIMIT 10;",
                "SELECT name n FROM users ORDER BY n LIMIT 10;",
                "SELECT id FROM tasks WHERE label = '#urgent' LIMIT 10;",
                "SELECT id FROM tasks WHERE label = 'done; delete later' LIMIT 10;",
                "SELECT id FROM users WHERE name = 'x' OR status = 'status' LIMIT 10;");
        for (String sql : statements) {
            ValidationResult result = withCatalog.validate(sql, options);
            assertTrue(result.isValid(), sql + " -> " + result.getFindings());
        }
    }
}
