package com.sqlvalidator.rule.existence;

import com.sqlvalidator.catalog.CatalogAccessException;
import com.sqlvalidator.catalog.InMemorySchemaCatalog;
import com.sqlvalidator.catalog.SchemaCatalog;
import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.SqlScanner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExistenceCheckerTest {

    private final SqlScanner scanner = new SqlScanner();
    private final ExistenceChecker checker = new ExistenceChecker();

    private final SchemaCatalog catalog = InMemorySchemaCatalog.builder()
            .table("users", "id", "name", "email")
            .table("orders", "id", "user_id", "amount")
            .build();

    private List<Finding> check(String sql) {
        return checker.check(scanner.scan(sql), catalog);
    }

    @Test
    void shouldReportMissingTable() {
        List<Finding> findings = checker.check(scanner.scan("SELECT * FROM users"), InMemorySchemaCatalog.empty());

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(ExistenceChecker.MISSING_TABLE, finding.getRuleId());
        assertEquals(Category.EXISTENCE, finding.getCategory());
        assertEquals(Severity.ERROR, finding.getSeverity());
        assertTrue(finding.getMessage().contains("users"));
        assertEquals(14, finding.getLocation());
    }

    @Test
    void shouldPassKnownTablesAndColumns() {
        assertTrue(check("SELECT id, name FROM users WHERE email = 'x'").isEmpty());
        assertTrue(check("SELECT ID FROM USERS").isEmpty());
        assertTrue(check("SELECT \"id\" FROM \"users\"").isEmpty());
    }

    @Test
    void shouldReportMissingColumnOfSingleTable() {
        List<Finding> findings = check("SELECT id, nickname FROM users");

        assertEquals(1, findings.size());
        assertEquals(ExistenceChecker.MISSING_COLUMN, findings.get(0).getRuleId());
        assertTrue(findings.get(0).getMessage().contains("users.nickname"));
    }

    @Test
    void shouldResolveAliasQualifiedColumns() {
        List<Finding> findings = check("SELECT u.id, o.total FROM users u JOIN orders o ON o.user_id = u.id");

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getMessage().contains("orders.total"));
    }

    @Test
    void shouldSkipAmbiguousOrUnresolvableColumns() {
        assertTrue(check("SELECT nickname FROM users u JOIN orders o ON o.user_id = u.id").isEmpty());
        assertTrue(check("SELECT x.foo FROM users u").isEmpty());
        assertTrue(check("SELECT id FROM users WHERE id IN (SELECT user_id FROM orders)").isEmpty());
    }

    @Test
    void shouldReportOnlyTableWhenTableIsMissing() {
        List<Finding> findings = check("SELECT foo FROM ghosts");

        assertEquals(1, findings.size());
        assertEquals(ExistenceChecker.MISSING_TABLE, findings.get(0).getRuleId());
    }

    @Test
    void shouldCheckTablesInsideSubqueriesAndDerivedTables() {
        List<Finding> subquery = check("SELECT id FROM users WHERE id IN (SELECT user_id FROM payments)");
        assertEquals(1, subquery.size());
        assertTrue(subquery.get(0).getMessage().contains("payments"));

        List<Finding> derived = check("SELECT t.id FROM (SELECT id FROM ghosts) t");
        assertEquals(1, derived.size());
        assertTrue(derived.get(0).getMessage().contains("ghosts"));
    }

    @Test
    void shouldNotTreatCteNamesAsTables() {
        assertTrue(check("WITH recent AS (SELECT id FROM orders) SELECT id FROM recent").isEmpty());
    }

    @Test
    void shouldCheckInsertAndUpdateTargetColumns() {
        List<Finding> insert = check("INSERT INTO users (id, nickname) VALUES (1, 'x')");
        assertEquals(1, insert.size());
        assertTrue(insert.get(0).getMessage().contains("users.nickname"));

        List<Finding> update = check("UPDATE users SET nickname = 'x' WHERE id = 1");
        assertEquals(1, update.size());
        assertTrue(update.get(0).getMessage().contains("users.nickname"));
    }

    @Test
    void shouldHandleDdlTargets() {
        assertEquals(1, check("DROP TABLE ghosts").size());
        assertTrue(check("DROP TABLE IF EXISTS ghosts").isEmpty());
        assertTrue(check("CREATE TABLE new_table (id INT, user_id INT REFERENCES users(id))").isEmpty());
        assertEquals(1, check("CREATE TABLE new_table (id INT, user_id INT REFERENCES accounts(id))").size());
    }

    @Test
    void shouldSkipAliasesTypedLiteralsAndDateParts() {
        assertTrue(check("SELECT name AS n FROM users ORDER BY n").isEmpty());
        assertTrue(check("SELECT COUNT(*) FROM users WHERE EXTRACT(YEAR FROM created_at) = 2024").isEmpty());

        List<Finding> findings = check("SELECT id FROM users WHERE created_at > DATE '2024-01-01'");
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getMessage().contains("users.created_at"));
    }

    @Test
    void shouldReportEachMissingColumnOnce() {
        assertEquals(1, check("SELECT nickname FROM users WHERE nickname = 'a' ORDER BY nickname").size());
    }

    @Test
    void shouldDegradeToInfoWhenCatalogFails() {
        SchemaCatalog broken = new SchemaCatalog() {
            @Override
            public boolean tableExists(String name) {
                throw new CatalogAccessException("connection refused");
            }

            @Override
            public boolean columnExists(String table, String column) {
                throw new CatalogAccessException("connection refused");
            }
        };

        List<Finding> findings = checker.check(scanner.scan("SELECT id FROM users"), broken);

        assertEquals(1, findings.size());
        assertEquals(ExistenceChecker.CHECK_SKIPPED, findings.get(0).getRuleId());
        assertEquals(Severity.INFO, findings.get(0).getSeverity());
        assertEquals(Category.EXISTENCE, findings.get(0).getCategory());
    }

    @Test
    void shouldTreatAliasReusedInSubqueryAsAmbiguous() {
        assertTrue(check("SELECT a.name FROM users a WHERE EXISTS "
                + "(SELECT 1 FROM orders a WHERE a.amount > 0) LIMIT 10;").isEmpty());
        // 同一别名指向同一张表时仍然可以解析
        List<Finding> findings = check("SELECT a.nickname FROM users a WHERE a.id IN "
                + "(SELECT a.id FROM users a)");
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getMessage().contains("users.nickname"));
    }

    @Test
    void shouldSkipImplicitSelectListAliases() {
        assertTrue(check("SELECT name n FROM users ORDER BY n LIMIT 10;").isEmpty());
        assertTrue(check("SELECT count(*) total, name FROM users GROUP BY name ORDER BY total").isEmpty());
        assertTrue(check("SELECT CASE WHEN id > 1 THEN 'a' ELSE 'b' END kind FROM users ORDER BY kind").isEmpty());

        List<Finding> findings = check("SELECT name n FROM users ORDER BY nickname");
        assertEquals(1, findings.size());
        assertTrue(findings.get(0).getMessage().contains("users.nickname"));
    }
}
