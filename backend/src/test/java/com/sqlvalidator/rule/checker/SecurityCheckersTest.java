package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sqlvalidator.CheckerFixtures.check;
import static org.junit.jupiter.api.Assertions.*;

class SecurityCheckersTest {

    private final SqlInjectionChecker injection = new SqlInjectionChecker();
    private final HardcodedPasswordChecker password = new HardcodedPasswordChecker();

    @Test
    void shouldDetectOrTautology() {
        List<Finding> findings = check(injection, "SELECT * FROM users WHERE id = 1 OR '1'='1'");

        assertFalse(findings.isEmpty());
        assertTrue(findings.stream().allMatch(f -> f.getCategory() == Category.SECURITY
                && f.getSeverity() == Severity.ERROR));
        assertTrue(findings.stream().anyMatch(f -> f.getMessage().contains("OR 恒真条件注入")));
    }

    @Test
    void shouldDetectNumericTautology() {
        assertFalse(check(injection, "SELECT * FROM t WHERE a = '' OR 1=1").isEmpty());
    }

    @Test
    void shouldDetectAuthenticationBypass() {
        List<Finding> findings = check(injection, "SELECT * FROM users WHERE name = 'admin'--' AND pass = 'x'");

        assertTrue(findings.stream().anyMatch(f -> f.getMessage().contains("认证绕过注入")));
        assertTrue(findings.stream().anyMatch(f -> f.getMessage().contains("注释截断注入")));
    }

    @Test
    void shouldDetectStackedStatement() {
        List<Finding> findings = check(injection, "SELECT * FROM t WHERE id = 1; DROP TABLE users");

        assertTrue(findings.stream().anyMatch(f -> f.getMessage().contains("分号堆叠语句")));
    }

    @Test
    void shouldDetectUnionAfterLiteral() {
        List<Finding> findings = check(injection,
                "SELECT name FROM t WHERE id = '1' UNION SELECT password FROM users");

        assertTrue(findings.stream().anyMatch(f -> f.getMessage().contains("UNION 拼接查询注入")));
    }

    @Test
    void shouldPassOrdinaryQuery() {
        assertTrue(check(injection, "SELECT id, name FROM users WHERE id = 5 AND status = 'active';").isEmpty());
        assertTrue(check(injection, "SELECT id FROM t WHERE status = 'a' OR status = 'b'").isEmpty());
    }

    @Test
    void shouldWarnOnHardcodedPassword() {
        List<Finding> findings = check(password, "SELECT id FROM users WHERE password = 'secret'");

        assertEquals(1, findings.size());
        assertEquals("HARDCODED_PASSWORD", findings.get(0).getRuleId());
        assertEquals(Severity.WARNING, findings.get(0).getSeverity());
        assertFalse(check(password, "SELECT id FROM users WHERE PWD='x'").isEmpty());
    }

    @Test
    void shouldAcceptBoundPassword() {
        assertTrue(check(password, "UPDATE users SET pwd = ? WHERE id = 1").isEmpty());
    }

    @Test
    void shouldIgnoreCommentMarkersInsideLiterals() {
        assertTrue(check(injection, "SELECT id FROM tasks WHERE label = '#urgent' LIMIT 10;").isEmpty());
        assertTrue(check(injection, "SELECT id FROM settings WHERE sep = '--' LIMIT 10;").isEmpty());
        assertTrue(check(injection, "SELECT id FROM notes WHERE body = 'see -- below'").isEmpty());
    }

    @Test
    void shouldIgnoreStatementKeywordsInsideLiterals() {
        assertTrue(check(injection, "SELECT id FROM notes WHERE body = 'done; delete later' LIMIT 10;").isEmpty());
        assertTrue(check(injection, "SELECT id FROM notes WHERE body = 'x OR 1=1'").isEmpty());
        assertTrue(check(injection, "SELECT id FROM jobs WHERE cmd = 'sleep(5)'").isEmpty());
    }

    @Test
    void shouldStillDetectCommentAfterClosedLiteral() {
        List<Finding> findings = check(injection, "SELECT * FROM users WHERE name = 'bob' -- AND pass = 'x'");

        assertTrue(findings.stream().anyMatch(f -> f.getMessage().contains("注释截断注入")));
    }

    @Test
    void shouldNotTreatColumnVersusLiteralAsTautology() {
        assertTrue(check(injection, "SELECT id FROM users WHERE name = 'x' OR status = 'status' LIMIT 10;").isEmpty());
        assertTrue(check(injection, "SELECT id FROM users WHERE name = 'x' AND status = 'status'").isEmpty());
        assertTrue(check(injection, "SELECT id FROM users WHERE id = 1 OR 'a' = 'ab'").isEmpty());
        assertFalse(check(injection, "SELECT id FROM users WHERE name = 'x' AND 'a'='a'").isEmpty());
    }
}
