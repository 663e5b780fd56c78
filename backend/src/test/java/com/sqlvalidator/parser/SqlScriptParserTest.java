package com.sqlvalidator.parser;

import com.sqlvalidator.model.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlScriptParserTest {

    private final SqlScriptParser parser = new SqlScriptParser();

    @Test
    void shouldSplitOnSemicolonsAndKeepThem() {
        List<SqlStatement> statements = parser.parse("SELECT 1;\nSELECT 2;", "a.sql");

        assertEquals(2, statements.size());
        assertEquals("SELECT 1;", statements.get(0).getSqlText());
        assertEquals(1, statements.get(0).getLineNumber());
        assertEquals("SELECT 2;", statements.get(1).getSqlText());
        assertEquals(2, statements.get(1).getLineNumber());
        assertEquals("SELECT", statements.get(1).getStatementType());
    }

    @Test
    void shouldIgnoreSemicolonsInLiterals() {
        List<SqlStatement> statements = parser.parse(
                "INSERT INTO t VALUES ('a;b');\nSELECT 'it''s; fine';SELECT 2;", "a.sql");

        assertEquals(3, statements.size());
        assertTrue(statements.get(0).getSqlText().contains("'a;b'"));
        assertEquals("INSERT", statements.get(0).getStatementType());
        assertEquals("SELECT 'it''s; fine';", statements.get(1).getSqlText());
    }

    @Test
    void shouldIgnoreSemicolonsInCommentsAndKeepStartLines() {
        String script = """
                -- header; comment
                SELECT 1;
                /* block; */
                SELECT 2""";

        List<SqlStatement> statements = parser.parse(script, "a.sql");

        assertEquals(2, statements.size());
        assertEquals("-- header; comment\nSELECT 1;", statements.get(0).getSqlText());
        assertEquals(2, statements.get(0).getLineNumber());
        assertEquals("SELECT", statements.get(0).getStatementType());
        assertEquals("/* block; */\nSELECT 2", statements.get(1).getSqlText());
        assertEquals(4, statements.get(1).getLineNumber());
        assertEquals("SELECT", statements.get(1).getStatementType());
    }

    @Test
    void shouldDropBlankAndCommentOnlyPieces() {
        assertTrue(parser.parse(null, "a.sql").isEmpty());
        assertTrue(parser.parse("  \n ", "a.sql").isEmpty());
        assertTrue(parser.parse("-- nothing here", "a.sql").isEmpty());
        assertEquals(1, parser.parse("SELECT 1;;\n;", "a.sql").size());
    }
}
