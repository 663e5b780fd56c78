package com.sqlvalidator.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySchemaCatalogTest {

    private final InMemorySchemaCatalog catalog = InMemorySchemaCatalog.builder()
            .table("Users", "ID", "name")
            .build();

    @Test
    void shouldMatchNamesCaseInsensitively() {
        assertTrue(catalog.tableExists("users"));
        assertTrue(catalog.tableExists("USERS"));
        assertTrue(catalog.columnExists("users", "id"));
        assertTrue(catalog.columnExists("USERS", "Name"));
        assertFalse(catalog.columnExists("users", "email"));
    }

    @Test
    void shouldMatchSchemaQualifiedNamesByLastSegment() {
        assertTrue(catalog.tableExists("public.users"));
        assertTrue(catalog.columnExists("public.users", "id"));
    }

    @Test
    void shouldTreatUnknownTableAsMissing() {
        assertFalse(catalog.tableExists("orders"));
        assertFalse(catalog.columnExists("orders", "id"));
        assertTrue(InMemorySchemaCatalog.empty().tableNames().isEmpty());
    }
}
