package com.sqlvalidator.catalog;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 内存中的目录快照，名称不区分大小写
 * <p>
 * 适用于测试夹具，或调用方预先缓存的目录状态。带 schema 前缀的表名按最后一段匹配。
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {

    private final Map<String, Set<String>> tables;

    private InMemorySchemaCatalog(Map<String, Set<String>> tables) {
        Map<String, Set<String>> copy = new HashMap<>();
        tables.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new HashSet<>(v))));
        this.tables = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InMemorySchemaCatalog empty() {
        return new InMemorySchemaCatalog(Map.of());
    }

    @Override
    public boolean tableExists(String name) {
        return tables.containsKey(normalize(name));
    }

    @Override
    public boolean columnExists(String table, String column) {
        Set<String> columns = tables.get(normalize(table));
        return columns != null && columns.contains(column.toLowerCase(Locale.ROOT));
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    private static String normalize(String table) {
        String lower = table.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot >= 0 ? lower.substring(dot + 1) : lower;
    }

    public static final class Builder {

        private final Map<String, Set<String>> tables = new HashMap<>();

        private Builder() {
        }

        public Builder table(String name, String... columns) {
            Set<String> set = tables.computeIfAbsent(normalize(name), k -> new HashSet<>());
            for (String column : columns) {
                set.add(column.toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public InMemorySchemaCatalog build() {
            return new InMemorySchemaCatalog(tables);
        }
    }
}
