package com.sqlvalidator.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 基于 JDBC 元数据的在线目录
 * <p>
 * 通过 {@link DatabaseMetaData} 查询，兼容 KingbaseES/PostgreSQL（小写折叠）与 H2 等（大写折叠）。
 * 未加引号的名称依次按原样、小写、大写尝试。
 */
public class JdbcSchemaCatalog implements SchemaCatalog {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaCatalog.class);

    private static final String[] TABLE_TYPES = {"TABLE", "VIEW", "BASE TABLE", "MATERIALIZED VIEW"};

    private final JdbcTemplate jdbcTemplate;
    private final String defaultSchema;

    /**
     * @param defaultSchema 未带 schema 前缀时使用的 schema；为空表示不限 schema
     */
    public JdbcSchemaCatalog(JdbcTemplate jdbcTemplate, String defaultSchema) {
        this.jdbcTemplate = jdbcTemplate;
        this.defaultSchema = defaultSchema == null || defaultSchema.isBlank() ? null : defaultSchema;
    }

    @Override
    public boolean tableExists(String name) {
        QualifiedName qn = QualifiedName.parse(name, defaultSchema);
        return query(meta -> resolveTable(meta, qn) != null);
    }

    @Override
    public boolean columnExists(String table, String column) {
        QualifiedName qn = QualifiedName.parse(table, defaultSchema);
        return query(meta -> {
            ResolvedTable resolved = resolveTable(meta, qn);
            if (resolved == null) {
                return false;
            }
            for (String candidate : caseVariants(column)) {
                try (ResultSet rs = meta.getColumns(null, escape(meta, resolved.schema()),
                        escape(meta, resolved.table()), escape(meta, candidate))) {
                    if (rs.next()) {
                        return true;
                    }
                }
            }
            return false;
        });
    }

    private <T> T query(MetadataQuery<T> query) {
        try {
            return jdbcTemplate.execute((ConnectionCallback<T>) connection -> query.apply(connection.getMetaData()));
        } catch (DataAccessException e) {
            log.warn("查询数据库目录失败: {}", e.getMessage());
            throw new CatalogAccessException("查询数据库目录失败: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private ResolvedTable resolveTable(DatabaseMetaData meta, QualifiedName qn) throws SQLException {
        for (String schema : schemaVariants(qn.schema())) {
            for (String candidate : caseVariants(qn.table())) {
                try (ResultSet rs = meta.getTables(null, escape(meta, schema), escape(meta, candidate), TABLE_TYPES)) {
                    if (rs.next()) {
                        return new ResolvedTable(rs.getString("TABLE_SCHEM"), rs.getString("TABLE_NAME"));
                    }
                }
            }
        }
        return null;
    }

    private Set<String> schemaVariants(String schema) {
        Set<String> variants = new LinkedHashSet<>();
        if (schema == null) {
            variants.add(null);
        } else {
            variants.addAll(caseVariants(schema));
        }
        return variants;
    }

    private static Set<String> caseVariants(String name) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(name);
        variants.add(name.toLowerCase(Locale.ROOT));
        variants.add(name.toUpperCase(Locale.ROOT));
        return variants;
    }

    /**
     * 元数据查询参数是 LIKE 模式，名称中的 _ 和 % 需要转义
     */
    private static String escape(DatabaseMetaData meta, String name) throws SQLException {
        if (name == null) {
            return null;
        }
        String esc = meta.getSearchStringEscape();
        if (esc == null || esc.isEmpty()) {
            return name;
        }
        return name.replace(esc, esc + esc).replace("_", esc + "_").replace("%", esc + "%");
    }

    @FunctionalInterface
    private interface MetadataQuery<T> {
        T apply(DatabaseMetaData meta) throws SQLException;
    }

    private record ResolvedTable(String schema, String table) {
    }

    private record QualifiedName(String schema, String table) {

        static QualifiedName parse(String name, String defaultSchema) {
            int dot = name.lastIndexOf('.');
            if (dot < 0) {
                return new QualifiedName(defaultSchema, name);
            }
            String schema = name.substring(0, dot);
            int catalogDot = schema.lastIndexOf('.');
            return new QualifiedName(catalogDot >= 0 ? schema.substring(catalogDot + 1) : schema,
                    name.substring(dot + 1));
        }
    }
}
