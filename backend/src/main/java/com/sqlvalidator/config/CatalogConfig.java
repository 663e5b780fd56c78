package com.sqlvalidator.config;

import com.sqlvalidator.catalog.JdbcSchemaCatalog;
import com.sqlvalidator.catalog.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * 在线数据库目录
 * <p>
 * 仅在配置了 sql-validator.catalog.url 时创建；连接在首次查询时才建立，启动时数据库不可用不影响服务启动。
 */
@Configuration
@ConditionalOnExpression("'${sql-validator.catalog.url:}' != ''")
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public DataSource catalogDataSource(ValidatorProperties properties) {
        ValidatorProperties.Catalog catalog = properties.getCatalog();
        log.info("使用在线数据库目录: {} (schema: {})", catalog.getUrl(), catalog.getSchema());
        DataSourceBuilder<?> builder = DataSourceBuilder.create()
                .url(catalog.getUrl())
                .username(catalog.getUsername())
                .password(catalog.getPassword());
        if (catalog.getDriverClassName() != null && !catalog.getDriverClassName().isBlank()) {
            builder.driverClassName(catalog.getDriverClassName());
        }
        return builder.build();
    }

    @Bean
    public SchemaCatalog schemaCatalog(DataSource catalogDataSource, ValidatorProperties properties) {
        return new JdbcSchemaCatalog(new JdbcTemplate(catalogDataSource), properties.getCatalog().getSchema());
    }
}
