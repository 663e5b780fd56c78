package com.sqlvalidator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 校验引擎配置，前缀 sql-validator
 */
@Data
@ConfigurationProperties(prefix = "sql-validator")
public class ValidatorProperties {

    /** 请求未指定时是否默认做表/列存在性检查 */
    private boolean checkExistence = false;

    /** 是否并行执行四个检查器族（报告顺序不变） */
    private boolean parallelFamilies = false;

    private Catalog catalog = new Catalog();

    @Data
    public static class Catalog {

        /** JDBC 连接串，为空时不创建在线目录 */
        private String url;

        private String username;

        private String password;

        /** 驱动类名，为空时按连接串推断（如 jdbc:postgresql） */
        private String driverClassName;

        /** 未带 schema 前缀的表在此 schema 下查找 */
        private String schema = "public";
    }
}
