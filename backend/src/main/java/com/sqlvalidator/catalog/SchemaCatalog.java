package com.sqlvalidator.catalog;

/**
 * 数据库目录访问接口：回答表/列是否存在
 * <p>
 * 实现可以访问在线连接，因此可能抛出 {@link CatalogAccessException}；
 * 调用方应把失败视为"无法检查"，而不是"不存在"。
 */
public interface SchemaCatalog {

    /**
     * @param name 表名，可带 schema 前缀（如 public.users）
     */
    boolean tableExists(String name);

    boolean columnExists(String table, String column);
}
