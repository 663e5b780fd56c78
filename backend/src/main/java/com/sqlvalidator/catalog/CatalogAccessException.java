package com.sqlvalidator.catalog;

/**
 * 访问数据库目录失败（连接中断、权限不足等）
 */
public class CatalogAccessException extends RuntimeException {

    public CatalogAccessException(String message) {
        super(message);
    }

    public CatalogAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
