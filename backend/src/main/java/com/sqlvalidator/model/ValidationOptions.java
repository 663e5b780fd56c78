package com.sqlvalidator.model;

import com.sqlvalidator.catalog.SchemaCatalog;
import lombok.Builder;
import lombok.Value;

/**
 * 单次校验的选项
 */
@Value
@Builder
public class ValidationOptions {

    /** 是否检查表/列是否存在 */
    boolean checkExistence;

    /** 存在性检查使用的 catalog；为空时回退到配置的默认 catalog */
    SchemaCatalog catalog;

    public static ValidationOptions defaults() {
        return ValidationOptions.builder().build();
    }

    public static ValidationOptions withCatalog(SchemaCatalog catalog) {
        return ValidationOptions.builder()
                .checkExistence(true)
                .catalog(catalog)
                .build();
    }
}
