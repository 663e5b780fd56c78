package com.sqlvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条 SQL 校验请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidateRequest {

    private String sql;

    /** 为空时使用 sql-validator.check-existence 配置 */
    private Boolean checkExistence;
}
