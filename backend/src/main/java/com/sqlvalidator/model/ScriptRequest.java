package com.sqlvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 脚本校验请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScriptRequest {

    private String script;

    private String name;

    private Boolean checkExistence;
}
