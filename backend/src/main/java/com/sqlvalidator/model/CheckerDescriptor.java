package com.sqlvalidator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已注册检查器的描述信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckerDescriptor {

    /** 检查器名称 */
    private String name;

    /** 所属检查器族 */
    private Finding.Category category;

    /** 检查内容说明 */
    private String description;
}
