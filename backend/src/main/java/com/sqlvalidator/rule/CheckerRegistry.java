package com.sqlvalidator.rule;

import com.sqlvalidator.model.CheckerDescriptor;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.rule.checker.SqlChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 检查器注册表
 * <p>
 * 按检查器族分组，族的执行顺序固定为 语法 → 安全 → 性能 → 命名，
 * 族内保持注册顺序（Spring 按 {@code @Order} 注入）。新增检查器只需注册为组件。
 */
@Component
public class CheckerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CheckerRegistry.class);

    public static final List<Category> FAMILY_ORDER = List.of(
            Category.SYNTAX, Category.SECURITY, Category.PERFORMANCE, Category.NAMING);

    private final Map<Category, List<SqlChecker>> families = new EnumMap<>(Category.class);

    public CheckerRegistry(List<SqlChecker> checkers) {
        for (SqlChecker checker : checkers) {
            if (!FAMILY_ORDER.contains(checker.category())) {
                throw new IllegalArgumentException(
                        "检查器 " + checker.name() + " 的分类 " + checker.category() + " 不属于任何检查器族");
            }
            families.computeIfAbsent(checker.category(), k -> new ArrayList<>()).add(checker);
        }
        families.replaceAll((k, v) -> List.copyOf(v));
        log.info("注册了 {} 个检查器: {}", checkers.size(), describeCounts());
    }

    public List<SqlChecker> family(Category category) {
        return families.getOrDefault(category, Collections.emptyList());
    }

    /**
     * 按执行顺序返回全部检查器
     */
    public List<SqlChecker> all() {
        List<SqlChecker> all = new ArrayList<>();
        for (Category category : FAMILY_ORDER) {
            all.addAll(family(category));
        }
        return all;
    }

    public List<CheckerDescriptor> describe() {
        return all().stream()
                .map(c -> CheckerDescriptor.builder()
                        .name(c.name())
                        .category(c.category())
                        .description(c.description())
                        .build())
                .toList();
    }

    private String describeCounts() {
        StringBuilder sb = new StringBuilder();
        for (Category category : FAMILY_ORDER) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(category.name()).append('=').append(family(category).size());
        }
        return sb.toString();
    }
}
