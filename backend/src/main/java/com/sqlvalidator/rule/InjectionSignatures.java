package com.sqlvalidator.rule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * SQL 注入特征库
 * <p>
 * 进程启动时编译一次，之后只读。匹配针对原始文本而非 token，
 * 因为注入片段往往故意破坏正常的词法结构。
 * <p>
 * {@code literalAware} 的特征若起点落在字符串字面量内部则不算命中，
 * 避免 {@code '#urgent'}、{@code 'done; delete later'} 这类普通文本被误报；
 * 认证绕过与 ${} 拼接本身就出现在引号内，不做该过滤。
 */
public final class InjectionSignatures {

    public record Signature(String name, Pattern pattern, boolean literalAware) {
    }

    public static final List<Signature> ALL = List.of(
            // 两侧同为带引号字面量或同为裸值，列与同名字面量比较不算恒真
            signature("OR 恒真条件注入",
                    "\\bOR\\s+(?:'(\\w+)'\\s*=\\s*'\\1(?![\\w.])|(\\w+)\\s*=\\s*\\2(?![\\w.]))", true),
            signature("AND 恒真条件注入",
                    "'\\s*AND\\s+(?:'(\\w+)'\\s*=\\s*'\\1(?![\\w.])|(\\w+)\\s*=\\s*\\2(?![\\w.]))", true),
            signature("引号截断后的破坏性语句注入",
                    "'\\s*\\)?\\s*;\\s*(DROP|DELETE|TRUNCATE|ALTER|UPDATE|INSERT|EXEC|EXECUTE)\\b", true),
            signature("分号堆叠语句",
                    ";\\s*(DROP|DELETE|TRUNCATE|ALTER|UPDATE|INSERT|EXEC|EXECUTE|CREATE|GRANT|SHUTDOWN)\\b", true),
            signature("注释截断注入",
                    "'\\s*(;\\s*)?(--|#)", true),
            signature("认证绕过注入",
                    "\\badmin'\\s*(--|#|/\\*)", false),
            signature("UNION 拼接查询注入",
                    "'\\s*\\)?\\s*UNION\\s+(ALL\\s+)?SELECT\\b", true),
            signature("基于时间的盲注",
                    "\\b(PG_SLEEP|SLEEP|BENCHMARK)\\s*\\(|\\bWAITFOR\\s+DELAY\\b", true),
            signature("模板 ${} 字符串拼接",
                    "\\$\\{[^}]*}", false));

    private InjectionSignatures() {
    }

    private static Signature signature(String name, String regex, boolean literalAware) {
        return new Signature(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), literalAware);
    }
}
