package com.sqlvalidator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.ValidationResult;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * 校验结果渲染与导出
 */
@Service
public class ReportExportService {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ObjectMapper objectMapper;

    public ReportExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 纯文本报告：结论行 + 按分类分组的发现
     */
    public String renderText(ValidationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(summaryLine(result)).append('\n');
        for (Map.Entry<Category, List<Finding>> entry : result.findingsByCategory().entrySet()) {
            sb.append('\n').append('[').append(entry.getKey().label()).append(']').append('\n');
            for (Finding f : entry.getValue()) {
                sb.append("  ").append(f.getSeverity().symbol()).append(' ').append(orEmpty(f.getMessage()));
                if (f.getLine() != null) {
                    sb.append(" (第 ").append(f.getLine()).append(" 行)");
                }
                sb.append('\n');
                if (notBlank(f.getSuggestion())) {
                    sb.append("    → ").append(f.getSuggestion()).append('\n');
                }
            }
        }
        return sb.toString();
    }

    public ExportPayload exportMarkdown(ValidationResult result) {
        byte[] content = buildMarkdown(result).getBytes(StandardCharsets.UTF_8);
        return new ExportPayload(
                "sql-validation-report-" + fileTs() + ".md",
                "text/markdown;charset=UTF-8",
                content);
    }

    public ExportPayload exportJson(ValidationResult result) {
        try {
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(result);
            return new ExportPayload(
                    "sql-validation-report-" + fileTs() + ".json",
                    "application/json;charset=UTF-8",
                    content);
        } catch (Exception e) {
            throw new IllegalStateException("JSON 导出失败: " + e.getMessage(), e);
        }
    }

    private String buildMarkdown(ValidationResult result) {
        StringBuilder md = new StringBuilder();
        md.append("# SQL 校验报告\n\n");
        md.append("**生成时间:** ").append(LocalDateTime.now()).append("\n\n");
        md.append("## 📊 统计摘要\n");
        md.append("- **结论:** ").append(summaryLine(result)).append("\n");
        md.append("- **发现总数:** ").append(result.totalCount())
                .append(" (❌ 错误: ").append(result.getErrorCount())
                .append(", ⚠️ 警告: ").append(result.getWarningCount())
                .append(", ℹ️ 提示: ").append(result.getInfoCount())
                .append(")\n\n");

        if (result.getFindings().isEmpty()) {
            md.append("✅ **未发现任何问题**\n");
            return md.toString();
        }

        md.append("## 🚫 发现详情\n\n");
        for (Map.Entry<Category, List<Finding>> entry : result.findingsByCategory().entrySet()) {
            md.append("### ").append(entry.getKey().label()).append(" (")
                    .append(entry.getValue().size()).append(" 项)\n\n");
            for (Finding f : entry.getValue()) {
                md.append("**[").append(f.getSeverity().name()).append("]** `")
                        .append(escapeInlineCode(f.getRuleId())).append("`\n");
                if (f.getLine() != null) {
                    md.append("- **位置:** 行 ").append(f.getLine())
                            .append(", 偏移 ").append(f.getLocation()).append("\n");
                }
                md.append("- **说明:** ").append(orEmpty(f.getMessage())).append("\n");
                if (notBlank(f.getSuggestion())) {
                    md.append("- **修复建议:** ").append(f.getSuggestion()).append("\n");
                }
                md.append("\n");
            }
        }
        return md.toString();
    }

    private String summaryLine(ValidationResult result) {
        String verdict = result.isValid() ? "✓ SQL 校验通过" : "✗ SQL 校验失败";
        return verdict + "（错误 " + result.getErrorCount()
                + "，警告 " + result.getWarningCount()
                + "，提示 " + result.getInfoCount() + "）";
    }

    private String escapeInlineCode(String text) {
        return orEmpty(text).replace("`", "\\`");
    }

    private String orEmpty(String text) {
        return text == null ? "" : text;
    }

    private boolean notBlank(String text) {
        return text != null && !text.isBlank();
    }

    private String fileTs() {
        return LocalDateTime.now().format(FILE_TS);
    }

    public record ExportPayload(String filename, String contentType, byte[] content) {
    }
}
