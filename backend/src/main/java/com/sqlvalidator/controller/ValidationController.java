package com.sqlvalidator.controller;

import com.sqlvalidator.config.ValidatorProperties;
import com.sqlvalidator.model.CheckerDescriptor;
import com.sqlvalidator.model.ScriptRequest;
import com.sqlvalidator.model.ScriptValidationReport;
import com.sqlvalidator.model.ValidateRequest;
import com.sqlvalidator.model.ValidationOptions;
import com.sqlvalidator.model.ValidationResult;
import com.sqlvalidator.rule.CheckerRegistry;
import com.sqlvalidator.service.ReportExportService;
import com.sqlvalidator.service.ScriptValidationService;
import com.sqlvalidator.service.SqlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * SQL 校验 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ValidationController {

    private static final Logger log = LoggerFactory.getLogger(ValidationController.class);

    private final SqlValidator sqlValidator;
    private final ScriptValidationService scriptValidationService;
    private final ReportExportService reportExportService;
    private final CheckerRegistry checkerRegistry;
    private final ValidatorProperties properties;

    public ValidationController(SqlValidator sqlValidator, ScriptValidationService scriptValidationService,
                                ReportExportService reportExportService, CheckerRegistry checkerRegistry,
                                ValidatorProperties properties) {
        this.sqlValidator = sqlValidator;
        this.scriptValidationService = scriptValidationService;
        this.reportExportService = reportExportService;
        this.checkerRegistry = checkerRegistry;
        this.properties = properties;
    }

    /**
     * 校验单条 SQL
     */
    @PostMapping("/validate")
    public ResponseEntity<?> validate(@RequestBody ValidateRequest request) {
        if (request == null || request.getSql() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供待校验的 SQL (sql)"));
        }
        try {
            ValidationResult result = sqlValidator.validate(request.getSql(), options(request.getCheckExistence()));
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            log.error("SQL 校验失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "校验过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 校验单条 SQL，返回文本报告
     */
    @PostMapping("/validate/report")
    public ResponseEntity<?> validateReport(@RequestBody ValidateRequest request) {
        if (request == null || request.getSql() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供待校验的 SQL (sql)"));
        }
        try {
            ValidationResult result = sqlValidator.validate(request.getSql(), options(request.getCheckExistence()));
            return ResponseEntity.ok()
                    .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                    .body(reportExportService.renderText(result));
        } catch (Exception e) {
            log.error("SQL 校验失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "校验过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 拆分并逐条校验 SQL 脚本
     */
    @PostMapping("/validate/script")
    public ResponseEntity<?> validateScript(@RequestBody ScriptRequest request) {
        if (request == null || request.getScript() == null || request.getScript().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "请提供 SQL 脚本内容 (script)"));
        }
        try {
            log.info("收到脚本校验请求: {}", request.getName());
            ScriptValidationReport report = scriptValidationService.validateScript(
                    request.getScript(), request.getName(), options(request.getCheckExistence()));
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("SQL 脚本校验失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "校验过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 导出校验结果
     */
    @PostMapping("/report/export/{format}")
    public ResponseEntity<?> exportReport(@PathVariable String format,
                                          @RequestBody(required = false) ValidationResult result) {
        if (result == null || result.getFindings() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "请在请求体中提供校验结果"));
        }
        try {
            ReportExportService.ExportPayload payload;
            if ("markdown".equalsIgnoreCase(format)) {
                payload = reportExportService.exportMarkdown(result);
            } else if ("json".equalsIgnoreCase(format)) {
                payload = reportExportService.exportJson(result);
            } else {
                return ResponseEntity.badRequest().body(Map.of("error", "不支持的导出格式: " + format));
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentLength(payload.content().length);
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (Exception e) {
            log.error("导出报告失败, format={}", format, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "导出失败: " + e.getMessage()));
        }
    }

    /**
     * 按执行顺序列出已注册的检查器
     */
    @GetMapping("/checkers")
    public ResponseEntity<List<CheckerDescriptor>> checkers() {
        return ResponseEntity.ok(checkerRegistry.describe());
    }

    private ValidationOptions options(Boolean checkExistence) {
        boolean check = checkExistence != null ? checkExistence : properties.isCheckExistence();
        return ValidationOptions.builder().checkExistence(check).build();
    }
}
