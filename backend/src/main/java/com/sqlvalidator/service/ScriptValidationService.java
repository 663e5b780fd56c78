package com.sqlvalidator.service;

import com.sqlvalidator.model.ScriptValidationReport;
import com.sqlvalidator.model.ScriptValidationReport.StatementResult;
import com.sqlvalidator.model.SqlStatement;
import com.sqlvalidator.model.ValidationOptions;
import com.sqlvalidator.model.ValidationResult;
import com.sqlvalidator.parser.SqlScriptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * SQL 脚本校验服务：拆分脚本后逐条校验
 */
@Service
public class ScriptValidationService {

    private static final Logger log = LoggerFactory.getLogger(ScriptValidationService.class);

    private final SqlScriptParser sqlScriptParser;
    private final SqlValidator sqlValidator;

    public ScriptValidationService(SqlScriptParser sqlScriptParser, SqlValidator sqlValidator) {
        this.sqlScriptParser = sqlScriptParser;
        this.sqlValidator = sqlValidator;
    }

    public ScriptValidationReport validateScript(String script, String scriptName) {
        return validateScript(script, scriptName, ValidationOptions.defaults());
    }

    public ScriptValidationReport validateScript(String script, String scriptName, ValidationOptions options) {
        String name = scriptName == null || scriptName.isBlank() ? "script.sql" : scriptName;
        log.info("开始校验 SQL 脚本: {}", name);

        List<SqlStatement> statements = sqlScriptParser.parse(script, name);
        List<StatementResult> results = new ArrayList<>();
        int errors = 0;
        int warnings = 0;
        int infos = 0;
        for (SqlStatement statement : statements) {
            ValidationResult result = sqlValidator.validate(statement.getSqlText(), options);
            errors += result.getErrorCount();
            warnings += result.getWarningCount();
            infos += result.getInfoCount();
            results.add(StatementResult.builder()
                    .statement(statement)
                    .result(result)
                    .build());
        }
        log.info("脚本 {} 校验完成: {} 条语句, 错误 {}, 警告 {}, 提示 {}",
                name, statements.size(), errors, warnings, infos);

        return ScriptValidationReport.builder()
                .scriptName(name)
                .validatedAt(LocalDateTime.now())
                .totalStatements(statements.size())
                .errorCount(errors)
                .warningCount(warnings)
                .infoCount(infos)
                .valid(errors == 0)
                .statements(results)
                .build();
    }
}
