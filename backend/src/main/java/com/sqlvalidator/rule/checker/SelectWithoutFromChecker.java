package com.sqlvalidator.rule.checker;

import com.sqlvalidator.model.Finding;
import com.sqlvalidator.model.Finding.Category;
import com.sqlvalidator.model.Finding.Severity;
import com.sqlvalidator.scanner.ScanContext;
import com.sqlvalidator.scanner.Token;
import com.sqlvalidator.scanner.TokenType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 检查顶层 SELECT 是否缺少 FROM 子句
 * <p>
 * {@code SELECT 1}、{@code SELECT now()} 这类纯表达式查询不需要 FROM，
 * 只有查询列表中出现列引用时才提示；含子查询的语句不做判断。
 */
@Component
@Order(130)
public class SelectWithoutFromChecker implements SqlChecker {

    @Override
    public String name() {
        return "SELECT_WITHOUT_FROM";
    }

    @Override
    public Category category() {
        return Category.SYNTAX;
    }

    @Override
    public String description() {
        return "引用了列的 SELECT 语句必须包含 FROM 子句";
    }

    @Override
    public List<Finding> check(ScanContext context, String sql) {
        if (!context.startsWith("SELECT") || context.hasKeywordAtDepth("FROM", 0) || context.hasSubquery()) {
            return List.of();
        }
        List<Token> tokens = context.tokens();
        for (int i = 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.depth() == 0 && (t.isKeyword("WHERE") || t.isKeyword("INTO"))) {
                break;
            }
            if (isColumnReference(context, i)) {
                return List.of(finding(Severity.WARNING, context, tokens.get(0).offset())
                        .message("SELECT 语句引用了列 '" + t.identifierName() + "'，但缺少 FROM 子句")
                        .suggestion("补充 FROM 子句指明数据来源表")
                        .build());
            }
        }
        return List.of();
    }

    private boolean isColumnReference(ScanContext context, int index) {
        Token t = context.tokenAt(index);
        if (!t.isIdentifier()) {
            return false;
        }
        String name = t.identifierName();
        if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        Token next = context.tokenAt(index + 1);
        if (next != null && next.isPunctuation('(')) {
            return false;
        }
        Token prev = context.tokenAt(index - 1);
        if (prev.isKeyword("AS") || prev.isOperator("::")) {
            return false;
        }
        // 紧跟在表达式之后的标识符是隐式别名
        return prev.type() != TokenType.IDENTIFIER
                && prev.type() != TokenType.STRING_LITERAL
                && prev.type() != TokenType.NUMERIC_LITERAL
                && !prev.isPunctuation(')');
    }
}
