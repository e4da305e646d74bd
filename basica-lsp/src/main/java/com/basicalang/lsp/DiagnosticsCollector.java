package com.basicalang.lsp;

import com.basicalang.compiler.lexer.Lexer;
import com.basicalang.compiler.parser.ParseResult;
import com.basicalang.compiler.parser.Parser;
import com.google.gson.JsonArray;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.basicalang.lsp.LspConstants.*;

/**
 * 诊断收集器
 *
 * <p>先交给语法校验器；有语法错误时只报告这一条。语法正确时依次检查未定义变量、未使用变量、
 * 不可达代码和未定义的跳转目标。</p>
 */
final class DiagnosticsCollector {

    static final String SOURCE = "basica";

    private static final String LINE_PREFIX = "Line ";
    private static final String AT_LINE = "at line ";

    private final BasicaSettings settings;

    DiagnosticsCollector(BasicaSettings settings) {
        this.settings = settings;
    }

    JsonArray collect(String content) {
        JsonArray diagnostics = new JsonArray();
        List<SourceLine> lines = SourceLine.parse(content);
        JumpTargetIndex jumps = JumpTargetIndex.build(lines);

        ParseResult result = new Parser(new Lexer(content)).parse();
        if (!result.isSuccess()) {
            addSyntaxError(diagnostics, result.getErrorMessage(), lines, jumps);
            return diagnostics;
        }

        VariableIndex variables = VariableIndex.build(lines);
        if (settings.isUndefinedVariableWarnings()) {
            checkUndefinedVariables(diagnostics, variables);
        }
        if (settings.isUnusedVariableHints()) {
            checkUnusedVariables(diagnostics, variables);
        }
        if (settings.isUnreachableCodeHints()) {
            checkUnreachableCode(diagnostics, lines, jumps);
        }
        checkUndefinedLines(diagnostics, jumps);
        return diagnostics;
    }

    // ============ 语法错误 ============

    private void addSyntaxError(JsonArray diagnostics, String errorMessage,
                                List<SourceLine> lines, JumpTargetIndex jumps) {
        int row = locateSyntaxError(errorMessage, jumps, lines.size());
        int length = row < lines.size() ? lines.get(row).length() : 0;
        diagnostics.add(LspJson.createDiagnostic(
                LspJson.createRange(row, 0, row, length), SEVERITY_ERROR, syntaxErrorMessage(errorMessage)));
    }

    /**
     * 错误所在物理行：{@code Line N: ...} 按行号索引查找，{@code ... at line R} 取第 R 行（1-based），
     * 都不匹配时为 0
     */
    static int locateSyntaxError(String message, JumpTargetIndex jumps, int lineCount) {
        int lineNumber = leadingLineNumber(message);
        if (lineNumber >= 0) {
            int row = jumps.rowOf(lineNumber);
            return row >= 0 ? row : 0;
        }
        int idx = message.indexOf(AT_LINE);
        if (idx >= 0) {
            int start = idx + AT_LINE.length();
            int end = start;
            while (end < message.length() && LspTextUtils.isAsciiDigit(message.charAt(end))) end++;
            int physical = LspTextUtils.parseLineNumber(message.substring(start, end));
            if (physical >= 1 && physical <= lineCount) {
                return physical - 1;
            }
        }
        return 0;
    }

    /**
     * {@code Line N: rest} 只保留 rest，其余格式原样返回
     */
    static String syntaxErrorMessage(String message) {
        if (leadingLineNumber(message) < 0) return message;
        return message.substring(message.indexOf(':') + 1).trim();
    }

    private static int leadingLineNumber(String message) {
        if (!message.startsWith(LINE_PREFIX)) return -1;
        int colon = message.indexOf(':', LINE_PREFIX.length());
        if (colon < 0) return -1;
        return LspTextUtils.parseLineNumber(message.substring(LINE_PREFIX.length(), colon).trim());
    }

    // ============ 变量 ============

    private void checkUndefinedVariables(JsonArray diagnostics, VariableIndex variables) {
        for (Map.Entry<String, List<VariableIndex.Site>> entry : variables.usages().entrySet()) {
            String name = entry.getKey();
            if (variables.isDeclared(name) || BasicCatalog.isBuiltinVariable(name)) continue;
            for (VariableIndex.Site site : entry.getValue()) {
                diagnostics.add(LspJson.createDiagnostic(
                        LspJson.createRange(site.row, site.startColumn, site.row, site.endColumn),
                        SEVERITY_WARNING, "Variable '" + name + "' may not be defined"));
            }
        }
    }

    private void checkUnusedVariables(JsonArray diagnostics, VariableIndex variables) {
        for (Map.Entry<String, List<VariableIndex.Site>> entry : variables.declarations().entrySet()) {
            String name = entry.getKey();
            if (variables.isUsed(name)) continue;
            VariableIndex.Site site = entry.getValue().get(0);
            diagnostics.add(LspJson.createDiagnostic(
                    LspJson.createRange(site.row, site.startColumn, site.row, site.endColumn),
                    SEVERITY_HINT, "Variable '" + name + "' is defined but never used",
                    DIAGNOSTIC_TAG_UNNECESSARY));
        }
    }

    // ============ 不可达代码 ============

    /**
     * END / STOP / RETURN / 无条件 GOTO 之后到下一个被跳转到的行之前为不可达区域；
     * 文末仍未关闭的区域不报告
     */
    private void checkUnreachableCode(JsonArray diagnostics, List<SourceLine> lines, JumpTargetIndex jumps) {
        Set<Integer> targets = jumps.targets();
        int regionStart = -1;
        for (SourceLine line : lines) {
            if (regionStart >= 0 && line.hasLineNumber() && targets.contains(line.lineNumber)) {
                int end = line.row - 1;
                if (end >= regionStart) {
                    diagnostics.add(LspJson.createDiagnostic(
                            LspJson.createRange(regionStart, 0, end, lines.get(end).length()),
                            SEVERITY_HINT, "Unreachable code", DIAGNOSTIC_TAG_UNNECESSARY));
                }
                regionStart = -1;
            }

            String statement = line.statementCode();
            if (statement.isEmpty()) continue;

            if (regionStart < 0 && isTerminator(statement, line.code)) {
                regionStart = line.row + 1;
            }
        }
    }

    private static boolean isTerminator(String statement, String code) {
        if ("END".equals(statement) || "STOP".equals(statement) || "RETURN".equals(statement)) {
            return true;
        }
        // IF / ON 按整词匹配，DIF、ELSEIF 之类的标识符不算
        return statement.startsWith("GOTO ")
                && !LspTextUtils.containsWord(code, "IF") && !LspTextUtils.containsWord(code, "ON");
    }

    // ============ 跳转目标 ============

    private void checkUndefinedLines(JsonArray diagnostics, JumpTargetIndex jumps) {
        for (JumpTargetIndex.JumpReference ref : jumps.references()) {
            if (jumps.isDefined(ref.target)) continue;
            diagnostics.add(LspJson.createDiagnostic(
                    LspJson.createRange(ref.row, ref.startColumn, ref.row, ref.endColumn),
                    SEVERITY_ERROR, "Line " + ref.target + " is not defined"));
        }
    }
}
