package com.basicalang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import static com.basicalang.lsp.LspConstants.*;

/**
 * 折叠区域
 *
 * <p>FOR / WHILE / DO / SELECT / 块 IF 各用一个栈配对，按子语句匹配开闭关键词；
 * GOSUB 目标行到下一个 RETURN 为子程序区域；连续注释行和连续 DATA 行各合并为一块。</p>
 */
final class FoldingRangeCollector {

    private static final String CONSTRUCT_TEXT = "...";
    private static final String COMMENT_TEXT = "REM...";
    private static final String DATA_TEXT = "DATA...";

    private final Deque<Integer> forStack = new ArrayDeque<>();
    private final Deque<Integer> whileStack = new ArrayDeque<>();
    private final Deque<Integer> doStack = new ArrayDeque<>();
    private final Deque<Integer> selectStack = new ArrayDeque<>();
    private final Deque<Integer> ifStack = new ArrayDeque<>();

    private final JsonArray result = new JsonArray();

    private FoldingRangeCollector() {}

    static JsonArray collect(String content) {
        List<SourceLine> lines = SourceLine.parse(content);
        FoldingRangeCollector collector = new FoldingRangeCollector();
        collector.collectConstructs(lines);
        collector.collectSubroutines(lines, JumpTargetIndex.build(lines).gosubTargets());
        collector.collectBlocks(lines);
        return collector.result;
    }

    // ============ 控制结构 ============

    private void collectConstructs(List<SourceLine> lines) {
        for (SourceLine line : lines) {
            for (LspTextUtils.Statement statement : line.statements()) {
                matchStatement(line.row, statement.text);
            }
        }
        // 未闭合的开启行直接丢弃
    }

    private void matchStatement(int row, String text) {
        if (LspTextUtils.startsWithWord(text, "FOR")) {
            forStack.push(row);
        } else if (LspTextUtils.startsWithWord(text, "NEXT")) {
            // NEXT I, J 依次关闭两层
            int count = LspTextUtils.splitTopLevelCommas(text, 4).size();
            for (int i = 0; i < count; i++) close(forStack, row);
        } else if (LspTextUtils.startsWithWord(text, "WHILE")) {
            whileStack.push(row);
        } else if (LspTextUtils.startsWithWord(text, "WEND")) {
            close(whileStack, row);
        } else if (LspTextUtils.startsWithWord(text, "DO")) {
            doStack.push(row);
        } else if (LspTextUtils.startsWithWord(text, "LOOP")) {
            close(doStack, row);
        } else if (startsWithWords(text, "SELECT", "CASE")) {
            selectStack.push(row);
        } else if (startsWithWords(text, "END", "SELECT")) {
            close(selectStack, row);
        } else if (startsWithWords(text, "END", "IF") || LspTextUtils.startsWithWord(text, "ENDIF")) {
            close(ifStack, row);
        } else if (LspTextUtils.startsWithWord(text, "IF") && opensBlock(text)) {
            ifStack.push(row);
        }
    }

    /** THEN 之后没有任何内容才是块 IF */
    private static boolean opensBlock(String text) {
        int then = LspTextUtils.indexOfWord(text, "THEN", 0);
        return then >= 0 && text.substring(then + 4).trim().isEmpty();
    }

    private static boolean startsWithWords(String text, String first, String second) {
        if (!LspTextUtils.startsWithWord(text, first)) return false;
        int pos = LspTextUtils.skipWhitespace(text, first.length());
        return pos > first.length() && LspTextUtils.startsWithWord(text.substring(pos), second);
    }

    private void close(Deque<Integer> stack, int row) {
        if (stack.isEmpty()) return;
        int start = stack.pop();
        if (start < row) {
            addFoldingRange(start, row, FOLDING_REGION, CONSTRUCT_TEXT);
        }
    }

    // ============ 子程序 ============

    private void collectSubroutines(List<SourceLine> lines, Set<Integer> gosubTargets) {
        int start = -1;
        for (SourceLine line : lines) {
            if (line.hasLineNumber() && gosubTargets.contains(line.lineNumber)) {
                if (start >= 0 && line.row - 1 > start) {
                    addFoldingRange(start, line.row - 1, FOLDING_REGION, CONSTRUCT_TEXT);
                }
                start = line.row;
            }
            String code = line.statementCode();
            if (start >= 0 && LspTextUtils.containsWord(code, "RETURN") && !LspTextUtils.containsWord(code, "GOSUB")) {
                if (line.row > start) {
                    addFoldingRange(start, line.row, FOLDING_REGION, CONSTRUCT_TEXT);
                }
                start = -1;
            }
        }
    }

    // ============ 注释块 / DATA 块 ============

    private void collectBlocks(List<SourceLine> lines) {
        int commentStart = -1;
        int dataStart = -1;
        for (SourceLine line : lines) {
            if (line.isComment()) {
                if (commentStart < 0) commentStart = line.row;
            } else {
                closeBlock(commentStart, line.row - 1, FOLDING_COMMENT, COMMENT_TEXT);
                commentStart = -1;
            }
            if (LspTextUtils.startsWithWord(line.statementCode(), "DATA")) {
                if (dataStart < 0) dataStart = line.row;
            } else {
                closeBlock(dataStart, line.row - 1, FOLDING_REGION, DATA_TEXT);
                dataStart = -1;
            }
        }
        int last = lines.size() - 1;
        closeBlock(commentStart, last, FOLDING_COMMENT, COMMENT_TEXT);
        closeBlock(dataStart, last, FOLDING_REGION, DATA_TEXT);
    }

    private void closeBlock(int start, int end, String kind, String collapsedText) {
        if (start >= 0 && end > start) {
            addFoldingRange(start, end, kind, collapsedText);
        }
    }

    private void addFoldingRange(int startLine, int endLine, String kind, String collapsedText) {
        JsonObject range = new JsonObject();
        range.addProperty("startLine", startLine);
        range.addProperty("endLine", endLine);
        range.addProperty("kind", kind);
        range.addProperty("collapsedText", collapsedText);
        result.add(range);
    }
}
