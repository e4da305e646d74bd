package com.basicalang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * 跳转定义、查找引用与重命名
 *
 * <p>数字单词按行号处理，其余非关键词单词按变量处理。</p>
 */
final class NavigationProvider {

    private static final String[] JUMP_KEYWORDS = {"GOTO", "GOSUB", "RESTORE", "THEN"};

    // ============ 跳转定义 ============

    JsonObject goToDefinition(String uri, String content, int line, int character) {
        List<SourceLine> lines = SourceLine.parse(content);
        if (line < 0 || line >= lines.size()) return null;
        SourceLine sourceLine = lines.get(line);
        LspTextUtils.WordSpan word = LspTextUtils.wordAt(sourceLine.text, character);
        if (word == null) return null;
        String upper = LspTextUtils.toUpperAscii(word.text);

        int lineNumber = LspTextUtils.parseLineNumber(upper);
        if (lineNumber >= 0 && mentionsJump(sourceLine.code)) {
            int row = JumpTargetIndex.build(lines).rowOf(lineNumber);
            if (row < 0) return null;
            return LspJson.createLocation(uri, row, 0, 0);
        }
        if (BasicCatalog.isKeyword(upper)) return null;

        VariableIndex.Site site = VariableIndex.build(lines).firstDeclaration(upper);
        if (site == null) return null;
        return LspJson.createLocation(uri, site.row, site.startColumn, site.endColumn);
    }

    private static boolean mentionsJump(String code) {
        for (String keyword : JUMP_KEYWORDS) {
            if (LspTextUtils.containsWord(code, keyword)) return true;
        }
        return false;
    }

    // ============ 查找引用 ============

    JsonArray findReferences(String uri, String content, int line, int character) {
        JsonArray result = new JsonArray();
        List<SourceLine> lines = SourceLine.parse(content);
        if (line < 0 || line >= lines.size()) return result;
        LspTextUtils.WordSpan word = LspTextUtils.wordAt(lines.get(line).text, character);
        if (word == null) return result;
        String upper = LspTextUtils.toUpperAscii(word.text);

        int lineNumber = LspTextUtils.parseLineNumber(upper);
        if (lineNumber >= 0) {
            for (SourceLine sourceLine : lines) {
                if (sourceLine.lineNumber == lineNumber) {
                    result.add(LspJson.createLocation(uri, sourceLine.row, sourceLine.numberStart, sourceLine.numberEnd));
                }
            }
            for (JumpTargetIndex.JumpReference ref : JumpTargetIndex.build(lines).referencesTo(lineNumber)) {
                result.add(LspJson.createLocation(uri, ref.row, ref.startColumn, ref.endColumn));
            }
            return result;
        }
        if (BasicCatalog.isKeyword(upper) || BasicCatalog.isFunction(upper)) return result;

        for (SourceLine sourceLine : lines) {
            for (int[] span : findOccurrences(sourceLine.text, upper)) {
                result.add(LspJson.createLocation(uri, sourceLine.row, span[0], span[1]));
            }
        }
        return result;
    }

    // ============ 重命名 ============

    JsonObject prepareRename(String content, int line, int character) {
        List<String> lines = LspTextUtils.splitLines(content);
        if (line < 0 || line >= lines.size()) return null;
        LspTextUtils.WordSpan word = renameableWordAt(lines.get(line), character);
        if (word == null) return null;
        return LspJson.createRange(line, word.start, line, word.end);
    }

    JsonObject rename(String uri, String content, int line, int character, String newName) {
        List<String> lines = LspTextUtils.splitLines(content);
        if (line < 0 || line >= lines.size()) return null;
        LspTextUtils.WordSpan word = renameableWordAt(lines.get(line), character);
        if (word == null || newName == null) return null;

        String newBase = LspTextUtils.stripDollar(newName.trim());
        if (newBase.isEmpty()) return null;
        String base = LspTextUtils.stripDollar(LspTextUtils.toUpperAscii(word.text));

        JsonArray edits = new JsonArray();
        for (int row = 0; row < lines.size(); row++) {
            for (int[] span : findOccurrences(lines.get(row), base)) {
                boolean hasDollar = span[1] - span[0] > base.length();
                JsonObject edit = new JsonObject();
                edit.add("range", LspJson.createRange(row, span[0], row, span[1]));
                edit.addProperty("newText", hasDollar ? newBase + "$" : newBase);
                edits.add(edit);
            }
        }
        if (edits.size() == 0) return null;

        JsonObject changes = new JsonObject();
        changes.add(uri, edits);
        JsonObject workspaceEdit = new JsonObject();
        workspaceEdit.add("changes", changes);
        return workspaceEdit;
    }

    /** 行号和关键词不可重命名 */
    private static LspTextUtils.WordSpan renameableWordAt(String lineText, int character) {
        LspTextUtils.WordSpan word = LspTextUtils.wordAt(lineText, character);
        if (word == null) return null;
        String upper = LspTextUtils.toUpperAscii(word.text);
        if (LspTextUtils.isNumeric(upper) || BasicCatalog.isKeyword(upper)) return null;
        if (LspTextUtils.stripDollar(upper).isEmpty()) return null;
        return word;
    }

    // ============ 整词匹配 ============

    /**
     * 行内大小写不敏感的整词出现位置；紧跟的 {@code $} 算作出现的一部分
     *
     * @return 每项为 {start, end}
     */
    static List<int[]> findOccurrences(String lineText, String upperName) {
        List<int[]> result = new ArrayList<>();
        if (upperName.isEmpty()) return result;
        String upperLine = LspTextUtils.toUpperAscii(lineText);
        int from = 0;
        while (true) {
            int idx = upperLine.indexOf(upperName, from);
            if (idx < 0) break;
            from = idx + 1;
            if (idx > 0 && LspTextUtils.isWordChar(upperLine.charAt(idx - 1))) continue;
            int end = idx + upperName.length();
            if (end < upperLine.length()) {
                char next = upperLine.charAt(end);
                if (LspTextUtils.isIdentChar(next)) continue;
                if (next == '$' && !upperName.endsWith("$")) end++;
            }
            result.add(new int[]{idx, end});
        }
        return result;
    }
}
