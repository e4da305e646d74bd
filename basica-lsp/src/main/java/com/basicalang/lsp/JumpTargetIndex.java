package com.basicalang.lsp;

import java.util.*;

/**
 * 行号索引
 *
 * <p>BASIC 行号到物理行的映射（重复行号取第一次出现），以及 GOTO / GOSUB / THEN / RESTORE
 * 之后（含 {@code ON ... GOTO a, b, c} 列表）的全部跳转引用。每次查询重新构建。</p>
 */
final class JumpTargetIndex {

    private static final String[] TRIGGER_KEYWORDS = {"GOTO", "GOSUB", "THEN", "RESTORE"};

    /** 一处跳转引用 */
    static final class JumpReference {
        final int row;
        final int startColumn;
        final int endColumn;
        final int target;
        /** 触发关键词（大写） */
        final String keyword;

        JumpReference(int row, int startColumn, int endColumn, int target, String keyword) {
            this.row = row;
            this.startColumn = startColumn;
            this.endColumn = endColumn;
            this.target = target;
            this.keyword = keyword;
        }
    }

    private final Map<Integer, Integer> lineRows;
    private final List<JumpReference> references;

    private JumpTargetIndex(Map<Integer, Integer> lineRows, List<JumpReference> references) {
        this.lineRows = lineRows;
        this.references = references;
    }

    static JumpTargetIndex build(List<SourceLine> lines) {
        Map<Integer, Integer> lineRows = new LinkedHashMap<>();
        List<JumpReference> references = new ArrayList<>();
        for (SourceLine line : lines) {
            if (line.hasLineNumber()) {
                lineRows.putIfAbsent(line.lineNumber, line.row);
            }
            collectReferences(line, references);
        }
        return new JumpTargetIndex(lineRows, references);
    }

    private static void collectReferences(SourceLine line, List<JumpReference> out) {
        String code = line.code;
        for (String keyword : TRIGGER_KEYWORDS) {
            int idx = LspTextUtils.indexOfWord(code, keyword, 0);
            while (idx >= 0) {
                int after = idx + keyword.length();
                if (after < code.length() && code.charAt(after) == ' ') {
                    collectTargets(line.row, code, after + 1, keyword, out);
                }
                idx = LspTextUtils.indexOfWord(code, keyword, after);
            }
        }
    }

    /**
     * 读取关键词之后以逗号分隔的行号列表，遇到不是整数的项即停止
     */
    private static void collectTargets(int row, String code, int from, String keyword,
                                       List<JumpReference> out) {
        int pos = from;
        while (pos <= code.length()) {
            int start = LspTextUtils.skipWhitespace(code, pos);
            int end = start;
            while (end < code.length() && LspTextUtils.isAsciiDigit(code.charAt(end))) end++;
            if (end == start) return;
            if (end < code.length() && (LspTextUtils.isWordChar(code.charAt(end)) || code.charAt(end) == '.')) return;

            int target = LspTextUtils.parseLineNumber(code.substring(start, end));
            if (target < 0) return;
            out.add(new JumpReference(row, start, end, target, keyword));

            int next = LspTextUtils.skipWhitespace(code, end);
            if (next >= code.length() || code.charAt(next) != ',') return;
            pos = next + 1;
        }
    }

    // ============ 查询 ============

    /**
     * 行号所在的物理行，未定义返回 -1
     */
    int rowOf(int lineNumber) {
        Integer row = lineRows.get(lineNumber);
        return row != null ? row : -1;
    }

    boolean isDefined(int lineNumber) {
        return lineRows.containsKey(lineNumber);
    }

    List<JumpReference> references() {
        return Collections.unmodifiableList(references);
    }

    List<JumpReference> referencesTo(int lineNumber) {
        List<JumpReference> result = new ArrayList<>();
        for (JumpReference ref : references) {
            if (ref.target == lineNumber) result.add(ref);
        }
        return result;
    }

    /** 所有被跳转到的行号 */
    Set<Integer> targets() {
        Set<Integer> result = new HashSet<>();
        for (JumpReference ref : references) result.add(ref.target);
        return result;
    }

    /** GOSUB（含 ON ... GOSUB）调用的行号 */
    Set<Integer> gosubTargets() {
        Set<Integer> result = new HashSet<>();
        for (JumpReference ref : references) {
            if ("GOSUB".equals(ref.keyword)) result.add(ref.target);
        }
        return result;
    }
}
