package com.basicalang.lsp;

import java.util.*;

/**
 * 变量符号索引
 *
 * <p>逐行按 {@code :} 切分子语句，先匹配声明形式（DIM、FOR、INPUT / LINE INPUT、READ、LET、
 * 隐式赋值），再逐个扫描标识符记录使用点。变量名大写，{@code $} 后缀属于名字的一部分；
 * 所有变量都是文档全局的。</p>
 */
final class VariableIndex {

    /** 声明 / 使用点的种类，声明种类的顺序即跳转定义时的优先级 */
    enum SiteKind {
        DIM,
        ASSIGNMENT,
        FOR,
        INPUT,
        READ,
        USAGE
    }

    /** 一处声明或使用 */
    static final class Site {
        final String name;
        final int row;
        final int startColumn;
        final int endColumn;
        final SiteKind kind;

        Site(String name, int row, int startColumn, int endColumn, SiteKind kind) {
            this.name = name;
            this.row = row;
            this.startColumn = startColumn;
            this.endColumn = endColumn;
            this.kind = kind;
        }
    }

    /** 以这些词开头的子语句不按隐式赋值处理 */
    private static final Set<String> NON_ASSIGNMENT_STARTS = new HashSet<String>(Arrays.asList(
            "IF", "PRINT", "GOTO", "GOSUB"));

    private final Map<String, List<Site>> declarations = new LinkedHashMap<>();
    private final Map<String, List<Site>> usages = new LinkedHashMap<>();

    private VariableIndex() {}

    static VariableIndex build(List<SourceLine> lines) {
        VariableIndex index = new VariableIndex();
        for (SourceLine line : lines) {
            for (LspTextUtils.Statement statement : line.statements()) {
                Set<Integer> declared = new HashSet<>();
                index.collectDeclarations(line.row, statement, declared);
                index.collectUsages(line.row, statement, declared);
            }
        }
        return index;
    }

    // ============ 声明 ============

    private void collectDeclarations(int row, LspTextUtils.Statement statement, Set<Integer> declared) {
        String text = statement.text;
        int base = statement.start;

        if (LspTextUtils.startsWithWord(text, "DIM")) {
            for (int itemStart : LspTextUtils.splitTopLevelCommas(text, 3)) {
                int pos = LspTextUtils.skipWhitespace(text, itemStart);
                if (LspTextUtils.startsWithWord(text.substring(pos), "SHARED")) {
                    pos = LspTextUtils.skipWhitespace(text, pos + 6);
                }
                declare(row, text, base, pos, SiteKind.DIM, declared);
            }
        } else if (LspTextUtils.startsWithWord(text, "FOR")) {
            int pos = LspTextUtils.skipWhitespace(text, 3);
            int end = LspTextUtils.scanIdentifier(text, pos);
            int eq = LspTextUtils.skipWhitespace(text, end);
            if (end > pos && eq < text.length() && text.charAt(eq) == '=') {
                declare(row, text, base, pos, SiteKind.FOR, declared);
            }
        } else if (LspTextUtils.startsWithWord(text, "INPUT")) {
            collectInputTargets(row, text, base, 5, declared);
        } else if (LspTextUtils.startsWithWord(text, "LINE")) {
            int pos = LspTextUtils.skipWhitespace(text, 4);
            if (LspTextUtils.startsWithWord(text.substring(pos), "INPUT")) {
                collectInputTargets(row, text, base, pos + 5, declared);
            }
        } else if (LspTextUtils.startsWithWord(text, "READ")) {
            for (int itemStart : LspTextUtils.splitTopLevelCommas(text, 4)) {
                declare(row, text, base, LspTextUtils.skipWhitespace(text, itemStart), SiteKind.READ, declared);
            }
        } else if (LspTextUtils.startsWithWord(text, "LET")) {
            int pos = LspTextUtils.skipWhitespace(text, 3);
            declare(row, text, base, pos, SiteKind.ASSIGNMENT, declared);
        } else {
            collectImplicitAssignment(row, text, base, declared);
        }
    }

    /**
     * INPUT 目标列表：跳过 {@code #n,} 文件号，或 {@code "prompt";} 提示串
     */
    private void collectInputTargets(int row, String text, int base, int from, Set<Integer> declared) {
        int pos = LspTextUtils.skipWhitespace(text, from);
        if (pos < text.length() && text.charAt(pos) == ';') {
            pos = LspTextUtils.skipWhitespace(text, pos + 1);
        }
        if (pos < text.length() && text.charAt(pos) == '#') {
            int comma = text.indexOf(',', pos);
            if (comma < 0) return;
            pos = comma + 1;
        } else if (pos < text.length() && text.charAt(pos) == '"') {
            pos = LspTextUtils.skipWhitespace(text, LspTextUtils.scanString(text, pos));
            if (pos < text.length() && (text.charAt(pos) == ';' || text.charAt(pos) == ',')) pos++;
        }
        for (int itemStart : LspTextUtils.splitTopLevelCommas(text, pos)) {
            declare(row, text, base, LspTextUtils.skipWhitespace(text, itemStart), SiteKind.INPUT, declared);
        }
    }

    /**
     * {@code NAME = expr} / {@code NAME(I) = expr}：等号左侧（括号外）不含空格
     */
    private void collectImplicitAssignment(int row, String text, int base, Set<Integer> declared) {
        int firstEnd = LspTextUtils.scanIdentifier(text, 0);
        if (firstEnd == 0) return;
        if (NON_ASSIGNMENT_STARTS.contains(text.substring(0, firstEnd))) return;

        int eq = text.indexOf('=');
        if (eq <= 0) return;
        String target = text.substring(0, eq).trim();
        int depth = 0;
        for (int i = 0; i < target.length(); i++) {
            char c = target.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == ' ' && depth == 0) return;
        }
        declare(row, text, base, 0, SiteKind.ASSIGNMENT, declared);
    }

    private void declare(int row, String text, int base, int pos, SiteKind kind, Set<Integer> declared) {
        int end = LspTextUtils.scanIdentifier(text, pos);
        if (end == pos) return;
        String name = text.substring(pos, end);
        if (!isVariableName(name)) return;
        int column = base + pos;
        if (!declared.add(column)) return;
        declarations.computeIfAbsent(name, k -> new ArrayList<>())
                .add(new Site(name, row, column, base + end, kind));
    }

    // ============ 使用 ============

    private void collectUsages(int row, LspTextUtils.Statement statement, Set<Integer> declared) {
        String text = statement.text;
        int base = statement.start;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"') {
                i = LspTextUtils.scanString(text, i);
            } else if (LspTextUtils.isNumberStart(text, i)) {
                i = LspTextUtils.scanNumber(text, i);
            } else if (LspTextUtils.isAsciiLetter(c)) {
                int end = LspTextUtils.scanIdentifier(text, i);
                String name = text.substring(i, end);
                if (isVariableName(name) && !declared.contains(base + i)) {
                    usages.computeIfAbsent(name, k -> new ArrayList<>())
                            .add(new Site(name, row, base + i, base + end, SiteKind.USAGE));
                }
                i = end;
            } else {
                i++;
            }
        }
    }

    /** 关键词和内置函数之外的标识符都是变量 */
    private static boolean isVariableName(String name) {
        return !BasicCatalog.isKeyword(name) && !BasicCatalog.isFunction(name);
    }

    // ============ 查询 ============

    Map<String, List<Site>> declarations() {
        return Collections.unmodifiableMap(declarations);
    }

    Map<String, List<Site>> usages() {
        return Collections.unmodifiableMap(usages);
    }

    boolean isDeclared(String name) {
        return declarations.containsKey(name);
    }

    boolean isUsed(String name) {
        return usages.containsKey(name);
    }

    /**
     * 首个声明点：行号最小者，同一行按 DIM、赋值、FOR、INPUT / READ 的顺序
     */
    Site firstDeclaration(String name) {
        List<Site> sites = declarations.get(name);
        if (sites == null || sites.isEmpty()) return null;
        Site best = sites.get(0);
        for (Site site : sites) {
            if (site.row < best.row || (site.row == best.row && site.kind.ordinal() < best.kind.ordinal())) {
                best = site;
            }
        }
        return best;
    }
}
