package com.basicalang.lsp;

import com.google.gson.JsonArray;

import java.util.*;

/**
 * 语义令牌生成器
 *
 * <p>逐行从左到右扫描源码文本为 LSP 语义令牌（相对编码格式），不依赖语法树，
 * 语法错误的文档同样可以着色。</p>
 */
public class SemanticTokensBuilder {

    // === 令牌类型 ===
    private static final String[] TOKEN_TYPES = {
            "keyword",      // 0
            "function",     // 1
            "variable",     // 2
            "string",       // 3
            "number",       // 4
            "comment",      // 5
            "operator",     // 6
    };

    // === 令牌修饰符 ===
    private static final String[] TOKEN_MODIFIERS = {
            "declaration",  // 0 (bit 0)
            "definition",   // 1 (bit 1)
    };

    static final int TYPE_KEYWORD = 0;
    static final int TYPE_FUNCTION = 1;
    static final int TYPE_VARIABLE = 2;
    static final int TYPE_STRING = 3;
    static final int TYPE_NUMBER = 4;
    static final int TYPE_COMMENT = 5;
    static final int TYPE_OPERATOR = 6;

    static final int MOD_DECLARATION = 1;

    private static final String OPERATORS = "+-*/^=<>(),;:";

    public static JsonArray getTokenTypesJson() {
        JsonArray arr = new JsonArray();
        for (String t : TOKEN_TYPES) arr.add(t);
        return arr;
    }

    public static JsonArray getTokenModifiersJson() {
        JsonArray arr = new JsonArray();
        for (String m : TOKEN_MODIFIERS) arr.add(m);
        return arr;
    }

    /** 原始令牌条目（绝对位置） */
    private static class RawToken implements Comparable<RawToken> {
        final int line;      // 0-based
        final int startChar; // 0-based
        final int length;
        final int tokenType;
        final int modifiers;

        RawToken(int line, int startChar, int length, int tokenType, int modifiers) {
            this.line = line;
            this.startChar = startChar;
            this.length = length;
            this.tokenType = tokenType;
            this.modifiers = modifiers;
        }

        @Override
        public int compareTo(RawToken o) {
            int cmp = Integer.compare(this.line, o.line);
            return cmp != 0 ? cmp : Integer.compare(this.startChar, o.startChar);
        }
    }

    private final List<RawToken> tokens = new ArrayList<>();
    /** 变量声明点的 "row:column" */
    private final Set<String> declarationSites = new HashSet<>();

    private void addToken(int line, int startChar, int length, int tokenType, int modifiers) {
        if (length <= 0) return;
        tokens.add(new RawToken(line, startChar, length, tokenType, modifiers));
    }

    /**
     * 扫描文档生成语义令牌数据数组
     */
    public int[] build(String content) {
        tokens.clear();
        declarationSites.clear();
        List<SourceLine> lines = SourceLine.parse(content);
        for (List<VariableIndex.Site> sites : VariableIndex.build(lines).declarations().values()) {
            for (VariableIndex.Site site : sites) {
                declarationSites.add(site.row + ":" + site.startColumn);
            }
        }
        for (SourceLine line : lines) {
            scanLine(line);
        }

        // 排序 + 编码为相对格式
        Collections.sort(tokens);

        int[] data = new int[tokens.size() * 5];
        int prevLine = 0, prevChar = 0;
        for (int i = 0; i < tokens.size(); i++) {
            RawToken t = tokens.get(i);
            int deltaLine = t.line - prevLine;
            int deltaChar = deltaLine == 0 ? t.startChar - prevChar : t.startChar;
            data[i * 5] = deltaLine;
            data[i * 5 + 1] = deltaChar;
            data[i * 5 + 2] = t.length;
            data[i * 5 + 3] = t.tokenType;
            data[i * 5 + 4] = t.modifiers;
            prevLine = t.line;
            prevChar = t.startChar;
        }
        return data;
    }

    // ============ 逐行扫描 ============

    private void scanLine(SourceLine line) {
        String text = line.text;
        int row = line.row;
        int pos = 0;
        if (line.hasLineNumber()) {
            addToken(row, line.numberStart, line.numberEnd - line.numberStart, TYPE_NUMBER, 0);
            pos = line.numberEnd;
        }
        int comment = LspTextUtils.commentStart(line.code);
        int end = comment < 0 ? text.length() : comment;

        while (pos < end) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"') {
                int close = Math.min(LspTextUtils.scanString(text, pos), end);
                addToken(row, pos, close - pos, TYPE_STRING, 0);
                pos = close;
            } else if (LspTextUtils.isNumberStart(text, pos)) {
                int close = LspTextUtils.scanNumber(text, pos);
                addToken(row, pos, close - pos, TYPE_NUMBER, 0);
                pos = close;
            } else if (LspTextUtils.isAsciiLetter(c)) {
                int close = LspTextUtils.scanIdentifier(text, pos);
                String word = line.code.substring(pos, close);
                addToken(row, pos, close - pos, classify(word), modifiersAt(row, pos, word));
                pos = close;
            } else {
                if (OPERATORS.indexOf(c) >= 0) {
                    addToken(row, pos, 1, TYPE_OPERATOR, 0);
                }
                pos++;
            }
        }

        // 注释一直到行尾
        if (comment >= 0) {
            addToken(row, comment, text.length() - comment, TYPE_COMMENT, 0);
        }
    }

    private static int classify(String word) {
        if (BasicCatalog.isKeyword(word)) return TYPE_KEYWORD;
        if (BasicCatalog.isFunction(word)) return TYPE_FUNCTION;
        return TYPE_VARIABLE;
    }

    private int modifiersAt(int row, int column, String word) {
        if (classify(word) != TYPE_VARIABLE) return 0;
        return declarationSites.contains(row + ":" + column) ? MOD_DECLARATION : 0;
    }
}
