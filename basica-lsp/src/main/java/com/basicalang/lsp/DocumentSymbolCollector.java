package com.basicalang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.basicalang.lsp.LspConstants.*;

/**
 * 文档大纲：只列出带行号的关键行
 */
final class DocumentSymbolCollector {

    private static final int COMMENT_PREVIEW = 30;
    private static final int STATEMENT_PREVIEW = 40;

    /** 以这些关键词开头的行显示在大纲中 */
    private static final Set<String> OUTLINE_KEYWORDS = new HashSet<String>(Arrays.asList(
            "FOR", "WHILE", "DO", "SELECT", "IF", "GOSUB", "ON"));

    private DocumentSymbolCollector() {}

    static JsonArray collect(String content) {
        JsonArray symbols = new JsonArray();
        List<SourceLine> lines = SourceLine.parse(content);
        Set<Integer> subroutines = JumpTargetIndex.build(lines).gosubTargets();

        for (SourceLine line : lines) {
            if (!line.hasLineNumber()) continue;
            JsonObject symbol = toSymbol(line, subroutines);
            if (symbol != null) {
                symbols.add(symbol);
            }
        }
        return symbols;
    }

    private static JsonObject toSymbol(SourceLine line, Set<Integer> subroutines) {
        int n = line.lineNumber;
        String body = line.code.substring(line.contentStart);

        if (subroutines.contains(n)) {
            return createSymbol(line, n + " (SUB)", SYMBOL_FUNCTION, "Subroutine");
        }
        if (line.isComment()) {
            int skip = body.startsWith("'") ? 1 : 3;
            String comment = line.text.substring(line.contentStart + skip).trim();
            return createSymbol(line, n + " REM " + LspTextUtils.preview(comment, COMMENT_PREVIEW),
                    SYMBOL_STRING, "Comment");
        }
        if (LspTextUtils.startsWithWord(body, "DATA")) {
            return createSymbol(line, n + " DATA", SYMBOL_ARRAY, "Data");
        }
        if (LspTextUtils.startsWithWord(body, "DEF")) {
            int pos = LspTextUtils.skipWhitespace(body, 3);
            if (body.startsWith("FN", pos)) {
                String name = functionName(line.text.substring(line.contentStart + pos + 2));
                return createSymbol(line, n + " DEF FN" + name, SYMBOL_FUNCTION, "User function");
            }
        }

        int end = LspTextUtils.scanIdentifier(body, 0);
        if (end > 0 && OUTLINE_KEYWORDS.contains(body.substring(0, end))) {
            return createSymbol(line, n + " " + LspTextUtils.preview(line.content(), STATEMENT_PREVIEW),
                    SYMBOL_KEY, null);
        }
        return null;
    }

    /** {@code NAME(X) = ...} 中的 NAME */
    private static String functionName(String rest) {
        int cut = rest.length();
        int paren = rest.indexOf('(');
        if (paren >= 0) cut = paren;
        int eq = rest.indexOf('=');
        if (eq >= 0 && eq < cut) cut = eq;
        return rest.substring(0, cut).trim();
    }

    private static JsonObject createSymbol(SourceLine line, String name, int kind, String detail) {
        JsonObject symbol = new JsonObject();
        symbol.addProperty("name", name);
        if (detail != null) {
            symbol.addProperty("detail", detail);
        }
        symbol.addProperty("kind", kind);
        JsonObject range = LspJson.createRange(line.row, 0, line.row, line.length());
        symbol.add("range", range);
        symbol.add("selectionRange", range.deepCopy());
        return symbol;
    }
}
