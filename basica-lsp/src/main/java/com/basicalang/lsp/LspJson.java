package com.basicalang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * LSP 协议对象的 JSON 构造工具
 */
final class LspJson {

    private LspJson() {}

    static JsonObject createRange(int startLine, int startChar, int endLine, int endChar) {
        JsonObject range = new JsonObject();
        JsonObject start = new JsonObject();
        start.addProperty("line", startLine);
        start.addProperty("character", startChar);
        range.add("start", start);
        JsonObject end = new JsonObject();
        end.addProperty("line", endLine);
        end.addProperty("character", endChar);
        range.add("end", end);
        return range;
    }

    static JsonObject createLocation(String uri, int line, int startChar, int endChar) {
        JsonObject location = new JsonObject();
        location.addProperty("uri", uri);
        location.add("range", createRange(line, startChar, line, endChar));
        return location;
    }

    static JsonObject createHover(String markdownContent) {
        JsonObject hover = new JsonObject();
        JsonObject contents = new JsonObject();
        contents.addProperty("kind", "markdown");
        contents.addProperty("value", markdownContent);
        hover.add("contents", contents);
        return hover;
    }

    static JsonObject createDiagnostic(JsonObject range, int severity, String message, int... tags) {
        JsonObject diag = new JsonObject();
        diag.add("range", range);
        diag.addProperty("severity", severity);
        diag.addProperty("source", DiagnosticsCollector.SOURCE);
        diag.addProperty("message", message);
        if (tags.length > 0) {
            JsonArray tagArray = new JsonArray();
            for (int tag : tags) tagArray.add(tag);
            diag.add("tags", tagArray);
        }
        return diag;
    }
}
