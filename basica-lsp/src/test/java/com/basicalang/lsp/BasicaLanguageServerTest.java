package com.basicalang.lsp;

import com.google.gson.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.*;

/**
 * LSP 服务器集成测试
 *
 * <p>通过 ByteArrayInputStream/ByteArrayOutputStream 模拟 LSP 客户端，
 * 验证完整的请求-响应流程。</p>
 */
@DisplayName("BasicaLanguageServer 集成测试")
class BasicaLanguageServerTest {

    private static final Gson GSON = new Gson();
    private static final String URI = "file:///test.bas";

    // ============ 辅助方法 ============

    /**
     * 将 JSON 对象编码为 LSP 消息格式
     */
    private static byte[] encode(JsonObject message) {
        byte[] bodyBytes = GSON.toJson(message).getBytes(StandardCharsets.UTF_8);
        byte[] headerBytes = ("Content-Length: " + bodyBytes.length + "\r\n\r\n").getBytes(StandardCharsets.UTF_8);
        byte[] result = new byte[headerBytes.length + bodyBytes.length];
        System.arraycopy(headerBytes, 0, result, 0, headerBytes.length);
        System.arraycopy(bodyBytes, 0, result, headerBytes.length, bodyBytes.length);
        return result;
    }

    private static JsonObject request(int id, String method, JsonObject params) {
        JsonObject msg = notification(method, params);
        msg.addProperty("id", id);
        return msg;
    }

    private static JsonObject notification(String method, JsonObject params) {
        JsonObject msg = new JsonObject();
        msg.addProperty("jsonrpc", "2.0");
        msg.addProperty("method", method);
        msg.add("params", params != null ? params : new JsonObject());
        return msg;
    }

    private static JsonObject didOpen(String uri, String text) {
        JsonObject textDocument = new JsonObject();
        textDocument.addProperty("uri", uri);
        textDocument.addProperty("languageId", "basic");
        textDocument.addProperty("version", 1);
        textDocument.addProperty("text", text);
        JsonObject params = new JsonObject();
        params.add("textDocument", textDocument);
        return notification("textDocument/didOpen", params);
    }

    private static JsonObject textDocument(String uri) {
        JsonObject textDocument = new JsonObject();
        textDocument.addProperty("uri", uri);
        JsonObject params = new JsonObject();
        params.add("textDocument", textDocument);
        return params;
    }

    private static JsonObject positionParams(String uri, int line, int character) {
        JsonObject params = textDocument(uri);
        JsonObject position = new JsonObject();
        position.addProperty("line", line);
        position.addProperty("character", character);
        params.add("position", position);
        return params;
    }

    /**
     * 以 initialize / initialized 开头、shutdown / exit 结尾运行一次会话，返回全部输出消息
     */
    private static List<JsonObject> runSessionWith(JsonObject initializeParams, JsonObject... messages) throws IOException {
        ByteArrayOutputStream input = new ByteArrayOutputStream();
        input.write(encode(request(1, "initialize", initializeParams != null ? initializeParams : new JsonObject())));
        input.write(encode(notification("initialized", null)));
        for (JsonObject message : messages) {
            input.write(encode(message));
        }
        input.write(encode(request(99, "shutdown", null)));
        input.write(encode(notification("exit", null)));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new BasicaLanguageServer(new ByteArrayInputStream(input.toByteArray()), out).run();
        return parseAllMessages(out.toByteArray());
    }

    private static List<JsonObject> runSession(JsonObject... messages) throws IOException {
        return runSessionWith(null, messages);
    }

    /**
     * 从输出流解析所有 JSON-RPC 消息（复用 JsonRpcTransport 避免字节/字符偏移问题）
     */
    private static List<JsonObject> parseAllMessages(byte[] outputBytes) throws IOException {
        JsonRpcTransport reader = new JsonRpcTransport(new ByteArrayInputStream(outputBytes), new ByteArrayOutputStream());
        List<JsonObject> messages = new ArrayList<>();
        JsonObject msg;
        while ((msg = reader.readMessage()) != null) {
            messages.add(msg);
        }
        return messages;
    }

    private static JsonObject findResponse(List<JsonObject> messages, int id) {
        for (JsonObject msg : messages) {
            if (msg.has("id") && !msg.has("method") && msg.get("id").getAsInt() == id) {
                return msg;
            }
        }
        return null;
    }

    private static List<JsonObject> findNotifications(List<JsonObject> messages, String method) {
        List<JsonObject> result = new ArrayList<>();
        for (JsonObject msg : messages) {
            if (msg.has("method") && method.equals(msg.get("method").getAsString())) {
                result.add(msg);
            }
        }
        return result;
    }

    private static JsonObject findNotification(List<JsonObject> messages, String method) {
        List<JsonObject> found = findNotifications(messages, method);
        return found.isEmpty() ? null : found.get(0);
    }

    // ============ 生命周期 ============

    @Nested
    @DisplayName("生命周期")
    class Lifecycle {

        @Test
        @DisplayName("initialize 返回服务器能力")
        void testInitialize() throws IOException {
            List<JsonObject> messages = runSession();

            JsonObject result = findResponse(messages, 1).getAsJsonObject("result");
            JsonObject capabilities = result.getAsJsonObject("capabilities");
            JsonObject sync = capabilities.getAsJsonObject("textDocumentSync");
            assertThat(sync.get("openClose").getAsBoolean()).isTrue();
            assertThat(sync.get("change").getAsInt()).isEqualTo(1);
            assertThat(capabilities.getAsJsonObject("completionProvider").getAsJsonArray("triggerCharacters"))
                    .containsExactly(new JsonPrimitive(" "));
            assertThat(capabilities.get("hoverProvider").getAsBoolean()).isTrue();
            assertThat(capabilities.get("definitionProvider").getAsBoolean()).isTrue();
            assertThat(capabilities.get("referencesProvider").getAsBoolean()).isTrue();
            assertThat(capabilities.get("documentSymbolProvider").getAsBoolean()).isTrue();
            assertThat(capabilities.get("foldingRangeProvider").getAsBoolean()).isTrue();
            assertThat(capabilities.getAsJsonObject("signatureHelpProvider").getAsJsonArray("triggerCharacters"))
                    .containsExactly(new JsonPrimitive("("), new JsonPrimitive(","));
            assertThat(capabilities.getAsJsonObject("renameProvider").get("prepareProvider").getAsBoolean()).isTrue();

            JsonObject semantic = capabilities.getAsJsonObject("semanticTokensProvider");
            assertThat(semantic.get("full").getAsBoolean()).isTrue();
            assertThat(semantic.getAsJsonObject("legend").getAsJsonArray("tokenTypes").size()).isEqualTo(7);

            JsonObject serverInfo = result.getAsJsonObject("serverInfo");
            assertThat(serverInfo.get("name").getAsString()).isEqualTo("basica-lsp");
            assertThat(serverInfo.get("version").getAsString()).isEqualTo("0.1.0");
        }

        @Test
        @DisplayName("initialized 之后发送 logMessage")
        void testInitializedLogMessage() throws IOException {
            JsonObject log = findNotification(runSession(), "window/logMessage");

            assertThat(log).isNotNull();
            assertThat(log.getAsJsonObject("params").get("type").getAsInt()).isEqualTo(3);
            assertThat(log.getAsJsonObject("params").get("message").getAsString()).isEqualTo("basica LSP initialized");
        }

        @Test
        @DisplayName("shutdown 返回 null 结果")
        void testShutdown() throws IOException {
            JsonObject response = findResponse(runSession(), 99);

            assertThat(response).isNotNull();
            assertThat(response.has("result")).isTrue();
            assertThat(response.get("result").isJsonNull()).isTrue();
        }

        @Test
        @DisplayName("输入流结束时主循环返回")
        void testEndOfStream() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            BasicaLanguageServer server = new BasicaLanguageServer(new ByteArrayInputStream(new byte[0]), out);

            assertThatCode(server::run).doesNotThrowAnyException();
            assertThat(out.size()).isZero();
        }
    }

    // ============ 诊断 ============

    @Nested
    @DisplayName("诊断推送")
    class Diagnostics {

        @Test
        @DisplayName("didOpen 立即推送诊断")
        void testDidOpenPublishesDiagnostics() throws IOException {
            List<JsonObject> messages = runSession(didOpen(URI, "10 GOTO 99"));

            JsonObject params = findNotification(messages, "textDocument/publishDiagnostics").getAsJsonObject("params");
            assertThat(params.get("uri").getAsString()).isEqualTo(URI);
            JsonArray diagnostics = params.getAsJsonArray("diagnostics");
            assertThat(diagnostics.size()).isEqualTo(1);
            JsonObject diagnostic = diagnostics.get(0).getAsJsonObject();
            assertThat(diagnostic.get("severity").getAsInt()).isEqualTo(1);
            assertThat(diagnostic.get("message").getAsString()).isEqualTo("Line 99 is not defined");
        }

        @Test
        @DisplayName("合法程序没有诊断")
        void testValidProgram() throws IOException {
            List<JsonObject> messages = runSession(didOpen(URI, "10 LET X = 5\n20 PRINT X\n30 GOTO 10"));

            JsonObject params = findNotification(messages, "textDocument/publishDiagnostics").getAsJsonObject("params");
            assertThat(params.getAsJsonArray("diagnostics").size()).isZero();
        }

        @Test
        @DisplayName("didClose 推送空诊断")
        void testDidCloseClearsDiagnostics() throws IOException {
            List<JsonObject> messages = runSession(
                    didOpen(URI, "10 GOTO 99"),
                    notification("textDocument/didClose", textDocument(URI)));

            List<JsonObject> published = findNotifications(messages, "textDocument/publishDiagnostics");
            assertThat(published).hasSize(2);
            assertThat(published.get(0).getAsJsonObject("params").getAsJsonArray("diagnostics").size()).isEqualTo(1);
            assertThat(published.get(1).getAsJsonObject("params").getAsJsonArray("diagnostics").size()).isZero();
        }

        @Test
        @DisplayName("initializationOptions 可以关闭未使用变量提示")
        void testInitializationOptions() throws IOException {
            String program = "10 X = 1\n20 END";

            JsonObject withHints = findNotification(runSession(didOpen(URI, program)),
                    "textDocument/publishDiagnostics").getAsJsonObject("params");
            assertThat(withHints.getAsJsonArray("diagnostics").size()).isEqualTo(1);

            JsonObject options = new JsonObject();
            options.addProperty("unusedVariableHints", false);
            JsonObject initializeParams = new JsonObject();
            initializeParams.add("initializationOptions", options);
            JsonObject withoutHints = findNotification(runSessionWith(initializeParams, didOpen(URI, program)),
                    "textDocument/publishDiagnostics").getAsJsonObject("params");
            assertThat(withoutHints.getAsJsonArray("diagnostics").size()).isZero();
        }
    }

    // ============ 请求 ============

    @Nested
    @DisplayName("请求")
    class Requests {

        @Test
        @DisplayName("completion 返回关键词、函数与变量")
        void testCompletion() throws IOException {
            List<JsonObject> messages = runSession(
                    didOpen(URI, "10 COUNT = 1\n20 PRINT "),
                    request(3, "textDocument/completion", positionParams(URI, 1, 9)));

            JsonArray items = findResponse(messages, 3).getAsJsonArray("result");
            List<String> labels = new ArrayList<>();
            for (JsonElement item : items) {
                labels.add(item.getAsJsonObject().get("label").getAsString());
            }
            assertThat(labels).contains("PRINT", "LEFT$", "COUNT");
        }

        @Test
        @DisplayName("definition 跳转到行号所在行")
        void testDefinition() throws IOException {
            List<JsonObject> messages = runSession(
                    didOpen(URI, "10 GOSUB 100\n20 END\n100 RETURN"),
                    request(4, "textDocument/definition", positionParams(URI, 0, 10)));

            JsonObject location = findResponse(messages, 4).getAsJsonObject("result");
            assertThat(location.get("uri").getAsString()).isEqualTo(URI);
            assertThat(location.getAsJsonObject("range").getAsJsonObject("start").get("line").getAsInt())
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("rename 返回 WorkspaceEdit")
        void testRename() throws IOException {
            JsonObject params = positionParams(URI, 0, 3);
            params.addProperty("newName", "TOTAL");
            List<JsonObject> messages = runSession(
                    didOpen(URI, "10 COUNT = 1\n20 PRINT COUNT"),
                    request(5, "textDocument/rename", params));

            JsonArray edits = findResponse(messages, 5).getAsJsonObject("result")
                    .getAsJsonObject("changes").getAsJsonArray(URI);
            assertThat(edits.size()).isEqualTo(2);
            assertThat(edits.get(0).getAsJsonObject().get("newText").getAsString()).isEqualTo("TOTAL");
        }

        @Test
        @DisplayName("未打开的文档返回空结果")
        void testUnknownDocument() throws IOException {
            List<JsonObject> messages = runSession(
                    request(6, "textDocument/completion", positionParams("file:///none.bas", 0, 0)),
                    request(7, "textDocument/documentSymbol", textDocument("file:///none.bas")),
                    request(8, "textDocument/hover", positionParams("file:///none.bas", 0, 0)));

            assertThat(findResponse(messages, 6).getAsJsonArray("result").size()).isZero();
            assertThat(findResponse(messages, 7).getAsJsonArray("result").size()).isZero();
            assertThat(findResponse(messages, 8).get("result").isJsonNull()).isTrue();
        }
    }

    // ============ 错误处理 ============

    @Nested
    @DisplayName("错误处理")
    class Errors {

        @Test
        @DisplayName("缺少 position 返回 -32602")
        void testMissingPosition() throws IOException {
            List<JsonObject> messages = runSession(request(3, "textDocument/hover", textDocument(URI)));

            JsonObject error = findResponse(messages, 3).getAsJsonObject("error");
            assertThat(error.get("code").getAsInt()).isEqualTo(-32602);
            assertThat(error.get("message").getAsString()).isEqualTo("Missing textDocument or position");
        }

        @Test
        @DisplayName("rename 缺少 newName 返回 -32602")
        void testRenameWithoutNewName() throws IOException {
            List<JsonObject> messages = runSession(request(3, "textDocument/rename", positionParams(URI, 0, 0)));

            assertThat(findResponse(messages, 3).getAsJsonObject("error").get("code").getAsInt()).isEqualTo(-32602);
        }

        @Test
        @DisplayName("未知方法返回 -32601")
        void testMethodNotFound() throws IOException {
            List<JsonObject> messages = runSession(request(3, "workspace/unknown", null));

            JsonObject error = findResponse(messages, 3).getAsJsonObject("error");
            assertThat(error.get("code").getAsInt()).isEqualTo(-32601);
            assertThat(error.get("message").getAsString()).isEqualTo("Method not found: workspace/unknown");
        }

        @Test
        @DisplayName("未知通知被忽略")
        void testUnknownNotification() throws IOException {
            List<JsonObject> messages = runSession(notification("$/cancelRequest", null));

            for (JsonObject msg : messages) {
                assertThat(msg.has("error")).isFalse();
            }
        }

        @Test
        @DisplayName("缺少 method 的请求返回 -32600")
        void testMissingMethod() throws IOException {
            JsonObject invalid = new JsonObject();
            invalid.addProperty("jsonrpc", "2.0");
            invalid.addProperty("id", 3);

            List<JsonObject> messages = runSession(invalid);

            JsonObject error = findResponse(messages, 3).getAsJsonObject("error");
            assertThat(error.get("code").getAsInt()).isEqualTo(-32600);
            assertThat(error.get("message").getAsString()).isEqualTo("Missing 'method' field");
        }
    }

    @Test
    @DisplayName("日志级别解析")
    void testResolveLogLevel() {
        assertThat(BasicaLanguageServer.resolveLogLevel("fine")).isEqualTo(Level.FINE);
        assertThat(BasicaLanguageServer.resolveLogLevel(null)).isEqualTo(Level.INFO);
        assertThat(BasicaLanguageServer.resolveLogLevel("loud")).isEqualTo(Level.INFO);
    }
}
