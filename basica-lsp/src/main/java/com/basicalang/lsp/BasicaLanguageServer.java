package com.basicalang.lsp;

import com.google.gson.*;

import static com.basicalang.lsp.LspConstants.*;

import java.io.*;
import java.util.concurrent.*;
import java.util.function.Function;
import java.util.logging.*;

/**
 * BASIC Language Server
 *
 * <p>实现 LSP 协议，提供代码智能功能。通过 stdin/stdout 与编辑器通信。</p>
 *
 * <p>支持的功能：</p>
 * <ul>
 *   <li>语法错误与变量、跳转目标诊断</li>
 *   <li>关键词 + 函数 + 变量补全</li>
 *   <li>悬停文档</li>
 *   <li>跳转定义</li>
 *   <li>查找引用</li>
 *   <li>重命名</li>
 *   <li>文档符号</li>
 *   <li>折叠范围</li>
 *   <li>签名帮助</li>
 *   <li>语义令牌</li>
 * </ul>
 */
public class BasicaLanguageServer {
    private static final Logger LOG = Logger.getLogger(BasicaLanguageServer.class.getName());

    static final String SERVER_NAME = "basica-lsp";
    static final String SERVER_VERSION = "0.1.0";
    static final String LOG_LEVEL_PROPERTY = "basica.lsp.logLevel";

    /** LSP 标准错误码 */
    static final int ERR_INVALID_REQUEST = -32600;
    static final int ERR_METHOD_NOT_FOUND = -32601;
    static final int ERR_INVALID_PARAMS = -32602;
    static final int ERR_INTERNAL = -32603;

    private final JsonRpcTransport transport;
    private final DocumentManager documents;
    private final BasicaAnalyzer analyzer;
    private volatile boolean running = true;

    /** 异步请求线程池 */
    private final ExecutorService requestPool = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "basica-lsp-request");
        t.setDaemon(true);
        return t;
    });

    public BasicaLanguageServer(InputStream input, OutputStream output) {
        this.transport = new JsonRpcTransport(input, output);
        this.documents = new DocumentManager();
        this.analyzer = new BasicaAnalyzer();

        // debounce 结束后异步发布诊断
        this.documents.setChangeCallback((uri, content) -> {
            try {
                publishDiagnostics(uri, content);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "发布诊断失败: " + uri, e);
            }
        });
    }

    /**
     * 启动服务器主循环，输入流结束或收到 exit 后返回
     */
    public void run() {
        LOG.info("BASIC LSP 服务器启动");

        while (running) {
            JsonObject message = null;
            try {
                message = transport.readMessage();
                if (message == null) {
                    break; // 流结束
                }
                handleMessage(message);
            } catch (Exception e) {
                LOG.log(Level.SEVERE, "处理消息时出错", e);
                // 对带有 id 的请求发送错误响应，确保客户端不会挂起
                if (message != null && message.has("id")) {
                    try {
                        transport.sendError(message.get("id"), ERR_INTERNAL, "Internal error: " + describe(e));
                    } catch (IOException ioEx) {
                        LOG.log(Level.SEVERE, "发送错误响应失败", ioEx);
                    }
                }
            }
        }

        requestPool.shutdown();
        documents.shutdown();
        try {
            if (!requestPool.awaitTermination(5, TimeUnit.SECONDS)) {
                requestPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            requestPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("BASIC LSP 服务器关闭");
    }

    private void handleMessage(JsonObject message) throws IOException {
        String method = message.has("method") ? message.get("method").getAsString() : null;
        JsonElement id = message.get("id");
        JsonObject params = message.has("params") && message.get("params").isJsonObject()
                ? message.getAsJsonObject("params") : null;

        // 无 method 的消息：如果有 id 则为无效请求，否则忽略（可能是响应）
        if (method == null) {
            if (id != null) {
                transport.sendError(id, ERR_INVALID_REQUEST, "Missing 'method' field");
            }
            return;
        }

        switch (method) {
            // === 生命周期 ===
            case "initialize":
                handleInitialize(id, params);
                break;
            case "initialized":
                handleInitialized();
                break;
            case "shutdown":
                transport.sendResponse(id, JsonNull.INSTANCE);
                break;
            case "exit":
                running = false;
                break;

            // === 通知（同步处理，保证顺序） ===
            case "textDocument/didOpen":
                handleDidOpen(params);
                break;
            case "textDocument/didChange":
                handleDidChange(params);
                break;
            case "textDocument/didClose":
                handleDidClose(params);
                break;

            // === 请求（异步处理） ===
            case "textDocument/completion":
                submitAsync(id, () -> handlePositionRequest(id, params, new JsonArray(),
                        (p, content) -> analyzer.complete(p.uri, content, p.line, p.character)));
                break;
            case "textDocument/hover":
                submitAsync(id, () -> handlePositionRequest(id, params, JsonNull.INSTANCE,
                        (p, content) -> analyzer.hover(p.uri, content, p.line, p.character)));
                break;
            case "textDocument/definition":
                submitAsync(id, () -> handlePositionRequest(id, params, JsonNull.INSTANCE,
                        (p, content) -> analyzer.goToDefinition(p.uri, content, p.line, p.character)));
                break;
            case "textDocument/references":
                submitAsync(id, () -> handlePositionRequest(id, params, new JsonArray(),
                        (p, content) -> analyzer.findReferences(p.uri, content, p.line, p.character)));
                break;
            case "textDocument/signatureHelp":
                submitAsync(id, () -> handlePositionRequest(id, params, JsonNull.INSTANCE,
                        (p, content) -> analyzer.signatureHelp(p.uri, content, p.line, p.character)));
                break;
            case "textDocument/prepareRename":
                submitAsync(id, () -> handlePositionRequest(id, params, JsonNull.INSTANCE,
                        (p, content) -> analyzer.prepareRename(p.uri, content, p.line, p.character)));
                break;
            case "textDocument/rename":
                submitAsync(id, () -> handleRename(id, params));
                break;
            case "textDocument/documentSymbol":
                submitAsync(id, () -> handleDocumentRequest(id, params, new JsonArray(),
                        content -> analyzer.documentSymbols(uriOf(params), content)));
                break;
            case "textDocument/foldingRange":
                submitAsync(id, () -> handleDocumentRequest(id, params, new JsonArray(),
                        content -> analyzer.foldingRanges(uriOf(params), content)));
                break;
            case "textDocument/semanticTokens/full":
                submitAsync(id, () -> handleDocumentRequest(id, params, new JsonObject(),
                        content -> analyzer.semanticTokensFull(uriOf(params), content)));
                break;

            default:
                // 未支持的方法
                if (id != null) {
                    transport.sendError(id, ERR_METHOD_NOT_FOUND, "Method not found: " + method);
                }
                break;
        }
    }

    // ============ 异步请求管理 ============

    private void submitAsync(JsonElement id, RequestHandler handler) {
        try {
            requestPool.submit(() -> {
                try {
                    handler.handle();
                } catch (Exception e) {
                    LOG.log(Level.WARNING, "异步请求处理失败", e);
                    try {
                        if (id != null) {
                            transport.sendError(id, ERR_INTERNAL, "Internal error: " + describe(e));
                        }
                    } catch (IOException ioEx) {
                        LOG.log(Level.SEVERE, "发送错误响应失败", ioEx);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.log(Level.WARNING, "请求线程池已关闭，丢弃请求 " + id, e);
        }
    }

    @FunctionalInterface
    private interface RequestHandler {
        void handle() throws Exception;
    }

    @FunctionalInterface
    private interface PositionQuery {
        JsonElement query(TextPosition position, String content);
    }

    /** 请求中的文档与光标位置 */
    private static final class TextPosition {
        final String uri;
        final int line;
        final int character;

        TextPosition(String uri, int line, int character) {
            this.uri = uri;
            this.line = line;
            this.character = character;
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private static String uriOf(JsonObject params) {
        return params.getAsJsonObject("textDocument").get("uri").getAsString();
    }

    /**
     * 解析 textDocument + position；缺失时回复 invalid params 并返回 null
     */
    private TextPosition readPosition(JsonElement id, JsonObject params) throws IOException {
        if (params == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing params");
            return null;
        }
        JsonObject textDocument = params.has("textDocument") && params.get("textDocument").isJsonObject()
                ? params.getAsJsonObject("textDocument") : null;
        JsonObject position = params.has("position") && params.get("position").isJsonObject()
                ? params.getAsJsonObject("position") : null;
        if (textDocument == null || !textDocument.has("uri") || position == null
                || !position.has("line") || !position.has("character")) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument or position");
            return null;
        }
        return new TextPosition(textDocument.get("uri").getAsString(),
                position.get("line").getAsInt(), position.get("character").getAsInt());
    }

    private void handlePositionRequest(JsonElement id, JsonObject params, JsonElement empty,
                                       PositionQuery query) throws IOException {
        TextPosition position = readPosition(id, params);
        if (position == null) return;

        JsonElement result = documents.read(position.uri,
                content -> content == null ? empty : query.query(position, content));
        transport.sendResponse(id, result != null ? result : JsonNull.INSTANCE);
    }

    private void handleDocumentRequest(JsonElement id, JsonObject params, JsonElement empty,
                                       Function<String, JsonElement> query) throws IOException {
        if (params == null) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing params");
            return;
        }
        JsonObject textDocument = params.has("textDocument") && params.get("textDocument").isJsonObject()
                ? params.getAsJsonObject("textDocument") : null;
        if (textDocument == null || !textDocument.has("uri")) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument");
            return;
        }
        String uri = textDocument.get("uri").getAsString();

        JsonElement result = documents.read(uri, content -> content == null ? empty : query.apply(content));
        transport.sendResponse(id, result != null ? result : JsonNull.INSTANCE);
    }

    // ============ LSP 方法处理 ============

    private void handleInitialize(JsonElement id, JsonObject params) throws IOException {
        JsonElement options = params != null ? params.get("initializationOptions") : null;
        BasicaSettings settings = BasicaSettings.fromJson(transport.getGson(), options);
        analyzer.setSettings(settings);
        documents.setDebounceMs(settings.getDiagnosticsDelayMs());
        LOG.info("诊断 debounce: " + settings.getDiagnosticsDelayMs() + "ms");

        JsonObject result = new JsonObject();

        // 服务器能力
        JsonObject capabilities = new JsonObject();

        // 文本同步：全量同步
        JsonObject textDocumentSync = new JsonObject();
        textDocumentSync.addProperty("openClose", true);
        textDocumentSync.addProperty("change", SYNC_FULL);
        capabilities.add("textDocumentSync", textDocumentSync);

        // 补全
        JsonObject completionProvider = new JsonObject();
        completionProvider.addProperty("resolveProvider", false);
        JsonArray triggerChars = new JsonArray();
        triggerChars.add(" ");
        completionProvider.add("triggerCharacters", triggerChars);
        capabilities.add("completionProvider", completionProvider);

        capabilities.addProperty("hoverProvider", true);
        capabilities.addProperty("definitionProvider", true);
        capabilities.addProperty("referencesProvider", true);
        capabilities.addProperty("documentSymbolProvider", true);
        capabilities.addProperty("foldingRangeProvider", true);

        // 签名帮助
        JsonObject signatureHelpProvider = new JsonObject();
        JsonArray sigTriggerChars = new JsonArray();
        sigTriggerChars.add("(");
        sigTriggerChars.add(",");
        signatureHelpProvider.add("triggerCharacters", sigTriggerChars);
        capabilities.add("signatureHelpProvider", signatureHelpProvider);

        // 重命名
        JsonObject renameProvider = new JsonObject();
        renameProvider.addProperty("prepareProvider", true);
        capabilities.add("renameProvider", renameProvider);

        // 语义令牌
        JsonObject semanticTokensProvider = new JsonObject();
        JsonObject legend = new JsonObject();
        legend.add("tokenTypes", SemanticTokensBuilder.getTokenTypesJson());
        legend.add("tokenModifiers", SemanticTokensBuilder.getTokenModifiersJson());
        semanticTokensProvider.add("legend", legend);
        semanticTokensProvider.addProperty("full", true);
        capabilities.add("semanticTokensProvider", semanticTokensProvider);

        result.add("capabilities", capabilities);

        // 服务器信息
        JsonObject serverInfo = new JsonObject();
        serverInfo.addProperty("name", SERVER_NAME);
        serverInfo.addProperty("version", SERVER_VERSION);
        result.add("serverInfo", serverInfo);

        transport.sendResponse(id, result);
    }

    private void handleInitialized() throws IOException {
        JsonObject params = new JsonObject();
        params.addProperty("type", MESSAGE_INFO);
        params.addProperty("message", "basica LSP initialized");
        transport.sendNotification("window/logMessage", params);
    }

    private void handleDidOpen(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri") || !textDocument.has("text")) return;
        String uri = textDocument.get("uri").getAsString();
        String text = textDocument.get("text").getAsString();

        documents.open(uri, text);
        publishDiagnostics(uri, text);
    }

    private void handleDidChange(JsonObject params) {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();

        JsonArray changes = params.getAsJsonArray("contentChanges");
        if (changes == null || changes.size() == 0) return;

        // 全量同步：最后一项即完整文本
        JsonObject change = changes.get(changes.size() - 1).getAsJsonObject();
        if (!change.has("text")) return;
        documents.change(uri, change.get("text").getAsString());
    }

    private void handleDidClose(JsonObject params) throws IOException {
        if (params == null) return;
        JsonObject textDocument = params.getAsJsonObject("textDocument");
        if (textDocument == null || !textDocument.has("uri")) return;
        String uri = textDocument.get("uri").getAsString();
        documents.close(uri);

        // 清除诊断
        JsonObject diagParams = new JsonObject();
        diagParams.addProperty("uri", uri);
        diagParams.add("diagnostics", new JsonArray());
        transport.sendNotification("textDocument/publishDiagnostics", diagParams);
    }

    // ============ textDocument/rename ============

    private void handleRename(JsonElement id, JsonObject params) throws IOException {
        if (params != null && !params.has("newName")) {
            transport.sendError(id, ERR_INVALID_PARAMS, "Missing textDocument, position or newName");
            return;
        }
        TextPosition position = readPosition(id, params);
        if (position == null) return;
        String newName = params.get("newName").getAsString();

        JsonObject result = documents.read(position.uri, content -> content == null ? null
                : analyzer.rename(position.uri, content, position.line, position.character, newName));
        transport.sendResponse(id, result != null ? result : JsonNull.INSTANCE);
    }

    // ============ 诊断 ============

    private void publishDiagnostics(String uri, String content) throws IOException {
        JsonArray diagnostics = analyzer.analyze(uri, content);

        JsonObject params = new JsonObject();
        params.addProperty("uri", uri);
        params.add("diagnostics", diagnostics);

        transport.sendNotification("textDocument/publishDiagnostics", params);
    }

    // ============ 入口 ============

    static Level resolveLogLevel(String value) {
        if (value == null || value.trim().isEmpty()) return Level.INFO;
        try {
            return Level.parse(value.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    public static void main(String[] args) {
        // 配置日志到 stderr（不干扰 stdin/stdout 的 LSP 通信）
        Level level = resolveLogLevel(System.getProperty(LOG_LEVEL_PROPERTY));
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.setLevel(level);
        rootLogger.addHandler(stderrHandler);

        BasicaLanguageServer server = new BasicaLanguageServer(System.in, System.out);
        server.run();
    }
}
