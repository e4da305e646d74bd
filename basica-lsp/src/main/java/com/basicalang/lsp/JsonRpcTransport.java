package com.basicalang.lsp;

import com.google.gson.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * JSON-RPC 2.0 传输层
 *
 * <p>按 LSP 基础协议读写 {@code Content-Length} 分帧的消息。写出是同步的，
 * 请求线程池和诊断调度线程可以并发调用。</p>
 */
public class JsonRpcTransport {
    private static final String CONTENT_LENGTH = "content-length:";

    private final InputStream input;
    private final OutputStream output;
    private final Gson gson;

    public JsonRpcTransport(InputStream input, OutputStream output) {
        this.input = new BufferedInputStream(input);
        this.output = output;
        this.gson = new GsonBuilder().serializeNulls().create();
    }

    /**
     * 读取一条 JSON-RPC 消息
     *
     * @return 解析后的 JSON 对象，如果流结束则返回 null
     * @throws IOException 读取失败、头部格式错误或消息体不是 JSON 对象
     */
    public JsonObject readMessage() throws IOException {
        int contentLength = -1;
        String line;
        while ((line = readLine()) != null) {
            if (line.isEmpty()) {
                if (contentLength >= 0) break;
                continue; // 消息之间多余的空行
            }
            if (line.toLowerCase(Locale.ROOT).startsWith(CONTENT_LENGTH)) {
                String value = line.substring(CONTENT_LENGTH.length()).trim();
                try {
                    contentLength = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid Content-Length: " + value, e);
                }
            }
            // 其余 header（如 Content-Type）忽略
        }

        if (contentLength < 0) {
            return null; // 流结束
        }

        byte[] bodyBytes = new byte[contentLength];
        int offset = 0;
        while (offset < contentLength) {
            int read = input.read(bodyBytes, offset, contentLength - offset);
            if (read < 0) {
                return null;
            }
            offset += read;
        }

        String body = new String(bodyBytes, StandardCharsets.UTF_8);
        try {
            JsonElement element = JsonParser.parseString(body);
            if (!element.isJsonObject()) {
                throw new IOException("JSON-RPC message is not an object: " + LspTextUtils.preview(body, 80));
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Malformed JSON-RPC message: " + LspTextUtils.preview(body, 80), e);
        }
    }

    /**
     * 发送 JSON-RPC 响应
     */
    public void sendResponse(JsonElement id, JsonElement result) throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id);
        response.add("result", result != null ? result : JsonNull.INSTANCE);
        writeMessage(response);
    }

    /**
     * 发送 JSON-RPC 错误响应
     */
    public void sendError(JsonElement id, int code, String message) throws IOException {
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", id);
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", message);
        response.add("error", error);
        writeMessage(response);
    }

    /**
     * 发送 JSON-RPC 通知（无 id）
     */
    public void sendNotification(String method, JsonElement params) throws IOException {
        JsonObject notification = new JsonObject();
        notification.addProperty("jsonrpc", "2.0");
        notification.addProperty("method", method);
        notification.add("params", params);
        writeMessage(notification);
    }

    private synchronized void writeMessage(JsonObject message) throws IOException {
        byte[] bodyBytes = gson.toJson(message).getBytes(StandardCharsets.UTF_8);
        String header = "Content-Length: " + bodyBytes.length + "\r\n\r\n";
        output.write(header.getBytes(StandardCharsets.US_ASCII));
        output.write(bodyBytes);
        output.flush();
    }

    /**
     * 读取一行 header，以 \r\n 结尾；流结束且没有内容时返回 null
     */
    private String readLine() throws IOException {
        StringBuilder sb = new StringBuilder();
        while (true) {
            int c = input.read();
            if (c < 0) {
                return sb.length() > 0 ? sb.toString() : null;
            }
            if (c == '\n') {
                int len = sb.length();
                if (len > 0 && sb.charAt(len - 1) == '\r') sb.setLength(len - 1);
                return sb.toString();
            }
            sb.append((char) c);
        }
    }

    public Gson getGson() {
        return gson;
    }
}
