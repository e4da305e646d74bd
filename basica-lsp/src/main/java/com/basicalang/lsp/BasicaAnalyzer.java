package com.basicalang.lsp;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import static com.basicalang.lsp.LspConstants.*;

import java.util.*;

/**
 * BASIC 代码分析器
 *
 * <p>所有操作都是文档文本的纯函数：每次请求重新扫描文本，不缓存任何分析状态。
 * 无法识别的输入返回空结果，从不抛出异常。</p>
 */
public class BasicaAnalyzer {

    private final NavigationProvider navigation = new NavigationProvider();
    private volatile DiagnosticsCollector diagnostics;

    public BasicaAnalyzer() {
        this(BasicaSettings.defaults());
    }

    public BasicaAnalyzer(BasicaSettings settings) {
        this.diagnostics = new DiagnosticsCollector(settings);
    }

    public void setSettings(BasicaSettings settings) {
        this.diagnostics = new DiagnosticsCollector(settings);
    }

    /**
     * 分析文档，返回诊断信息
     */
    public JsonArray analyze(String uri, String content) {
        if (content == null) return new JsonArray();
        return diagnostics.collect(content);
    }

    /**
     * 获取补全候选：全部关键词、全部内置函数和文档中声明过的变量，不按前缀过滤
     */
    public JsonArray complete(String uri, String content, int line, int character) {
        JsonArray items = new JsonArray();
        for (Map.Entry<String, String> entry : BasicCatalog.keywords().entrySet()) {
            items.add(createCompletionItem(entry.getKey(), COMPLETION_KEYWORD, entry.getValue()));
        }
        for (Map.Entry<String, String> entry : BasicCatalog.functions().entrySet()) {
            items.add(createCompletionItem(entry.getKey(), COMPLETION_FUNCTION, entry.getValue()));
        }
        if (content == null) return items;

        VariableIndex variables = VariableIndex.build(SourceLine.parse(content));
        Map<String, Boolean> names = new TreeMap<>();
        for (Map.Entry<String, List<VariableIndex.Site>> entry : variables.declarations().entrySet()) {
            boolean array = false;
            for (VariableIndex.Site site : entry.getValue()) {
                if (site.kind == VariableIndex.SiteKind.DIM) array = true;
            }
            names.put(entry.getKey(), array);
        }
        for (Map.Entry<String, Boolean> entry : names.entrySet()) {
            if (entry.getValue()) {
                items.add(createCompletionItem(entry.getKey(), COMPLETION_FIELD, "Array"));
            } else {
                items.add(createCompletionItem(entry.getKey(), COMPLETION_VARIABLE, "Variable"));
            }
        }
        return items;
    }

    private static JsonObject createCompletionItem(String label, int kind, String detail) {
        JsonObject item = new JsonObject();
        item.addProperty("label", label);
        item.addProperty("kind", kind);
        item.addProperty("detail", detail);
        return item;
    }

    /**
     * 悬停文档
     */
    public JsonObject hover(String uri, String content, int line, int character) {
        if (content == null) return null;
        List<String> lines = LspTextUtils.splitLines(content);
        if (line < 0 || line >= lines.size()) return null;
        LspTextUtils.WordSpan word = LspTextUtils.wordAt(lines.get(line), character);
        if (word == null) return null;
        String doc = BasicCatalog.documentation(word.text);
        return doc != null ? LspJson.createHover(doc) : null;
    }

    public JsonObject goToDefinition(String uri, String content, int line, int character) {
        if (content == null) return null;
        return navigation.goToDefinition(uri, content, line, character);
    }

    /**
     * 查找引用，声明点始终包含在结果中
     */
    public JsonArray findReferences(String uri, String content, int line, int character) {
        if (content == null) return new JsonArray();
        return navigation.findReferences(uri, content, line, character);
    }

    public JsonObject prepareRename(String uri, String content, int line, int character) {
        if (content == null) return null;
        return navigation.prepareRename(content, line, character);
    }

    public JsonObject rename(String uri, String content, int line, int character, String newName) {
        if (content == null) return null;
        return navigation.rename(uri, content, line, character, newName);
    }

    /**
     * 函数签名帮助
     */
    public JsonObject signatureHelp(String uri, String content, int line, int character) {
        if (content == null) return null;

        List<String> lines = LspTextUtils.splitLines(content);
        if (line < 0 || line >= lines.size()) return null;

        String lineText = lines.get(line);
        String textBefore = lineText.substring(0, Math.max(0, Math.min(character, lineText.length())));

        // 从光标位置向左扫描找到未闭合的 '('
        int depth = 0;
        int parenPos = -1;
        int commaCount = 0;
        for (int i = textBefore.length() - 1; i >= 0; i--) {
            char c = textBefore.charAt(i);
            if (c == ')') depth++;
            else if (c == '(') {
                if (depth == 0) { parenPos = i; break; }
                else depth--;
            } else if (c == ',' && depth == 0) {
                commaCount++;
            }
        }
        if (parenPos < 0) return null;

        // 提取函数名
        String beforeParen = textBefore.substring(0, parenPos).trim();
        int nameStart = beforeParen.length();
        while (nameStart > 0 && LspTextUtils.isWordChar(beforeParen.charAt(nameStart - 1))) nameStart--;
        String funcName = LspTextUtils.toUpperAscii(beforeParen.substring(nameStart));
        if (funcName.isEmpty()) return null;

        BasicCatalog.Signature signature = BasicCatalog.signature(funcName);
        if (signature == null) return null;

        JsonObject sigInfo = new JsonObject();
        sigInfo.addProperty("label", signature.label);
        sigInfo.addProperty("documentation", signature.documentation);
        JsonArray params = new JsonArray();
        for (String parameter : signature.parameters) {
            int dash = parameter.indexOf(" - ");
            JsonObject param = new JsonObject();
            param.addProperty("label", dash >= 0 ? parameter.substring(0, dash) : parameter);
            param.addProperty("documentation", parameter);
            params.add(param);
        }
        sigInfo.add("parameters", params);
        sigInfo.addProperty("activeParameter", commaCount);

        JsonObject result = new JsonObject();
        JsonArray signatures = new JsonArray();
        signatures.add(sigInfo);
        result.add("signatures", signatures);
        result.addProperty("activeSignature", 0);
        result.addProperty("activeParameter", commaCount);
        return result;
    }

    /**
     * 获取文档符号
     */
    public JsonArray documentSymbols(String uri, String content) {
        if (content == null) return new JsonArray();
        return DocumentSymbolCollector.collect(content);
    }

    public JsonArray foldingRanges(String uri, String content) {
        if (content == null) return new JsonArray();
        return FoldingRangeCollector.collect(content);
    }

    /**
     * 语义令牌（完整文档）
     */
    public JsonObject semanticTokensFull(String uri, String content) {
        if (content == null) return new JsonObject();

        SemanticTokensBuilder builder = new SemanticTokensBuilder();
        int[] data = builder.build(content);

        JsonObject result = new JsonObject();
        JsonArray dataArray = new JsonArray();
        for (int d : data) dataArray.add(d);
        result.add("data", dataArray);
        return result;
    }
}
