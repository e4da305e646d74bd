package com.basicalang.lsp;

/**
 * LSP 协议常量定义。
 *
 * @see <a href="https://microsoft.github.io/language-server-protocol/specifications/lsp/3.17/specification/">LSP 3.17 Spec</a>
 */
public final class LspConstants {

    private LspConstants() {}

    // ==================== CompletionItemKind ====================

    public static final int COMPLETION_FUNCTION = 3;
    public static final int COMPLETION_FIELD = 5;
    public static final int COMPLETION_VARIABLE = 6;
    public static final int COMPLETION_KEYWORD = 14;

    // ==================== DiagnosticSeverity ====================

    public static final int SEVERITY_ERROR = 1;
    public static final int SEVERITY_WARNING = 2;
    public static final int SEVERITY_HINT = 4;

    // ==================== DiagnosticTag ====================

    public static final int DIAGNOSTIC_TAG_UNNECESSARY = 1;

    // ==================== SymbolKind ====================

    public static final int SYMBOL_FUNCTION = 12;
    public static final int SYMBOL_STRING = 15;
    public static final int SYMBOL_ARRAY = 18;
    public static final int SYMBOL_KEY = 20;

    // ==================== FoldingRangeKind ====================

    public static final String FOLDING_COMMENT = "comment";
    public static final String FOLDING_REGION = "region";

    // ==================== MessageType ====================

    public static final int MESSAGE_INFO = 3;

    // ==================== TextDocumentSyncKind ====================

    public static final int SYNC_FULL = 1;
}
