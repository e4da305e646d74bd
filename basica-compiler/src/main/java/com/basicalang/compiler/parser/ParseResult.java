package com.basicalang.compiler.parser;

/**
 * 校验结果：成功，或第一个语法错误的消息
 */
public final class ParseResult {
    private final ParseException error;
    private final int lineCount;
    private final int statementCount;

    private ParseResult(ParseException error, int lineCount, int statementCount) {
        this.error = error;
        this.lineCount = lineCount;
        this.statementCount = statementCount;
    }

    static ParseResult success(int lineCount, int statementCount) {
        return new ParseResult(null, lineCount, statementCount);
    }

    static ParseResult failure(ParseException error, int lineCount, int statementCount) {
        return new ParseResult(error, lineCount, statementCount);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public ParseException getError() {
        return error;
    }

    /** 错误消息，成功时为 null */
    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }

    /** 已解析的非空物理行数（失败时不含出错行） */
    public int getLineCount() {
        return lineCount;
    }

    public int getStatementCount() {
        return statementCount;
    }
}
