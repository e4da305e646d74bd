package com.basicalang.compiler.parser;

import com.basicalang.compiler.lexer.Token;
import com.basicalang.compiler.lexer.TokenType;

/**
 * 解析异常
 *
 * <p>消息格式：出错的物理行带有 BASIC 行号 N 时为 {@code "Line N: ..."}，
 * 否则为 {@code "... at line R"}（R 为 1-based 物理行）。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final int basicLineNumber;

    public ParseException(String message, Token token, int basicLineNumber) {
        super(message);
        this.token = token;
        this.basicLineNumber = basicLineNumber;
    }

    public Token getToken() {
        return token;
    }

    /** 出错行的 BASIC 行号，无行号时为 -1 */
    public int getBasicLineNumber() {
        return basicLineNumber;
    }

    /** 不含位置信息的原始描述 */
    public String getDescription() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (token != null && token.getType() != TokenType.ERROR) {
            sb.append(" (found ").append(describe(token)).append(')');
        }
        return sb.toString();
    }

    @Override
    public String getMessage() {
        if (basicLineNumber >= 0) {
            return "Line " + basicLineNumber + ": " + getDescription();
        }
        StringBuilder sb = new StringBuilder(getDescription());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
        }
        return sb.toString();
    }

    private static String describe(Token token) {
        switch (token.getType()) {
            case NEWLINE:
                return "end of line";
            case EOF:
                return "end of input";
            case COMMENT:
                return "comment";
            default:
                return "'" + token.getLexeme() + "'";
        }
    }
}
