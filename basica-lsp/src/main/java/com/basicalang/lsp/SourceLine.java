package com.basicalang.lsp;

import java.util.ArrayList;
import java.util.List;

/**
 * 一行源码的词法视图
 *
 * <p>{@link #code} 是大写并遮蔽了字符串内容与注释正文的同长度文本，各分析器都在它上面做匹配，
 * 列号可直接映射回原文。</p>
 */
final class SourceLine {

    /** 0-based 物理行 */
    final int row;
    /** 原始文本 */
    final String text;
    /** 大写 + 遮蔽后的文本 */
    final String code;
    /** BASIC 行号，没有为 -1 */
    final int lineNumber;
    final int numberStart;
    final int numberEnd;
    /** 行号之后第一个非空白字符的位置 */
    final int contentStart;

    private SourceLine(int row, String text) {
        this.row = row;
        this.text = text;
        this.code = LspTextUtils.toUpperAscii(LspTextUtils.maskLiterals(text));

        int start = LspTextUtils.skipWhitespace(text, 0);
        int end = start;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end))) end++;
        int number = LspTextUtils.parseLineNumber(text.substring(start, end));
        if (number >= 0) {
            this.lineNumber = number;
            this.numberStart = start;
            this.numberEnd = end;
            this.contentStart = LspTextUtils.skipWhitespace(text, end);
        } else {
            this.lineNumber = -1;
            this.numberStart = -1;
            this.numberEnd = -1;
            this.contentStart = start;
        }
    }

    static List<SourceLine> parse(String content) {
        List<String> lines = LspTextUtils.splitLines(content);
        List<SourceLine> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            result.add(new SourceLine(i, lines.get(i)));
        }
        return result;
    }

    boolean hasLineNumber() {
        return lineNumber >= 0;
    }

    int length() {
        return text.length();
    }

    /** 行号之后的原始内容 */
    String content() {
        return text.substring(contentStart).trim();
    }

    /** 行号之后、注释之前的大写语句文本 */
    String statementCode() {
        int comment = LspTextUtils.commentStart(code);
        int end = comment < 0 ? code.length() : comment;
        return end <= contentStart ? "" : code.substring(contentStart, end).trim();
    }

    /** 行号之后是否直接是 REM 或 ' 注释 */
    boolean isComment() {
        String body = code.substring(contentStart);
        return body.startsWith("'") || LspTextUtils.startsWithWord(body, "REM");
    }

    /** 以 : 切分的子语句（大写、已遮蔽），注释不参与切分 */
    List<LspTextUtils.Statement> statements() {
        int comment = LspTextUtils.commentStart(code);
        String body = comment < 0 ? code : code.substring(0, comment);
        return LspTextUtils.splitStatements(body, Math.min(contentStart, body.length()));
    }
}
