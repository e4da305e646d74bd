package com.basicalang.compiler.parser;

import com.basicalang.compiler.lexer.Lexer;
import com.basicalang.compiler.lexer.Token;
import com.basicalang.compiler.lexer.TokenType;

import java.util.List;

import static com.basicalang.compiler.lexer.TokenType.*;

/**
 * BASIC 语法校验器（递归下降）
 *
 * <p>逐行校验：可选的行号，之后是以 {@code :} 分隔的语句。遇到第一个错误即停止，
 * 不构建语法树。</p>
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    /** 当前物理行的 BASIC 行号，无行号为 -1 */
    private int currentLineNumber = -1;

    private int lineCount = 0;
    private int statementCount = 0;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
    }

    public Parser(Lexer lexer) {
        this(lexer.scanTokens());
    }

    /**
     * 校验整个程序
     */
    public ParseResult parse() {
        try {
            while (!isAtEnd()) {
                parseLine();
            }
            return ParseResult.success(lineCount, statementCount);
        } catch (ParseException e) {
            return ParseResult.failure(e, lineCount, statementCount);
        }
    }

    // ============ 行 / 语句列表 ============

    private void parseLine() {
        if (match(NEWLINE)) {
            return; // 空行
        }

        currentLineNumber = -1;
        if (check(NUMBER) && current().isInteger()) {
            currentLineNumber = Integer.parseInt(advance().getLexeme());
        }

        parseStatementList(false);
        match(COMMENT);

        if (!isAtEnd()) {
            expect(NEWLINE, "Expected end of statement");
        }
        lineCount++;
    }

    /**
     * 以 {@code :} 分隔的语句序列，遇到行尾或注释停止
     *
     * @param insideIf 单行 IF 的分支中，ELSE 结束语句序列；否则 ELSE 是块 IF 的分支语句
     */
    void parseStatementList(boolean insideIf) {
        do {
            if ((check(KW_ELSE) && !insideIf) || !isStatementEnd()) {
                stmtParser.parseStatement();
                statementCount++;
            }
        } while (match(COLON));
    }

    // ============ 基础方法 ============

    Token current() {
        return tokens.get(position);
    }

    Token advance() {
        Token token = tokens.get(position);
        if (token.getType() != EOF) {
            position++;
        }
        return token;
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    boolean check(TokenType type) {
        return current().getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    /**
     * 当前语句是否已结束（: 、行尾、注释或单行 IF 的 ELSE）
     */
    boolean isStatementEnd() {
        return checkAny(COLON, NEWLINE, EOF, COMMENT, KW_ELSE);
    }

    /**
     * 当前是否位于物理行末尾（注释也视为行尾）
     */
    boolean isLineEnd() {
        return checkAny(NEWLINE, EOF, COMMENT);
    }

    /**
     * 期望一个行号（GOTO / GOSUB / THEN 等之后）
     */
    Token expectLineNumber(String after) {
        if (check(NUMBER) && current().isInteger()) {
            return advance();
        }
        throw error("Expected line number after " + after);
    }

    ParseException error(String message) {
        Token token = current();
        if (token.getType() == ERROR) {
            // 词法错误优先于语法描述
            return new ParseException(String.valueOf(token.getLiteral()), token, currentLineNumber);
        }
        return new ParseException(message, token, currentLineNumber);
    }
}
