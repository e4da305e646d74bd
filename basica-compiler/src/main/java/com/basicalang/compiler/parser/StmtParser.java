package com.basicalang.compiler.parser;

import com.basicalang.compiler.lexer.Token;

import java.util.Locale;

import static com.basicalang.compiler.lexer.TokenType.*;

/**
 * 语句校验器
 */
final class StmtParser {

    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    private ExprParser expr() {
        return parser.exprParser;
    }

    void parseStatement() {
        Token token = parser.current();
        switch (token.getType()) {
            // === 赋值 ===
            case KW_LET:
                parser.advance();
                parseAssignment();
                break;
            case IDENTIFIER:
                parseAssignment();
                break;
            case FUNCTION:
                if (isMidFunction(token)) {
                    parseAssignment(); // MID$(A$, 1, 1) = "x"
                    break;
                }
                throw parser.error("Function cannot start a statement");
            case KW_SWAP:
                parser.advance();
                parseTarget("Expected variable after SWAP");
                parser.expect(COMMA, "Expected ',' in SWAP");
                parseTarget("Expected variable after ','");
                break;

            // === 输入输出 ===
            case KW_PRINT:
            case KW_LPRINT:
                parsePrint();
                break;
            case KW_INPUT:
                parser.advance();
                parseInputRest();
                break;
            case KW_LINE:
                parser.advance();
                if (parser.match(KW_INPUT)) {
                    parseInputRest();
                } else {
                    parseGenericArguments();
                }
                break;
            case KW_READ:
                parser.advance();
                parseTargetList();
                break;
            case KW_DATA:
                parser.advance();
                while (!parser.isStatementEnd()) {
                    if (parser.check(ERROR)) throw parser.error("Invalid DATA item");
                    parser.advance();
                }
                break;
            case KW_RESTORE:
                parser.advance();
                if (parser.check(NUMBER)) parser.expectLineNumber("RESTORE");
                break;

            // === 条件 ===
            case KW_IF:
                parseIf();
                break;
            case KW_ELSEIF:
                parser.advance();
                expr().parseExpression();
                parser.expect(KW_THEN, "Expected THEN after ELSEIF condition");
                break;
            case KW_ELSE:
                parser.advance(); // 块 IF 的 ELSE 分支，可直接跟一条语句
                if (!parser.isStatementEnd()) parseStatement();
                break;
            case KW_SELECT:
                parser.advance();
                parser.expect(KW_CASE, "Expected CASE after SELECT");
                expr().parseExpression();
                break;
            case KW_CASE:
                parseCase();
                break;
            case KW_END:
                parser.advance();
                if (!parser.matchAny(KW_IF, KW_SELECT) && isStatementWord("SUB")) {
                    parser.advance();
                }
                break;

            // === 循环 ===
            case KW_FOR:
                parseFor();
                break;
            case KW_NEXT:
                parser.advance();
                if (parser.match(IDENTIFIER)) {
                    while (parser.match(COMMA)) {
                        parser.expect(IDENTIFIER, "Expected loop variable after ','");
                    }
                }
                break;
            case KW_WHILE:
                parser.advance();
                expr().parseExpression();
                break;
            case KW_DO:
            case KW_LOOP:
                parser.advance();
                if (parser.matchAny(KW_WHILE, KW_UNTIL)) {
                    expr().parseExpression();
                }
                break;
            case KW_EXIT:
                parser.advance();
                if (!parser.matchAny(KW_FOR, KW_DO)) {
                    if (!isStatementWord("SUB")) throw parser.error("Expected FOR or DO after EXIT");
                    parser.advance();
                }
                break;

            // === 跳转 ===
            case KW_GOTO:
            case KW_GOSUB:
                parser.advance();
                parser.expectLineNumber(upper(token));
                break;
            case KW_RETURN:
                parser.advance();
                if (parser.check(NUMBER)) parser.expectLineNumber("RETURN");
                break;
            case KW_ON:
                parseOn();
                break;
            case KW_RESUME:
                parser.advance();
                if (!parser.match(KW_NEXT) && parser.check(NUMBER)) {
                    parser.expectLineNumber("RESUME");
                }
                break;
            case KW_ERROR:
                parser.advance();
                expr().parseExpression();
                break;
            case KW_ENDIF:
            case KW_WEND:
            case KW_STOP:
                parser.advance();
                break;

            // === 声明 ===
            case KW_DIM:
                parseDim();
                break;
            case KW_DEF:
                parseDef();
                break;

            case STATEMENT:
                parser.advance();
                parseGenericArguments();
                break;

            default:
                throw parser.error("Unexpected token at start of statement");
        }
    }

    // ============ 赋值 ============

    private void parseAssignment() {
        parseTarget("Expected variable name");
        parser.expect(EQ, "Expected '=' in assignment");
        expr().parseExpression();
    }

    /**
     * 可赋值目标：变量或数组元素
     */
    private void parseTarget(String message) {
        if (!parser.check(IDENTIFIER) && !isMidFunction(parser.current())) {
            throw parser.error(message);
        }
        parser.advance();
        if (parser.match(LPAREN)) {
            expr().parseArguments();
            parser.expect(RPAREN, "Expected ')' after subscripts");
        }
    }

    private void parseTargetList() {
        do {
            parseTarget("Expected variable name");
        } while (parser.match(COMMA));
    }

    // ============ 输入输出 ============

    private void parsePrint() {
        parser.advance();
        if (parser.match(HASH)) {
            expr().parseExpression();
            parser.expect(COMMA, "Expected ',' after file number");
        }
        if (parser.match(KW_USING)) {
            expr().parseExpression();
            parser.expect(SEMICOLON, "Expected ';' after USING format");
        }
        while (!parser.isStatementEnd()) {
            if (!parser.matchAny(SEMICOLON, COMMA)) {
                expr().parseExpression();
            }
        }
    }

    private void parseInputRest() {
        parser.match(SEMICOLON);
        if (parser.match(HASH)) {
            expr().parseExpression();
            parser.expect(COMMA, "Expected ',' after file number");
        } else if (parser.match(STRING)) {
            if (!parser.matchAny(SEMICOLON, COMMA)) {
                throw parser.error("Expected ';' or ',' after INPUT prompt");
            }
        }
        parseTargetList();
    }

    // ============ 条件 ============

    private void parseIf() {
        parser.advance();
        expr().parseExpression();
        if (parser.match(KW_THEN)) {
            if (parser.isLineEnd()) {
                return; // 块 IF，由 END IF 结束
            }
            parseBranch("THEN");
        } else if (parser.match(KW_GOTO)) {
            parser.expectLineNumber("GOTO");
        } else {
            throw parser.error("Expected THEN or GOTO after IF condition");
        }
        if (parser.match(KW_ELSE)) {
            parseBranch("ELSE");
        }
    }

    private void parseBranch(String keyword) {
        if (parser.check(NUMBER)) {
            parser.expectLineNumber(keyword);
            return;
        }
        parser.parseStatementList(true);
    }

    private void parseCase() {
        parser.advance();
        if (parser.match(KW_ELSE)) {
            return;
        }
        do {
            if (parser.match(KW_IS)) {
                if (!parser.matchAny(EQ, NE, LT, GT, LE, GE)) {
                    throw parser.error("Expected comparison operator after IS");
                }
                expr().parseExpression();
            } else {
                expr().parseExpression();
                if (parser.match(KW_TO)) {
                    expr().parseExpression();
                }
            }
        } while (parser.match(COMMA));
    }

    // ============ 循环 / 跳转 ============

    private void parseFor() {
        parser.advance();
        parser.expect(IDENTIFIER, "Expected loop variable after FOR");
        parser.expect(EQ, "Expected '=' after FOR variable");
        expr().parseExpression();
        parser.expect(KW_TO, "Expected TO in FOR statement");
        expr().parseExpression();
        if (parser.match(KW_STEP)) {
            expr().parseExpression();
        }
    }

    private void parseOn() {
        parser.advance();
        if (parser.match(KW_ERROR)) {
            parser.expect(KW_GOTO, "Expected GOTO after ON ERROR");
            parser.expectLineNumber("GOTO");
            return;
        }
        expr().parseExpression();
        Token keyword = parser.current();
        if (!parser.matchAny(KW_GOTO, KW_GOSUB)) {
            throw parser.error("Expected GOTO or GOSUB after ON expression");
        }
        do {
            parser.expectLineNumber(upper(keyword));
        } while (parser.match(COMMA));
    }

    // ============ 声明 ============

    private void parseDim() {
        parser.advance();
        do {
            if (isStatementWord("SHARED")) parser.advance();
            parser.expect(IDENTIFIER, "Expected array name in DIM");
            if (parser.match(LPAREN)) {
                expr().parseArguments();
                parser.expect(RPAREN, "Expected ')' after dimensions");
            }
        } while (parser.match(COMMA));
    }

    private void parseDef() {
        parser.advance();
        Token name = parser.current();
        if (parser.match(KW_FN)) {
            parser.expect(IDENTIFIER, "Expected function name after FN");
        } else if (name.is(IDENTIFIER) && upper(name).startsWith("FN") && name.getLexeme().length() > 2) {
            parser.advance();
        } else if (name.is(IDENTIFIER) && "SEG".equals(upper(name))) {
            parser.advance(); // DEF SEG [= address]
            if (parser.match(EQ)) expr().parseExpression();
            return;
        } else {
            throw parser.error("Expected FN after DEF");
        }

        if (parser.match(LPAREN)) {
            do {
                parser.expect(IDENTIFIER, "Expected parameter name");
            } while (parser.match(COMMA));
            parser.expect(RPAREN, "Expected ')' after parameters");
        }
        parser.expect(EQ, "Expected '=' in DEF FN");
        expr().parseExpression();
    }

    // ============ 通用语句 ============

    /**
     * 其他语句：参数只检查括号配对与词法错误
     */
    private void parseGenericArguments() {
        int depth = 0;
        while (!parser.isStatementEnd()) {
            Token token = parser.current();
            if (token.is(ERROR)) {
                throw parser.error("Invalid argument");
            }
            if (token.is(LPAREN)) {
                depth++;
            } else if (token.is(RPAREN)) {
                if (depth == 0) throw parser.error("Unmatched ')'");
                depth--;
            }
            parser.advance();
        }
        if (depth > 0) {
            throw parser.error("Expected ')'");
        }
    }

    // ============ 辅助 ============

    private boolean isStatementWord(String word) {
        return parser.check(STATEMENT) && word.equals(upper(parser.current()));
    }

    private static boolean isMidFunction(Token token) {
        return token.is(FUNCTION) && "MID$".equals(upper(token));
    }

    private static String upper(Token token) {
        return token.getLexeme().toUpperCase(Locale.ROOT);
    }
}
