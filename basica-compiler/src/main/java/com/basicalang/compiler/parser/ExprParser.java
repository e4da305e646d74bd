package com.basicalang.compiler.parser;

import static com.basicalang.compiler.lexer.TokenType.*;

/**
 * 表达式校验器
 *
 * <p>优先级从低到高：IMP、EQV、XOR、OR、AND、NOT、关系运算、+ -、MOD、\、* /、一元正负、^。</p>
 */
final class ExprParser {

    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    void parseExpression() {
        parseImp();
    }

    /**
     * 逗号分隔的参数 / 下标列表，允许为空
     */
    void parseArguments() {
        if (parser.check(RPAREN)) {
            return;
        }
        do {
            parseExpression();
        } while (parser.match(COMMA));
    }

    // ============ 逻辑运算 ============

    private void parseImp() {
        parseEqv();
        while (parser.match(KW_IMP)) parseEqv();
    }

    private void parseEqv() {
        parseXor();
        while (parser.match(KW_EQV)) parseXor();
    }

    private void parseXor() {
        parseOr();
        while (parser.match(KW_XOR)) parseOr();
    }

    private void parseOr() {
        parseAnd();
        while (parser.match(KW_OR)) parseAnd();
    }

    private void parseAnd() {
        parseNot();
        while (parser.match(KW_AND)) parseNot();
    }

    private void parseNot() {
        if (parser.match(KW_NOT)) {
            parseNot();
            return;
        }
        parseRelational();
    }

    // ============ 关系 / 算术运算 ============

    private void parseRelational() {
        parseAdditive();
        while (parser.matchAny(EQ, NE, LT, GT, LE, GE)) parseAdditive();
    }

    private void parseAdditive() {
        parseModulo();
        while (parser.matchAny(PLUS, MINUS)) parseModulo();
    }

    private void parseModulo() {
        parseIntegerDivision();
        while (parser.match(KW_MOD)) parseIntegerDivision();
    }

    private void parseIntegerDivision() {
        parseMultiplicative();
        while (parser.match(INT_DIV)) parseMultiplicative();
    }

    private void parseMultiplicative() {
        parseUnary();
        while (parser.matchAny(MUL, DIV)) parseUnary();
    }

    private void parseUnary() {
        if (parser.matchAny(MINUS, PLUS)) {
            parseUnary();
            return;
        }
        parsePower();
    }

    /** ^ 左结合，指数可带符号：2 ^ -1 */
    private void parsePower() {
        parsePrimary();
        while (parser.match(POWER)) {
            parseExponent();
        }
    }

    private void parseExponent() {
        if (parser.matchAny(MINUS, PLUS)) {
            parseExponent();
            return;
        }
        parsePrimary();
    }

    // ============ 基本表达式 ============

    private void parsePrimary() {
        if (parser.matchAny(NUMBER, STRING)) {
            return;
        }

        if (parser.matchAny(IDENTIFIER, FUNCTION)) {
            parseOptionalArguments();
            return;
        }

        if (parser.match(KW_FN)) {
            parser.expect(IDENTIFIER, "Expected function name after FN");
            parseOptionalArguments();
            return;
        }

        if (parser.match(LPAREN)) {
            parseExpression();
            parser.expect(RPAREN, "Expected ')'");
            return;
        }

        throw parser.error("Expected expression");
    }

    private void parseOptionalArguments() {
        if (parser.match(LPAREN)) {
            parseArguments();
            parser.expect(RPAREN, "Expected ')' after arguments");
        }
    }
}
