package com.basicalang.compiler.parser;

import com.basicalang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private ParseResult parse(String source) {
        return new Parser(new Lexer(source)).parse();
    }

    private void assertValid(String source) {
        ParseResult result = parse(source);
        assertTrue(result.isSuccess(), () -> "Expected valid program, got: " + result.getErrorMessage());
    }

    private String errorOf(String source) {
        ParseResult result = parse(source);
        assertFalse(result.isSuccess(), "Expected parse error for: " + source);
        return result.getErrorMessage();
    }

    @Nested
    @DisplayName("合法程序")
    class ValidProgramTests {

        @Test
        @DisplayName("赋值、输出与跳转")
        void testSimpleProgram() {
            assertValid("10 LET X = 5\n20 PRINT X\n30 GOTO 10");
        }

        @Test
        @DisplayName("空程序与空行")
        void testEmpty() {
            assertValid("");
            assertValid("\n\n10 END\n\n");
        }

        @Test
        @DisplayName("FOR / NEXT 循环")
        void testForLoop() {
            assertValid("10 FOR I = 1 TO 10 STEP 2\n20 PRINT I;\n30 NEXT I");
            assertValid("10 FOR I = 1 TO 3: FOR J = 1 TO 3: NEXT J, I");
        }

        @Test
        @DisplayName("单行 IF THEN ELSE")
        void testInlineIf() {
            assertValid("10 IF A = 1 THEN PRINT \"ONE\" ELSE PRINT \"OTHER\"");
            assertValid("10 IF A > 1 THEN 100 ELSE 200");
            assertValid("10 IF A THEN X = 1: Y = 2 ELSE Z = 3");
            assertValid("10 IF A GOTO 50");
        }

        @Test
        @DisplayName("块 IF")
        void testBlockIf() {
            assertValid("10 IF X > 1 THEN\n20 PRINT X\n30 ELSEIF X = 0 THEN\n40 PRINT 0\n50 ELSE\n60 PRINT -1\n70 END IF");
        }

        @Test
        @DisplayName("ON GOTO / GOSUB 与错误处理")
        void testOnStatements() {
            assertValid("10 ON X GOSUB 100, 200, 300");
            assertValid("10 ON ERROR GOTO 900\n900 RESUME NEXT");
        }

        @Test
        @DisplayName("DEF FN 与函数调用")
        void testDefFn() {
            assertValid("10 DEF FNSQ(X) = X * X\n20 Y = FNSQ(3)");
            assertValid("10 DEF FN AREA(R) = 3.14 * R ^ 2\n20 PRINT FN AREA(2)");
        }

        @Test
        @DisplayName("输入输出语句")
        void testInputOutput() {
            assertValid("10 INPUT \"NAME\"; N$");
            assertValid("10 LINE INPUT \"TEXT: \", T$");
            assertValid("10 PRINT USING \"##.#\"; X");
            assertValid("10 PRINT #1, A$; TAB(10); B");
            assertValid("10 DATA 1, 2, HELLO\n20 READ A, B, C$\n30 RESTORE 10");
        }

        @Test
        @DisplayName("SELECT CASE 与 DO LOOP")
        void testStructuredBlocks() {
            assertValid("SELECT CASE X\nCASE 1, 2\nCASE IS > 5\nCASE 6 TO 9\nCASE ELSE\nEND SELECT");
            assertValid("DO WHILE X < 10\nX = X + 1\nLOOP\nDO\nLOOP UNTIL X = 0");
        }

        @Test
        @DisplayName("通用语句与注释")
        void testGenericStatements() {
            assertValid("10 OPEN \"DATA.TXT\" FOR INPUT AS #1\n20 CLOSE #1");
            assertValid("10 SCREEN 1: CLS: LINE (0, 0)-(10, 10), 1");
            assertValid("10 PRINT \"HI\" ' greet\n20 REM comment: ignored");
            assertValid("10 MID$(A$, 1, 1) = \"X\"");
        }

        @Test
        @DisplayName("复杂表达式")
        void testExpressions() {
            assertValid("10 X = -2 ^ -1 + 3 MOD 2 \\ 1 * (4 / 2)");
            assertValid("10 IF NOT (A <> B) AND C >= 1 OR D XOR E THEN END");
            assertValid("10 A$ = LEFT$(B$, LEN(B$) - 1) + CHR$(65)");
            assertValid("10 R = RND: T = TIMER");
        }

        @Test
        @DisplayName("统计行数与语句数")
        void testCounts() {
            ParseResult result = parse("10 A = 1: B = 2\n20 PRINT A + B");
            assertTrue(result.isSuccess());
            assertEquals(2, result.getLineCount());
            assertEquals(3, result.getStatementCount());
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("带行号的错误使用 Line N: 格式")
        void testNumberedLineError() {
            assertEquals("Line 10: Expected variable name (found '=')", errorOf("10 LET = 5"));
        }

        @Test
        @DisplayName("错误定位到出错的行号")
        void testSecondLineError() {
            assertEquals("Line 20: Expected '=' in assignment (found '5')", errorOf("10 PRINT 1\n20 X 5"));
        }

        @Test
        @DisplayName("无行号的错误使用 at line R 格式")
        void testUnnumberedLineError() {
            assertEquals("Expected expression (found ')') at line 3", errorOf("PRINT 1\nPRINT 2\nPRINT )"));
        }

        @Test
        @DisplayName("缺少跳转目标")
        void testMissingLineNumber() {
            assertEquals("Line 10: Expected line number after GOTO (found end of input)", errorOf("10 GOTO"));
        }

        @Test
        @DisplayName("FOR 缺少 TO")
        void testForWithoutTo() {
            assertTrue(errorOf("10 FOR I = 1 10").startsWith("Line 10: Expected TO in FOR statement"));
        }

        @Test
        @DisplayName("IF 缺少 THEN")
        void testIfWithoutThen() {
            assertTrue(errorOf("20 IF X PRINT X").startsWith("Line 20: Expected THEN or GOTO after IF condition"));
        }

        @Test
        @DisplayName("词法错误作为语法错误报告")
        void testLexicalError() {
            assertEquals("Line 10: Unexpected character '@'", errorOf("10 PRINT @"));
        }

        @Test
        @DisplayName("括号不配对")
        void testUnbalancedParens() {
            assertTrue(errorOf("10 PRINT (1 + 2").startsWith("Line 10: Expected ')'"));
            assertTrue(errorOf("10 CLS )").startsWith("Line 10: Unmatched ')'"));
        }

        @Test
        @DisplayName("遇到第一个错误即停止")
        void testStopsAtFirstError() {
            ParseResult result = parse("10 PRINT 1\n20 LET = 1\n30 LET = 2");
            assertFalse(result.isSuccess());
            assertEquals(20, result.getError().getBasicLineNumber());
            assertEquals(1, result.getLineCount());
        }
    }
}
