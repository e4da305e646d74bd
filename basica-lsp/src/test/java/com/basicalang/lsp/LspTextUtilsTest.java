package com.basicalang.lsp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LspTextUtils 测试")
class LspTextUtilsTest {

    @Nested
    @DisplayName("行切分与行号")
    class Lines {

        @Test
        @DisplayName("去掉 \\r，文末换行不产生空行")
        void testSplitLines() {
            assertThat(LspTextUtils.splitLines("10 A\r\n20 B\n")).containsExactly("10 A", "20 B");
            assertThat(LspTextUtils.splitLines("a\n\nb")).containsExactly("a", "", "b");
            assertThat(LspTextUtils.splitLines("")).isEmpty();
        }

        @Test
        @DisplayName("行号只接受非负十进制整数")
        void testParseLineNumber() {
            assertThat(LspTextUtils.parseLineNumber("0010")).isEqualTo(10);
            assertThat(LspTextUtils.parseLineNumber("1a")).isEqualTo(-1);
            assertThat(LspTextUtils.parseLineNumber("-5")).isEqualTo(-1);
            assertThat(LspTextUtils.parseLineNumber("1234567890")).isEqualTo(-1);
        }

        @Test
        @DisplayName("SourceLine 拆出行号与内容")
        void testSourceLine() {
            SourceLine line = SourceLine.parse("  120   PRINT \"A:B\": X = 1 ' note").get(0);

            assertThat(line.lineNumber).isEqualTo(120);
            assertThat(line.numberStart).isEqualTo(2);
            assertThat(line.numberEnd).isEqualTo(5);
            assertThat(line.contentStart).isEqualTo(8);
            assertThat(line.statementCode()).isEqualTo("PRINT \"   \": X = 1");
            assertThat(line.statements()).extracting(s -> s.text)
                    .containsExactly("PRINT \"   \"", "X = 1");
        }

        @Test
        @DisplayName("没有行号的行")
        void testSourceLineWithoutNumber() {
            SourceLine line = SourceLine.parse("PRINT 1").get(0);

            assertThat(line.hasLineNumber()).isFalse();
            assertThat(line.contentStart).isZero();
        }
    }

    @Nested
    @DisplayName("光标取词")
    class WordAt {

        @Test
        @DisplayName("包含 $ 后缀")
        void testDollarSuffix() {
            LspTextUtils.WordSpan word = LspTextUtils.wordAt("10 PRINT A$", 9);

            assertThat(word.text).isEqualTo("A$");
            assertThat(word.start).isEqualTo(9);
            assertThat(word.end).isEqualTo(11);
        }

        @Test
        @DisplayName("光标紧贴单词末尾同样命中")
        void testEndOfWord() {
            assertThat(LspTextUtils.wordAt("10 PRINT A$", 11).text).isEqualTo("A$");
        }

        @Test
        @DisplayName("空白处返回 null")
        void testWhitespace() {
            assertThat(LspTextUtils.wordAt("10  X", 3)).isNull();
            assertThat(LspTextUtils.wordAt("", 0)).isNull();
        }
    }

    @Nested
    @DisplayName("扫描")
    class Scanning {

        @Test
        @DisplayName("十进制、指数与十六进制数字")
        void testScanNumber() {
            assertThat(LspTextUtils.scanNumber("1.5E-3 ", 0)).isEqualTo(6);
            assertThat(LspTextUtils.scanNumber("&HFF)", 0)).isEqualTo(4);
            assertThat(LspTextUtils.scanNumber("12E", 0)).isEqualTo(2);
            assertThat(LspTextUtils.isNumberStart(".5", 0)).isTrue();
            assertThat(LspTextUtils.isNumberStart("&HZ", 0)).isFalse();
        }

        @Test
        @DisplayName("未闭合字符串延伸到行尾")
        void testScanString() {
            assertThat(LspTextUtils.scanString("\"AB\" C", 0)).isEqualTo(4);
            assertThat(LspTextUtils.scanString("\"AB C", 0)).isEqualTo(5);
        }

        @Test
        @DisplayName("标识符最多带一个 $")
        void testScanIdentifier() {
            assertThat(LspTextUtils.scanIdentifier("NAME$ = 1", 0)).isEqualTo(5);
            assertThat(LspTextUtils.scanIdentifier("A_1(2)", 0)).isEqualTo(3);
            assertThat(LspTextUtils.scanIdentifier("1A", 0)).isZero();
        }
    }

    @Nested
    @DisplayName("注释与遮蔽")
    class Comments {

        @Test
        @DisplayName("字符串中的 ' 不是注释")
        void testCommentStart() {
            assertThat(LspTextUtils.commentStart("10 PRINT \"'\" ' x")).isEqualTo(13);
            assertThat(LspTextUtils.commentStart("10 rem hello")).isEqualTo(3);
            assertThat(LspTextUtils.commentStart("10 REMARK = 1")).isEqualTo(-1);
            assertThat(LspTextUtils.commentStart("10 PRINT 1")).isEqualTo(-1);
        }

        @Test
        @DisplayName("遮蔽字符串内容与注释正文，长度不变")
        void testMaskLiterals() {
            String line = "10 PRINT \"GOTO 5\" ' GOTO 6";
            String masked = LspTextUtils.maskLiterals(line);

            assertThat(masked).hasSameSizeAs(line);
            assertThat(masked).isEqualTo("10 PRINT \"      \" '       ");
        }
    }

    @Nested
    @DisplayName("语句切分与整词匹配")
    class Statements {

        @Test
        @DisplayName("按字符串之外的 : 切分并记录起始列")
        void testSplitStatements() {
            List<LspTextUtils.Statement> statements =
                    LspTextUtils.splitStatements("10 A = 1:  PRINT \"A:B\"", 3);

            assertThat(statements).hasSize(2);
            assertThat(statements.get(0).text).isEqualTo("A = 1");
            assertThat(statements.get(0).start).isEqualTo(3);
            assertThat(statements.get(1).text).isEqualTo("PRINT \"A:B\"");
            assertThat(statements.get(1).start).isEqualTo(11);
        }

        @Test
        @DisplayName("括号内的逗号不切分")
        void testSplitTopLevelCommas() {
            assertThat(LspTextUtils.splitTopLevelCommas("A(1, 2), B", 0)).containsExactly(0, 8);
        }

        @Test
        @DisplayName("整词匹配不命中更长的标识符")
        void testWholeWord() {
            assertThat(LspTextUtils.containsWord("GOTO 10", "GOTO")).isTrue();
            assertThat(LspTextUtils.containsWord("GOTOX = 1", "GOTO")).isFalse();
            assertThat(LspTextUtils.startsWithWord("FOR I", "FOR")).isTrue();
            assertThat(LspTextUtils.startsWithWord("FORMAT$", "FOR")).isFalse();
            assertThat(LspTextUtils.indexOfWord("A = ON + ON", "ON", 0)).isEqualTo(4);
        }

        @Test
        @DisplayName("预览截断")
        void testPreview() {
            assertThat(LspTextUtils.preview("abcdef", 3)).isEqualTo("abc...");
            assertThat(LspTextUtils.preview("abc", 3)).isEqualTo("abc");
        }
    }
}
