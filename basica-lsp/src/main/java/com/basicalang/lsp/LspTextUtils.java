package com.basicalang.lsp;

import java.util.ArrayList;
import java.util.List;

/**
 * 纯文本层面的 BASIC 词法工具方法集合。
 *
 * <p>所有方法均为 static，不依赖 LSP 协议或语法树。列号按 Java {@code char}（UTF-16 代码单元）计。
 * 大小写折叠只处理 ASCII，保证折叠前后长度一致。</p>
 */
final class LspTextUtils {

    private LspTextUtils() {}

    // ============ 行切分 ============

    /**
     * 按 {@code \n} 切分，去掉行尾的 {@code \r}；文末换行之后不产生空行
     */
    static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        if (content == null || content.isEmpty()) return lines;
        int start = 0;
        while (start < content.length()) {
            int nl = content.indexOf('\n', start);
            int end = nl < 0 ? content.length() : nl;
            String line = content.substring(start, end);
            if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);
            lines.add(line);
            if (nl < 0) break;
            start = nl + 1;
        }
        return lines;
    }

    // ============ 字符 / 标识符 ============

    static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentChar(char c) {
        return isAsciiLetter(c) || isAsciiDigit(c) || c == '_';
    }

    /** 光标取词时的单词字符：标识符字符加 {@code $} */
    static boolean isWordChar(char c) {
        return isIdentChar(c) || c == '$';
    }

    static String toUpperAscii(String s) {
        char[] chars = s.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c >= 'a' && c <= 'z') chars[i] = (char) (c - 32);
        }
        return new String(chars);
    }

    static boolean isNumeric(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!isAsciiDigit(s.charAt(i))) return false;
        }
        return true;
    }

    /**
     * 解析 BASIC 行号（非负十进制整数），失败返回 -1
     */
    static int parseLineNumber(String s) {
        if (!isNumeric(s) || s.length() > 9) return -1;
        return Integer.parseInt(s);
    }

    static String stripDollar(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '$') end--;
        return name.substring(0, end);
    }

    // ============ 光标取词 ============

    /** 行内一段单词 */
    static final class WordSpan {
        final int start;
        final int end;
        final String text;

        WordSpan(int start, int end, String text) {
            this.start = start;
            this.end = end;
            this.text = text;
        }
    }

    /**
     * 从列号向左右扩展单词字符，光标紧贴单词末尾时同样命中
     *
     * @return 单词范围，列号不在单词上时返回 null
     */
    static WordSpan wordAt(String line, int column) {
        if (line == null || column < 0) return null;
        int pos = Math.min(column, line.length());
        int start = pos;
        while (start > 0 && isWordChar(line.charAt(start - 1))) start--;
        int end = pos;
        while (end < line.length() && isWordChar(line.charAt(end))) end++;
        if (start >= end) return null;
        return new WordSpan(start, end, line.substring(start, end));
    }

    // ============ 扫描 ============

    /**
     * 扫描数字字面量：十进制（可含小数点与带符号的 E 指数）或 {@code &H} 十六进制
     *
     * @return 字面量结束位置（不含）
     */
    static int scanNumber(String line, int pos) {
        int i = pos;
        int len = line.length();
        if (i + 1 < len && line.charAt(i) == '&' && (line.charAt(i + 1) == 'H' || line.charAt(i + 1) == 'h')) {
            i += 2;
            while (i < len && isHexDigit(line.charAt(i))) i++;
            return i;
        }
        while (i < len && (isAsciiDigit(line.charAt(i)) || line.charAt(i) == '.')) i++;
        if (i < len && (line.charAt(i) == 'E' || line.charAt(i) == 'e')) {
            int j = i + 1;
            if (j < len && (line.charAt(j) == '+' || line.charAt(j) == '-')) j++;
            if (j < len && isAsciiDigit(line.charAt(j))) {
                i = j;
                while (i < len && isAsciiDigit(line.charAt(i))) i++;
            }
        }
        return i;
    }

    /** 当前位置是否开始一个数字字面量 */
    static boolean isNumberStart(String line, int pos) {
        char c = line.charAt(pos);
        if (isAsciiDigit(c)) return true;
        if (c == '.' && pos + 1 < line.length() && isAsciiDigit(line.charAt(pos + 1))) return true;
        return c == '&' && pos + 2 < line.length()
                && (line.charAt(pos + 1) == 'H' || line.charAt(pos + 1) == 'h')
                && isHexDigit(line.charAt(pos + 2));
    }

    private static boolean isHexDigit(char c) {
        return isAsciiDigit(c) || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
    }

    /**
     * 扫描字符串字面量，无转义；未闭合时延伸到行尾
     *
     * @param pos 开头引号的位置
     * @return 字面量结束位置（不含）
     */
    static int scanString(String line, int pos) {
        int close = line.indexOf('"', pos + 1);
        return close < 0 ? line.length() : close + 1;
    }

    /**
     * 扫描标识符：字母开头，之后是字母、数字或下划线，可带一个 {@code $} 后缀
     *
     * @return 标识符结束位置（不含），pos 处不是字母时返回 pos
     */
    static int scanIdentifier(String line, int pos) {
        if (pos >= line.length() || !isAsciiLetter(line.charAt(pos))) return pos;
        int i = pos + 1;
        while (i < line.length() && isIdentChar(line.charAt(i))) i++;
        if (i < line.length() && line.charAt(i) == '$') i++;
        return i;
    }

    // ============ 注释 / 字面量遮蔽 ============

    /**
     * 注释起点：字符串之外的 {@code '} 或整词 {@code REM}，没有注释返回 -1
     */
    static int commentStart(String line) {
        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (!inString) {
                if (c == '\'') return i;
                if (isRemAt(line, i)) return i;
            }
        }
        return -1;
    }

    private static boolean isRemAt(String line, int i) {
        if (!line.regionMatches(true, i, "REM", 0, 3)) return false;
        if (i > 0 && isIdentChar(line.charAt(i - 1))) return false;
        int after = i + 3;
        return after >= line.length() || !isWordChar(line.charAt(after));
    }

    /**
     * 将字符串内容和注释正文替换为空格，保留引号、{@code REM} 与 {@code '} 本身，长度不变
     */
    static String maskLiterals(String line) {
        char[] chars = line.toCharArray();
        boolean inString = false;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (inString) {
                if (c == '"') inString = false;
                else chars[i] = ' ';
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '\'' || isRemAt(line, i)) {
                int from = c == '\'' ? i + 1 : i + 3;
                for (int j = from; j < chars.length; j++) chars[j] = ' ';
                break;
            }
        }
        return new String(chars);
    }

    // ============ 语句切分 ============

    /** 一条子语句：去掉首尾空白后的文本及其在行内的起始列 */
    static final class Statement {
        final String text;
        final int start;

        Statement(String text, int start) {
            this.text = text;
            this.start = start;
        }
    }

    /**
     * 以 {@code :} 切分子语句，跳过字符串内的冒号，忽略空语句
     *
     * @param from 行内开始切分的位置（通常为行号之后）
     */
    static List<Statement> splitStatements(String line, int from) {
        List<Statement> result = new ArrayList<>();
        boolean inString = false;
        int segmentStart = from;
        for (int i = from; i <= line.length(); i++) {
            char c = i < line.length() ? line.charAt(i) : ':';
            if (c == '"') inString = !inString;
            if (c == ':' && (!inString || i == line.length())) {
                addStatement(result, line, segmentStart, i);
                segmentStart = i + 1;
            }
        }
        return result;
    }

    private static void addStatement(List<Statement> result, String line, int start, int end) {
        while (start < end && Character.isWhitespace(line.charAt(start))) start++;
        while (end > start && Character.isWhitespace(line.charAt(end - 1))) end--;
        if (start < end) {
            result.add(new Statement(line.substring(start, end), start));
        }
    }

    /**
     * 逗号切分，括号与字符串内的逗号不算
     *
     * @return 每段的起始位置（相对 text），段数 = 返回长度
     */
    static List<Integer> splitTopLevelCommas(String text, int from) {
        List<Integer> starts = new ArrayList<>();
        starts.add(from);
        int depth = 0;
        boolean inString = false;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inString = !inString;
            if (inString) continue;
            if (c == '(') depth++;
            else if (c == ')') depth = Math.max(0, depth - 1);
            else if (c == ',' && depth == 0) starts.add(i + 1);
        }
        return starts;
    }

    // ============ 整词匹配 ============

    /**
     * 文本以整词 word 开头（之后不是标识符字符）
     */
    static boolean startsWithWord(String text, String word) {
        if (!text.startsWith(word)) return false;
        return text.length() == word.length() || !isWordChar(text.charAt(word.length()));
    }

    /**
     * 整词包含：前后都不是标识符字符
     */
    static boolean containsWord(String text, String word) {
        return indexOfWord(text, word, 0) >= 0;
    }

    static int indexOfWord(String text, String word, int from) {
        int idx = text.indexOf(word, from);
        while (idx >= 0) {
            int end = idx + word.length();
            boolean leftOk = idx == 0 || !isIdentChar(text.charAt(idx - 1));
            boolean rightOk = end >= text.length() || !isWordChar(text.charAt(end));
            if (leftOk && rightOk) return idx;
            idx = text.indexOf(word, idx + 1);
        }
        return -1;
    }

    static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        return pos;
    }

    /**
     * 截断预览文本，超出上限时保留前 max 个字符并以 {@code ...} 结尾
     */
    static String preview(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
