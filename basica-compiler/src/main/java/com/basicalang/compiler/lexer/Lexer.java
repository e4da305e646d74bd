package com.basicalang.compiler.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * BASIC 词法分析器
 *
 * <p>关键词不区分大小写。词法错误不抛异常，而是生成 {@link TokenType#ERROR} 交给解析器报告。</p>
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    // 关键词映射表（大写）
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 控制流
        map.put("IF", TokenType.KW_IF);
        map.put("THEN", TokenType.KW_THEN);
        map.put("ELSE", TokenType.KW_ELSE);
        map.put("ELSEIF", TokenType.KW_ELSEIF);
        map.put("END", TokenType.KW_END);
        map.put("ENDIF", TokenType.KW_ENDIF);
        map.put("FOR", TokenType.KW_FOR);
        map.put("TO", TokenType.KW_TO);
        map.put("STEP", TokenType.KW_STEP);
        map.put("NEXT", TokenType.KW_NEXT);
        map.put("WHILE", TokenType.KW_WHILE);
        map.put("WEND", TokenType.KW_WEND);
        map.put("DO", TokenType.KW_DO);
        map.put("LOOP", TokenType.KW_LOOP);
        map.put("UNTIL", TokenType.KW_UNTIL);
        map.put("EXIT", TokenType.KW_EXIT);
        map.put("GOTO", TokenType.KW_GOTO);
        map.put("GOSUB", TokenType.KW_GOSUB);
        map.put("RETURN", TokenType.KW_RETURN);
        map.put("ON", TokenType.KW_ON);
        map.put("SELECT", TokenType.KW_SELECT);
        map.put("CASE", TokenType.KW_CASE);
        map.put("IS", TokenType.KW_IS);
        map.put("STOP", TokenType.KW_STOP);
        map.put("RESUME", TokenType.KW_RESUME);
        map.put("ERROR", TokenType.KW_ERROR);

        // 声明与赋值
        map.put("LET", TokenType.KW_LET);
        map.put("DIM", TokenType.KW_DIM);
        map.put("DEF", TokenType.KW_DEF);
        map.put("FN", TokenType.KW_FN);
        map.put("SWAP", TokenType.KW_SWAP);

        // 输入输出
        map.put("PRINT", TokenType.KW_PRINT);
        map.put("LPRINT", TokenType.KW_LPRINT);
        map.put("INPUT", TokenType.KW_INPUT);
        map.put("LINE", TokenType.KW_LINE);
        map.put("READ", TokenType.KW_READ);
        map.put("DATA", TokenType.KW_DATA);
        map.put("RESTORE", TokenType.KW_RESTORE);
        map.put("USING", TokenType.KW_USING);

        // 运算符
        map.put("AND", TokenType.KW_AND);
        map.put("OR", TokenType.KW_OR);
        map.put("XOR", TokenType.KW_XOR);
        map.put("NOT", TokenType.KW_NOT);
        map.put("MOD", TokenType.KW_MOD);
        map.put("IMP", TokenType.KW_IMP);
        map.put("EQV", TokenType.KW_EQV);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 参数只做括号配对检查的语句关键词 */
    private static final Set<String> GENERIC_STATEMENTS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "CLS", "SCREEN", "COLOR", "LOCATE", "WIDTH", "VIEW", "WINDOW", "PALETTE",
            "CIRCLE", "PAINT", "PSET", "PRESET", "DRAW", "PLAY", "SOUND", "BEEP",
            "OPEN", "CLOSE", "GET", "PUT", "WRITE", "FIELD", "LSET", "RSET",
            "KILL", "NAME", "MKDIR", "RMDIR", "CHDIR", "FILES",
            "RANDOMIZE", "CLEAR", "POKE", "OUT", "WAIT", "ERASE", "OPTION", "KEY",
            "CALL", "CHAIN", "COMMON", "SHARED", "STATIC", "SUB", "SYSTEM",
            "TRON", "TROFF", "DEFINT", "DEFSNG", "DEFDBL", "DEFSTR"
    )));

    /** 内置函数名（含 $ 后缀） */
    private static final Set<String> FUNCTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "CHR$", "ASC", "LEN", "LEFT$", "RIGHT$", "MID$", "STR$", "VAL",
            "STRING$", "SPACE$", "INSTR", "UCASE$", "LCASE$", "LTRIM$", "RTRIM$",
            "HEX$", "OCT$", "ABS", "SGN", "INT", "FIX", "CINT", "CSNG", "CDBL",
            "SQR", "SIN", "COS", "TAN", "ATN", "LOG", "EXP", "RND",
            "PEEK", "INP", "TIMER", "DATE$", "TIME$", "INKEY$", "INPUT$",
            "EOF", "LOF", "LOC", "FRE", "CSRLIN", "POS", "POINT", "TAB", "SPC",
            "VARPTR", "VARPTR$", "SADD"
    )));

    /** 获取所有关键词集合（大写） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    /** 获取所有内置函数名（大写，含 $ 后缀） */
    public static Set<String> getFunctions() {
        return FUNCTIONS;
    }

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        start = current;
        tokens.add(new Token(TokenType.EOF, "", null, line, current - lineStart + 1, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '#': addToken(TokenType.HASH); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.MUL); break;
            case '/': addToken(TokenType.DIV); break;
            case '\\': addToken(TokenType.INT_DIV); break;
            case '^': addToken(TokenType.POWER); break;
            case '?': addToken(TokenType.KW_PRINT); break;

            case '=':
                if (match('<')) addToken(TokenType.LE);
                else if (match('>')) addToken(TokenType.GE);
                else addToken(TokenType.EQ);
                break;

            case '<':
                if (match('>')) addToken(TokenType.NE);
                else if (match('=')) addToken(TokenType.LE);
                else addToken(TokenType.LT);
                break;

            case '>':
                if (match('<')) addToken(TokenType.NE);
                else if (match('=')) addToken(TokenType.GE);
                else addToken(TokenType.GT);
                break;

            case '\'':
                comment();
                break;

            case '"':
                string();
                break;

            case '&':
                radixNumber();
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                addToken(TokenType.NEWLINE);
                newLine();
                break;

            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character '" + c + "'");
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '_';
    }

    private static boolean isTypeSuffix(char c) {
        return c == '$' || c == '%' || c == '!' || c == '#';
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, line, start - lineStart + 1, start));
    }

    // === 复杂 Token 扫描 ===

    /** 双引号字符串，无转义；未闭合时到行尾结束 */
    private void string() {
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            advance();
        }
        int valueEnd = current;
        if (peek() == '"') {
            advance();
        }
        addToken(TokenType.STRING, source.substring(start + 1, valueEnd));
    }

    /** REM 或 ' 注释，到行尾 */
    private void comment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        int end = current;
        while (end > start && source.charAt(end - 1) == '\r') end--;
        String lexeme = source.substring(start, end);
        tokens.add(new Token(TokenType.COMMENT, lexeme, null, line, start - lineStart + 1, start));
    }

    private void number() {
        boolean leadingPoint = source.charAt(start) == '.';
        while (isDigit(peek())) advance();

        // 小数部分（.5 这种形式已经带过小数点）
        if (!leadingPoint && peek() == '.') {
            advance();
            while (isDigit(peek())) advance();
        }

        // 指数部分（E 或 D）
        char e = Character.toUpperCase(peek());
        if (e == 'E' || e == 'D') {
            char next = peekNext();
            boolean signed = (next == '+' || next == '-')
                    && current + 2 < source.length() && isDigit(source.charAt(current + 2));
            if (isDigit(next) || signed) {
                advance();
                if (signed) advance();
                while (isDigit(peek())) advance();
            }
        }

        // 1.2.3、.5. 之类：多余的小数点连同后面的数字一起作为错误 token
        if (peek() == '.') {
            while (isDigit(peek()) || peek() == '.') advance();
            error("Malformed number '" + source.substring(start, current) + "'");
            return;
        }

        String digits = source.substring(start, current).toUpperCase(Locale.ROOT).replace('D', 'E');

        // 类型后缀
        if (peek() == '%' || peek() == '!' || peek() == '#') {
            advance();
        }

        double value;
        try {
            value = Double.parseDouble(digits);
        } catch (NumberFormatException ex) {
            error("Malformed number '" + source.substring(start, current) + "'");
            return;
        }
        addToken(TokenType.NUMBER, value);
    }

    /** &H 十六进制 / &O 八进制 */
    private void radixNumber() {
        char kind = Character.toUpperCase(peek());
        int radix;
        if (kind == 'H') {
            radix = 16;
            advance();
        } else if (kind == 'O') {
            radix = 8;
            advance();
        } else if (isDigit(kind)) {
            radix = 8; // &777 等价于 &O777
        } else {
            error("Unexpected character '&'");
            return;
        }
        int digitsStart = current;
        while (!isAtEnd() && Character.digit(peek(), radix) >= 0) advance();
        if (current == digitsStart) {
            error("Missing digits after '" + source.substring(start, current) + "'");
            return;
        }
        String digits = source.substring(digitsStart, current);
        if (digits.length() > 15) {
            error("Number too large: " + source.substring(start, current));
            return;
        }
        addToken(TokenType.NUMBER, Long.parseLong(digits, radix));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        if (isTypeSuffix(peek())) advance();

        String word = source.substring(start, current).toUpperCase(Locale.ROOT);
        if ("REM".equals(word)) {
            comment();
            return;
        }

        TokenType type = KEYWORDS.get(word);
        if (type == null) {
            if (GENERIC_STATEMENTS.contains(word)) {
                type = TokenType.STATEMENT;
            } else if (FUNCTIONS.contains(word)) {
                type = TokenType.FUNCTION;
            } else {
                type = TokenType.IDENTIFIER;
            }
        }
        addToken(type);
    }

    private void error(String message) {
        addToken(TokenType.ERROR, message);
    }
}
