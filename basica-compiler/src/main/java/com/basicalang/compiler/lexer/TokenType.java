package com.basicalang.compiler.lexer;

/**
 * BASIC 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,
    STRING,

    // === 标识符 ===
    IDENTIFIER,
    FUNCTION,               // 内置函数名（CHR$、LEN、RND...）

    // === 注释 ===
    COMMENT,                // REM ... 或 ' ...，到行尾

    // === 关键词 - 控制流 ===
    KW_IF, KW_THEN, KW_ELSE, KW_ELSEIF, KW_END, KW_ENDIF,
    KW_FOR, KW_TO, KW_STEP, KW_NEXT,
    KW_WHILE, KW_WEND, KW_DO, KW_LOOP, KW_UNTIL, KW_EXIT,
    KW_GOTO, KW_GOSUB, KW_RETURN, KW_ON,
    KW_SELECT, KW_CASE, KW_IS,
    KW_STOP, KW_RESUME, KW_ERROR,

    // === 关键词 - 声明与赋值 ===
    KW_LET, KW_DIM, KW_DEF, KW_FN, KW_SWAP,

    // === 关键词 - 输入输出 ===
    KW_PRINT, KW_LPRINT, KW_INPUT, KW_LINE,
    KW_READ, KW_DATA, KW_RESTORE, KW_USING,

    // === 关键词 - 运算符 ===
    KW_AND, KW_OR, KW_XOR, KW_NOT, KW_MOD, KW_IMP, KW_EQV,

    // === 其他语句关键词（参数只做括号配对检查） ===
    STATEMENT,

    // === 操作符 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    INT_DIV,        // \
    POWER,          // ^
    EQ,             // =
    NE,             // <> 或 ><
    LT,             // <
    GT,             // >
    LE,             // <= 或 =<
    GE,             // >= 或 =>

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    COMMA,          // ,
    SEMICOLON,      // ;
    COLON,          // :
    HASH,           // #

    // === 特殊 ===
    NEWLINE,
    ERROR,
    EOF
}
