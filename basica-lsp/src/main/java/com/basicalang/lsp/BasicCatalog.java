package com.basicalang.lsp;

import java.util.*;

/**
 * BASIC 关键词 / 内置函数目录
 *
 * <p>进程级只读表：补全说明、悬停文档与函数签名。名称一律大写。</p>
 */
final class BasicCatalog {

    private BasicCatalog() {}

    /** 函数签名 */
    static final class Signature {
        final String label;
        final String documentation;
        /** 形如 {@code "count - Number of characters"} */
        final List<String> parameters;

        Signature(String label, String documentation, String... parameters) {
            this.label = label;
            this.documentation = documentation;
            this.parameters = Collections.unmodifiableList(Arrays.asList(parameters));
        }
    }

    // ============ 关键词 ============

    private static final Map<String, String> KEYWORDS = new LinkedHashMap<String, String>();
    static {
        // 控制流
        KEYWORDS.put("IF", "Conditional execution");
        KEYWORDS.put("THEN", "Part of IF statement");
        KEYWORDS.put("ELSE", "Alternative branch");
        KEYWORDS.put("ELSEIF", "Chained condition");
        KEYWORDS.put("ENDIF", "End of IF block");
        KEYWORDS.put("FOR", "Counted loop");
        KEYWORDS.put("TO", "Loop end value");
        KEYWORDS.put("STEP", "Loop increment");
        KEYWORDS.put("NEXT", "End of FOR loop");
        KEYWORDS.put("WHILE", "Conditional loop");
        KEYWORDS.put("WEND", "End of WHILE");
        KEYWORDS.put("DO", "DO...LOOP block");
        KEYWORDS.put("LOOP", "End of DO block");
        KEYWORDS.put("UNTIL", "Loop exit condition");
        KEYWORDS.put("EXIT", "Exit loop early");
        KEYWORDS.put("GOTO", "Jump to line");
        KEYWORDS.put("GOSUB", "Call subroutine");
        KEYWORDS.put("RETURN", "Return from subroutine");
        KEYWORDS.put("ON", "Computed GOTO/GOSUB");
        KEYWORDS.put("SELECT", "Multi-way branch");
        KEYWORDS.put("CASE", "Branch option");
        KEYWORDS.put("IS", "CASE comparison");
        KEYWORDS.put("END", "End program");
        KEYWORDS.put("STOP", "Halt execution");
        KEYWORDS.put("ERROR", "Raise or trap an error");
        KEYWORDS.put("RESUME", "Continue after error");
        KEYWORDS.put("SUB", "Subprogram");
        KEYWORDS.put("CALL", "Call subprogram");
        KEYWORDS.put("CHAIN", "Run another program");
        KEYWORDS.put("COMMON", "Share variables with CHAINed program");
        KEYWORDS.put("SHARED", "Share variables");
        KEYWORDS.put("STATIC", "Static variables");
        KEYWORDS.put("SYSTEM", "Return to operating system");
        // 变量与数据
        KEYWORDS.put("LET", "Variable assignment");
        KEYWORDS.put("DIM", "Declare array");
        KEYWORDS.put("ERASE", "Delete arrays");
        KEYWORDS.put("OPTION", "OPTION BASE statement");
        KEYWORDS.put("BASE", "Lowest array subscript");
        KEYWORDS.put("DEF", "Define function");
        KEYWORDS.put("DEFINT", "Default integer type");
        KEYWORDS.put("DEFSNG", "Default single type");
        KEYWORDS.put("DEFDBL", "Default double type");
        KEYWORDS.put("DEFSTR", "Default string type");
        KEYWORDS.put("SEG", "Memory segment");
        KEYWORDS.put("FN", "User-defined function");
        KEYWORDS.put("SWAP", "Exchange variables");
        KEYWORDS.put("RANDOMIZE", "Seed RNG");
        KEYWORDS.put("CLEAR", "Clear variables");
        KEYWORDS.put("POKE", "Write to memory");
        KEYWORDS.put("OUT", "Write to I/O port");
        KEYWORDS.put("WAIT", "Wait on I/O port");
        // 输入输出
        KEYWORDS.put("PRINT", "Output to screen");
        KEYWORDS.put("LPRINT", "Output to printer");
        KEYWORDS.put("USING", "Formatted output");
        KEYWORDS.put("INPUT", "Read user input");
        KEYWORDS.put("LINE", "LINE INPUT statement / draw line");
        KEYWORDS.put("READ", "Read from DATA");
        KEYWORDS.put("DATA", "Define data values");
        KEYWORDS.put("RESTORE", "Reset DATA pointer");
        KEYWORDS.put("REM", "Comment");
        KEYWORDS.put("WRITE", "Write delimited data");
        KEYWORDS.put("KEY", "Function key settings");
        KEYWORDS.put("TRON", "Trace on");
        KEYWORDS.put("TROFF", "Trace off");
        // 文件
        KEYWORDS.put("OPEN", "Open file");
        KEYWORDS.put("CLOSE", "Close file");
        KEYWORDS.put("AS", "File number / new name");
        KEYWORDS.put("OUTPUT", "File mode");
        KEYWORDS.put("APPEND", "File mode");
        KEYWORDS.put("RANDOM", "File mode");
        KEYWORDS.put("BINARY", "File mode");
        KEYWORDS.put("FIELD", "Define record buffer");
        KEYWORDS.put("LSET", "Left-justify into field");
        KEYWORDS.put("RSET", "Right-justify into field");
        KEYWORDS.put("KILL", "Delete file");
        KEYWORDS.put("NAME", "Rename file");
        KEYWORDS.put("MKDIR", "Create directory");
        KEYWORDS.put("RMDIR", "Remove directory");
        KEYWORDS.put("CHDIR", "Change directory");
        KEYWORDS.put("FILES", "List files");
        // 屏幕、图形与声音
        KEYWORDS.put("SCREEN", "Set screen mode");
        KEYWORDS.put("COLOR", "Set colors");
        KEYWORDS.put("CLS", "Clear screen");
        KEYWORDS.put("LOCATE", "Position cursor");
        KEYWORDS.put("WIDTH", "Set screen width");
        KEYWORDS.put("VIEW", "Set viewport");
        KEYWORDS.put("WINDOW", "Set logical coordinates");
        KEYWORDS.put("PALETTE", "Change palette");
        KEYWORDS.put("CIRCLE", "Draw circle");
        KEYWORDS.put("PAINT", "Flood fill");
        KEYWORDS.put("PSET", "Set pixel");
        KEYWORDS.put("PRESET", "Clear pixel");
        KEYWORDS.put("DRAW", "Turtle graphics");
        KEYWORDS.put("GET", "Capture sprite");
        KEYWORDS.put("PUT", "Draw sprite");
        KEYWORDS.put("PLAY", "Play music");
        KEYWORDS.put("SOUND", "Play tone");
        KEYWORDS.put("BEEP", "System beep");
        // 运算符
        KEYWORDS.put("AND", "Logical AND");
        KEYWORDS.put("OR", "Logical OR");
        KEYWORDS.put("XOR", "Logical XOR");
        KEYWORDS.put("NOT", "Logical NOT");
        KEYWORDS.put("MOD", "Modulo operator");
        KEYWORDS.put("IMP", "Logical implication");
        KEYWORDS.put("EQV", "Logical equivalence");
    }

    // ============ 内置函数 ============

    private static final Map<String, String> FUNCTIONS = new LinkedHashMap<String, String>();
    static {
        // 字符串
        FUNCTIONS.put("CHR$", "Character from ASCII code");
        FUNCTIONS.put("ASC", "ASCII code of character");
        FUNCTIONS.put("LEN", "String length");
        FUNCTIONS.put("LEFT$", "Leftmost characters");
        FUNCTIONS.put("RIGHT$", "Rightmost characters");
        FUNCTIONS.put("MID$", "Substring");
        FUNCTIONS.put("STR$", "Number to string");
        FUNCTIONS.put("VAL", "String to number");
        FUNCTIONS.put("STRING$", "Repeat character");
        FUNCTIONS.put("SPACE$", "String of spaces");
        FUNCTIONS.put("INSTR", "Find substring");
        FUNCTIONS.put("UCASE$", "Uppercase");
        FUNCTIONS.put("LCASE$", "Lowercase");
        FUNCTIONS.put("LTRIM$", "Trim left spaces");
        FUNCTIONS.put("RTRIM$", "Trim right spaces");
        FUNCTIONS.put("HEX$", "Hexadecimal string");
        FUNCTIONS.put("OCT$", "Octal string");
        FUNCTIONS.put("INPUT$", "Read characters");
        // 数学
        FUNCTIONS.put("ABS", "Absolute value");
        FUNCTIONS.put("SGN", "Sign of number");
        FUNCTIONS.put("INT", "Integer part (floor)");
        FUNCTIONS.put("FIX", "Truncate to integer");
        FUNCTIONS.put("CINT", "Round to integer");
        FUNCTIONS.put("CSNG", "Convert to single");
        FUNCTIONS.put("CDBL", "Convert to double");
        FUNCTIONS.put("SQR", "Square root");
        FUNCTIONS.put("SIN", "Sine");
        FUNCTIONS.put("COS", "Cosine");
        FUNCTIONS.put("TAN", "Tangent");
        FUNCTIONS.put("ATN", "Arctangent");
        FUNCTIONS.put("LOG", "Natural logarithm");
        FUNCTIONS.put("EXP", "Exponential");
        FUNCTIONS.put("RND", "Random number");
        // 系统与输入输出
        FUNCTIONS.put("PEEK", "Read memory");
        FUNCTIONS.put("INP", "Read I/O port");
        FUNCTIONS.put("FRE", "Free memory");
        FUNCTIONS.put("VARPTR", "Variable address");
        FUNCTIONS.put("VARPTR$", "Variable pointer string");
        FUNCTIONS.put("SADD", "String address");
        FUNCTIONS.put("TIMER", "Seconds since midnight");
        FUNCTIONS.put("DATE$", "Current date");
        FUNCTIONS.put("TIME$", "Current time");
        FUNCTIONS.put("INKEY$", "Read key (no wait)");
        FUNCTIONS.put("EOF", "End of file check");
        FUNCTIONS.put("LOF", "File length");
        FUNCTIONS.put("LOC", "File position");
        FUNCTIONS.put("CSRLIN", "Cursor row");
        FUNCTIONS.put("POS", "Cursor column");
        FUNCTIONS.put("POINT", "Pixel color");
        FUNCTIONS.put("TAB", "Move to column");
        FUNCTIONS.put("SPC", "Output spaces");
    }

    /** 不需要声明即可读取的内置伪变量 */
    private static final Set<String> BUILTIN_VARIABLES = new HashSet<String>(Arrays.asList(
            "TIMER", "DATE$", "TIME$", "INKEY$", "ERR", "ERL"));

    // ============ 悬停文档（键为去掉 $ 的大写名） ============

    private static final Map<String, String> DOCUMENTATION = new HashMap<String, String>();
    static {
        // 控制流
        DOCUMENTATION.put("IF", "**IF** condition **THEN** statement [**ELSE** statement]\n\nConditional execution. If the condition is true, executes the THEN clause; otherwise executes the optional ELSE clause.");
        DOCUMENTATION.put("THEN", "**THEN**\n\nPart of IF...THEN...ELSE statement. Introduces the code to execute when the condition is true.");
        DOCUMENTATION.put("ELSE", "**ELSE**\n\nPart of IF...THEN...ELSE statement. Introduces the code to execute when the condition is false.");
        DOCUMENTATION.put("FOR", "**FOR** var **=** start **TO** end [**STEP** step]\n\nBegin a counted loop. The variable is initialized to start and incremented by step (default 1) until it exceeds end.");
        DOCUMENTATION.put("TO", "**TO**\n\nPart of FOR...TO...STEP statement. Specifies the ending value of the loop.");
        DOCUMENTATION.put("STEP", "**STEP** value\n\nOptional part of FOR loop. Specifies the increment (can be negative for counting down).");
        DOCUMENTATION.put("NEXT", "**NEXT** [var]\n\nEnd of FOR loop. Increments the loop variable and continues if not past the end value.");
        DOCUMENTATION.put("WHILE", "**WHILE** condition\n\nBegin a conditional loop. Repeats while the condition is true.");
        DOCUMENTATION.put("WEND", "**WEND**\n\nEnd of WHILE loop. Returns to WHILE to re-check the condition.");
        DOCUMENTATION.put("DO", "**DO** [**WHILE**|**UNTIL** condition]\n\nBegin a DO...LOOP block. Can have condition at start or end.");
        DOCUMENTATION.put("LOOP", "**LOOP** [**WHILE**|**UNTIL** condition]\n\nEnd of DO...LOOP block. Can have condition at end.");
        DOCUMENTATION.put("UNTIL", "**UNTIL** condition\n\nLoop exit condition. Loop continues until the condition becomes true.");
        DOCUMENTATION.put("EXIT", "**EXIT** **DO** | **EXIT** **FOR**\n\nExit from the innermost DO or FOR loop.");
        DOCUMENTATION.put("GOTO", "**GOTO** line\n\nUnconditional jump to the specified line number.");
        DOCUMENTATION.put("GOSUB", "**GOSUB** line\n\nCall subroutine at line number. Use RETURN to come back.");
        DOCUMENTATION.put("RETURN", "**RETURN**\n\nReturn from subroutine to the statement after GOSUB.");
        DOCUMENTATION.put("ON", "**ON** expr **GOTO** line1, line2, ... | **ON** expr **GOSUB** line1, line2, ...\n\nComputed GOTO/GOSUB. Jumps to the nth line in the list based on the expression value.");
        DOCUMENTATION.put("SELECT", "**SELECT CASE** expr\n\nBegin a SELECT CASE block for multi-way branching.");
        DOCUMENTATION.put("CASE", "**CASE** value | **CASE** v1 **TO** v2 | **CASE IS** op value | **CASE ELSE**\n\nDefines a case in SELECT CASE block.");
        DOCUMENTATION.put("END", "**END**\n\nTerminate program execution.");
        DOCUMENTATION.put("STOP", "**STOP**\n\nHalt program execution (can be resumed in some implementations).");

        // 输入输出
        DOCUMENTATION.put("PRINT", "**PRINT** [expr] [; | ,] ...\n\nOutput to screen. Semicolon continues on same line; comma moves to next tab zone.");
        DOCUMENTATION.put("LPRINT", "**LPRINT** [expr] [; | ,] ...\n\nOutput to printer. Same format as PRINT.");
        DOCUMENTATION.put("INPUT", "**INPUT** [\"prompt\";] var1 [, var2, ...]\n\nRead input from user. Displays optional prompt and waits for keyboard input.");
        DOCUMENTATION.put("LINE", "**LINE INPUT** [\"prompt\";] var$\n\nRead entire line of input including commas into string variable.");
        DOCUMENTATION.put("READ", "**READ** var1 [, var2, ...]\n\nRead values from DATA statements into variables.");
        DOCUMENTATION.put("DATA", "**DATA** value1, value2, ...\n\nDefine constant data to be read by READ statements.");
        DOCUMENTATION.put("RESTORE", "**RESTORE** [line]\n\nReset DATA pointer to beginning or to specified line.");

        // 变量与数组
        DOCUMENTATION.put("LET", "**LET** var = expr | var = expr\n\nAssign value to variable. LET keyword is optional.");
        DOCUMENTATION.put("DIM", "**DIM** array(size) [, array2(size), ...]\n\nDeclare array dimensions. Arrays are 0-indexed by default.");
        DOCUMENTATION.put("SWAP", "**SWAP** var1, var2\n\nExchange values of two variables.");

        // 字符串函数
        DOCUMENTATION.put("CHR", "**CHR$(n)**\n\nReturns the character with ASCII code n.\n\nExample: `CHR$(65)` returns `\"A\"`");
        DOCUMENTATION.put("ASC", "**ASC(string$)**\n\nReturns the ASCII code of the first character.\n\nExample: `ASC(\"A\")` returns `65`");
        DOCUMENTATION.put("LEN", "**LEN(string$)**\n\nReturns the length of the string.\n\nExample: `LEN(\"Hello\")` returns `5`");
        DOCUMENTATION.put("LEFT", "**LEFT$(string$, n)**\n\nReturns the leftmost n characters.\n\nExample: `LEFT$(\"Hello\", 2)` returns `\"He\"`");
        DOCUMENTATION.put("RIGHT", "**RIGHT$(string$, n)**\n\nReturns the rightmost n characters.\n\nExample: `RIGHT$(\"Hello\", 2)` returns `\"lo\"`");
        DOCUMENTATION.put("MID", "**MID$(string$, start [, length])**\n\nReturns substring starting at position start (1-based).\n\nExample: `MID$(\"Hello\", 2, 3)` returns `\"ell\"`");
        DOCUMENTATION.put("STR", "**STR$(n)**\n\nConverts number to string.\n\nExample: `STR$(42)` returns `\" 42\"` (with leading space for positive)");
        DOCUMENTATION.put("VAL", "**VAL(string$)**\n\nConverts string to number.\n\nExample: `VAL(\"3.14\")` returns `3.14`");
        DOCUMENTATION.put("STRING", "**STRING$(n, char)**\n\nReturns string of n copies of character.\n\nExample: `STRING$(5, 42)` returns `\"*****\"`");
        DOCUMENTATION.put("SPACE", "**SPACE$(n)**\n\nReturns string of n spaces.\n\nExample: `SPACE$(5)` returns `\"     \"`");
        DOCUMENTATION.put("INSTR", "**INSTR([start,] string1$, string2$)**\n\nReturns position of string2$ in string1$ (1-based, 0 if not found).\n\nExample: `INSTR(\"Hello\", \"ll\")` returns `3`");
        DOCUMENTATION.put("UCASE", "**UCASE$(string$)**\n\nConverts string to uppercase.\n\nExample: `UCASE$(\"Hello\")` returns `\"HELLO\"`");
        DOCUMENTATION.put("LCASE", "**LCASE$(string$)**\n\nConverts string to lowercase.\n\nExample: `LCASE$(\"Hello\")` returns `\"hello\"`");
        DOCUMENTATION.put("LTRIM", "**LTRIM$(string$)**\n\nRemoves leading spaces.\n\nExample: `LTRIM$(\"  Hi\")` returns `\"Hi\"`");
        DOCUMENTATION.put("RTRIM", "**RTRIM$(string$)**\n\nRemoves trailing spaces.");
        DOCUMENTATION.put("HEX", "**HEX$(n)**\n\nReturns hexadecimal representation of number.\n\nExample: `HEX$(255)` returns `\"FF\"`");
        DOCUMENTATION.put("OCT", "**OCT$(n)**\n\nReturns octal representation of number.");

        // 数学函数
        DOCUMENTATION.put("ABS", "**ABS(n)**\n\nReturns absolute value.\n\nExample: `ABS(-5)` returns `5`");
        DOCUMENTATION.put("SGN", "**SGN(n)**\n\nReturns sign: -1 if negative, 0 if zero, 1 if positive.");
        DOCUMENTATION.put("INT", "**INT(n)**\n\nReturns largest integer not greater than n (floor).\n\nExample: `INT(3.7)` returns `3`, `INT(-3.7)` returns `-4`");
        DOCUMENTATION.put("FIX", "**FIX(n)**\n\nReturns integer part (truncates toward zero).\n\nExample: `FIX(-3.7)` returns `-3`");
        DOCUMENTATION.put("CINT", "**CINT(n)**\n\nConverts to integer with rounding.");
        DOCUMENTATION.put("SQR", "**SQR(n)**\n\nReturns square root.\n\nExample: `SQR(16)` returns `4`");
        DOCUMENTATION.put("SIN", "**SIN(n)**\n\nReturns sine of angle in radians.");
        DOCUMENTATION.put("COS", "**COS(n)**\n\nReturns cosine of angle in radians.");
        DOCUMENTATION.put("TAN", "**TAN(n)**\n\nReturns tangent of angle in radians.");
        DOCUMENTATION.put("ATN", "**ATN(n)**\n\nReturns arctangent in radians.");
        DOCUMENTATION.put("LOG", "**LOG(n)**\n\nReturns natural logarithm (base e).");
        DOCUMENTATION.put("EXP", "**EXP(n)**\n\nReturns e raised to the power n.");
        DOCUMENTATION.put("RND", "**RND** [(n)]\n\nReturns random number between 0 and 1.\n\nUse `RANDOMIZE` to seed the generator.");
        DOCUMENTATION.put("RANDOMIZE", "**RANDOMIZE** [seed]\n\nSeed the random number generator. Without argument, uses system time.");

        // 系统函数
        DOCUMENTATION.put("INKEY", "**INKEY$**\n\nReturns key pressed (empty string if none). Non-blocking keyboard input.");
        DOCUMENTATION.put("TAB", "**TAB(n)**\n\nMove to column n in PRINT statement.");
        DOCUMENTATION.put("SPC", "**SPC(n)**\n\nOutput n spaces in PRINT statement.");
        DOCUMENTATION.put("TIMER", "**TIMER**\n\nReturns seconds since midnight as floating-point number.");
        DOCUMENTATION.put("DATE", "**DATE$**\n\nReturns current date as string.");
        DOCUMENTATION.put("TIME", "**TIME$**\n\nReturns current time as string.");
        DOCUMENTATION.put("EOF", "**EOF(n)**\n\nReturns -1 (true) if end of file reached on file #n.");
        DOCUMENTATION.put("PEEK", "**PEEK(address)**\n\nReturns byte value at memory address.");
        DOCUMENTATION.put("POKE", "**POKE** address, value\n\nWrite byte value to memory address.");
        DOCUMENTATION.put("POINT", "**POINT(x, y)**\n\nReturns color of pixel at coordinates.");

        // 图形与声音
        DOCUMENTATION.put("SCREEN", "**SCREEN** mode [, colorswitch]\n\nSet graphics mode. Mode 0 is text, higher modes are graphics.");
        DOCUMENTATION.put("COLOR", "**COLOR** foreground [, background [, border]]\n\nSet text or graphics colors.");
        DOCUMENTATION.put("CLS", "**CLS**\n\nClear screen.");
        DOCUMENTATION.put("LOCATE", "**LOCATE** row, col [, cursor]\n\nPosition text cursor. Row and column are 1-based.");
        DOCUMENTATION.put("CIRCLE", "**CIRCLE** (x, y), radius [, color]\n\nDraw circle centered at (x, y).");
        DOCUMENTATION.put("PAINT", "**PAINT** (x, y) [, color [, border]]\n\nFlood fill starting at (x, y).");
        DOCUMENTATION.put("PSET", "**PSET** (x, y) [, color]\n\nSet pixel at coordinates.");
        DOCUMENTATION.put("PRESET", "**PRESET** (x, y)\n\nReset pixel at coordinates to background color.");
        DOCUMENTATION.put("GET", "**GET** (x1, y1)-(x2, y2), array\n\nCapture screen rectangle into array (sprite capture).");
        DOCUMENTATION.put("PUT", "**PUT** (x, y), array\n\nDraw array contents at position (sprite draw).");
        DOCUMENTATION.put("DRAW", "**DRAW** command$\n\nTurtle graphics. Commands: U/D/L/R (move), M (move to), C (color), etc.");
        DOCUMENTATION.put("PLAY", "**PLAY** music$\n\nPlay music notation. Notes: A-G, O (octave), L (length), T (tempo).");
        DOCUMENTATION.put("SOUND", "**SOUND** frequency, duration\n\nPlay tone at frequency (Hz) for duration.");
        DOCUMENTATION.put("BEEP", "**BEEP**\n\nPlay system beep sound.");
        DOCUMENTATION.put("WIDTH", "**WIDTH** columns\n\nSet screen width (40 or 80 columns typically).");

        // 文件
        DOCUMENTATION.put("OPEN", "**OPEN** filename$ **FOR** mode **AS** #n\n\nOpen file. Modes: INPUT, OUTPUT, APPEND.");
        DOCUMENTATION.put("CLOSE", "**CLOSE** [#n]\n\nClose file. Without argument, closes all files.");
        DOCUMENTATION.put("KILL", "**KILL** filename$\n\nDelete file.");
        DOCUMENTATION.put("NAME", "**NAME** oldname$ **AS** newname$\n\nRename file.");
        DOCUMENTATION.put("FILES", "**FILES** [pattern$]\n\nList files matching pattern.");
        DOCUMENTATION.put("MKDIR", "**MKDIR** dirname$\n\nCreate directory.");
        DOCUMENTATION.put("RMDIR", "**RMDIR** dirname$\n\nRemove directory.");
        DOCUMENTATION.put("CHDIR", "**CHDIR** dirname$\n\nChange current directory.");

        // 运算符
        DOCUMENTATION.put("AND", "**AND**\n\nLogical AND operator. Returns true if both operands are true.\n\nExample: `IF A > 0 AND B > 0 THEN ...`");
        DOCUMENTATION.put("OR", "**OR**\n\nLogical OR operator. Returns true if either operand is true.\n\nExample: `IF A = 1 OR A = 2 THEN ...`");
        DOCUMENTATION.put("XOR", "**XOR**\n\nLogical exclusive OR. Returns true if operands differ.");
        DOCUMENTATION.put("NOT", "**NOT**\n\nLogical NOT operator. Inverts boolean value.\n\nExample: `IF NOT EOF(1) THEN ...`");
        DOCUMENTATION.put("MOD", "**MOD**\n\nModulo operator. Returns remainder of integer division.\n\nExample: `10 MOD 3` returns `1`");

        // 错误处理
        DOCUMENTATION.put("ERROR", "**ON ERROR GOTO** line\n\nSet error trap. When error occurs, jumps to specified line.");
        DOCUMENTATION.put("RESUME", "**RESUME** [line | **NEXT**]\n\nContinue after error. RESUME retries, RESUME NEXT continues, RESUME line jumps.");

        // 其他
        DOCUMENTATION.put("REM", "**REM** comment\n\nComment. Everything after REM is ignored.");
        DOCUMENTATION.put("DEF", "**DEF FN**name(params) = expression\n\nDefine user function.\n\nExample: `DEF FNSQUARE(X) = X * X`");
        DOCUMENTATION.put("FN", "**FN**name(args)\n\nCall user-defined function.\n\nExample: `Y = FNSQUARE(5)`");
        DOCUMENTATION.put("CLEAR", "**CLEAR**\n\nClear all variables and reset program state.");
        DOCUMENTATION.put("CHAIN", "**CHAIN** filename$ [, line]\n\nLoad and run another BASIC program.");
    }

    // ============ 函数签名 ============

    private static final Map<String, Signature> SIGNATURES = new HashMap<String, Signature>();
    static {
        // 字符串
        SIGNATURES.put("CHR$", new Signature("CHR$(code)", "Returns character for ASCII code",
                "code - ASCII code (0-255)"));
        SIGNATURES.put("ASC", new Signature("ASC(string$)", "Returns ASCII code of first character",
                "string$ - String to get first character from"));
        SIGNATURES.put("LEN", new Signature("LEN(string$)", "Returns length of string",
                "string$ - String to measure"));
        SIGNATURES.put("LEFT$", new Signature("LEFT$(string$, count)", "Returns leftmost characters",
                "string$ - Source string", "count - Number of characters"));
        SIGNATURES.put("RIGHT$", new Signature("RIGHT$(string$, count)", "Returns rightmost characters",
                "string$ - Source string", "count - Number of characters"));
        SIGNATURES.put("MID$", new Signature("MID$(string$, start[, length])", "Returns substring",
                "string$ - Source string", "start - Starting position (1-based)",
                "length - Number of characters (optional)"));
        SIGNATURES.put("STR$", new Signature("STR$(number)", "Converts number to string",
                "number - Number to convert"));
        SIGNATURES.put("VAL", new Signature("VAL(string$)", "Converts string to number",
                "string$ - String to parse"));
        SIGNATURES.put("STRING$", new Signature("STRING$(count, char)", "Returns repeated character",
                "count - Number of repetitions", "char - Character or ASCII code"));
        SIGNATURES.put("SPACE$", new Signature("SPACE$(count)", "Returns string of spaces",
                "count - Number of spaces"));
        SIGNATURES.put("INSTR", new Signature("INSTR([start,] string$, search$)", "Returns position of substring",
                "start - Starting position (optional)", "string$ - String to search in", "search$ - String to find"));
        SIGNATURES.put("UCASE$", new Signature("UCASE$(string$)", "Converts to uppercase",
                "string$ - String to convert"));
        SIGNATURES.put("LCASE$", new Signature("LCASE$(string$)", "Converts to lowercase",
                "string$ - String to convert"));
        SIGNATURES.put("LTRIM$", new Signature("LTRIM$(string$)", "Removes leading spaces",
                "string$ - String to trim"));
        SIGNATURES.put("RTRIM$", new Signature("RTRIM$(string$)", "Removes trailing spaces",
                "string$ - String to trim"));
        SIGNATURES.put("HEX$", new Signature("HEX$(number)", "Converts to hexadecimal string",
                "number - Number to convert"));
        SIGNATURES.put("OCT$", new Signature("OCT$(number)", "Converts to octal string",
                "number - Number to convert"));

        // 数学
        SIGNATURES.put("ABS", new Signature("ABS(number)", "Returns absolute value",
                "number - Number to get absolute value of"));
        SIGNATURES.put("SGN", new Signature("SGN(number)", "Returns sign (-1, 0, or 1)",
                "number - Number to check"));
        SIGNATURES.put("INT", new Signature("INT(number)", "Returns largest integer <= number",
                "number - Number to floor"));
        SIGNATURES.put("FIX", new Signature("FIX(number)", "Truncates toward zero",
                "number - Number to truncate"));
        SIGNATURES.put("CINT", new Signature("CINT(number)", "Rounds to nearest integer",
                "number - Number to round"));
        SIGNATURES.put("SQR", new Signature("SQR(number)", "Returns square root",
                "number - Non-negative number"));
        SIGNATURES.put("SIN", new Signature("SIN(angle)", "Returns sine", "angle - Angle in radians"));
        SIGNATURES.put("COS", new Signature("COS(angle)", "Returns cosine", "angle - Angle in radians"));
        SIGNATURES.put("TAN", new Signature("TAN(angle)", "Returns tangent", "angle - Angle in radians"));
        SIGNATURES.put("ATN", new Signature("ATN(number)", "Returns arctangent in radians", "number - Value"));
        SIGNATURES.put("LOG", new Signature("LOG(number)", "Returns natural logarithm",
                "number - Positive number"));
        SIGNATURES.put("EXP", new Signature("EXP(number)", "Returns e raised to power", "number - Exponent"));
        SIGNATURES.put("RND", new Signature("RND[(seed)]", "Returns random number 0-1",
                "seed - Optional seed value"));

        // 屏幕 / 图形
        SIGNATURES.put("POINT", new Signature("POINT(x, y)", "Returns color at pixel",
                "x - X coordinate", "y - Y coordinate"));
        SIGNATURES.put("CSRLIN", new Signature("CSRLIN", "Returns cursor row"));
        SIGNATURES.put("POS", new Signature("POS(dummy)", "Returns cursor column", "dummy - Ignored value"));
        SIGNATURES.put("TAB", new Signature("TAB(column)", "Moves to column in PRINT",
                "column - Column to move to"));
        SIGNATURES.put("SPC", new Signature("SPC(count)", "Outputs spaces in PRINT", "count - Number of spaces"));

        // 输入输出
        SIGNATURES.put("EOF", new Signature("EOF(filenum)", "Returns true if at end of file",
                "filenum - File number"));
        SIGNATURES.put("PEEK", new Signature("PEEK(address)", "Returns byte at address",
                "address - Memory address"));
        SIGNATURES.put("TIMER", new Signature("TIMER", "Returns seconds since midnight"));
    }

    // ============ 查询 ============

    static boolean isKeyword(String upper) {
        return KEYWORDS.containsKey(upper);
    }

    static boolean isFunction(String upper) {
        return FUNCTIONS.containsKey(upper);
    }

    static boolean isBuiltinVariable(String upper) {
        return BUILTIN_VARIABLES.contains(upper);
    }

    static Map<String, String> keywords() {
        return Collections.unmodifiableMap(KEYWORDS);
    }

    static Map<String, String> functions() {
        return Collections.unmodifiableMap(FUNCTIONS);
    }

    /**
     * 悬停文档：大小写不敏感，忽略 {@code $} 后缀
     */
    static String documentation(String word) {
        return DOCUMENTATION.get(LspTextUtils.stripDollar(LspTextUtils.toUpperAscii(word)));
    }

    static Signature signature(String upperName) {
        return SIGNATURES.get(upperName);
    }
}
