package com.basicalang.lsp;

import com.basicalang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BasicCatalog 测试")
class BasicCatalogTest {

    @Test
    @DisplayName("词法分析器认识的关键词都在目录中")
    void testLexerKeywordsCovered() {
        for (String keyword : Lexer.getKeywords()) {
            assertThat(BasicCatalog.isKeyword(keyword)).as(keyword).isTrue();
        }
    }

    @Test
    @DisplayName("词法分析器认识的内置函数都在目录中")
    void testLexerFunctionsCovered() {
        for (String function : Lexer.getFunctions()) {
            assertThat(BasicCatalog.isFunction(function)).as(function).isTrue();
        }
    }

    @Test
    @DisplayName("关键词与函数互不重叠")
    void testDisjoint() {
        assertThat(BasicCatalog.keywords().keySet())
                .doesNotContainAnyElementsOf(BasicCatalog.functions().keySet());
    }

    @Test
    @DisplayName("目录只读")
    void testUnmodifiable() {
        assertThatThrownBy(() -> BasicCatalog.keywords().put("FOO", "bar"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("悬停文档大小写不敏感并忽略 $ 后缀")
    void testDocumentation() {
        assertThat(BasicCatalog.documentation("goto")).startsWith("**GOTO** line");
        assertThat(BasicCatalog.documentation("left$")).isEqualTo(BasicCatalog.documentation("LEFT"));
        assertThat(BasicCatalog.documentation("NOPE")).isNull();
    }

    @Test
    @DisplayName("函数签名带参数说明")
    void testSignature() {
        BasicCatalog.Signature mid = BasicCatalog.signature("MID$");

        assertThat(mid.label).isEqualTo("MID$(string$, start[, length])");
        assertThat(mid.parameters).hasSize(3);
        assertThat(mid.parameters.get(0)).startsWith("string$");
        assertThat(BasicCatalog.signature("TIMER").parameters).isEmpty();
        assertThat(BasicCatalog.signature("PRINT")).isNull();
    }

    @Test
    @DisplayName("内置伪变量")
    void testBuiltinVariables() {
        assertThat(BasicCatalog.isBuiltinVariable("INKEY$")).isTrue();
        assertThat(BasicCatalog.isBuiltinVariable("X")).isFalse();
    }
}
