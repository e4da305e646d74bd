package com.basicalang.lsp;

import com.google.gson.Gson;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BasicaSettings 测试")
class BasicaSettingsTest {

    private static final Gson GSON = new Gson();

    @Test
    @DisplayName("缺省配置全部开启")
    void testDefaults() {
        BasicaSettings settings = BasicaSettings.fromJson(GSON, null);

        assertThat(settings.isUndefinedVariableWarnings()).isTrue();
        assertThat(settings.isUnusedVariableHints()).isTrue();
        assertThat(settings.isUnreachableCodeHints()).isTrue();
        assertThat(settings.getDiagnosticsDelayMs()).isEqualTo(200);
    }

    @Test
    @DisplayName("只覆盖出现的键")
    void testPartialOverride() {
        BasicaSettings settings = BasicaSettings.fromJson(GSON,
                JsonParser.parseString("{\"unusedVariableHints\":false,\"diagnosticsDelayMs\":0}"));

        assertThat(settings.isUnusedVariableHints()).isFalse();
        assertThat(settings.isUndefinedVariableWarnings()).isTrue();
        assertThat(settings.getDiagnosticsDelayMs()).isZero();
    }

    @Test
    @DisplayName("负数延迟回退到默认值")
    void testNegativeDelay() {
        BasicaSettings settings = BasicaSettings.fromJson(GSON,
                JsonParser.parseString("{\"diagnosticsDelayMs\":-5}"));

        assertThat(settings.getDiagnosticsDelayMs()).isEqualTo(200);
    }

    @Test
    @DisplayName("格式错误或不是对象时使用默认配置")
    void testMalformed() {
        assertThat(BasicaSettings.fromJson(GSON,
                JsonParser.parseString("{\"unusedVariableHints\":[1,2]}")).isUnusedVariableHints()).isTrue();
        assertThat(BasicaSettings.fromJson(GSON, new JsonPrimitive("x")).isUnreachableCodeHints()).isTrue();
    }
}
