package com.basicalang.lsp;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 服务器配置，取自 initialize 请求的 {@code initializationOptions}
 *
 * <p>缺失的键保持默认值；格式错误时整体回退到默认配置。</p>
 */
public class BasicaSettings {
    private static final Logger LOG = Logger.getLogger(BasicaSettings.class.getName());

    private static final long DEFAULT_DIAGNOSTICS_DELAY_MS = 200;

    private boolean undefinedVariableWarnings = true;
    private boolean unusedVariableHints = true;
    private boolean unreachableCodeHints = true;
    /** didChange 之后重新发布诊断的 debounce 延迟，0 表示立即发布 */
    private long diagnosticsDelayMs = DEFAULT_DIAGNOSTICS_DELAY_MS;

    public static BasicaSettings defaults() {
        return new BasicaSettings();
    }

    public static BasicaSettings fromJson(Gson gson, JsonElement options) {
        if (options == null || !options.isJsonObject()) {
            return defaults();
        }
        try {
            BasicaSettings settings = gson.fromJson(options, BasicaSettings.class);
            if (settings == null) {
                return defaults();
            }
            if (settings.diagnosticsDelayMs < 0) {
                LOG.warning("diagnosticsDelayMs 不能为负数，使用默认值: " + settings.diagnosticsDelayMs);
                settings.diagnosticsDelayMs = DEFAULT_DIAGNOSTICS_DELAY_MS;
            }
            return settings;
        } catch (JsonParseException e) {
            LOG.log(Level.WARNING, "initializationOptions 格式错误，使用默认配置", e);
            return defaults();
        }
    }

    public boolean isUndefinedVariableWarnings() {
        return undefinedVariableWarnings;
    }

    public boolean isUnusedVariableHints() {
        return unusedVariableHints;
    }

    public boolean isUnreachableCodeHints() {
        return unreachableCodeHints;
    }

    public long getDiagnosticsDelayMs() {
        return diagnosticsDelayMs;
    }
}
