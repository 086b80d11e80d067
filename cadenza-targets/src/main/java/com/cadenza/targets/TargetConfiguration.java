package com.cadenza.targets;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 后端生成配置
 * <p>可从 JSON 加载，缺失的键保持默认值，未知的键被忽略。</p>
 */
public class TargetConfiguration {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private boolean optimizeForSize = false;
    private boolean optimizeForSpeed = true;
    private boolean includeDebugInfo = false;
    private boolean enableRuntimeChecks = true;
    private String runtimeVersion = "latest";
    private int indentSize = 4;
    private boolean useSpaces = true;
    private Map<String, String> targetSpecificOptions = new LinkedHashMap<String, String>();

    public TargetConfiguration() {
    }

    public boolean isOptimizeForSize() {
        return optimizeForSize;
    }

    public void setOptimizeForSize(boolean optimizeForSize) {
        this.optimizeForSize = optimizeForSize;
    }

    public boolean isOptimizeForSpeed() {
        return optimizeForSpeed;
    }

    public void setOptimizeForSpeed(boolean optimizeForSpeed) {
        this.optimizeForSpeed = optimizeForSpeed;
    }

    public boolean isIncludeDebugInfo() {
        return includeDebugInfo;
    }

    public void setIncludeDebugInfo(boolean includeDebugInfo) {
        this.includeDebugInfo = includeDebugInfo;
    }

    /** 为真时生成副作用跟踪调用和运行时断言 */
    public boolean isEnableRuntimeChecks() {
        return enableRuntimeChecks;
    }

    public void setEnableRuntimeChecks(boolean enableRuntimeChecks) {
        this.enableRuntimeChecks = enableRuntimeChecks;
    }

    public String getRuntimeVersion() {
        return runtimeVersion;
    }

    public void setRuntimeVersion(String runtimeVersion) {
        this.runtimeVersion = runtimeVersion;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public Map<String, String> getTargetSpecificOptions() {
        return targetSpecificOptions;
    }

    public void setTargetSpecificOptions(Map<String, String> targetSpecificOptions) {
        this.targetSpecificOptions = targetSpecificOptions != null
                ? targetSpecificOptions : new LinkedHashMap<String, String>();
    }

    /**
     * 读取目标相关选项，如 "java.package"
     */
    public String getOption(String key, String defaultValue) {
        String value = targetSpecificOptions != null ? targetSpecificOptions.get(key) : null;
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public TargetConfiguration setOption(String key, String value) {
        if (targetSpecificOptions == null) {
            targetSpecificOptions = new LinkedHashMap<String, String>();
        }
        targetSpecificOptions.put(key, value);
        return this;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }

    // ============ JSON ============

    /**
     * 从 JSON 文档加载配置；空文档得到默认配置
     *
     * @throws IllegalArgumentException JSON 格式错误
     */
    public static TargetConfiguration fromJson(Reader reader) {
        TargetConfiguration config;
        try {
            config = GSON.fromJson(reader, TargetConfiguration.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid target configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            return new TargetConfiguration();
        }
        if (config.targetSpecificOptions == null) {
            config.targetSpecificOptions = new LinkedHashMap<String, String>();
        }
        if (config.runtimeVersion == null) {
            config.runtimeVersion = "latest";
        }
        return config;
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
