package com.cadenza.targets;

/**
 * 多目标编译选项
 */
public class CompilerOptions {
    private boolean parallel = true;
    private long timeoutMillis = 0;
    private String fileName = "<source>";
    private TargetConfiguration configuration = new TargetConfiguration();

    public CompilerOptions() {
    }

    /** 各目标是否并行生成 */
    public boolean isParallel() {
        return parallel;
    }

    public CompilerOptions setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    /** 单个目标的超时（毫秒），0 表示不限 */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public CompilerOptions setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeoutMillis must not be negative: " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    /** 诊断中显示的源文件名 */
    public String getFileName() {
        return fileName;
    }

    public CompilerOptions setFileName(String fileName) {
        this.fileName = fileName;
        return this;
    }

    public TargetConfiguration getConfiguration() {
        return configuration;
    }

    public CompilerOptions setConfiguration(TargetConfiguration configuration) {
        this.configuration = configuration != null ? configuration : new TargetConfiguration();
        return this;
    }
}
