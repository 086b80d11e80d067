package com.cadenza.targets;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个目标的编译结果
 */
public final class CompilationOutcome {
    private final TargetPlatform target;
    private final boolean success;
    private final Path outputDirectory;
    private final List<Path> writtenFiles;
    private final TargetGenerationResult generationResult;
    private final String errorMessage;
    private final Throwable error;
    private final long elapsedMillis;

    private CompilationOutcome(TargetPlatform target, boolean success, Path outputDirectory, List<Path> writtenFiles,
                               TargetGenerationResult generationResult, String errorMessage, Throwable error,
                               long elapsedMillis) {
        this.target = target;
        this.success = success;
        this.outputDirectory = outputDirectory;
        this.writtenFiles = Collections.unmodifiableList(new ArrayList<Path>(writtenFiles));
        this.generationResult = generationResult;
        this.errorMessage = errorMessage;
        this.error = error;
        this.elapsedMillis = elapsedMillis;
    }

    public static CompilationOutcome success(TargetPlatform target, Path outputDirectory, List<Path> writtenFiles,
                                             TargetGenerationResult generationResult, long elapsedMillis) {
        return new CompilationOutcome(target, true, outputDirectory, writtenFiles, generationResult, null, null,
                elapsedMillis);
    }

    public static CompilationOutcome failure(TargetPlatform target, Path outputDirectory, String errorMessage,
                                             Throwable error, long elapsedMillis) {
        String message = errorMessage != null ? errorMessage
                : error != null ? error.getClass().getSimpleName() : "unknown error";
        return new CompilationOutcome(target, false, outputDirectory, Collections.<Path>emptyList(), null, message,
                error, elapsedMillis);
    }

    public TargetPlatform getTarget() {
        return target;
    }

    public boolean isSuccess() {
        return success;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /** 成功时写出的文件，主源文件在前 */
    public List<Path> getWrittenFiles() {
        return writtenFiles;
    }

    /** 失败时为 null */
    public TargetGenerationResult getGenerationResult() {
        return generationResult;
    }

    /** 成功时为 null */
    public String getErrorMessage() {
        return errorMessage;
    }

    public Throwable getError() {
        return error;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return target.getDisplayName() + ": " + (success ? "ok (" + writtenFiles.size() + " files)" : "failed - " + errorMessage);
    }
}
