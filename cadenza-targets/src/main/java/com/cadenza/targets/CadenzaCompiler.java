package com.cadenza.targets;

import com.cadenza.compiler.FrontEnd;
import com.cadenza.compiler.analysis.AnalyzedProgram;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * 编译入口：源码 → 前端分析 → 多目标生成
 * <p>词法、语法或语义错误以 {@link com.cadenza.compiler.CadenzaException} 抛出，此时不产生任何输出。</p>
 */
public class CadenzaCompiler {
    private final CompilerOptions options;

    public CadenzaCompiler() {
        this(new CompilerOptions());
    }

    public CadenzaCompiler(CompilerOptions options) {
        this.options = options != null ? options : new CompilerOptions();
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * 编译到多个目标，每个目标写入 outputDir 下各自的子目录
     */
    public MultiTargetResult compile(String sourceText, Set<TargetPlatform> targets, Path outputDir) {
        AnalyzedProgram program = analyze(sourceText);
        return new MultiTargetCompiler(options).compileToTargets(program, targets, outputDir);
    }

    /**
     * 编译到单个目标，直接写入 outputPath
     */
    public CompilationOutcome compile(String sourceText, TargetPlatform target, Path outputPath) {
        AnalyzedProgram program = analyze(sourceText);
        return new MultiTargetCompiler(options).compileToTarget(program, target, outputPath);
    }

    /** 编译到所有已注册目标 */
    public MultiTargetResult compileAll(String sourceText, Path outputDir) {
        return compile(sourceText, TargetRegistry.registeredTargets(), outputDir);
    }

    /**
     * 读取源文件并编译，诊断中使用该文件名
     */
    public MultiTargetResult compileFile(Path source, Set<TargetPlatform> targets, Path outputDir) throws IOException {
        String text = new String(Files.readAllBytes(source), StandardCharsets.UTF_8);
        CompilerOptions fileOptions = new CompilerOptions()
                .setParallel(options.isParallel())
                .setTimeoutMillis(options.getTimeoutMillis())
                .setConfiguration(options.getConfiguration())
                .setFileName(source.getFileName().toString());
        return new CadenzaCompiler(fileOptions).compile(text, targets, outputDir);
    }

    /** 只运行前端 */
    public AnalyzedProgram analyze(String sourceText) {
        return FrontEnd.analyze(sourceText, options.getFileName());
    }
}
