package com.cadenza.targets;

import com.cadenza.compiler.analysis.AnalyzedProgram;

import java.util.List;

/**
 * 后端代码生成器
 * <p>实现必须是无状态的：同一个实例可能被多个线程同时调用，每次调用的中间结构只属于该次调用。</p>
 */
public interface TargetGenerator {

    /**
     * 为已分析的程序生成目标代码
     *
     * @throws GenerationException 该后端无法处理此程序
     */
    TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config);

    /** 目标名称，如 "C#" */
    String targetName();

    /** 支持的语言特性描述 */
    List<String> supportedFeatures();

    TargetCapabilities capabilities();
}
