package com.cadenza.targets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个后端的生成结果
 */
public final class TargetGenerationResult {
    private final String sourceText;
    private final List<AuxiliaryFile> auxiliaryFiles;
    private final List<String> dependencies;
    private final Map<String, String> buildInstructions;

    public TargetGenerationResult(String sourceText, List<AuxiliaryFile> auxiliaryFiles,
                                  List<String> dependencies, Map<String, String> buildInstructions) {
        this.sourceText = sourceText;
        this.auxiliaryFiles = Collections.unmodifiableList(new ArrayList<AuxiliaryFile>(auxiliaryFiles));
        this.dependencies = Collections.unmodifiableList(new ArrayList<String>(dependencies));
        this.buildInstructions = Collections.unmodifiableMap(new LinkedHashMap<String, String>(buildInstructions));
    }

    public String getSourceText() {
        return sourceText;
    }

    public List<AuxiliaryFile> getAuxiliaryFiles() {
        return auxiliaryFiles;
    }

    /**
     * 按文件名查找辅助文件
     *
     * @return 找不到返回 null
     */
    public AuxiliaryFile findAuxiliaryFile(String name) {
        for (AuxiliaryFile file : auxiliaryFiles) {
            if (file.getName().equals(name)) {
                return file;
            }
        }
        return null;
    }

    /** 外部依赖坐标，如 "Microsoft.NETCore.App" */
    public List<String> getDependencies() {
        return dependencies;
    }

    /** 构建步骤名 → 命令，按执行顺序 */
    public Map<String, String> getBuildInstructions() {
        return buildInstructions;
    }
}
