package com.cadenza.targets;

/**
 * 主源文件之外的生成产物
 */
public final class AuxiliaryFile {

    public enum Kind {
        /** 构建清单：csproj、pom.xml、package.json、CMakeLists.txt */
        MANIFEST,
        /** 运行时支持：Result/Option 类型与副作用跟踪 */
        RUNTIME,
        /** 宿主胶水：HTML 页面、WASM 加载器 */
        LOADER,
        /** 构建脚本 */
        SCRIPT
    }

    private final String name;
    private final String content;
    private final Kind kind;

    public AuxiliaryFile(String name, String content, Kind kind) {
        this.name = name;
        this.content = content;
        this.kind = kind;
    }

    /** 相对目标输出目录的文件名 */
    public String getName() {
        return name;
    }

    public String getContent() {
        return content;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return name + " (" + kind + ")";
    }
}
