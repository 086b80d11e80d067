package com.cadenza.targets;

/**
 * 目标平台
 */
public enum TargetPlatform {
    CSHARP("C#", "csharp", "Program.cs"),
    JAVA("Java", "java", "CadenzaProgram.java"),
    JAVASCRIPT("JavaScript", "javascript", "program.js"),
    NATIVE("C++", "native", "program.cpp"),
    WEBASSEMBLY("WebAssembly", "wasm", "program.wat");

    private final String displayName;
    private final String directoryName;
    private final String primaryFileName;

    TargetPlatform(String displayName, String directoryName, String primaryFileName) {
        this.displayName = displayName;
        this.directoryName = directoryName;
        this.primaryFileName = primaryFileName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** 多目标编译时的输出子目录名 */
    public String getDirectoryName() {
        return directoryName;
    }

    /** 主源文件名 */
    public String getPrimaryFileName() {
        return primaryFileName;
    }

    /**
     * 按目录名或枚举名查找（忽略大小写），如 "wasm"、"NATIVE"
     *
     * @return 对应平台，未知返回 null
     */
    public static TargetPlatform fromName(String name) {
        if (name == null) return null;
        for (TargetPlatform platform : values()) {
            if (platform.name().equalsIgnoreCase(name) || platform.directoryName.equalsIgnoreCase(name)) {
                return platform;
            }
        }
        return null;
    }
}
