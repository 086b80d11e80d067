package com.cadenza.targets;

import com.cadenza.targets.cpp.CppGenerator;
import com.cadenza.targets.csharp.CSharpGenerator;
import com.cadenza.targets.java.JavaGenerator;
import com.cadenza.targets.javascript.JavaScriptGenerator;
import com.cadenza.targets.wasm.WasmGenerator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 目标平台到生成器的静态注册表
 * <p>新增目标只需实现 {@link TargetGenerator} 并在此登记，编排器无需改动。</p>
 */
public final class TargetRegistry {
    private static final Map<TargetPlatform, TargetGenerator> GENERATORS =
            Collections.synchronizedMap(new EnumMap<TargetPlatform, TargetGenerator>(TargetPlatform.class));

    static {
        registerDefaults();
    }

    private TargetRegistry() {}

    /**
     * 取得目标的生成器
     *
     * @throws IllegalArgumentException 目标未注册
     */
    public static TargetGenerator get(TargetPlatform platform) {
        TargetGenerator generator = GENERATORS.get(platform);
        if (generator == null) {
            throw new IllegalArgumentException("No generator registered for " + platform);
        }
        return generator;
    }

    /**
     * 替换某个目标的生成器，返回原来的生成器（可能为 null）
     */
    public static TargetGenerator register(TargetPlatform platform, TargetGenerator generator) {
        if (platform == null || generator == null) {
            throw new IllegalArgumentException("platform and generator must not be null");
        }
        return GENERATORS.put(platform, generator);
    }

    /** 恢复内置生成器 */
    public static void reset() {
        registerDefaults();
    }

    public static Set<TargetPlatform> registeredTargets() {
        synchronized (GENERATORS) {
            Set<TargetPlatform> targets = EnumSet.noneOf(TargetPlatform.class);
            targets.addAll(GENERATORS.keySet());
            return Collections.unmodifiableSet(targets);
        }
    }

    private static void registerDefaults() {
        GENERATORS.put(TargetPlatform.CSHARP, new CSharpGenerator());
        GENERATORS.put(TargetPlatform.JAVA, new JavaGenerator());
        GENERATORS.put(TargetPlatform.JAVASCRIPT, new JavaScriptGenerator());
        GENERATORS.put(TargetPlatform.NATIVE, new CppGenerator());
        GENERATORS.put(TargetPlatform.WEBASSEMBLY, new WasmGenerator());
    }
}
