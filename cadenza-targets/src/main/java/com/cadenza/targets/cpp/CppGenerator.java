package com.cadenza.targets.cpp;

import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.compiler.ast.Effect;
import com.cadenza.targets.AuxiliaryFile;
import com.cadenza.targets.TargetCapabilities;
import com.cadenza.targets.TargetConfiguration;
import com.cadenza.targets.TargetGenerationResult;
import com.cadenza.targets.TargetGenerator;
import com.cadenza.targets.TargetPlatform;
import com.cadenza.targets.support.Templates;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * C++ 后端（NATIVE），以 CMake 构建
 */
public class CppGenerator implements TargetGenerator {
    public static final String RUNTIME_FILE = "cadenza_runtime.h";
    public static final String CMAKE_FILE = "CMakeLists.txt";
    public static final String BUILD_SCRIPT = "build.sh";

    private static final TargetCapabilities CAPABILITIES = new TargetCapabilities(
            true, true, false, false, true,
            EnumSet.of(Effect.MEMORY, Effect.IO, Effect.FILE_SYSTEM, Effect.NETWORK, Effect.LOGGING));

    private static final List<String> FEATURES = Collections.unmodifiableList(Arrays.asList(
            "Result<T, E> with error propagation",
            "Option<T>",
            "Guard statements",
            "Match expressions (immediately invoked lambdas)",
            "String formatting via ostringstream",
            "Modules as namespaces",
            "Effect tracking"
    ));

    @Override
    public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
        CppEmitter emitter = new CppEmitter(program, config, CAPABILITIES);
        String source = emitter.emit();

        Map<String, String> vars = new HashMap<String, String>();
        vars.put("project", config.getOption("cpp.project", "cadenza_program"));
        vars.put("standard", config.getOption("cpp.standard", "17"));
        vars.put("buildType", buildType(config));
        vars.put("targetCommand", emitter.hasEntryPoint() ? "add_executable" : "add_library");
        vars.put("sources", TargetPlatform.NATIVE.getPrimaryFileName());

        List<AuxiliaryFile> files = new ArrayList<AuxiliaryFile>();
        files.add(new AuxiliaryFile(CMAKE_FILE, Templates.render("cpp/CMakeLists.txt", vars), AuxiliaryFile.Kind.MANIFEST));
        files.add(new AuxiliaryFile(RUNTIME_FILE, Templates.load("cpp/cadenza_runtime.h"), AuxiliaryFile.Kind.RUNTIME));
        files.add(new AuxiliaryFile(BUILD_SCRIPT, Templates.render("cpp/build.sh", vars), AuxiliaryFile.Kind.SCRIPT));

        Map<String, String> build = new LinkedHashMap<String, String>();
        build.put("configure", "cmake -S . -B build");
        build.put("build", "cmake --build build");

        return new TargetGenerationResult(source, files, Collections.singletonList("cmake"), build);
    }

    private static String buildType(TargetConfiguration config) {
        if (config.isIncludeDebugInfo()) {
            return config.isOptimizeForSpeed() ? "RelWithDebInfo" : "Debug";
        }
        if (config.isOptimizeForSize()) {
            return "MinSizeRel";
        }
        return "Release";
    }

    @Override
    public String targetName() {
        return "C++";
    }

    @Override
    public List<String> supportedFeatures() {
        return FEATURES;
    }

    @Override
    public TargetCapabilities capabilities() {
        return CAPABILITIES;
    }
}
