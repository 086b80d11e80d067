package com.cadenza.targets.csharp;

import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.compiler.ast.Effect;
import com.cadenza.targets.AuxiliaryFile;
import com.cadenza.targets.TargetCapabilities;
import com.cadenza.targets.TargetConfiguration;
import com.cadenza.targets.TargetGenerationResult;
import com.cadenza.targets.TargetGenerator;
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
 * C# 后端（参考实现），面向 .NET SDK 项目
 */
public class CSharpGenerator implements TargetGenerator {
    public static final String RUNTIME_FILE = "CadenzaRuntime.cs";
    public static final String PROJECT_FILE = "Program.csproj";

    private static final TargetCapabilities CAPABILITIES = new TargetCapabilities(
            true, true, true, true, true, EnumSet.allOf(Effect.class));

    private static final List<String> FEATURES = Collections.unmodifiableList(Arrays.asList(
            "Result<T, E> with error propagation",
            "Option<T>",
            "Guard statements",
            "Match expressions (switch expressions and Match lambdas)",
            "String interpolation ($\"...\")",
            "Modules as namespaces with static classes",
            "Effect tracking",
            "XML documentation comments"
    ));

    @Override
    public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
        CSharpEmitter emitter = new CSharpEmitter(program, config, CAPABILITIES);
        String source = emitter.emit();

        Map<String, String> vars = new HashMap<String, String>();
        vars.put("outputType", emitter.hasEntryPoint() ? "Exe" : "Library");
        vars.put("framework", config.getOption("csharp.framework", "net8.0"));
        vars.put("optimize", String.valueOf(config.isOptimizeForSpeed() || config.isOptimizeForSize()));
        vars.put("debugType", config.isIncludeDebugInfo() ? "portable" : "none");
        vars.put("assemblyName", config.getOption("csharp.assemblyName", "CadenzaProgram"));

        List<AuxiliaryFile> files = new ArrayList<AuxiliaryFile>();
        files.add(new AuxiliaryFile(PROJECT_FILE, Templates.render("csharp/Program.csproj", vars),
                AuxiliaryFile.Kind.MANIFEST));
        files.add(new AuxiliaryFile(RUNTIME_FILE, Templates.load("csharp/CadenzaRuntime.cs"),
                AuxiliaryFile.Kind.RUNTIME));

        Map<String, String> build = new LinkedHashMap<String, String>();
        build.put("build", "dotnet build");
        build.put("run", "dotnet run");

        return new TargetGenerationResult(source, files,
                Collections.singletonList("Microsoft.NETCore.App"), build);
    }

    @Override
    public String targetName() {
        return "C#";
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
