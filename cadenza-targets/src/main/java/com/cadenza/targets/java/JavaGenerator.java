package com.cadenza.targets.java;

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
 * Java 后端，生成可由 Maven 构建的单类程序
 */
public class JavaGenerator implements TargetGenerator {
    public static final String RUNTIME_FILE = "CadenzaRuntime.java";
    public static final String PROJECT_FILE = "pom.xml";
    public static final String DEFAULT_PACKAGE = "cadenza.generated";

    private static final TargetCapabilities CAPABILITIES = new TargetCapabilities(
            true, true, true, true, true,
            EnumSet.of(Effect.DATABASE, Effect.NETWORK, Effect.LOGGING, Effect.FILE_SYSTEM, Effect.MEMORY, Effect.IO));

    private static final List<String> FEATURES = Collections.unmodifiableList(Arrays.asList(
            "Result<T, E> with error propagation",
            "Option<T>",
            "Guard statements",
            "Match expressions (switch expressions and match lambdas)",
            "String interpolation (concatenation)",
            "Modules as static nested classes",
            "Effect tracking",
            "Javadoc comments"
    ));

    @Override
    public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
        String packageName = config.getOption("java.package", DEFAULT_PACKAGE);
        String source = new JavaEmitter(program, config, CAPABILITIES, packageName).emit();

        Map<String, String> vars = new HashMap<String, String>();
        vars.put("package", packageName);
        vars.put("artifactId", config.getOption("java.artifactId", "cadenza-program"));
        vars.put("javaVersion", config.getOption("java.version", "17"));
        vars.put("debug", String.valueOf(config.isIncludeDebugInfo()));

        List<AuxiliaryFile> files = new ArrayList<AuxiliaryFile>();
        files.add(new AuxiliaryFile(PROJECT_FILE, Templates.render("java/pom.xml", vars), AuxiliaryFile.Kind.MANIFEST));
        files.add(new AuxiliaryFile(RUNTIME_FILE, Templates.render("java/CadenzaRuntime.java", vars),
                AuxiliaryFile.Kind.RUNTIME));

        Map<String, String> build = new LinkedHashMap<String, String>();
        build.put("build", "mvn -q package");
        build.put("run", "java -cp target/classes " + packageName + "." + JavaEmitter.PROGRAM_CLASS);

        return new TargetGenerationResult(source, files, Collections.<String>emptyList(), build);
    }

    @Override
    public String targetName() {
        return "Java";
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
