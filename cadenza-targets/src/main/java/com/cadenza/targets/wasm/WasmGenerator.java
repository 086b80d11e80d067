package com.cadenza.targets.wasm;

import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.compiler.ast.Effect;
import com.cadenza.targets.AuxiliaryFile;
import com.cadenza.targets.TargetCapabilities;
import com.cadenza.targets.TargetConfiguration;
import com.cadenza.targets.TargetGenerationResult;
import com.cadenza.targets.TargetGenerator;
import com.cadenza.targets.TargetPlatform;
import com.cadenza.targets.support.Templates;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WebAssembly 后端：输出 WAT 文本，由 wabt 的 wat2wasm 编译为二进制
 */
public class WasmGenerator implements TargetGenerator {
    public static final String BINARY_FILE = "program.wasm";
    public static final String LOADER_FILE = "loader.js";
    public static final String PAGE_FILE = "index.html";
    public static final String PACKAGE_FILE = "package.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private static final TargetCapabilities CAPABILITIES = new TargetCapabilities(
            false, false, false, false, false,
            EnumSet.of(Effect.MEMORY, Effect.IO));

    private static final List<String> FEATURES = Collections.unmodifiableList(Arrays.asList(
            "Integer and floating point arithmetic",
            "Result<T, E> and Option<T> as multi-value returns",
            "Error propagation",
            "Guard statements",
            "Match on Result, Option and literals",
            "String constants in a data segment",
            "Effect tracking through host imports"
    ));

    @Override
    public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
        String primary = TargetPlatform.WEBASSEMBLY.getPrimaryFileName();
        String source = new WasmEmitter(program, config, CAPABILITIES).emit();

        Map<String, String> vars = new HashMap<String, String>();
        vars.put("binary", BINARY_FILE);
        vars.put("title", "Cadenza - " + program.getProgram().getFileName());

        List<AuxiliaryFile> files = new ArrayList<AuxiliaryFile>();
        files.add(new AuxiliaryFile(LOADER_FILE, Templates.render("wasm/loader.js", vars), AuxiliaryFile.Kind.LOADER));
        files.add(new AuxiliaryFile(PAGE_FILE, Templates.render("wasm/index.html", vars), AuxiliaryFile.Kind.LOADER));
        files.add(new AuxiliaryFile(PACKAGE_FILE, packageJson(config, primary), AuxiliaryFile.Kind.MANIFEST));

        Map<String, String> build = new LinkedHashMap<String, String>();
        build.put("build", "wat2wasm " + primary + " -o " + BINARY_FILE);
        build.put("run", "node " + LOADER_FILE);

        return new TargetGenerationResult(source, files, Collections.singletonList("wabt"), build);
    }

    private static String packageJson(TargetConfiguration config, String primary) {
        JsonObject json = new JsonObject();
        json.addProperty("name", config.getOption("wasm.packageName", "cadenza-wasm-program"));
        json.addProperty("version", "1.0.0");
        json.addProperty("description", "Generated by the Cadenza compiler");
        json.addProperty("main", LOADER_FILE);
        JsonObject scripts = new JsonObject();
        scripts.addProperty("build", "wat2wasm " + primary + " -o " + BINARY_FILE);
        scripts.addProperty("start", "node " + LOADER_FILE);
        json.add("scripts", scripts);
        JsonObject devDependencies = new JsonObject();
        devDependencies.addProperty("wabt", "^1.0.36");
        json.add("devDependencies", devDependencies);
        json.addProperty("private", true);
        return GSON.toJson(json) + "\n";
    }

    @Override
    public String targetName() {
        return "WebAssembly";
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
