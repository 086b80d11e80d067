package com.cadenza.targets.javascript;

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
 * JavaScript 后端，输出 Node.js 可直接运行的脚本，附带浏览器页面
 * <p>模块系统由选项 javascript.moduleSystem 决定：commonjs（默认）或 es。</p>
 */
public class JavaScriptGenerator implements TargetGenerator {
    public static final String RUNTIME_FILE = "cadenza-runtime.js";
    public static final String PACKAGE_FILE = "package.json";
    public static final String PAGE_FILE = "index.html";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private static final TargetCapabilities CAPABILITIES = new TargetCapabilities(
            true, true, true, true, true,
            EnumSet.of(Effect.DOM, Effect.NETWORK, Effect.LOCAL_STORAGE, Effect.WEB_SOCKET, Effect.LOGGING));

    private static final List<String> FEATURES = Collections.unmodifiableList(Arrays.asList(
            "Result<T, E> with error propagation",
            "Option<T>",
            "Guard statements",
            "Match expressions (match callbacks and conditional chains)",
            "Template literals",
            "Modules as frozen export objects",
            "CommonJS and ES modules",
            "Effect tracking",
            "JSDoc comments"
    ));

    @Override
    public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
        String moduleSystem = config.getOption("javascript.moduleSystem", "commonjs");
        boolean esModule = "es".equalsIgnoreCase(moduleSystem) || "esm".equalsIgnoreCase(moduleSystem);
        String source = new JavaScriptEmitter(program, config, CAPABILITIES, esModule).emit();
        String primary = TargetPlatform.JAVASCRIPT.getPrimaryFileName();

        Map<String, String> vars = new HashMap<String, String>();
        vars.put("program", primary);
        vars.put("title", "Cadenza - " + program.getProgram().getFileName());
        vars.put("exports", esModule
                ? "export { Result, Option, Cadenza };"
                : "module.exports = { Result, Option, Cadenza };");
        vars.put("scripts", Templates.render(esModule ? "javascript/scripts-es.html" : "javascript/scripts-commonjs.html",
                vars).trim());

        List<AuxiliaryFile> files = new ArrayList<AuxiliaryFile>();
        files.add(new AuxiliaryFile(PACKAGE_FILE, packageJson(config, esModule, primary), AuxiliaryFile.Kind.MANIFEST));
        files.add(new AuxiliaryFile(RUNTIME_FILE, Templates.render("javascript/cadenza-runtime.js", vars),
                AuxiliaryFile.Kind.RUNTIME));
        files.add(new AuxiliaryFile(PAGE_FILE, Templates.render("javascript/index.html", vars),
                AuxiliaryFile.Kind.LOADER));

        Map<String, String> build = new LinkedHashMap<String, String>();
        build.put("run", "node " + primary);

        return new TargetGenerationResult(source, files, Collections.<String>emptyList(), build);
    }

    private static String packageJson(TargetConfiguration config, boolean esModule, String primary) {
        JsonObject json = new JsonObject();
        json.addProperty("name", config.getOption("javascript.packageName", "cadenza-program"));
        json.addProperty("version", "1.0.0");
        json.addProperty("description", "Generated by the Cadenza compiler");
        json.addProperty("main", primary);
        json.addProperty("type", esModule ? "module" : "commonjs");
        JsonObject scripts = new JsonObject();
        scripts.addProperty("start", "node " + primary);
        json.add("scripts", scripts);
        JsonObject engines = new JsonObject();
        engines.addProperty("node", ">=" + config.getOption("javascript.nodeVersion", "18"));
        json.add("engines", engines);
        json.addProperty("private", true);
        return GSON.toJson(json) + "\n";
    }

    @Override
    public String targetName() {
        return "JavaScript";
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
