package com.cadenza.compiler.analysis;

import com.cadenza.compiler.ast.decl.FunctionDeclaration;
import com.cadenza.compiler.ast.decl.ModuleDeclaration;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 符号表：模块、顶层函数，以及每个作用域的导入绑定
 * <p>作用域键为模块名，顶层作用域用 {@link #TOP_LEVEL}。</p>
 */
public final class SymbolTable {
    public static final String TOP_LEVEL = "";

    private final Map<String, ModuleDeclaration> modules = new LinkedHashMap<String, ModuleDeclaration>();
    private final Map<String, FunctionDeclaration> topLevelFunctions = new LinkedHashMap<String, FunctionDeclaration>();
    private final Map<String, Map<String, ResolvedCall>> importBindings = new HashMap<String, Map<String, ResolvedCall>>();

    void defineModule(ModuleDeclaration module) {
        modules.put(module.getName(), module);
    }

    void defineFunction(FunctionDeclaration function) {
        topLevelFunctions.put(function.getName(), function);
    }

    void bindImport(String scope, String name, ResolvedCall target) {
        Map<String, ResolvedCall> bindings = importBindings.get(scope);
        if (bindings == null) {
            bindings = new LinkedHashMap<String, ResolvedCall>();
            importBindings.put(scope, bindings);
        }
        bindings.put(name, target);
    }

    public ModuleDeclaration getModule(String name) {
        return modules.get(name);
    }

    public boolean isModule(String name) {
        return modules.containsKey(name);
    }

    public Map<String, ModuleDeclaration> getModules() {
        return Collections.unmodifiableMap(modules);
    }

    public FunctionDeclaration getTopLevelFunction(String name) {
        return topLevelFunctions.get(name);
    }

    public Map<String, FunctionDeclaration> getTopLevelFunctions() {
        return Collections.unmodifiableMap(topLevelFunctions);
    }

    /** 作用域内由 import 引入的名字 */
    public Map<String, ResolvedCall> getImportBindings(String scope) {
        Map<String, ResolvedCall> bindings = importBindings.get(scope);
        return bindings == null ? Collections.<String, ResolvedCall>emptyMap() : Collections.unmodifiableMap(bindings);
    }

    /**
     * 按作用域解析非限定名：所在模块 → 导入 → 顶层函数
     */
    public ResolvedCall resolveSimpleName(String scope, String name) {
        if (!TOP_LEVEL.equals(scope)) {
            ModuleDeclaration module = modules.get(scope);
            FunctionDeclaration fn = module != null ? module.findFunction(name) : null;
            if (fn != null) {
                return new ResolvedCall(ResolvedCall.Kind.LOCAL, scope, name, fn);
            }
        }
        ResolvedCall imported = getImportBindings(scope).get(name);
        if (imported == null && !TOP_LEVEL.equals(scope)) {
            imported = getImportBindings(TOP_LEVEL).get(name);
        }
        if (imported != null) {
            return imported;
        }
        FunctionDeclaration fn = topLevelFunctions.get(name);
        if (fn != null) {
            return new ResolvedCall(ResolvedCall.Kind.LOCAL, null, name, fn);
        }
        return ResolvedCall.unresolved(name);
    }
}
