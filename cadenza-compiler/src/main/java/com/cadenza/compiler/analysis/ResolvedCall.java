package com.cadenza.compiler.analysis;

import com.cadenza.compiler.ast.decl.FunctionDeclaration;

/**
 * 调用解析结果：点号调用名解析为 (模块, 函数) 二元组
 */
public final class ResolvedCall {

    public enum Kind {
        /** 同一作用域内的函数：所在模块内的函数，或顶层函数 */
        LOCAL,
        /** 限定名调用 Module.fn */
        MODULE,
        /** 通过 import 引入的名字 */
        IMPORTED,
        /** 未知名字（外部函数或接收者方法），按原样输出 */
        UNRESOLVED
    }

    private final Kind kind;
    private final String moduleName;
    private final String functionName;
    private final FunctionDeclaration declaration;

    public ResolvedCall(Kind kind, String moduleName, String functionName, FunctionDeclaration declaration) {
        this.kind = kind;
        this.moduleName = moduleName;
        this.functionName = functionName;
        this.declaration = declaration;
    }

    public static ResolvedCall unresolved(String name) {
        return new ResolvedCall(Kind.UNRESOLVED, null, name, null);
    }

    public Kind getKind() {
        return kind;
    }

    /** 目标函数所在模块，顶层函数或未解析时为 null */
    public String getModuleName() {
        return moduleName;
    }

    public String getFunctionName() {
        return functionName;
    }

    /** 未解析时为 null */
    public FunctionDeclaration getDeclaration() {
        return declaration;
    }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }

    @Override
    public String toString() {
        if (moduleName == null) {
            return kind + "(" + functionName + ")";
        }
        return kind + "(" + moduleName + ", " + functionName + ")";
    }
}
