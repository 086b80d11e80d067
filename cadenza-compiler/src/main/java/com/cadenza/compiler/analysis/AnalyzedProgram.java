package com.cadenza.compiler.analysis;

import com.cadenza.compiler.Diagnostic;
import com.cadenza.compiler.ast.decl.Program;
import com.cadenza.compiler.ast.expr.CallExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 语义分析结果：只读 AST + 符号表 + 调用解析 + 警告
 * <p>各后端共享同一实例，生成阶段只读。</p>
 */
public final class AnalyzedProgram {
    private final Program program;
    private final SymbolTable symbols;
    private final Map<CallExpression, ResolvedCall> calls;
    private final List<Diagnostic> diagnostics;

    AnalyzedProgram(Program program, SymbolTable symbols, Map<CallExpression, ResolvedCall> calls,
                    List<Diagnostic> diagnostics) {
        this.program = program;
        this.symbols = symbols;
        this.calls = Collections.unmodifiableMap(new IdentityHashMap<CallExpression, ResolvedCall>(calls));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
    }

    public Program getProgram() {
        return program;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    /**
     * 调用的解析结果；树外构造的调用视为未解析
     */
    public ResolvedCall resolve(CallExpression call) {
        ResolvedCall resolved = calls.get(call);
        return resolved != null ? resolved : ResolvedCall.unresolved(call.getName());
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getWarnings() {
        List<Diagnostic> result = new ArrayList<Diagnostic>();
        for (Diagnostic d : diagnostics) {
            if (d.getSeverity() == Diagnostic.Severity.WARNING) {
                result.add(d);
            }
        }
        return result;
    }
}
