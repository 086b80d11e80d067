package com.cadenza.compiler.analysis;

import com.cadenza.compiler.Diagnostic;
import com.cadenza.compiler.ast.AstScanner;
import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.ast.decl.*;
import com.cadenza.compiler.ast.expr.CallExpression;
import com.cadenza.compiler.ast.expr.ErrorPropagation;
import com.cadenza.compiler.ast.expr.MatchExpression;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 语义分析：建立符号表、解析点号调用、校验错误传播与模块可见性
 * <p>不做类型推断，也不检查传递副作用（调用方声明的副作用不要求覆盖被调用方）。</p>
 */
public final class SemanticAnalyzer {

    private final SymbolTable symbols = new SymbolTable();
    private final Map<CallExpression, ResolvedCall> calls = new IdentityHashMap<CallExpression, ResolvedCall>();
    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

    /**
     * 分析程序
     *
     * @throws SemanticException 第一处语义错误
     */
    public AnalyzedProgram analyze(Program program) {
        declare(program);
        bindImports(SymbolTable.TOP_LEVEL, program.getStatements());
        for (ModuleDeclaration module : program.getModules()) {
            bindImports(module.getName(), module.getBody());
        }

        BodyChecker checker = new BodyChecker();
        for (Statement stmt : program.getStatements()) {
            if (stmt instanceof FunctionDeclaration) {
                checkFunction(checker, SymbolTable.TOP_LEVEL, (FunctionDeclaration) stmt);
            } else if (stmt instanceof ModuleDeclaration) {
                ModuleDeclaration module = (ModuleDeclaration) stmt;
                for (FunctionDeclaration fn : module.getFunctions()) {
                    checkFunction(checker, module.getName(), fn);
                }
            }
        }
        return new AnalyzedProgram(program, symbols, calls, diagnostics);
    }

    // ============ 声明收集 ============

    private void declare(Program program) {
        for (Statement stmt : program.getStatements()) {
            if (stmt instanceof ModuleDeclaration) {
                ModuleDeclaration module = (ModuleDeclaration) stmt;
                if (symbols.isModule(module.getName())) {
                    throw new SemanticException("Duplicate module '" + module.getName() + "'", module.getLocation());
                }
                checkDuplicateFunctions(module.getFunctions());
                checkExportsExist(module);
                symbols.defineModule(module);
            } else if (stmt instanceof FunctionDeclaration) {
                FunctionDeclaration fn = (FunctionDeclaration) stmt;
                if (symbols.getTopLevelFunction(fn.getName()) != null) {
                    throw new SemanticException("Duplicate function '" + fn.getName() + "'", fn.getLocation());
                }
                symbols.defineFunction(fn);
            }
        }
    }

    private void checkDuplicateFunctions(List<FunctionDeclaration> functions) {
        for (int i = 0; i < functions.size(); i++) {
            for (int j = i + 1; j < functions.size(); j++) {
                if (functions.get(i).getName().equals(functions.get(j).getName())) {
                    throw new SemanticException("Duplicate function '" + functions.get(j).getName() + "'",
                            functions.get(j).getLocation());
                }
            }
        }
    }

    private void checkExportsExist(ModuleDeclaration module) {
        if (!module.hasExportList()) return;
        for (String name : module.getExports()) {
            if (module.findFunction(name) == null) {
                throw new SemanticException("Module '" + module.getName() + "' exports unknown function '" + name + "'",
                        module.getLocation());
            }
        }
    }

    // ============ 导入 ============

    private void bindImports(String scope, List<Statement> statements) {
        for (Statement stmt : statements) {
            if (!(stmt instanceof ImportStatement)) continue;
            ImportStatement imp = (ImportStatement) stmt;
            ModuleDeclaration module = symbols.getModule(imp.getModuleName());
            if (module == null) {
                // 外部模块，生成阶段按原样引用
                diagnostics.add(warning("Import of unknown module '" + imp.getModuleName() + "'", imp.getLocation()));
                continue;
            }
            if (imp.isWildcard()) {
                for (FunctionDeclaration fn : module.getFunctions()) {
                    if (module.isVisible(fn.getName())) {
                        symbols.bindImport(scope, fn.getName(),
                                new ResolvedCall(ResolvedCall.Kind.IMPORTED, module.getName(), fn.getName(), fn));
                    }
                }
            } else {
                for (String name : imp.getSpecificNames()) {
                    if (!module.isVisible(name)) {
                        throw new SemanticException("Module '" + module.getName() + "' does not export '" + name + "'",
                                imp.getLocation());
                    }
                    symbols.bindImport(scope, name, new ResolvedCall(ResolvedCall.Kind.IMPORTED,
                            module.getName(), name, module.findFunction(name)));
                }
            }
        }
    }

    // ============ 函数体 ============

    private void checkFunction(BodyChecker checker, String scope, FunctionDeclaration fn) {
        checker.scanStatements(fn.getBody(), new FunctionContext(scope, fn));
    }

    private static Diagnostic warning(String message, SourceLocation loc) {
        return new Diagnostic(Diagnostic.Severity.WARNING, message, loc.getLine(), loc.getColumn());
    }

    private static final class FunctionContext {
        final String scope;
        final FunctionDeclaration function;

        FunctionContext(String scope, FunctionDeclaration function) {
            this.scope = scope;
            this.function = function;
        }
    }

    private final class BodyChecker extends AstScanner<FunctionContext> {

        @Override
        public Void visitCall(CallExpression node, FunctionContext ctx) {
            calls.put(node, resolveCall(node, ctx));
            return super.visitCall(node, ctx);
        }

        @Override
        public Void visitErrorPropagation(ErrorPropagation node, FunctionContext ctx) {
            FunctionDeclaration fn = ctx.function;
            if (!fn.returnsResult()) {
                throw new SemanticException("Error propagation '?' requires function '" + fn.getName()
                        + "' to return Result, but it returns " + fn.getReturnType(), node.getLocation());
            }
            super.visitErrorPropagation(node, ctx);

            Expression inner = node.getExpression();
            if (inner instanceof CallExpression) {
                ResolvedCall target = calls.get(inner);
                FunctionDeclaration callee = target != null ? target.getDeclaration() : null;
                if (callee != null) {
                    TypeRef calleeType = callee.getReturnType();
                    if (!calleeType.isResult()) {
                        throw new SemanticException("Error propagation '?' applied to '" + callee.getName()
                                + "' which returns " + calleeType + ", not Result", node.getLocation());
                    }
                    if (!calleeType.getErrorType().equals(fn.getReturnType().getErrorType())) {
                        throw new SemanticException("Incompatible error type: '" + callee.getName() + "' fails with "
                                + calleeType.getErrorType() + " but '" + fn.getName() + "' fails with "
                                + fn.getReturnType().getErrorType(), node.getLocation());
                    }
                }
            }
            return null;
        }

        @Override
        public Void visitMatch(MatchExpression node, FunctionContext ctx) {
            if (!node.isExhaustive()) {
                diagnostics.add(warning("Non-exhaustive match: add the missing variant or a '_' case",
                        node.getLocation()));
            }
            return super.visitMatch(node, ctx);
        }

        private ResolvedCall resolveCall(CallExpression call, FunctionContext ctx) {
            if (!call.isQualified()) {
                return symbols.resolveSimpleName(ctx.scope, call.getName());
            }
            String qualifier = call.getQualifier();
            ModuleDeclaration module = symbols.getModule(qualifier);
            if (module == null) {
                // 接收者方法或外部模块
                return ResolvedCall.unresolved(call.getName());
            }
            String name = call.getSimpleName();
            FunctionDeclaration fn = module.findFunction(name);
            if (fn == null) {
                throw new SemanticException("Module '" + qualifier + "' has no function '" + name + "'",
                        call.getLocation());
            }
            if (!qualifier.equals(ctx.scope) && !module.isVisible(name)) {
                throw new SemanticException("Function '" + name + "' is not exported from module '" + qualifier + "'",
                        call.getLocation());
            }
            return new ResolvedCall(ResolvedCall.Kind.MODULE, qualifier, name, fn);
        }
    }
}
