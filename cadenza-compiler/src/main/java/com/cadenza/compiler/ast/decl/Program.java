package com.cadenza.compiler.ast.decl;

import com.cadenza.compiler.ast.AstNode;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元），持有全部顶层声明
 */
public final class Program extends AstNode {
    private final String fileName;
    private final List<Statement> statements;

    public Program(SourceLocation location, String fileName, List<Statement> statements) {
        super(location);
        this.fileName = fileName;
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public String getFileName() {
        return fileName;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /** 顶层函数（不含模块内函数） */
    public List<FunctionDeclaration> getFunctions() {
        List<FunctionDeclaration> result = new ArrayList<FunctionDeclaration>();
        for (Statement stmt : statements) {
            if (stmt instanceof FunctionDeclaration) {
                result.add((FunctionDeclaration) stmt);
            }
        }
        return result;
    }

    public List<ModuleDeclaration> getModules() {
        List<ModuleDeclaration> result = new ArrayList<ModuleDeclaration>();
        for (Statement stmt : statements) {
            if (stmt instanceof ModuleDeclaration) {
                result.add((ModuleDeclaration) stmt);
            }
        }
        return result;
    }

    public List<ImportStatement> getImports() {
        List<ImportStatement> result = new ArrayList<ImportStatement>();
        for (Statement stmt : statements) {
            if (stmt instanceof ImportStatement) {
                result.add((ImportStatement) stmt);
            }
        }
        return result;
    }

    public ModuleDeclaration findModule(String name) {
        for (ModuleDeclaration module : getModules()) {
            if (module.getName().equals(name)) {
                return module;
            }
        }
        return null;
    }
}
