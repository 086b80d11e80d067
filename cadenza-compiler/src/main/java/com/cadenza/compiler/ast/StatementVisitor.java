package com.cadenza.compiler.ast;

import com.cadenza.compiler.ast.decl.*;
import com.cadenza.compiler.ast.stmt.*;

/**
 * 语句与声明访问者
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface StatementVisitor<R, C> {

    // ============ 声明 ============

    R visitFunction(FunctionDeclaration node, C context);

    R visitModule(ModuleDeclaration node, C context);

    R visitImport(ImportStatement node, C context);

    R visitExport(ExportStatement node, C context);

    // ============ 语句 ============

    R visitLet(LetStatement node, C context);

    R visitIf(IfStatement node, C context);

    R visitGuard(GuardStatement node, C context);

    R visitReturn(ReturnStatement node, C context);

    R visitExpressionStatement(ExpressionStatement node, C context);
}
