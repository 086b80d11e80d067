package com.cadenza.compiler.ast;

import com.cadenza.compiler.ast.decl.*;
import com.cadenza.compiler.ast.expr.*;
import com.cadenza.compiler.ast.stmt.*;

import java.util.List;

/**
 * 深度优先遍历整棵树的访问者基类，子类只覆盖关心的节点并调用 super 继续下降
 *
 * @param <C> 上下文类型
 */
public abstract class AstScanner<C> implements StatementVisitor<Void, C>, ExpressionVisitor<Void, C> {

    public void scan(Statement statement, C context) {
        if (statement != null) {
            statement.accept(this, context);
        }
    }

    public void scan(Expression expression, C context) {
        if (expression != null) {
            expression.accept(this, context);
        }
    }

    public void scanStatements(List<Statement> statements, C context) {
        if (statements == null) return;
        for (Statement stmt : statements) {
            scan(stmt, context);
        }
    }

    public void scanExpressions(List<Expression> expressions, C context) {
        for (Expression expr : expressions) {
            scan(expr, context);
        }
    }

    // ============ 声明 ============

    @Override
    public Void visitFunction(FunctionDeclaration node, C context) {
        scanStatements(node.getBody(), context);
        return null;
    }

    @Override
    public Void visitModule(ModuleDeclaration node, C context) {
        scanStatements(node.getBody(), context);
        return null;
    }

    @Override
    public Void visitImport(ImportStatement node, C context) {
        return null;
    }

    @Override
    public Void visitExport(ExportStatement node, C context) {
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitLet(LetStatement node, C context) {
        scan(node.getInitializer(), context);
        return null;
    }

    @Override
    public Void visitIf(IfStatement node, C context) {
        scan(node.getCondition(), context);
        scanStatements(node.getThenBody(), context);
        scanStatements(node.getElseBody(), context);
        return null;
    }

    @Override
    public Void visitGuard(GuardStatement node, C context) {
        scan(node.getCondition(), context);
        scanStatements(node.getElseBody(), context);
        return null;
    }

    @Override
    public Void visitReturn(ReturnStatement node, C context) {
        scan(node.getValue(), context);
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement node, C context) {
        scan(node.getExpression(), context);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinary(BinaryExpression node, C context) {
        scan(node.getLeft(), context);
        scan(node.getRight(), context);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpression node, C context) {
        scan(node.getOperand(), context);
        return null;
    }

    @Override
    public Void visitCall(CallExpression node, C context) {
        scanExpressions(node.getArguments(), context);
        return null;
    }

    @Override
    public Void visitMethodCall(MethodCallExpression node, C context) {
        scan(node.getReceiver(), context);
        scanExpressions(node.getArguments(), context);
        return null;
    }

    @Override
    public Void visitMemberAccess(MemberAccessExpression node, C context) {
        scan(node.getTarget(), context);
        return null;
    }

    @Override
    public Void visitIndex(IndexExpression node, C context) {
        scan(node.getTarget(), context);
        scan(node.getIndex(), context);
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, C context) {
        return null;
    }

    @Override
    public Void visitNumber(NumberLiteral node, C context) {
        return null;
    }

    @Override
    public Void visitString(StringLiteral node, C context) {
        return null;
    }

    @Override
    public Void visitBoolean(BooleanLiteral node, C context) {
        return null;
    }

    @Override
    public Void visitInterpolation(StringInterpolation node, C context) {
        scanExpressions(node.getParts(), context);
        return null;
    }

    @Override
    public Void visitList(ListExpression node, C context) {
        scanExpressions(node.getElements(), context);
        return null;
    }

    @Override
    public Void visitResult(ResultExpression node, C context) {
        scan(node.getValue(), context);
        return null;
    }

    @Override
    public Void visitOption(OptionExpression node, C context) {
        scan(node.getValue(), context);
        return null;
    }

    @Override
    public Void visitErrorPropagation(ErrorPropagation node, C context) {
        scan(node.getExpression(), context);
        return null;
    }

    @Override
    public Void visitMatch(MatchExpression node, C context) {
        scan(node.getScrutinee(), context);
        for (MatchCase matchCase : node.getCases()) {
            scanStatements(matchCase.getBody(), context);
        }
        return null;
    }

    @Override
    public Void visitTernary(TernaryExpression node, C context) {
        scan(node.getCondition(), context);
        scan(node.getThenExpr(), context);
        scan(node.getElseExpr(), context);
        return null;
    }
}
