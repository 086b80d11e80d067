package com.cadenza.compiler.ast;

import com.cadenza.compiler.ast.expr.*;

/**
 * 表达式访问者
 * <p>每种表达式一个方法且均为抽象，新增节点时所有渲染器都必须处理。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface ExpressionVisitor<R, C> {

    R visitBinary(BinaryExpression node, C context);

    R visitUnary(UnaryExpression node, C context);

    R visitCall(CallExpression node, C context);

    R visitMethodCall(MethodCallExpression node, C context);

    R visitMemberAccess(MemberAccessExpression node, C context);

    R visitIndex(IndexExpression node, C context);

    R visitIdentifier(Identifier node, C context);

    R visitNumber(NumberLiteral node, C context);

    R visitString(StringLiteral node, C context);

    R visitBoolean(BooleanLiteral node, C context);

    R visitInterpolation(StringInterpolation node, C context);

    R visitList(ListExpression node, C context);

    R visitResult(ResultExpression node, C context);

    R visitOption(OptionExpression node, C context);

    R visitErrorPropagation(ErrorPropagation node, C context);

    R visitMatch(MatchExpression node, C context);

    R visitTernary(TernaryExpression node, C context);
}
