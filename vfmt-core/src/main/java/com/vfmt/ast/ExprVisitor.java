package com.vfmt.ast;

import com.vfmt.ast.expr.*;

/**
 * 表达式访问者接口，同样不提供默认实现
 */
public interface ExprVisitor<R, C> {

    // ============ 字面量 ============

    R visitLiteral(Literal node, C ctx);

    R visitStringInterpolation(StringInterpolation node, C ctx);

    // ============ 复合字面量 ============

    R visitArrayInit(ArrayInit node, C ctx);

    R visitMapInit(MapInit node, C ctx);

    R visitStructInit(StructInit node, C ctx);

    R visitAnonFn(AnonFn node, C ctx);

    // ============ 调用与运算 ============

    R visitCallExpr(CallExpr node, C ctx);

    R visitOrExpr(OrExpr node, C ctx);

    R visitCastExpr(CastExpr node, C ctx);

    R visitInfixExpr(InfixExpr node, C ctx);

    R visitPrefixExpr(PrefixExpr node, C ctx);

    R visitPostfixExpr(PostfixExpr node, C ctx);

    R visitParExpr(ParExpr node, C ctx);

    // ============ 控制流 ============

    R visitIfExpr(IfExpr node, C ctx);

    R visitMatchExpr(MatchExpr node, C ctx);

    R visitLockExpr(LockExpr node, C ctx);

    // ============ 访问 ============

    R visitIdentifier(Identifier node, C ctx);

    R visitSelectorExpr(SelectorExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitRangeExpr(RangeExpr node, C ctx);

    R visitEnumValue(EnumValue node, C ctx);

    R visitTypeExpr(TypeExpr node, C ctx);

    // ============ 内建 ============

    R visitSizeOfExpr(SizeOfExpr node, C ctx);

    R visitTypeOfExpr(TypeOfExpr node, C ctx);

    R visitLikelyExpr(LikelyExpr node, C ctx);
}
