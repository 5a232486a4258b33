package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 分支预测提示 {@code _likely_(cond)} / {@code _unlikely_(cond)}
 */
public class LikelyExpr extends Expression {
    private final Expression expr;
    private final boolean likely;

    public LikelyExpr(SourceLocation location, Expression expr, boolean likely) {
        super(location);
        this.expr = expr;
        this.likely = likely;
    }

    public Expression getExpr() {
        return expr;
    }

    public boolean isLikely() {
        return likely;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLikelyExpr(this, context);
    }
}
