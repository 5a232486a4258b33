package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 下标访问 {@code a[i]}、切片 {@code a[1..3]}
 */
public class IndexExpr extends Expression {
    private final Expression left;
    private final Expression index;

    public IndexExpr(SourceLocation location, Expression left, Expression index) {
        super(location);
        this.left = left;
        this.index = index;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
