package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 区间 {@code a..b}，两端都可省略
 */
public class RangeExpr extends Expression {
    private final Expression low;
    private final Expression high;

    public RangeExpr(SourceLocation location, Expression low, Expression high) {
        super(location);
        this.low = low;
        this.high = high;
    }

    public Expression getLow() {
        return low;
    }

    public Expression getHigh() {
        return high;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpr(this, context);
    }
}
