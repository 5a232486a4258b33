package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 括号表达式
 */
public class ParExpr extends Expression {
    private final Expression expr;

    public ParExpr(SourceLocation location, Expression expr) {
        super(location);
        this.expr = expr;
    }

    public Expression getExpr() {
        return expr;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitParExpr(this, context);
    }
}
