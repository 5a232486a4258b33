package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * {@code typeof(expr)}
 */
public class TypeOfExpr extends Expression {
    private final Expression expr;

    public TypeOfExpr(SourceLocation location, Expression expr) {
        super(location);
        this.expr = expr;
    }

    public Expression getExpr() {
        return expr;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitTypeOfExpr(this, context);
    }
}
