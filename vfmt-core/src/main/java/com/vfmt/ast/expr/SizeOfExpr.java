package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * {@code sizeof(Type)}
 */
public class SizeOfExpr extends Expression {
    private final int typeId;

    public SizeOfExpr(SourceLocation location, int typeId) {
        super(location);
        this.typeId = typeId;
    }

    public int getTypeId() {
        return typeId;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitSizeOfExpr(this, context);
    }
}
