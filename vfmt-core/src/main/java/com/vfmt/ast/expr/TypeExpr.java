package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 作为表达式出现的类型，如和类型 match 分支的模式
 */
public class TypeExpr extends Expression {
    private final int typeId;

    public TypeExpr(SourceLocation location, int typeId) {
        super(location);
        this.typeId = typeId;
    }

    public int getTypeId() {
        return typeId;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitTypeExpr(this, context);
    }
}
