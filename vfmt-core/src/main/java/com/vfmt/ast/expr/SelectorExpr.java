package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 成员访问 {@code user.name}
 */
public class SelectorExpr extends Expression {
    private final Expression target;
    private final String fieldName;

    public SelectorExpr(SourceLocation location, Expression target, String fieldName) {
        super(location);
        this.target = target;
        this.fieldName = fieldName;
    }

    public Expression getTarget() {
        return target;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitSelectorExpr(this, context);
    }
}
