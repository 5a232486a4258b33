package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 类型转换 {@code int(x)}、{@code string(buf, len)}
 */
public class CastExpr extends Expression {
    private final int typeId;
    private final Expression expr;
    private final Expression arg;  // 可选的第二个参数

    public CastExpr(SourceLocation location, int typeId, Expression expr, Expression arg) {
        super(location);
        this.typeId = typeId;
        this.expr = expr;
        this.arg = arg;
    }

    public int getTypeId() {
        return typeId;
    }

    public Expression getExpr() {
        return expr;
    }

    public Expression getArg() {
        return arg;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
