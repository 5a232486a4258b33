package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 未挂在调用上的错误处理后缀；合法的语法树中不会出现
 */
public class OrExpr extends Expression {
    private final OrBlock orBlock;

    public OrExpr(SourceLocation location, OrBlock orBlock) {
        super(location);
        this.orBlock = orBlock;
    }

    public OrBlock getOrBlock() {
        return orBlock != null ? orBlock : OrBlock.ABSENT;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitOrExpr(this, context);
    }
}
