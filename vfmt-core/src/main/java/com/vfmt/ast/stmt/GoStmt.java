package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

/**
 * 并发派发 {@code go worker(ch)}
 */
public class GoStmt extends Statement {
    private final Expression call;

    public GoStmt(SourceLocation location, Expression call) {
        super(location);
        this.call = call;
    }

    public Expression getCall() {
        return call;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitGoStmt(this, context);
    }
}
