package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

/**
 * assert 语句
 */
public class AssertStmt extends Statement {
    private final Expression condition;

    public AssertStmt(SourceLocation location, Expression condition) {
        super(location);
        this.condition = condition;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssertStmt(this, context);
    }
}
