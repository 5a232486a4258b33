package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

import java.util.List;

/**
 * 条件循环 {@code for cond {}}，无条件时为无限循环 {@code for {}}
 */
public class ForCondStmt extends Statement {
    private final String label;
    private final Expression condition;  // 可选
    private final List<Statement> body;

    public ForCondStmt(SourceLocation location, String label, Expression condition, List<Statement> body) {
        super(location);
        this.label = label;
        this.condition = condition;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public Expression getCondition() {
        return condition;
    }

    public boolean isInfinite() {
        return condition == null;
    }

    public List<Statement> getBody() {
        return orEmpty(body);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForCondStmt(this, context);
    }
}
