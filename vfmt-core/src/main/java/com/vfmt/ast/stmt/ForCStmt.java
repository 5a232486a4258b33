package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

import java.util.List;

/**
 * C 风格循环 {@code for i := 0; i < n; i++ {}}
 */
public class ForCStmt extends Statement {
    private final String label;
    private final Statement init;       // 可选
    private final Expression condition; // 可选
    private final Statement increment;  // 可选
    private final List<Statement> body;

    public ForCStmt(SourceLocation location, String label, Statement init, Expression condition,
                    Statement increment, List<Statement> body) {
        super(location);
        this.label = label;
        this.init = init;
        this.condition = condition;
        this.increment = increment;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public Statement getInit() {
        return init;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getIncrement() {
        return increment;
    }

    public List<Statement> getBody() {
        return orEmpty(body);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForCStmt(this, context);
    }
}
