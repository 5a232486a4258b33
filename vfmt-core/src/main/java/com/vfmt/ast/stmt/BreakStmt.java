package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;

/**
 * break 语句，可带标签
 */
public class BreakStmt extends Statement {
    private final String label;  // 可选

    public BreakStmt(SourceLocation location, String label) {
        super(location);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitBreakStmt(this, context);
    }
}
