package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;

/**
 * goto 目标标签 {@code name:}
 */
public class LabelStmt extends Statement {
    private final String name;

    public LabelStmt(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitLabelStmt(this, context);
    }
}
