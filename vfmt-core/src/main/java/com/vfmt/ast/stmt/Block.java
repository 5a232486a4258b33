package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;

import java.util.List;

/**
 * 代码块 {@code { ... }}
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return orEmpty(statements);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
