package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * 临界区 {@code lock a, b { ... }} / {@code rlock x { ... }}
 */
public class LockExpr extends Expression {
    private final boolean readLock;
    private final List<Expression> lockeds;
    private final List<Statement> stmts;

    public LockExpr(SourceLocation location, boolean readLock, List<Expression> lockeds, List<Statement> stmts) {
        super(location);
        this.readLock = readLock;
        this.lockeds = lockeds;
        this.stmts = stmts;
    }

    public boolean isReadLock() {
        return readLock;
    }

    public List<Expression> getLockeds() {
        return orEmpty(lockeds);
    }

    public List<Statement> getStmts() {
        return orEmpty(stmts);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLockExpr(this, context);
    }
}
