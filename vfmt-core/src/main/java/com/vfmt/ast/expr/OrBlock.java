package com.vfmt.ast.expr;

import com.vfmt.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 调用结果的错误处理后缀：无、{@code ?} 传播，或 {@code or { ... }} 恢复块
 */
public final class OrBlock {

    public static final OrBlock ABSENT = new OrBlock(Kind.ABSENT, null);
    public static final OrBlock PROPAGATE = new OrBlock(Kind.PROPAGATE, null);

    private final Kind kind;
    private final List<Statement> stmts;

    public OrBlock(Kind kind, List<Statement> stmts) {
        this.kind = kind;
        this.stmts = stmts;
    }

    public static OrBlock block(List<Statement> stmts) {
        return new OrBlock(Kind.BLOCK, stmts);
    }

    public Kind getKind() {
        return kind != null ? kind : Kind.ABSENT;
    }

    public List<Statement> getStmts() {
        return stmts != null ? stmts : Collections.<Statement>emptyList();
    }

    public enum Kind {
        ABSENT,
        PROPAGATE,
        BLOCK
    }
}
