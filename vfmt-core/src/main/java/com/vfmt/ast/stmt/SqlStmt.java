package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

import java.util.List;

/**
 * 结构化查询块 {@code sql db { ... }}，查询体逐行原样输出
 */
public class SqlStmt extends Statement {
    private final Expression database;
    private final List<String> lines;

    public SqlStmt(SourceLocation location, Expression database, List<String> lines) {
        super(location);
        this.database = database;
        this.lines = lines;
    }

    public Expression getDatabase() {
        return database;
    }

    public List<String> getLines() {
        return orEmpty(lines);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitSqlStmt(this, context);
    }
}
