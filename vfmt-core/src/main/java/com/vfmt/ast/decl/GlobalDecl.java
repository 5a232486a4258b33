package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * 全局变量 {@code __global x int}，多个字段时输出分组形式
 */
public class GlobalDecl extends Statement {
    private final List<FieldDecl> fields;

    public GlobalDecl(SourceLocation location, List<FieldDecl> fields) {
        super(location);
        this.fields = fields;
    }

    public List<FieldDecl> getFields() {
        return orEmpty(fields);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalDecl(this, context);
    }
}
