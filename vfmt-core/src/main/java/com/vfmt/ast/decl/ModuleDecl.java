package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;

/**
 * 模块声明 {@code module foo}
 */
public class ModuleDecl extends Statement {
    private final String name;

    public ModuleDecl(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }
}
