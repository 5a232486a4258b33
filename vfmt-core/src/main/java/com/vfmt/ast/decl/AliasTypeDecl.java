package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;

/**
 * 类型别名 {@code type MyInt = int}
 */
public class AliasTypeDecl extends Statement {
    private final boolean isPub;
    private final String name;
    private final int parentType;

    public AliasTypeDecl(SourceLocation location, boolean isPub, String name, int parentType) {
        super(location);
        this.isPub = isPub;
        this.name = name;
        this.parentType = parentType;
    }

    public boolean isPub() {
        return isPub;
    }

    public String getName() {
        return name;
    }

    public int getParentType() {
        return parentType;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAliasTypeDecl(this, context);
    }
}
