package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.type.FnSignature;

import java.util.List;

/**
 * 接口声明
 */
public class InterfaceDecl extends Statement {
    private final boolean isPub;
    private final String name;
    private final List<FnSignature> methods;

    public InterfaceDecl(SourceLocation location, boolean isPub, String name, List<FnSignature> methods) {
        super(location);
        this.isPub = isPub;
        this.name = name;
        this.methods = methods;
    }

    public boolean isPub() {
        return isPub;
    }

    public String getName() {
        return name;
    }

    public List<FnSignature> getMethods() {
        return orEmpty(methods);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitInterfaceDecl(this, context);
    }
}
