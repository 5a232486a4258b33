package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.type.FnSignature;

/**
 * 函数类型 {@code type Callback = fn (int) string}
 */
public class FnTypeDecl extends Statement {
    private final boolean isPub;
    private final String name;
    private final FnSignature signature;

    public FnTypeDecl(SourceLocation location, boolean isPub, String name, FnSignature signature) {
        super(location);
        this.isPub = isPub;
        this.name = name;
        this.signature = signature;
    }

    public boolean isPub() {
        return isPub;
    }

    public String getName() {
        return name;
    }

    public FnSignature getSignature() {
        return signature;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFnTypeDecl(this, context);
    }
}
