package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * 和类型 {@code type Expr = BinaryExpr | Ident | Literal}
 */
public class SumTypeDecl extends Statement {
    private final boolean isPub;
    private final String name;
    private final List<Integer> variants;

    public SumTypeDecl(SourceLocation location, boolean isPub, String name, List<Integer> variants) {
        super(location);
        this.isPub = isPub;
        this.name = name;
        this.variants = variants;
    }

    public boolean isPub() {
        return isPub;
    }

    public String getName() {
        return name;
    }

    public List<Integer> getVariants() {
        return orEmpty(variants);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitSumTypeDecl(this, context);
    }
}
