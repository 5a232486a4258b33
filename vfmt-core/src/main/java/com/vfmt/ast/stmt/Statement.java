package com.vfmt.ast.stmt;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StmtVisitor<R, C> visitor, C context);
}
