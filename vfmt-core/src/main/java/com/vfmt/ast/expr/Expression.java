package com.vfmt.ast.expr;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExprVisitor<R, C> visitor, C context);
}
