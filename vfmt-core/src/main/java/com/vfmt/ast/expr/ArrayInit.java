package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

import java.util.List;

/**
 * 数组字面量 {@code [1, 2, 3]}、{@code [1, 2]!}、{@code []int{len: 3, init: 0}}
 */
public class ArrayInit extends Expression {
    private final int typeId;  // 数组类型，用于空数组与 len/cap/init 形式
    private final List<Expression> exprs;
    private final Expression lenExpr;
    private final Expression capExpr;
    private final Expression initExpr;
    private final boolean fixed;

    public ArrayInit(SourceLocation location, int typeId, List<Expression> exprs, Expression lenExpr,
                     Expression capExpr, Expression initExpr, boolean fixed) {
        super(location);
        this.typeId = typeId;
        this.exprs = exprs;
        this.lenExpr = lenExpr;
        this.capExpr = capExpr;
        this.initExpr = initExpr;
        this.fixed = fixed;
    }

    public ArrayInit(SourceLocation location, List<Expression> exprs) {
        this(location, 0, exprs, null, null, null, false);
    }

    public int getTypeId() {
        return typeId;
    }

    public List<Expression> getExprs() {
        return orEmpty(exprs);
    }

    public Expression getLenExpr() {
        return lenExpr;
    }

    public Expression getCapExpr() {
        return capExpr;
    }

    public Expression getInitExpr() {
        return initExpr;
    }

    public boolean hasSizeFields() {
        return lenExpr != null || capExpr != null || initExpr != null;
    }

    public boolean isFixed() {
        return fixed;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitArrayInit(this, context);
    }
}
