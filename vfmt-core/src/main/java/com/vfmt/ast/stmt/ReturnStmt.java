package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

import java.util.List;

/**
 * return 语句，支持多返回值
 */
public class ReturnStmt extends Statement {
    private final List<Expression> values;

    public ReturnStmt(SourceLocation location, List<Expression> values) {
        super(location);
        this.values = values;
    }

    public List<Expression> getValues() {
        return orEmpty(values);
    }

    public boolean hasValue() {
        return !getValues().isEmpty();
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
