package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;

import java.util.List;

/**
 * 编译期条件 {@code $if linux {} $else {}}
 */
public class CompileTimeIf extends Statement {
    private final String condition;      // 平台名或编译选项
    private final boolean negated;       // $if !windows
    private final boolean optional;      // $if debug ?
    private final List<Statement> thenStmts;
    private final List<Statement> elseStmts;
    private final boolean hasElse;

    public CompileTimeIf(SourceLocation location, String condition, boolean negated, boolean optional,
                         List<Statement> thenStmts, List<Statement> elseStmts, boolean hasElse) {
        super(location);
        this.condition = condition;
        this.negated = negated;
        this.optional = optional;
        this.thenStmts = thenStmts;
        this.elseStmts = elseStmts;
        this.hasElse = hasElse;
    }

    public String getCondition() {
        return condition;
    }

    public boolean isNegated() {
        return negated;
    }

    public boolean isOptional() {
        return optional;
    }

    public List<Statement> getThenStmts() {
        return orEmpty(thenStmts);
    }

    public List<Statement> getElseStmts() {
        return orEmpty(elseStmts);
    }

    public boolean hasElse() {
        return hasElse;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitCompileTimeIf(this, context);
    }
}
