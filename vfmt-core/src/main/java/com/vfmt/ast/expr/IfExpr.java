package com.vfmt.ast.expr;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.Comment;
import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * if / else if / else，既可作语句也可作表达式
 */
public class IfExpr extends Expression {
    private final List<IfBranch> branches;
    private final boolean hasElse;     // 最后一个分支为 else
    private final boolean isExpr;      // 处于表达式位置（取值）

    public IfExpr(SourceLocation location, List<IfBranch> branches, boolean hasElse, boolean isExpr) {
        super(location);
        this.branches = branches;
        this.hasElse = hasElse;
        this.isExpr = isExpr;
    }

    public List<IfBranch> getBranches() {
        return orEmpty(branches);
    }

    public boolean hasElse() {
        return hasElse;
    }

    public boolean isExpr() {
        return isExpr;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }

    /**
     * 条件分支，else 分支的 condition 为 null
     */
    public static final class IfBranch extends AstNode {
        private final Expression condition;
        private final List<Statement> stmts;
        private final List<Comment> comments;

        public IfBranch(SourceLocation location, Expression condition, List<Statement> stmts,
                        List<Comment> comments) {
            super(location);
            this.condition = condition;
            this.stmts = stmts;
            this.comments = comments;
        }

        public Expression getCondition() {
            return condition;
        }

        public List<Statement> getStmts() {
            return orEmpty(stmts);
        }

        public List<Comment> getComments() {
            return orEmpty(comments);
        }
    }
}
