package com.vfmt.ast.expr;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.Comment;
import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * 模式匹配 {@code match x { 1, 2 { ... } else { ... } }}
 */
public class MatchExpr extends Expression {
    private final Expression subject;
    private final boolean isMut;
    private final List<MatchBranch> branches;
    private final boolean isExpr;      // 处于表达式位置（取值）

    public MatchExpr(SourceLocation location, Expression subject, boolean isMut, List<MatchBranch> branches,
                     boolean isExpr) {
        super(location);
        this.subject = subject;
        this.isMut = isMut;
        this.branches = branches;
        this.isExpr = isExpr;
    }

    public MatchExpr(SourceLocation location, Expression subject, boolean isMut, List<MatchBranch> branches) {
        this(location, subject, isMut, branches, false);
    }

    public Expression getSubject() {
        return subject;
    }

    public boolean isMut() {
        return isMut;
    }

    public List<MatchBranch> getBranches() {
        return orEmpty(branches);
    }

    public boolean isExpr() {
        return isExpr;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitMatchExpr(this, context);
    }

    /**
     * 匹配分支；else 分支没有模式
     */
    public static final class MatchBranch extends AstNode {
        private final List<Expression> patterns;
        private final boolean isElse;
        private final List<Statement> stmts;
        private final List<Comment> comments;  // 分支之前的注释

        public MatchBranch(SourceLocation location, List<Expression> patterns, boolean isElse,
                           List<Statement> stmts, List<Comment> comments) {
            super(location);
            this.patterns = patterns;
            this.isElse = isElse;
            this.stmts = stmts;
            this.comments = comments;
        }

        public List<Expression> getPatterns() {
            return orEmpty(patterns);
        }

        public boolean isElse() {
            return isElse;
        }

        public List<Statement> getStmts() {
            return orEmpty(stmts);
        }

        public List<Comment> getComments() {
            return orEmpty(comments);
        }
    }
}
