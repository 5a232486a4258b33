package com.vfmt.ast.stmt;

import com.vfmt.ast.Comment;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;

/**
 * 独立成语句的注释
 */
public class CommentStmt extends Statement {
    private final Comment comment;

    public CommentStmt(SourceLocation location, Comment comment) {
        super(location);
        this.comment = comment;
    }

    public Comment getComment() {
        return comment;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitCommentStmt(this, context);
    }
}
