package com.vfmt.ast.decl;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.Comment;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * 常量组 {@code const ( a = 1 ... )}
 */
public class ConstDecl extends Statement {
    private final boolean isPub;
    private final List<ConstField> fields;
    private final List<Comment> endComments;

    public ConstDecl(SourceLocation location, boolean isPub, List<ConstField> fields, List<Comment> endComments) {
        super(location);
        this.isPub = isPub;
        this.fields = fields;
        this.endComments = endComments;
    }

    public boolean isPub() {
        return isPub;
    }

    public List<ConstField> getFields() {
        return orEmpty(fields);
    }

    /** 最后一个常量之后、右括号之前的注释 */
    public List<Comment> getEndComments() {
        return orEmpty(endComments);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitConstDecl(this, context);
    }

    /**
     * 单个常量
     */
    public static final class ConstField extends AstNode {
        private final String name;
        private final Expression value;
        private final List<Comment> comments;

        public ConstField(SourceLocation location, String name, Expression value, List<Comment> comments) {
            super(location);
            this.name = name;
            this.value = value;
            this.comments = comments;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }

        public List<Comment> getComments() {
            return orEmpty(comments);
        }
    }
}
