package com.vfmt.ast.decl;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.Comment;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * 枚举声明
 */
public class EnumDecl extends Statement {
    private final List<String> attrs;
    private final boolean isPub;
    private final String name;
    private final List<EnumField> fields;
    private final List<Comment> endComments;

    public EnumDecl(SourceLocation location, List<String> attrs, boolean isPub, String name,
                    List<EnumField> fields, List<Comment> endComments) {
        super(location);
        this.attrs = attrs;
        this.isPub = isPub;
        this.name = name;
        this.fields = fields;
        this.endComments = endComments;
    }

    /** 如 {@code [flag]} */
    public List<String> getAttrs() {
        return orEmpty(attrs);
    }

    public boolean isPub() {
        return isPub;
    }

    public String getName() {
        return name;
    }

    public List<EnumField> getFields() {
        return orEmpty(fields);
    }

    public List<Comment> getEndComments() {
        return orEmpty(endComments);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    /**
     * 枚举条目，可带显式值
     */
    public static final class EnumField extends AstNode {
        private final String name;
        private final Expression value;  // 可选
        private final List<Comment> comments;

        public EnumField(SourceLocation location, String name, Expression value, List<Comment> comments) {
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

        public boolean hasValue() {
            return value != null;
        }

        public List<Comment> getComments() {
            return orEmpty(comments);
        }
    }
}
