package com.vfmt.ast.decl;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.Comment;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.expr.Expression;

import java.util.List;

/**
 * 结构体字段或全局变量：{@code name Type = default}
 *
 * <p>location 覆盖从字段名到类型结束的范围，注释按其偏移归属到字段前、名称与类型之间或行尾。</p>
 */
public class FieldDecl extends AstNode {
    private final String name;
    private final int typeId;
    private final Expression defaultValue;  // 可选
    private final List<Comment> comments;

    public FieldDecl(SourceLocation location, String name, int typeId, Expression defaultValue,
                     List<Comment> comments) {
        super(location);
        this.name = name;
        this.typeId = typeId;
        this.defaultValue = defaultValue;
        this.comments = comments;
    }

    public String getName() {
        return name;
    }

    public int getTypeId() {
        return typeId;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public List<Comment> getComments() {
        return orEmpty(comments);
    }
}
