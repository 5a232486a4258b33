package com.vfmt.ast.decl;

import com.vfmt.ast.Comment;
import com.vfmt.ast.Language;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;

import java.util.List;

/**
 * 结构体 / 联合体声明
 *
 * <p>{@code mut:}、{@code pub:}、{@code pub mut:} 分区以字段下标记录，-1 表示不存在。</p>
 */
public class StructDecl extends Statement {
    private final List<String> attrs;
    private final boolean isPub;
    private final boolean isUnion;
    private final Language language;
    private final String name;
    private final List<String> genericNames;
    private final List<FieldDecl> fields;
    private final int mutPos;
    private final int pubPos;
    private final int pubMutPos;
    private final List<Comment> endComments;

    public StructDecl(SourceLocation location, List<String> attrs, boolean isPub, boolean isUnion,
                      Language language, String name, List<String> genericNames, List<FieldDecl> fields,
                      int mutPos, int pubPos, int pubMutPos, List<Comment> endComments) {
        super(location);
        this.attrs = attrs;
        this.isPub = isPub;
        this.isUnion = isUnion;
        this.language = language;
        this.name = name;
        this.genericNames = genericNames;
        this.fields = fields;
        this.mutPos = mutPos;
        this.pubPos = pubPos;
        this.pubMutPos = pubMutPos;
        this.endComments = endComments;
    }

    public List<String> getAttrs() {
        return orEmpty(attrs);
    }

    public boolean isPub() {
        return isPub;
    }

    public boolean isUnion() {
        return isUnion;
    }

    public Language getLanguage() {
        return language != null ? language : Language.V;
    }

    public String getName() {
        return name;
    }

    public List<String> getGenericNames() {
        return orEmpty(genericNames);
    }

    public List<FieldDecl> getFields() {
        return orEmpty(fields);
    }

    public int getMutPos() {
        return mutPos;
    }

    public int getPubPos() {
        return pubPos;
    }

    public int getPubMutPos() {
        return pubMutPos;
    }

    public List<Comment> getEndComments() {
        return orEmpty(endComments);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
