package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 标识符表达式，name 可以带模块限定（{@code os.args}）
 */
public class Identifier extends Expression {
    private final String name;
    private final IdentKind identKind;
    private final boolean isMut;  // 声明处的 mut x

    public Identifier(SourceLocation location, String name, IdentKind identKind, boolean isMut) {
        super(location);
        this.name = name;
        this.identKind = identKind;
        this.isMut = isMut;
    }

    public Identifier(SourceLocation location, String name) {
        this(location, name, IdentKind.UNRESOLVED, false);
    }

    public String getName() {
        return name;
    }

    public IdentKind getIdentKind() {
        return identKind != null ? identKind : IdentKind.UNRESOLVED;
    }

    public boolean isMut() {
        return isMut;
    }

    public boolean isBlank() {
        return getIdentKind() == IdentKind.BLANK || "_".equals(name);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    /**
     * 标识符解析结果
     */
    public enum IdentKind {
        UNRESOLVED,
        VARIABLE,
        CONSTANT,
        GLOBAL,
        FUNCTION,
        BLANK
    }
}
