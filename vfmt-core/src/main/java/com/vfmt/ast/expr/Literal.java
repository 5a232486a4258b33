package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>value 保存源码中的原始文本（数字保留原写法，字符串与字符不含引号）。</p>
 */
public class Literal extends Expression {
    private final LiteralKind kind;
    private final String value;
    private final boolean raw;  // r'...' 原始字符串

    public Literal(SourceLocation location, LiteralKind kind, String value, boolean raw) {
        super(location);
        this.kind = kind;
        this.value = value;
        this.raw = raw;
    }

    public Literal(SourceLocation location, LiteralKind kind, String value) {
        this(location, kind, value, false);
    }

    public LiteralKind getKind() {
        return kind;
    }

    public String getValue() {
        return value != null ? value : "";
    }

    public boolean isRaw() {
        return raw;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        BOOL,
        CHAR,
        INT,
        FLOAT,
        STRING
    }
}
