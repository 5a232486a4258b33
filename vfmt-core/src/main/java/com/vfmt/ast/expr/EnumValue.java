package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 枚举值 {@code .red} 或 {@code Color.red}
 */
public class EnumValue extends Expression {
    private final String enumName;  // 可选，可带模块限定
    private final String value;

    public EnumValue(SourceLocation location, String enumName, String value) {
        super(location);
        this.enumName = enumName;
        this.value = value;
    }

    public String getEnumName() {
        return enumName;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitEnumValue(this, context);
    }
}
