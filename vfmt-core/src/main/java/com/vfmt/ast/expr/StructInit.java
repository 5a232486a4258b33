package com.vfmt.ast.expr;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

import java.util.List;

/**
 * 结构体字面量
 *
 * <ul>
 *   <li>{@code Point{}}：无字段</li>
 *   <li>{@code Point{1, 2}}：位置参数短形式（short）</li>
 *   <li>{@code Point{ x: 1 ... }}：每行一个字段</li>
 *   <li>{@code draw(color: red)}：调用实参中省略类型名与花括号（shortArgs）</li>
 * </ul>
 */
public class StructInit extends Expression {
    private final int typeId;
    private final List<Field> fields;
    private final boolean isShort;
    private final boolean isShortArgs;

    public StructInit(SourceLocation location, int typeId, List<Field> fields, boolean isShort, boolean isShortArgs) {
        super(location);
        this.typeId = typeId;
        this.fields = fields;
        this.isShort = isShort;
        this.isShortArgs = isShortArgs;
    }

    public int getTypeId() {
        return typeId;
    }

    public List<Field> getFields() {
        return orEmpty(fields);
    }

    public boolean isShort() {
        return isShort;
    }

    public boolean isShortArgs() {
        return isShortArgs;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitStructInit(this, context);
    }

    /**
     * 字段初始化；位置参数形式下 name 为 null
     */
    public static final class Field extends AstNode {
        private final String name;
        private final Expression value;

        public Field(SourceLocation location, String name, Expression value) {
            super(location);
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
