package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

import java.util.List;

/**
 * map 字面量，空 map 输出为 {@code map[string]int{}}
 */
public class MapInit extends Expression {
    private final int typeId;
    private final List<Expression> keys;
    private final List<Expression> values;

    public MapInit(SourceLocation location, int typeId, List<Expression> keys, List<Expression> values) {
        super(location);
        this.typeId = typeId;
        this.keys = keys;
        this.values = values;
    }

    public int getTypeId() {
        return typeId;
    }

    public List<Expression> getKeys() {
        return orEmpty(keys);
    }

    public List<Expression> getValues() {
        return orEmpty(values);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitMapInit(this, context);
    }
}
