package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

import java.util.List;

/**
 * 迭代循环 {@code for i, x in xs {}}、{@code for i in 0 .. n {}}
 */
public class ForInStmt extends Statement {
    private final String label;
    private final String keyVar;     // 可选
    private final String valueVar;
    private final boolean valueMut;
    private final Expression iterable;
    private final Expression high;   // 区间循环的上界，非区间为 null
    private final List<Statement> body;

    public ForInStmt(SourceLocation location, String label, String keyVar, String valueVar, boolean valueMut,
                     Expression iterable, Expression high, List<Statement> body) {
        super(location);
        this.label = label;
        this.keyVar = keyVar;
        this.valueVar = valueVar;
        this.valueMut = valueMut;
        this.iterable = iterable;
        this.high = high;
        this.body = body;
    }

    public String getLabel() {
        return label;
    }

    public String getKeyVar() {
        return keyVar;
    }

    public String getValueVar() {
        return valueVar;
    }

    public boolean isValueMut() {
        return valueMut;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Expression getHigh() {
        return high;
    }

    public boolean isRange() {
        return high != null;
    }

    public List<Statement> getBody() {
        return orEmpty(body);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForInStmt(this, context);
    }
}
