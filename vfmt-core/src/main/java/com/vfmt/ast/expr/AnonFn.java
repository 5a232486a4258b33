package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.type.FnSignature;

import java.util.List;

/**
 * 匿名函数 {@code fn (x int) int { return x * 2 }}
 */
public class AnonFn extends Expression {
    private final FnSignature signature;
    private final List<Statement> body;

    public AnonFn(SourceLocation location, FnSignature signature, List<Statement> body) {
        super(location);
        this.signature = signature;
        this.body = body;
    }

    public FnSignature getSignature() {
        return signature;
    }

    public List<Statement> getBody() {
        return orEmpty(body);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitAnonFn(this, context);
    }
}
