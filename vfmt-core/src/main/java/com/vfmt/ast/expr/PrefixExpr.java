package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 前缀表达式 {@code -x}、{@code !ok}、{@code &buf}、{@code <-ch}
 */
public class PrefixExpr extends Expression {
    private final PrefixOp operator;
    private final Expression operand;

    public PrefixExpr(SourceLocation location, PrefixOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public PrefixOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitPrefixExpr(this, context);
    }

    public enum PrefixOp {
        MINUS("-"),
        NOT("!"),
        AMP("&"),
        DEREF("*"),
        BIT_NOT("~"),
        ARROW("<-");

        private final String source;

        PrefixOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
