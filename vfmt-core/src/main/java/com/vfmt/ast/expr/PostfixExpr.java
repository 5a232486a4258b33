package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 后缀表达式 {@code i++}、{@code i--}
 */
public class PostfixExpr extends Expression {
    private final Expression operand;
    private final PostfixOp operator;

    public PostfixExpr(SourceLocation location, Expression operand, PostfixOp operator) {
        super(location);
        this.operand = operand;
        this.operator = operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public PostfixOp getOperator() {
        return operator;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitPostfixExpr(this, context);
    }

    public enum PostfixOp {
        INC("++"),
        DEC("--");

        private final String source;

        PostfixOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
