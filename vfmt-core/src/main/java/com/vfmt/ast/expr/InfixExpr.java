package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

/**
 * 二元表达式
 */
public class InfixExpr extends Expression {
    private final Expression left;
    private final InfixOp operator;
    private final Expression right;

    public InfixExpr(SourceLocation location, Expression left, InfixOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public InfixOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitInfixExpr(this, context);
    }

    /**
     * 二元运算符，precedence 越大结合越紧
     */
    public enum InfixOp {
        // 逻辑
        LOGICAL_OR("||", 1),
        LOGICAL_AND("&&", 2),

        // 包含与类型判断
        IN("in", 3),
        NOT_IN("!in", 3),
        IS("is", 3),
        NOT_IS("!is", 3),

        // 比较
        EQ("==", 4),
        NE("!=", 4),
        LT("<", 4),
        GT(">", 4),
        LE("<=", 4),
        GE(">=", 4),

        // 加法类
        PLUS("+", 5),
        MINUS("-", 5),
        PIPE("|", 5),
        XOR("^", 5),

        // 乘法类
        MUL("*", 6),
        DIV("/", 6),
        MOD("%", 6),
        LEFT_SHIFT("<<", 6),
        RIGHT_SHIFT(">>", 6),
        AMP("&", 6);

        private final String source;
        private final int precedence;

        InfixOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }
    }
}
