package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.expr.Expression;

import java.util.List;

/**
 * 赋值 / 声明语句（{@code a, b := 1, 2}、{@code x += 1}）
 */
public class AssignStmt extends Statement {
    private final List<Expression> left;
    private final AssignOp operator;
    private final List<Expression> right;

    public AssignStmt(SourceLocation location, List<Expression> left, AssignOp operator, List<Expression> right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public List<Expression> getLeft() {
        return orEmpty(left);
    }

    public AssignOp getOperator() {
        return operator;
    }

    public List<Expression> getRight() {
        return orEmpty(right);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }

    /**
     * 赋值运算符
     */
    public enum AssignOp {
        DECL(":="),
        ASSIGN("="),
        PLUS_ASSIGN("+="),
        MINUS_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/="),
        MOD_ASSIGN("%="),
        OR_ASSIGN("|="),
        AND_ASSIGN("&="),
        XOR_ASSIGN("^="),
        LEFT_SHIFT_ASSIGN("<<="),
        RIGHT_SHIFT_ASSIGN(">>=");

        private final String source;

        AssignOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
