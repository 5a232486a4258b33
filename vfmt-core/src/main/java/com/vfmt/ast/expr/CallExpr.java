package com.vfmt.ast.expr;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用 {@code os.read_file(path)?} 或方法调用 {@code list.map(it * 2)}
 *
 * <p>函数调用的 name 可以带模块限定；方法调用的 name 为方法名，接收者在 receiver 中。</p>
 */
public class CallExpr extends Expression {
    private final Expression receiver;  // 方法调用时非空
    private final String name;
    private final boolean isMethod;
    private final List<CallArg> args;
    private final List<Integer> genericTypes;
    private final OrBlock orBlock;

    public CallExpr(SourceLocation location, Expression receiver, String name, boolean isMethod,
                    List<CallArg> args, List<Integer> genericTypes, OrBlock orBlock) {
        super(location);
        this.receiver = receiver;
        this.name = name;
        this.isMethod = isMethod;
        this.args = args;
        this.genericTypes = genericTypes;
        this.orBlock = orBlock;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getName() {
        return name;
    }

    public boolean isMethod() {
        return isMethod;
    }

    public List<CallArg> getArgs() {
        return orEmpty(args);
    }

    public List<Integer> getGenericTypes() {
        return orEmpty(genericTypes);
    }

    public OrBlock getOrBlock() {
        return orBlock != null ? orBlock : OrBlock.ABSENT;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    /**
     * 调用实参
     */
    public static final class CallArg extends AstNode {
        private final Expression expr;
        private final boolean isMut;

        public CallArg(SourceLocation location, Expression expr, boolean isMut) {
            super(location);
            this.expr = expr;
            this.isMut = isMut;
        }

        public Expression getExpr() {
            return expr;
        }

        public boolean isMut() {
            return isMut;
        }
    }
}
