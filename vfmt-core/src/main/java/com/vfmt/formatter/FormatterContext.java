package com.vfmt.formatter;

/**
 * 沿递归向下传递的格式化上下文
 *
 * <p>不可变；进入某个结构时通过 {@code withXxx} 派生新实例，结构结束时自然失效。</p>
 */
public final class FormatterContext {

    public static final FormatterContext ROOT = new FormatterContext(null, false, false, false, 0, 0);

    private final String itName;            // match 主体为标识符时，分支内 it 的替换名
    private final boolean insideLambda;     // map/filter 等的实参中，it 不替换
    private final boolean shortStructArgs;  // 调用的最后一个实参，结构体字面量省略类型名与花括号
    private final boolean assignRhs;        // 赋值右侧
    private final int parenDepth;
    private final int depth;                // 括号类子上下文层次，决定表达式链是否共享捕获

    private FormatterContext(String itName, boolean insideLambda, boolean shortStructArgs, boolean assignRhs,
                             int parenDepth, int depth) {
        this.itName = itName;
        this.insideLambda = insideLambda;
        this.shortStructArgs = shortStructArgs;
        this.assignRhs = assignRhs;
        this.parenDepth = parenDepth;
        this.depth = depth;
    }

    public String getItName() {
        return itName;
    }

    public boolean isInsideLambda() {
        return insideLambda;
    }

    public boolean isShortStructArgs() {
        return shortStructArgs;
    }

    public boolean isAssignRhs() {
        return assignRhs;
    }

    public int getParenDepth() {
        return parenDepth;
    }

    public int getDepth() {
        return depth;
    }

    public FormatterContext withItName(String name) {
        return new FormatterContext(name, insideLambda, shortStructArgs, assignRhs, parenDepth, depth);
    }

    public FormatterContext withInsideLambda(boolean value) {
        return new FormatterContext(itName, value, shortStructArgs, assignRhs, parenDepth, depth);
    }

    public FormatterContext withShortStructArgs(boolean value) {
        return new FormatterContext(itName, insideLambda, value, assignRhs, parenDepth, depth);
    }

    public FormatterContext withAssignRhs(boolean value) {
        return new FormatterContext(itName, insideLambda, shortStructArgs, value, parenDepth, depth);
    }

    public FormatterContext inParens() {
        return new FormatterContext(itName, insideLambda, false, assignRhs, parenDepth + 1, depth);
    }

    /**
     * 进入括号类子上下文（实参、下标、字面量元素、语句块）
     */
    public FormatterContext nested() {
        return new FormatterContext(itName, insideLambda, false, false, parenDepth, depth + 1);
    }
}
