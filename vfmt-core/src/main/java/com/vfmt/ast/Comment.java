package com.vfmt.ast;

/**
 * 带位置信息的源码注释，text 不含注释定界符
 */
public final class Comment extends AstNode {
    private final String text;

    public Comment(SourceLocation location, String text) {
        super(location);
        this.text = text;
    }

    public String getText() {
        return text != null ? text : "";
    }

    /** 注释正文跨越多行时以块注释形式输出 */
    public boolean isMultiLine() {
        return getText().trim().indexOf('\n') >= 0;
    }
}
