package com.vfmt.ast.stmt;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;

/**
 * 嵌入的外部声明，原样输出（{@code #include <stdio.h>}、{@code #flag -lm}）
 */
public class HashStmt extends Statement {
    private final String value;  // 不含 #

    public HashStmt(SourceLocation location, String value) {
        super(location);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitHashStmt(this, context);
    }
}
