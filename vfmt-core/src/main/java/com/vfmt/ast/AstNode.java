package com.vfmt.ast;

import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location != null ? location : SourceLocation.UNKNOWN;
    }

    /**
     * 反序列化得到的节点可能缺少列表字段，统一按空列表处理
     */
    protected static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : Collections.<T>emptyList();
    }
}
