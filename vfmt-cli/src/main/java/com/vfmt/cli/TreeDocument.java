package com.vfmt.cli;

import com.vfmt.ast.SourceFile;
import com.vfmt.ast.type.SimpleTypeTable;

/**
 * 从 JSON 读入的一棵语法树及其类型表
 */
public final class TreeDocument {
    private final SourceFile file;
    private final SimpleTypeTable types;

    public TreeDocument(SourceFile file, SimpleTypeTable types) {
        this.file = file;
        this.types = types;
    }

    public SourceFile getFile() {
        return file;
    }

    public SimpleTypeTable getTypes() {
        return types;
    }
}
