package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;

/**
 * 导入声明
 *
 * <ul>
 *   <li>{@code import os}</li>
 *   <li>{@code import net.http}（别名为 http）</li>
 *   <li>{@code import crypto.sha256 as sha}</li>
 * </ul>
 */
public class ImportDecl extends Statement {
    private final String module;
    private final String alias;  // 可选

    public ImportDecl(SourceLocation location, String module, String alias) {
        super(location);
        this.module = module;
        this.alias = alias;
    }

    public String getModule() {
        return module;
    }

    /** 显式别名，缺省为模块路径最后一段 */
    public String getAlias() {
        if (alias != null && !alias.isEmpty()) {
            return alias;
        }
        return lastComponent(module);
    }

    public boolean hasExplicitAlias() {
        return alias != null && !alias.isEmpty() && !alias.equals(lastComponent(module));
    }

    public static String lastComponent(String module) {
        int dot = module.lastIndexOf('.');
        return dot >= 0 ? module.substring(dot + 1) : module;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
