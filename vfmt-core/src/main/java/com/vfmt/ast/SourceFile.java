package com.vfmt.ast;

import com.vfmt.ast.decl.ImportDecl;
import com.vfmt.ast.decl.ModuleDecl;
import com.vfmt.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个源文件解析后的顶层语句列表
 */
public class SourceFile {
    private final String path;
    private final List<Statement> stmts;

    public SourceFile(String path, List<Statement> stmts) {
        this.path = path;
        this.stmts = stmts;
    }

    public String getPath() {
        return path != null ? path : "<unknown>";
    }

    public List<Statement> getStmts() {
        return AstNode.orEmpty(stmts);
    }

    /** 源码中声明的 import，按出现顺序 */
    public List<ImportDecl> getImports() {
        List<ImportDecl> imports = new ArrayList<ImportDecl>();
        for (Statement stmt : getStmts()) {
            if (stmt instanceof ImportDecl) {
                imports.add((ImportDecl) stmt);
            }
        }
        return imports;
    }

    /** 文件的 module 名，缺省为 main */
    public String getModuleName() {
        for (Statement stmt : getStmts()) {
            if (stmt instanceof ModuleDecl) {
                return ((ModuleDecl) stmt).getName();
            }
        }
        return "main";
    }
}
