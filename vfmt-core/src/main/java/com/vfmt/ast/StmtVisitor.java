package com.vfmt.ast;

import com.vfmt.ast.decl.*;
import com.vfmt.ast.stmt.*;

/**
 * 语句访问者接口
 *
 * <p>不提供默认实现：新增语句类型后，所有访问者都必须补上对应方法才能编译通过。</p>
 */
public interface StmtVisitor<R, C> {

    // ============ 声明 ============

    R visitModuleDecl(ModuleDecl node, C ctx);

    R visitImportDecl(ImportDecl node, C ctx);

    R visitConstDecl(ConstDecl node, C ctx);

    R visitEnumDecl(EnumDecl node, C ctx);

    R visitFnDecl(FnDecl node, C ctx);

    R visitGlobalDecl(GlobalDecl node, C ctx);

    R visitInterfaceDecl(InterfaceDecl node, C ctx);

    R visitStructDecl(StructDecl node, C ctx);

    R visitAliasTypeDecl(AliasTypeDecl node, C ctx);

    R visitFnTypeDecl(FnTypeDecl node, C ctx);

    R visitSumTypeDecl(SumTypeDecl node, C ctx);

    // ============ 语句 ============

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitAssertStmt(AssertStmt node, C ctx);

    R visitBlock(Block node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitGotoStmt(GotoStmt node, C ctx);

    R visitLabelStmt(LabelStmt node, C ctx);

    R visitCommentStmt(CommentStmt node, C ctx);

    R visitCompileTimeIf(CompileTimeIf node, C ctx);

    R visitDeferStmt(DeferStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitForCStmt(ForCStmt node, C ctx);

    R visitForInStmt(ForInStmt node, C ctx);

    R visitForCondStmt(ForCondStmt node, C ctx);

    R visitGoStmt(GoStmt node, C ctx);

    R visitHashStmt(HashStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitUnsafeStmt(UnsafeStmt node, C ctx);

    R visitSqlStmt(SqlStmt node, C ctx);
}
