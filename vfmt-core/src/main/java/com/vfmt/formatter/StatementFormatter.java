package com.vfmt.formatter;

import com.vfmt.ast.Comment;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.decl.AliasTypeDecl;
import com.vfmt.ast.decl.ConstDecl;
import com.vfmt.ast.decl.EnumDecl;
import com.vfmt.ast.decl.FieldDecl;
import com.vfmt.ast.decl.FnDecl;
import com.vfmt.ast.decl.FnTypeDecl;
import com.vfmt.ast.decl.GlobalDecl;
import com.vfmt.ast.decl.ImportDecl;
import com.vfmt.ast.decl.InterfaceDecl;
import com.vfmt.ast.decl.ModuleDecl;
import com.vfmt.ast.decl.StructDecl;
import com.vfmt.ast.decl.SumTypeDecl;
import com.vfmt.ast.stmt.AssertStmt;
import com.vfmt.ast.stmt.AssignStmt;
import com.vfmt.ast.stmt.Block;
import com.vfmt.ast.stmt.BreakStmt;
import com.vfmt.ast.stmt.CommentStmt;
import com.vfmt.ast.stmt.CompileTimeIf;
import com.vfmt.ast.stmt.ContinueStmt;
import com.vfmt.ast.stmt.DeferStmt;
import com.vfmt.ast.stmt.ExpressionStmt;
import com.vfmt.ast.stmt.ForCStmt;
import com.vfmt.ast.stmt.ForCondStmt;
import com.vfmt.ast.stmt.ForInStmt;
import com.vfmt.ast.stmt.GoStmt;
import com.vfmt.ast.stmt.GotoStmt;
import com.vfmt.ast.stmt.HashStmt;
import com.vfmt.ast.stmt.LabelStmt;
import com.vfmt.ast.stmt.ReturnStmt;
import com.vfmt.ast.stmt.SqlStmt;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.stmt.UnsafeStmt;
import com.vfmt.ast.type.FnSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 语句与声明的格式化
 */
class StatementFormatter implements StmtVisitor<Void, FormatterContext> {

    private final FormatRun run;
    private final Emitter out;

    StatementFormatter(FormatRun run) {
        this.run = run;
        this.out = run.out;
    }

    // ============ 声明 ============

    @Override
    public Void visitModuleDecl(ModuleDecl node, FormatterContext ctx) {
        out.write("module " + node.getName());
        return null;
    }

    @Override
    public Void visitImportDecl(ImportDecl node, FormatterContext ctx) {
        // import 块在遍历结束后统一渲染
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node, FormatterContext ctx) {
        String pub = node.isPub() ? "pub " : "";
        List<ConstDecl.ConstField> fields = node.getFields();
        if (fields.size() == 1 && fields.get(0).getComments().isEmpty() && node.getEndComments().isEmpty()) {
            ConstDecl.ConstField field = fields.get(0);
            out.write(pub + "const " + field.getName() + " = ");
            run.expr(field.getValue(), ctx.withAssignRhs(true));
            return null;
        }
        out.write(pub + "const (");
        out.newLine();
        out.indent();
        List<Integer> lengths = new ArrayList<Integer>();
        for (ConstDecl.ConstField field : fields) {
            CommentWriter.Buckets buckets = run.comments.partition(field, field.getComments());
            lengths.add(FieldAligner.displayLength(field.getName(), buckets.getInline()));
        }
        FieldAligner aligner = FieldAligner.of(lengths);
        for (ConstDecl.ConstField field : fields) {
            CommentWriter.Buckets buckets = run.comments.partition(field, field.getComments());
            run.comments.writeStandalone(buckets.getBefore());
            writeNameWithInline(field.getName(), buckets.getInline());
            out.write(aligner.padding(FieldAligner.displayLength(field.getName(), buckets.getInline())) + " = ");
            run.expr(field.getValue(), ctx.withAssignRhs(true));
            run.comments.writeTrailing(buckets.getTrailing());
            out.newLine();
            run.comments.writeStandalone(buckets.getAfter());
        }
        run.comments.writeStandalone(node.getEndComments());
        out.dedent();
        out.write(")");
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, FormatterContext ctx) {
        writeAttrs(node.getAttrs());
        out.write((node.isPub() ? "pub " : "") + "enum " + node.getName() + " {");
        if (node.getFields().isEmpty() && node.getEndComments().isEmpty()) {
            out.write("}");
            return null;
        }
        out.newLine();
        out.indent();
        for (EnumDecl.EnumField field : node.getFields()) {
            CommentWriter.Buckets buckets = run.comments.partition(field, field.getComments());
            run.comments.writeStandalone(buckets.getBefore());
            writeNameWithInline(field.getName(), buckets.getInline());
            if (field.hasValue()) {
                out.write(" = ");
                run.expr(field.getValue(), ctx);
            }
            run.comments.writeTrailing(buckets.getTrailing());
            out.newLine();
            run.comments.writeStandalone(buckets.getAfter());
        }
        run.comments.writeStandalone(node.getEndComments());
        out.dedent();
        out.write("}");
        return null;
    }

    @Override
    public Void visitFnDecl(FnDecl node, FormatterContext ctx) {
        writeAttrs(node.getAttrs());
        out.write(run.names.signature(node.getSignature()));
        if (node.hasBody()) {
            out.write(" ");
            run.writeBlock(node.getBody(), ctx);
        }
        return null;
    }

    @Override
    public Void visitGlobalDecl(GlobalDecl node, FormatterContext ctx) {
        List<FieldDecl> fields = node.getFields();
        if (fields.size() == 1 && fields.get(0).getComments().isEmpty()) {
            out.write("__global ");
            writeField(fields.get(0), FieldAligner.of(Collections.<Integer>emptyList()), ctx);
            return null;
        }
        out.write("__global (");
        out.newLine();
        out.indent();
        FieldAligner aligner = alignerFor(fields);
        for (FieldDecl field : fields) {
            writeField(field, aligner, ctx);
            out.newLine();
        }
        out.dedent();
        out.write(")");
        return null;
    }

    @Override
    public Void visitInterfaceDecl(InterfaceDecl node, FormatterContext ctx) {
        out.write((node.isPub() ? "pub " : "") + "interface " + node.getName() + " {");
        if (node.getMethods().isEmpty()) {
            out.write("}");
            return null;
        }
        out.newLine();
        out.indent();
        for (FnSignature method : node.getMethods()) {
            out.writeln(methodSignature(method));
        }
        out.dedent();
        out.write("}");
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, FormatterContext ctx) {
        writeAttrs(node.getAttrs());
        StringBuilder head = new StringBuilder();
        if (node.isPub()) {
            head.append("pub ");
        }
        head.append(node.isUnion() ? "union " : "struct ");
        head.append(node.getLanguage().getPrefix()).append(node.getName());
        if (!node.getGenericNames().isEmpty()) {
            head.append('<').append(String.join(", ", node.getGenericNames())).append('>');
        }
        out.write(head.toString());
        List<FieldDecl> fields = node.getFields();
        if (fields.isEmpty() && node.getEndComments().isEmpty()) {
            out.write(" {}");
            return null;
        }
        out.write(" {");
        out.newLine();
        out.indent();
        FieldAligner aligner = alignerFor(fields);
        for (int i = 0; i < fields.size(); i++) {
            if (i == node.getMutPos()) {
                writeSectionMarker("mut:");
            }
            if (i == node.getPubPos()) {
                writeSectionMarker("pub:");
            }
            if (i == node.getPubMutPos()) {
                writeSectionMarker("pub mut:");
            }
            writeField(fields.get(i), aligner, ctx);
            out.newLine();
        }
        run.comments.writeStandalone(node.getEndComments());
        out.dedent();
        out.write("}");
        return null;
    }

    @Override
    public Void visitAliasTypeDecl(AliasTypeDecl node, FormatterContext ctx) {
        out.write((node.isPub() ? "pub " : "") + "type " + node.getName() + " = "
                + run.names.type(node.getParentType()));
        return null;
    }

    @Override
    public Void visitFnTypeDecl(FnTypeDecl node, FormatterContext ctx) {
        out.write((node.isPub() ? "pub " : "") + "type " + node.getName() + " = "
                + run.names.signature(node.getSignature()));
        return null;
    }

    @Override
    public Void visitSumTypeDecl(SumTypeDecl node, FormatterContext ctx) {
        out.write((node.isPub() ? "pub " : "") + "type " + node.getName() + " = ");
        List<String> variants = new ArrayList<String>();
        for (int typeId : node.getVariants()) {
            variants.add(run.names.type(typeId));
        }
        Collections.sort(variants);
        for (int i = 0; i < variants.size(); i++) {
            out.write(variants.get(i));
            if (i < variants.size() - 1) {
                out.write(" | ");
                out.wrapLongLine(2);
            }
        }
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitAssignStmt(AssignStmt node, FormatterContext ctx) {
        run.exprList(node.getLeft(), ctx);
        out.write(" " + node.getOperator().toSourceString() + " ");
        run.exprList(node.getRight(), ctx.withAssignRhs(true));
        return null;
    }

    @Override
    public Void visitAssertStmt(AssertStmt node, FormatterContext ctx) {
        out.write("assert ");
        run.expr(node.getCondition(), ctx);
        return null;
    }

    @Override
    public Void visitBlock(Block node, FormatterContext ctx) {
        run.writeBlock(node.getStatements(), ctx);
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FormatterContext ctx) {
        out.write(node.hasLabel() ? "break " + node.getLabel() : "break");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FormatterContext ctx) {
        out.write(node.hasLabel() ? "continue " + node.getLabel() : "continue");
        return null;
    }

    @Override
    public Void visitGotoStmt(GotoStmt node, FormatterContext ctx) {
        out.write("goto " + node.getLabel());
        return null;
    }

    @Override
    public Void visitLabelStmt(LabelStmt node, FormatterContext ctx) {
        out.write(node.getName() + ":");
        return null;
    }

    @Override
    public Void visitCommentStmt(CommentStmt node, FormatterContext ctx) {
        run.comments.write(node.getComment());
        return null;
    }

    @Override
    public Void visitCompileTimeIf(CompileTimeIf node, FormatterContext ctx) {
        out.write("$if " + (node.isNegated() ? "!" : "") + node.getCondition() + (node.isOptional() ? " ?" : "") + " ");
        run.writeBlock(node.getThenStmts(), ctx);
        if (node.hasElse()) {
            out.write(" $else ");
            run.writeBlock(node.getElseStmts(), ctx);
        }
        return null;
    }

    @Override
    public Void visitDeferStmt(DeferStmt node, FormatterContext ctx) {
        out.write("defer ");
        run.writeBlock(node.getStatements(), ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        run.expr(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitForCStmt(ForCStmt node, FormatterContext ctx) {
        writeLabel(node.getLabel());
        out.write("for ");
        final Statement init = node.getInit();
        final Statement increment = node.getIncrement();
        if (init != null) {
            out.write(out.capture(() -> init.accept(this, ctx)));
        }
        out.write("; ");
        run.expr(node.getCondition(), ctx);
        out.write("; ");
        if (increment != null) {
            out.write(out.capture(() -> increment.accept(this, ctx)));
        }
        out.write(" ");
        run.writeBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForInStmt(ForInStmt node, FormatterContext ctx) {
        writeLabel(node.getLabel());
        out.write("for ");
        if (node.getKeyVar() != null && !node.getKeyVar().isEmpty()) {
            out.write(node.getKeyVar() + ", ");
        }
        if (node.isValueMut()) {
            out.write("mut ");
        }
        out.write(node.getValueVar() + " in ");
        run.expr(node.getIterable(), ctx);
        if (node.isRange()) {
            out.write(" .. ");
            run.expr(node.getHigh(), ctx);
        }
        out.write(" ");
        run.writeBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForCondStmt(ForCondStmt node, FormatterContext ctx) {
        writeLabel(node.getLabel());
        out.write("for ");
        if (!node.isInfinite()) {
            run.expr(node.getCondition(), ctx);
            out.write(" ");
        }
        run.writeBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitGoStmt(GoStmt node, FormatterContext ctx) {
        out.write("go ");
        run.expr(node.getCall(), ctx);
        return null;
    }

    @Override
    public Void visitHashStmt(HashStmt node, FormatterContext ctx) {
        out.write("#" + node.getValue());
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        out.write("return");
        if (node.hasValue()) {
            out.write(" ");
            run.exprList(node.getValues(), ctx);
        }
        return null;
    }

    @Override
    public Void visitUnsafeStmt(UnsafeStmt node, FormatterContext ctx) {
        out.write("unsafe ");
        run.writeBlock(node.getStatements(), ctx);
        return null;
    }

    @Override
    public Void visitSqlStmt(SqlStmt node, FormatterContext ctx) {
        out.write("sql ");
        run.expr(node.getDatabase(), ctx);
        out.write(" {");
        out.newLine();
        out.indent();
        for (String line : node.getLines()) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                out.writeln(trimmed);
            }
        }
        out.dedent();
        out.write("}");
        return null;
    }

    // ============ 辅助方法 ============

    private void writeAttrs(List<String> attrs) {
        for (String attr : attrs) {
            out.writeln("[" + attr + "]");
        }
    }

    private void writeLabel(String label) {
        if (label != null && !label.isEmpty()) {
            out.write(label + ": ");
        }
    }

    /** 可见性分区标记与结构体本身同级缩进 */
    private void writeSectionMarker(String marker) {
        out.dedent();
        out.writeln(marker);
        out.indent();
    }

    private FieldAligner alignerFor(List<FieldDecl> fields) {
        List<Integer> lengths = new ArrayList<Integer>();
        for (FieldDecl field : fields) {
            CommentWriter.Buckets buckets = run.comments.partition(field, field.getComments());
            lengths.add(FieldAligner.displayLength(field.getName(), buckets.getInline()));
        }
        return FieldAligner.of(lengths);
    }

    /** 名称后接行内块注释 */
    private void writeNameWithInline(String name, List<Comment> inline) {
        out.write(name);
        for (Comment c : inline) {
            out.write(" " + CommentWriter.inlineForm(c));
        }
    }

    /**
     * 名称补齐到组内宽度后输出类型，之后是默认值与注释
     */
    private void writeField(FieldDecl field, FieldAligner aligner, FormatterContext ctx) {
        CommentWriter.Buckets buckets = run.comments.partition(field, field.getComments());
        run.comments.writeStandalone(buckets.getBefore());
        writeNameWithInline(field.getName(), buckets.getInline());
        out.write(aligner.padding(FieldAligner.displayLength(field.getName(), buckets.getInline())) + " ");
        out.write(run.names.type(field.getTypeId()));
        if (field.hasDefaultValue()) {
            out.write(" = ");
            run.expr(field.getDefaultValue(), ctx.withAssignRhs(true));
        }
        run.comments.writeTrailing(buckets.getTrailing());
        if (!buckets.getAfter().isEmpty()) {
            out.newLine();
            List<Comment> after = buckets.getAfter();
            for (int i = 0; i < after.size(); i++) {
                run.comments.write(after.get(i));
                if (i < after.size() - 1) {
                    out.newLine();
                }
            }
        }
    }

    /** 接口方法去掉 {@code pub fn } 前缀 */
    private String methodSignature(FnSignature method) {
        String sig = run.names.signature(method);
        if (sig.startsWith("pub ")) {
            sig = sig.substring(4);
        }
        if (sig.startsWith("fn ")) {
            sig = sig.substring(3);
        }
        return sig;
    }
}
