package com.vfmt.formatter;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.Comment;
import com.vfmt.ast.SourceFile;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.decl.AliasTypeDecl;
import com.vfmt.ast.decl.ConstDecl;
import com.vfmt.ast.decl.EnumDecl;
import com.vfmt.ast.decl.FnDecl;
import com.vfmt.ast.decl.FnTypeDecl;
import com.vfmt.ast.decl.GlobalDecl;
import com.vfmt.ast.decl.ImportDecl;
import com.vfmt.ast.decl.InterfaceDecl;
import com.vfmt.ast.decl.ModuleDecl;
import com.vfmt.ast.decl.StructDecl;
import com.vfmt.ast.decl.SumTypeDecl;
import com.vfmt.ast.expr.AnonFn;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.expr.IfExpr;
import com.vfmt.ast.expr.LockExpr;
import com.vfmt.ast.expr.MatchExpr;
import com.vfmt.ast.stmt.AssertStmt;
import com.vfmt.ast.stmt.AssignStmt;
import com.vfmt.ast.stmt.BreakStmt;
import com.vfmt.ast.stmt.CommentStmt;
import com.vfmt.ast.stmt.ContinueStmt;
import com.vfmt.ast.stmt.ExpressionStmt;
import com.vfmt.ast.stmt.ReturnStmt;
import com.vfmt.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 一次格式化运行：持有输出器、换行引擎、import 累积器与两个访问者
 */
final class FormatRun {

    private static final Logger LOG = Logger.getLogger(FormatRun.class.getName());

    final FormatEnvironment env;
    final FormatConfig config;
    final Emitter out;
    final LineBreaker chains;
    final ImportTracker imports;
    final TypeNames names;
    final CommentWriter comments;
    final StatementFormatter statements;
    final ExpressionFormatter expressions;
    private final Level traceLevel;

    FormatRun(SourceFile file, FormatEnvironment env) {
        this.env = env;
        this.config = env.getConfig();
        this.out = new Emitter(config);
        this.chains = new LineBreaker(out);
        this.imports = new ImportTracker(file.getImports(), config.getAutoImportModules());
        this.names = new TypeNames(env, imports);
        this.comments = new CommentWriter(out);
        this.statements = new StatementFormatter(this);
        this.expressions = new ExpressionFormatter(this);
        this.traceLevel = config.isDebug() ? Level.INFO : Level.FINE;
    }

    /**
     * 第一阶段：渲染全部顶层语句，import 插入点之前的部分单独保存
     */
    void formatFile(SourceFile file) {
        writeStmts(file.getStmts(), FormatterContext.ROOT, true);
    }

    /**
     * 第二阶段：拼接前导部分、import 块与其余部分
     */
    FormatResult finish() {
        String importBlock = ImportBlockRenderer.render(imports, config);
        String text = stripLeadingBlankLines(out.getLeading()) + importBlock + stripLeadingBlankLines(out.getRest());
        text = stripTrailingWhitespace(stripLeadingBlankLines(text));
        if (!text.isEmpty()) {
            text = text + "\n";
        }
        return new FormatResult(text, imports.getUsedModules(), imports.getAutoImports());
    }

    // ============ 语句列表 ============

    void writeStmts(List<Statement> stmts, FormatterContext ctx, boolean topLevel) {
        Statement prev = null;
        boolean anchorPending = false;
        boolean anchored = false;
        for (Statement stmt : stmts) {
            if (prev != null && isSameLineComment(prev, stmt)) {
                out.removeTrailingWhitespace();
                out.write(" ");
                comments.write(((CommentStmt) stmt).getComment());
                out.newLine();
                if (topLevel && isDeclaration(prev)) {
                    out.blankLine();
                }
                prev = stmt;
                continue;
            }
            if (topLevel && !anchored && (anchorPending || stmt instanceof ImportDecl)) {
                out.markImportAnchor();
                anchored = true;
            }
            if (prev != null && config.isPreserveBlankLines() && hasBlankLineBetween(prev, stmt)) {
                out.blankLine();
            }
            if (topLevel && LOG.isLoggable(traceLevel)) {
                LOG.log(traceLevel, "格式化 " + stmt.getClass().getSimpleName() + " @" + stmt.getLocation());
            }
            stmt.accept(statements, ctx);
            if (!(stmt instanceof ImportDecl)) {
                out.newLine();
            }
            if (topLevel && isDeclaration(stmt)) {
                out.blankLine();
            }
            if (stmt instanceof ModuleDecl) {
                anchorPending = true;
            }
            prev = stmt;
        }
        if (topLevel && anchorPending && !anchored) {
            out.markImportAnchor();
        }
    }

    /**
     * 语句块：空块为 {@code {}}，否则每条语句一行并缩进一层
     */
    void writeBlock(List<Statement> stmts, FormatterContext ctx) {
        writeBlock(stmts, ctx, Collections.<Comment>emptyList());
    }

    void writeBlock(List<Statement> stmts, FormatterContext ctx, List<Comment> leadingComments) {
        out.write("{");
        if (stmts.isEmpty() && leadingComments.isEmpty()) {
            out.write("}");
            return;
        }
        out.newLine();
        out.indent();
        comments.writeStandalone(leadingComments);
        writeStmts(stmts, ctx.nested(), false);
        out.dedent();
        out.write("}");
    }

    void expr(Expression expr, FormatterContext ctx) {
        if (expr != null) {
            expr.accept(expressions, ctx);
        }
    }

    void exprList(List<Expression> exprs, FormatterContext ctx) {
        formatJoined(exprs, ", ", (e, c) -> expr(e, c), ctx);
    }

    <T> void formatJoined(List<T> items, String separator, BiConsumer<T, FormatterContext> formatter,
                          FormatterContext ctx) {
        for (int i = 0; i < items.size(); i++) {
            formatter.accept(items.get(i), ctx);
            if (i < items.size() - 1) {
                out.write(separator);
            }
        }
    }

    /**
     * 可以放进单行 {@code { ... }} 的语句：表达式、return、赋值、assert、break 与 continue，且不含嵌套条件、匹配、临界区或匿名函数
     */
    static boolean isSimpleStatement(Statement stmt) {
        if (stmt instanceof ExpressionStmt) {
            return isSimpleExpression(((ExpressionStmt) stmt).getExpression());
        }
        if (stmt instanceof ReturnStmt) {
            return allSimple(((ReturnStmt) stmt).getValues());
        }
        if (stmt instanceof AssignStmt) {
            AssignStmt assign = (AssignStmt) stmt;
            return allSimple(assign.getLeft()) && allSimple(assign.getRight());
        }
        if (stmt instanceof AssertStmt) {
            return isSimpleExpression(((AssertStmt) stmt).getCondition());
        }
        return stmt instanceof BreakStmt || stmt instanceof ContinueStmt;
    }

    private static boolean allSimple(List<Expression> exprs) {
        for (Expression expr : exprs) {
            if (!isSimpleExpression(expr)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSimpleExpression(Expression expr) {
        return !(expr instanceof IfExpr || expr instanceof MatchExpr || expr instanceof LockExpr
                || expr instanceof AnonFn);
    }

    static boolean isDeclaration(Statement stmt) {
        return stmt instanceof ModuleDecl || stmt instanceof ConstDecl || stmt instanceof EnumDecl
                || stmt instanceof FnDecl || stmt instanceof GlobalDecl || stmt instanceof InterfaceDecl
                || stmt instanceof StructDecl || stmt instanceof AliasTypeDecl || stmt instanceof FnTypeDecl
                || stmt instanceof SumTypeDecl;
    }

    private static boolean isSameLineComment(Statement prev, Statement stmt) {
        if (!(stmt instanceof CommentStmt) || prev instanceof ImportDecl || prev instanceof CommentStmt) {
            return false;
        }
        SourceLocation loc = stmt.getLocation();
        return loc.isKnown() && !((CommentStmt) stmt).getComment().isMultiLine()
                && loc.getLine() == prev.getLocation().getLastLine();
    }

    static boolean hasBlankLineBetween(AstNode prev, AstNode next) {
        SourceLocation a = prev.getLocation();
        SourceLocation b = next.getLocation();
        return a.isKnown() && b.isKnown() && b.getLine() > a.getLastLine() + 1;
    }

    private static String stripLeadingBlankLines(String text) {
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                start = i + 1;
            } else if (c != ' ' && c != '\t' && c != '\r') {
                break;
            }
            i++;
        }
        return i == text.length() ? "" : text.substring(start);
    }

    private static String stripTrailingWhitespace(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
