package com.vfmt.formatter;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.expr.AnonFn;
import com.vfmt.ast.expr.ArrayInit;
import com.vfmt.ast.expr.CallExpr;
import com.vfmt.ast.expr.CastExpr;
import com.vfmt.ast.expr.EnumValue;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.expr.Identifier;
import com.vfmt.ast.expr.IfExpr;
import com.vfmt.ast.expr.IndexExpr;
import com.vfmt.ast.expr.InfixExpr;
import com.vfmt.ast.expr.LikelyExpr;
import com.vfmt.ast.expr.Literal;
import com.vfmt.ast.expr.LockExpr;
import com.vfmt.ast.expr.MapInit;
import com.vfmt.ast.expr.MatchExpr;
import com.vfmt.ast.expr.OrBlock;
import com.vfmt.ast.expr.OrExpr;
import com.vfmt.ast.expr.ParExpr;
import com.vfmt.ast.expr.PostfixExpr;
import com.vfmt.ast.expr.PrefixExpr;
import com.vfmt.ast.expr.RangeExpr;
import com.vfmt.ast.expr.SelectorExpr;
import com.vfmt.ast.expr.SizeOfExpr;
import com.vfmt.ast.expr.StringInterpolation;
import com.vfmt.ast.expr.StructInit;
import com.vfmt.ast.expr.TypeExpr;
import com.vfmt.ast.expr.TypeOfExpr;
import com.vfmt.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 表达式的格式化
 */
class ExpressionFormatter implements ExprVisitor<Void, FormatterContext> {

    /** 实参是以 it 为参数的隐式 lambda 的方法 */
    private static final Set<String> LAMBDA_METHODS = new HashSet<String>(Arrays.asList("map", "filter", "any", "all"));

    private final FormatRun run;
    private final Emitter out;

    ExpressionFormatter(FormatRun run) {
        this.run = run;
        this.out = run.out;
    }

    // ============ 字面量 ============

    @Override
    public Void visitLiteral(Literal node, FormatterContext ctx) {
        switch (node.getKind()) {
            case STRING:
                out.write(VStringUtils.quote(node.getValue(), node.isRaw()));
                break;
            case CHAR:
                out.write("`" + node.getValue() + "`");
                break;
            default:
                out.write(node.getValue());
        }
        return null;
    }

    @Override
    public Void visitStringInterpolation(StringInterpolation node, FormatterContext ctx) {
        List<String> vals = node.getVals();
        List<Expression> exprs = node.getExprs();
        char quote = VStringUtils.chooseQuote(String.join("", vals));
        StringBuilder sb = new StringBuilder();
        sb.append(quote);
        for (int i = 0; i < vals.size(); i++) {
            sb.append(VStringUtils.escapeQuote(vals.get(i), quote));
            if (i >= exprs.size()) {
                continue;
            }
            final Expression expr = exprs.get(i);
            String text = out.capture(() -> run.expr(expr, ctx.nested()));
            String format = node.getFormat(i);
            String next = i + 1 < vals.size() ? vals.get(i + 1) : "";
            if (format.isEmpty() && isPlainReference(expr) && !VStringUtils.continuesName(next)) {
                sb.append('$').append(text);
            } else {
                sb.append("${").append(text);
                if (!format.isEmpty()) {
                    sb.append(':').append(format);
                }
                sb.append('}');
            }
        }
        sb.append(quote);
        out.write(sb.toString());
        return null;
    }

    @Override
    public Void visitArrayInit(ArrayInit node, FormatterContext ctx) {
        if (node.hasSizeFields()) {
            out.write(run.names.type(node.getTypeId()) + "{");
            boolean first = writeSizeField("len", node.getLenExpr(), true, ctx);
            first = writeSizeField("cap", node.getCapExpr(), first, ctx);
            writeSizeField("init", node.getInitExpr(), first, ctx);
            out.write("}");
            return null;
        }
        if (node.getExprs().isEmpty()) {
            out.write(node.getTypeId() != 0 ? run.names.type(node.getTypeId()) + "{}" : "[]");
            return null;
        }
        out.write("[");
        writeWrappedList(node.getExprs(), ctx.nested());
        out.write("]");
        if (node.isFixed()) {
            out.write("!");
        }
        return null;
    }

    @Override
    public Void visitMapInit(MapInit node, FormatterContext ctx) {
        if (node.getKeys().isEmpty()) {
            out.write(node.getTypeId() != 0 ? run.names.type(node.getTypeId()) + "{}" : "{}");
            return null;
        }
        out.write("{");
        out.newLine();
        out.indent();
        FormatterContext inner = ctx.nested();
        for (int i = 0; i < node.getKeys().size(); i++) {
            run.expr(node.getKeys().get(i), inner);
            out.write(": ");
            run.expr(node.getValues().get(i), inner);
            out.newLine();
        }
        out.dedent();
        out.write("}");
        return null;
    }

    @Override
    public Void visitStructInit(StructInit node, FormatterContext ctx) {
        List<StructInit.Field> fields = node.getFields();
        FormatterContext inner = ctx.nested();
        if (ctx.isShortStructArgs() && node.isShortArgs() && !fields.isEmpty()) {
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    out.write(", ");
                    out.wrapLongLine(2);
                }
                out.write(fields.get(i).getName() + ": ");
                run.expr(fields.get(i).getValue(), inner);
            }
            return null;
        }
        String type = node.getTypeId() != 0 ? run.names.type(node.getTypeId()) : "";
        if (fields.isEmpty()) {
            out.write(type + "{}");
            return null;
        }
        if (node.isShort()) {
            out.write(type + "{");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    out.write(", ");
                }
                run.expr(fields.get(i).getValue(), inner);
            }
            out.write("}");
            return null;
        }
        out.write(type + "{");
        out.newLine();
        out.indent();
        List<Integer> lengths = new ArrayList<Integer>();
        for (StructInit.Field field : fields) {
            lengths.add(field.getName().length() + 1);
        }
        FieldAligner aligner = FieldAligner.of(lengths);
        for (StructInit.Field field : fields) {
            out.write(field.getName() + ":" + aligner.padding(field.getName().length() + 1) + " ");
            run.expr(field.getValue(), inner);
            out.newLine();
        }
        out.dedent();
        out.write("}");
        return null;
    }

    @Override
    public Void visitAnonFn(AnonFn node, FormatterContext ctx) {
        out.write(run.names.signature(node.getSignature()) + " ");
        run.writeBlock(node.getBody(), ctx);
        return null;
    }

    // ============ 调用 ============

    @Override
    public Void visitCallExpr(CallExpr node, FormatterContext ctx) {
        if (node.isMethod()) {
            Expression receiver = node.getReceiver();
            if (receiver instanceof Identifier) {
                run.imports.noteMethodCall((Identifier) receiver);
            }
            run.expr(receiver, ctx);
            out.write("." + node.getName());
        } else {
            out.write(run.names.shorten(node.getName()));
        }
        if (!node.getGenericTypes().isEmpty()) {
            List<String> generics = new ArrayList<String>();
            for (int typeId : node.getGenericTypes()) {
                generics.add(run.names.type(typeId));
            }
            out.write("<" + String.join(", ", generics) + ">");
        }
        out.write("(");
        FormatterContext argCtx = ctx.nested();
        if (node.isMethod() && LAMBDA_METHODS.contains(node.getName())) {
            argCtx = argCtx.withInsideLambda(true);
        }
        List<CallExpr.CallArg> args = node.getArgs();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                out.write(", ");
                out.wrapLongLine(2);
            }
            CallExpr.CallArg arg = args.get(i);
            if (arg.isMut()) {
                out.write("mut ");
            }
            run.expr(arg.getExpr(), i == args.size() - 1 ? argCtx.withShortStructArgs(true) : argCtx);
        }
        out.write(")");
        writeOrBlock(node.getOrBlock(), ctx);
        return null;
    }

    @Override
    public Void visitOrExpr(OrExpr node, FormatterContext ctx) {
        throw new FormatAbortError("or 块没有挂在调用表达式上: " + node.getLocation());
    }

    @Override
    public Void visitCastExpr(CastExpr node, FormatterContext ctx) {
        out.write(run.names.type(node.getTypeId()) + "(");
        FormatterContext inner = ctx.nested();
        run.expr(node.getExpr(), inner);
        if (node.getArg() != null) {
            out.write(", ");
            run.expr(node.getArg(), inner);
        }
        out.write(")");
        return null;
    }

    // ============ 条件与匹配 ============

    @Override
    public Void visitIfExpr(IfExpr node, FormatterContext ctx) {
        if (canCollapse(node, ctx)) {
            String line = out.capture(() -> writeIfBranches(node, ctx, true));
            if (line.indexOf('\n') < 0 && out.currentColumn() + line.length() <= run.config.getMaxLineWidth()) {
                out.write(line);
                return null;
            }
        }
        writeIfBranches(node, ctx, false);
        return null;
    }

    @Override
    public Void visitMatchExpr(MatchExpr node, FormatterContext ctx) {
        out.write(node.isMut() ? "match mut " : "match ");
        run.expr(node.getSubject(), ctx);
        out.write(" {");
        out.newLine();
        FormatterContext branchCtx = ctx.nested();
        if (node.getSubject() instanceof Identifier) {
            branchCtx = branchCtx.withItName(((Identifier) node.getSubject()).getName()).withInsideLambda(false);
        }
        List<MatchExpr.MatchBranch> branches = node.getBranches();
        out.indent();
        String[] singleLines = node.isExpr() || ctx.isAssignRhs() ? singleLineBodies(branches, branchCtx) : null;
        for (int i = 0; i < branches.size(); i++) {
            MatchExpr.MatchBranch branch = branches.get(i);
            run.comments.writeStandalone(branch.getComments());
            if (branch.isElse()) {
                out.write("else ");
            } else {
                run.exprList(branch.getPatterns(), branchCtx);
                out.write(" ");
            }
            if (branch.getStmts().isEmpty()) {
                out.write("{}");
            } else if (singleLines != null) {
                out.write("{ " + singleLines[i] + " }");
            } else {
                run.writeBlock(branch.getStmts(), branchCtx);
            }
            out.newLine();
        }
        out.dedent();
        out.write("}");
        return null;
    }

    @Override
    public Void visitLockExpr(LockExpr node, FormatterContext ctx) {
        out.write(node.isReadLock() ? "rlock " : "lock ");
        run.exprList(node.getLockeds(), ctx);
        out.write(" ");
        run.writeBlock(node.getStmts(), ctx);
        return null;
    }

    // ============ 运算符 ============

    @Override
    public Void visitInfixExpr(InfixExpr node, FormatterContext ctx) {
        FormatterContext operandCtx = ctx.withAssignRhs(false).withShortStructArgs(false);
        boolean owner = run.chains.open(ctx.getDepth());
        run.expr(node.getLeft(), operandCtx);
        out.write(" " + node.getOperator().toSourceString());
        int penalty = LineBreaker.penalty(isNested(node.getLeft()), isNested(node.getRight()));
        run.chains.boundary(penalty, LineBreaker.precedenceKey(node.getOperator().getPrecedence(), ctx.getParenDepth()));
        run.expr(node.getRight(), operandCtx);
        if (owner) {
            run.chains.close();
        }
        return null;
    }

    @Override
    public Void visitPrefixExpr(PrefixExpr node, FormatterContext ctx) {
        out.write(node.getOperator().toSourceString());
        run.expr(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitPostfixExpr(PostfixExpr node, FormatterContext ctx) {
        run.expr(node.getOperand(), ctx);
        out.write(node.getOperator().toSourceString());
        return null;
    }

    @Override
    public Void visitParExpr(ParExpr node, FormatterContext ctx) {
        out.write("(");
        run.expr(node.getExpr(), ctx.inParens());
        out.write(")");
        return null;
    }

    // ============ 名称与访问 ============

    @Override
    public Void visitIdentifier(Identifier node, FormatterContext ctx) {
        if (node.isMut()) {
            out.write("mut ");
        }
        String name = node.getName();
        if ("it".equals(name) && ctx.getItName() != null && !ctx.isInsideLambda()) {
            out.write(ctx.getItName());
            return null;
        }
        if (node.getIdentKind() != Identifier.IdentKind.VARIABLE && run.imports.isKnownAlias(name)) {
            run.imports.markUsed(name);
        }
        out.write(run.names.shorten(name));
        return null;
    }

    @Override
    public Void visitSelectorExpr(SelectorExpr node, FormatterContext ctx) {
        run.expr(node.getTarget(), ctx);
        out.write("." + node.getFieldName());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, FormatterContext ctx) {
        run.expr(node.getLeft(), ctx);
        out.write("[");
        run.expr(node.getIndex(), ctx.nested());
        out.write("]");
        return null;
    }

    @Override
    public Void visitRangeExpr(RangeExpr node, FormatterContext ctx) {
        run.expr(node.getLow(), ctx);
        out.write("..");
        run.expr(node.getHigh(), ctx);
        return null;
    }

    @Override
    public Void visitEnumValue(EnumValue node, FormatterContext ctx) {
        String enumName = node.getEnumName();
        if (enumName == null || enumName.isEmpty()) {
            out.write("." + node.getValue());
        } else {
            out.write(run.names.shorten(enumName) + "." + node.getValue());
        }
        return null;
    }

    @Override
    public Void visitTypeExpr(TypeExpr node, FormatterContext ctx) {
        out.write(run.names.type(node.getTypeId()));
        return null;
    }

    @Override
    public Void visitSizeOfExpr(SizeOfExpr node, FormatterContext ctx) {
        out.write("sizeof(" + run.names.type(node.getTypeId()) + ")");
        return null;
    }

    @Override
    public Void visitTypeOfExpr(TypeOfExpr node, FormatterContext ctx) {
        out.write("typeof(");
        run.expr(node.getExpr(), ctx.nested());
        out.write(")");
        return null;
    }

    @Override
    public Void visitLikelyExpr(LikelyExpr node, FormatterContext ctx) {
        out.write(node.isLikely() ? "_likely_(" : "_unlikely_(");
        run.expr(node.getExpr(), ctx.nested());
        out.write(")");
        return null;
    }

    // ============ 辅助方法 ============

    /**
     * @return 写完后下一项是否仍是第一项
     */
    private boolean writeSizeField(String name, Expression value, boolean first, FormatterContext ctx) {
        if (value == null) {
            return first;
        }
        if (!first) {
            out.write(", ");
        }
        out.write(name + ": ");
        run.expr(value, ctx.nested());
        return false;
    }

    private void writeWrappedList(List<Expression> exprs, FormatterContext ctx) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                out.write(", ");
                out.wrapLongLine(2);
            }
            run.expr(exprs.get(i), ctx);
        }
    }

    /**
     * 调用后缀：无、{@code ?}、{@code or {}}、单行 {@code or { expr }} 或多行块
     */
    private void writeOrBlock(OrBlock orBlock, FormatterContext ctx) {
        switch (orBlock.getKind()) {
            case ABSENT:
                return;
            case PROPAGATE:
                out.write("?");
                return;
            default:
                break;
        }
        List<Statement> stmts = orBlock.getStmts();
        if (stmts.isEmpty()) {
            out.write(" or {}");
            return;
        }
        if (stmts.size() == 1 && FormatRun.isSimpleStatement(stmts.get(0))) {
            final Statement stmt = stmts.get(0);
            String body = out.capture(() -> stmt.accept(run.statements, ctx.nested()));
            String line = " or { " + body + " }";
            if (line.indexOf('\n') < 0 && out.currentColumn() + line.length() <= run.config.getMaxLineWidth()) {
                out.write(line);
                return;
            }
        }
        out.write(" or ");
        run.writeBlock(stmts, ctx);
    }

    /**
     * 只有 if/else 两个分支、各含一条简单语句，且处于表达式位置或赋值右侧时才尝试单行
     */
    private static boolean canCollapse(IfExpr node, FormatterContext ctx) {
        List<IfExpr.IfBranch> branches = node.getBranches();
        if (branches.size() != 2 || !node.hasElse() || !(node.isExpr() || ctx.isAssignRhs())) {
            return false;
        }
        for (IfExpr.IfBranch branch : branches) {
            if (branch.getStmts().size() != 1 || !branch.getComments().isEmpty()
                    || !FormatRun.isSimpleStatement(branch.getStmts().get(0))) {
                return false;
            }
        }
        return true;
    }

    private void writeIfBranches(IfExpr node, FormatterContext ctx, boolean singleLine) {
        List<IfExpr.IfBranch> branches = node.getBranches();
        FormatterContext condCtx = ctx.withAssignRhs(false);
        for (int i = 0; i < branches.size(); i++) {
            IfExpr.IfBranch branch = branches.get(i);
            if (i > 0) {
                out.write(" else ");
            }
            if (branch.getCondition() != null) {
                out.write("if ");
                run.expr(branch.getCondition(), condCtx);
                out.write(" ");
            }
            if (singleLine) {
                out.write("{ ");
                branch.getStmts().get(0).accept(run.statements, ctx.nested());
                out.write(" }");
            } else {
                run.writeBlock(branch.getStmts(), ctx, branch.getComments());
            }
        }
    }

    /**
     * 每个非空分支都是一条简单语句，渲染为单行且不超出最高档位时返回各分支文本，否则返回 null
     */
    private String[] singleLineBodies(List<MatchExpr.MatchBranch> branches, FormatterContext ctx) {
        String[] bodies = new String[branches.size()];
        for (int i = 0; i < branches.size(); i++) {
            MatchExpr.MatchBranch branch = branches.get(i);
            List<Statement> stmts = branch.getStmts();
            if (stmts.isEmpty()) {
                continue;
            }
            if (stmts.size() != 1 || !FormatRun.isSimpleStatement(stmts.get(0))) {
                return null;
            }
            final Statement stmt = stmts.get(0);
            String text = out.capture(() -> stmt.accept(run.statements, ctx.nested()));
            String head = branch.isElse() ? "else " : out.capture(() -> run.exprList(branch.getPatterns(), ctx)) + " ";
            if (text.indexOf('\n') >= 0
                    || out.currentColumn() + head.length() + text.length() + 4 > run.config.getMaxLineWidth()) {
                return null;
            }
            bodies[i] = text;
        }
        return bodies;
    }

    private static boolean isNested(Expression expr) {
        return expr instanceof InfixExpr || expr instanceof ParExpr;
    }

    /** 可以写成 $name 的插值：标识符或标识符上的成员访问 */
    private static boolean isPlainReference(Expression expr) {
        if (expr instanceof Identifier) {
            return !((Identifier) expr).isMut();
        }
        if (expr instanceof SelectorExpr) {
            return isPlainReference(((SelectorExpr) expr).getTarget());
        }
        return false;
    }
}
