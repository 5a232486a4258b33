package com.vfmt.formatter;

import com.vfmt.ast.AstNode;
import com.vfmt.ast.Comment;
import com.vfmt.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 注释重新挂载
 *
 * <p>按注释偏移相对节点范围分为四组：节点之前、名称与类型之间、同一行行尾、之后的独立行。</p>
 */
public class CommentWriter {
    private final Emitter out;

    public CommentWriter(Emitter out) {
        this.out = out;
    }

    /**
     * 按位置把注释归到节点的各个挂载点；节点位置未知时全部视为前置注释
     */
    public Buckets partition(AstNode node, List<Comment> comments) {
        Buckets buckets = new Buckets();
        SourceLocation loc = node.getLocation();
        for (Comment c : comments) {
            SourceLocation cl = c.getLocation();
            if (!loc.isKnown() || cl.getOffset() < loc.getOffset()) {
                buckets.before.add(c);
            } else if (cl.getOffset() < loc.getEndOffset()) {
                buckets.inline.add(c);
            } else if (cl.getLine() == loc.getLastLine()) {
                buckets.trailing.add(c);
            } else {
                buckets.after.add(c);
            }
        }
        return buckets;
    }

    /**
     * 输出一条注释，不换行
     */
    public void write(Comment comment) {
        if (!comment.isMultiLine()) {
            out.write(lineForm(comment));
            return;
        }
        out.writeln("/*");
        for (String line : comment.getText().trim().split("\n")) {
            out.writeln(line.trim());
        }
        out.write("*/");
    }

    /**
     * 每条注释独占一行
     */
    public void writeStandalone(List<Comment> comments) {
        for (Comment c : comments) {
            if (!out.isAtLineStart()) {
                out.newLine();
            }
            write(c);
            out.newLine();
        }
    }

    /** 追加到当前行末尾 */
    public void writeTrailing(List<Comment> comments) {
        for (Comment c : comments) {
            out.write(" ");
            write(c);
        }
    }

    /** 名称与类型之间的形式 */
    public static String inlineForm(Comment comment) {
        return "/* " + comment.getText().trim() + " */";
    }

    public static String lineForm(Comment comment) {
        String text = comment.getText().trim();
        return text.isEmpty() ? "//" : "// " + text;
    }

    /**
     * 一个节点的注释分组
     */
    public static final class Buckets {
        final List<Comment> before = new ArrayList<Comment>();
        final List<Comment> inline = new ArrayList<Comment>();
        final List<Comment> trailing = new ArrayList<Comment>();
        final List<Comment> after = new ArrayList<Comment>();

        public List<Comment> getBefore() {
            return before;
        }

        public List<Comment> getInline() {
            return inline;
        }

        public List<Comment> getTrailing() {
            return trailing;
        }

        public List<Comment> getAfter() {
            return after;
        }
    }
}
