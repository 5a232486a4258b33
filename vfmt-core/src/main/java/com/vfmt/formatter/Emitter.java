package com.vfmt.formatter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 格式化输出器，跟踪缩进、行宽与输出目标栈
 *
 * <p>栈底是真实输出；表达式链捕获与 {@link #capture(Runnable)} 会压入临时缓冲，
 * 缓冲期间写入的文本不加缩进、不计行宽。</p>
 */
public class Emitter {
    private final FormatConfig config;
    private final String indentUnit;
    private final Deque<StringBuilder> sinks = new ArrayDeque<StringBuilder>();
    private LineBreaker breaker;
    private String leading = "";
    private int indentLevel = 0;
    private int pendingExtraIndent = 0;
    private int lineLength = 0;
    private boolean atLineStart = true;
    private int noWrapDepth = 0;

    public Emitter(FormatConfig config) {
        this.config = config;
        this.indentUnit = config.getIndentString();
        sinks.push(new StringBuilder());
    }

    void attach(LineBreaker breaker) {
        this.breaker = breaker;
    }

    public FormatConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 追加文本（行首自动缩进，每个物理行只注入一次）
     */
    public void write(String text) {
        if (text == null || text.isEmpty()) return;
        if (isBuffering()) {
            sinks.peek().append(text);
            return;
        }
        StringBuilder out = sinks.peek();
        if (atLineStart) {
            int levels = indentLevel + pendingExtraIndent;
            for (int i = 0; i < levels; i++) {
                out.append(indentUnit);
            }
            lineLength = levels * config.getIndentSize();
            pendingExtraIndent = 0;
            atLineStart = false;
        }
        out.append(text);
        int nl = text.lastIndexOf('\n');
        if (nl >= 0) {
            lineLength = text.length() - nl - 1;
        } else {
            lineLength += text.length();
        }
    }

    public void writeln(String text) {
        write(text);
        newLine();
    }

    /**
     * 换行；有未提交的表达式链时先原样提交
     */
    public void newLine() {
        if (breaker != null && noWrapDepth == 0 && breaker.hasPending()) {
            breaker.flush();
        }
        if (isBuffering()) {
            sinks.peek().append('\n');
            return;
        }
        sinks.peek().append('\n');
        lineLength = 0;
        pendingExtraIndent = 0;
        atLineStart = true;
    }

    /**
     * 追加空行，不产生连续空行
     */
    public void blankLine() {
        if (!atLineStart || isBuffering()) {
            newLine();
        }
        if (isBuffering()) {
            return;
        }
        StringBuilder out = sinks.peek();
        int len = out.length();
        if (len == 0 || (len >= 2 && out.charAt(len - 1) == '\n' && out.charAt(len - 2) == '\n')) {
            return;
        }
        out.append('\n');
    }

    /**
     * 去掉真实输出末尾的空白与换行，光标回到上一行末尾
     */
    public void removeTrailingWhitespace() {
        if (isBuffering()) {
            StringBuilder sink = sinks.peek();
            sink.setLength(trimmedLength(sink));
            return;
        }
        StringBuilder out = sinks.peek();
        out.setLength(trimmedLength(out));
        int lineStart = out.lastIndexOf("\n") + 1;
        int width = 0;
        for (int i = lineStart; i < out.length(); i++) {
            width += out.charAt(i) == '\t' ? config.getIndentSize() : 1;
        }
        lineLength = width;
        atLineStart = out.length() == 0;
    }

    private static int trimmedLength(StringBuilder sb) {
        int end = sb.length();
        while (end > 0) {
            char c = sb.charAt(end - 1);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                break;
            }
            end--;
        }
        return end;
    }

    /**
     * 在当前位置断行，下一行额外缩进 extraIndent 层
     */
    public void breakLine(int extraIndent) {
        if (!isBuffering()) {
            StringBuilder out = sinks.peek();
            while (out.length() > 0 && out.charAt(out.length() - 1) == ' ') {
                out.setLength(out.length() - 1);
            }
        }
        newLine();
        pendingExtraIndent = extraIndent;
    }

    /**
     * 当前行已超过 penalty 对应的宽度时在此断行，缩进多一层
     *
     * @return 是否断行
     */
    public boolean wrapLongLine(int penalty) {
        if (isBuffering() || noWrapDepth > 0) {
            return false;
        }
        if (lineLength <= config.getTier(penalty)) {
            return false;
        }
        breakLine(1);
        return true;
    }

    /**
     * 在独立缓冲中渲染，不换行，返回渲染出的文本
     */
    public String capture(Runnable body) {
        sinks.push(new StringBuilder());
        noWrapDepth++;
        try {
            body.run();
        } finally {
            noWrapDepth--;
        }
        return sinks.pop().toString();
    }

    public boolean isNoWrap() {
        return noWrapDepth > 0;
    }

    public boolean isBuffering() {
        return sinks.size() > 1;
    }

    /**
     * 当前行已占用的宽度；行首时计入即将注入的缩进
     */
    public int currentColumn() {
        if (atLineStart) {
            return (indentLevel + pendingExtraIndent) * config.getIndentSize();
        }
        return lineLength;
    }

    public int getLineLength() {
        return lineLength;
    }

    public boolean isAtLineStart() {
        return atLineStart;
    }

    /**
     * 记录 import 插入点：此前的真实输出成为前导部分
     */
    public void markImportAnchor() {
        StringBuilder out = sinks.peekLast();
        leading = leading + out;
        out.setLength(0);
    }

    /** import 插入点之前的文本 */
    public String getLeading() {
        return leading;
    }

    /** import 插入点之后的文本 */
    public String getRest() {
        return sinks.peekLast().toString();
    }

    // ============ 表达式链缓冲 ============

    void pushSink() {
        sinks.push(new StringBuilder());
    }

    String popSink() {
        return sinks.pop().toString();
    }

    /** 取出栈顶缓冲的内容并清空 */
    String takeSink() {
        StringBuilder top = sinks.peek();
        String text = top.toString();
        top.setLength(0);
        return text;
    }
}
