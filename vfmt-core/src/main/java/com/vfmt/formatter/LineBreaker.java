package com.vfmt.formatter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 二元运算链的换行引擎
 *
 * <p>链上每个运算符边界记录一个段落、一个惩罚值（越小越倾向于在此换行）和一个优先级键
 * {@code precedence | (parenDepth << 16)}。链结束时由最外层捕获做一次调整，再逐段输出：
 * 若"当前列 + 空格 + 下一段"超过该边界惩罚对应的宽度档位，就在此换行并多缩进一层。</p>
 *
 * <p>在括号类子上下文（调用实参、下标、字面量元素）中开始的链使用独立捕获，
 * 结束后作为一个不透明片段交回外层捕获。</p>
 */
public class LineBreaker {

    private static final Logger LOG = Logger.getLogger(LineBreaker.class.getName());

    /** 基础惩罚值 */
    static final int BASE_PENALTY = 3;

    private final Emitter out;
    private final FormatConfig config;
    private final Level traceLevel;
    private final Deque<ChainCapture> chains = new ArrayDeque<ChainCapture>();

    public LineBreaker(Emitter out) {
        this.out = out;
        this.config = out.getConfig();
        this.traceLevel = config.isDebug() ? Level.INFO : Level.FINE;
        out.attach(this);
    }

    /**
     * 边界惩罚：基础值 3，左右操作数每有一个是二元或括号表达式就减一，最低为 0
     */
    public static int penalty(boolean leftNested, boolean rightNested) {
        int p = BASE_PENALTY;
        if (leftNested) p--;
        if (rightNested) p--;
        return Math.max(p, 0);
    }

    public static int precedenceKey(int precedence, int parenDepth) {
        return precedence | (parenDepth << 16);
    }

    /**
     * 进入一个二元表达式
     *
     * @param depth 当前上下文的括号层次
     * @return 是否新开了捕获（调用方需在结束时调用 {@link #close()}）
     */
    public boolean open(int depth) {
        if (out.isNoWrap()) {
            return false;
        }
        ChainCapture top = chains.peek();
        if (top != null && !top.flushed && top.depth == depth) {
            return false;
        }
        boolean outermost = top == null || top.flushed;
        ChainCapture chain = new ChainCapture(depth, out.currentColumn(), outermost);
        out.pushSink();
        chains.push(chain);
        return true;
    }

    /**
     * 记录一个运算符边界：调用方已写出左操作数和运算符
     */
    public void boundary(int penalty, int key) {
        ChainCapture top = chains.peek();
        if (out.isNoWrap() || top == null || top.flushed) {
            out.write(" ");
            return;
        }
        top.segments.add(out.takeSink());
        top.penalties.add(penalty);
        top.keys.add(key);
    }

    /**
     * 结束由 {@link #open(int)} 新开的捕获
     */
    public void close() {
        ChainCapture chain = chains.pop();
        if (chain.flushed) {
            return;
        }
        chain.segments.add(out.popSink());
        if (!chain.outermost) {
            out.write(join(chain.segments));
            return;
        }
        int[] penalties = adjust(chain.segments, chain.penalties, chain.keys, chain.lineOffset);
        if (LOG.isLoggable(traceLevel)) {
            LOG.log(traceLevel, "表达式链 " + chain.segments.size() + " 段, 惩罚 " + Arrays.toString(penalties));
        }
        emit(chain.segments, penalties);
    }

    public boolean hasPending() {
        ChainCapture top = chains.peek();
        return top != null && !top.flushed;
    }

    /**
     * 换行前原样提交所有未完成的捕获，此后这些链不再参与换行
     */
    void flush() {
        List<ChainCapture> pending = new ArrayList<ChainCapture>();
        for (ChainCapture chain : chains) {
            if (chain.flushed) {
                break;
            }
            pending.add(chain);
        }
        // 栈顶在前，逐个弹出缓冲
        String[] texts = new String[pending.size()];
        for (int i = 0; i < pending.size(); i++) {
            ChainCapture chain = pending.get(i);
            List<String> parts = new ArrayList<String>(chain.segments);
            parts.add(out.popSink());
            texts[i] = join(parts);
            chain.flushed = true;
        }
        for (int i = texts.length - 1; i >= 0; i--) {
            out.write(texts[i]);
        }
    }

    /**
     * 调整惩罚值：先做同优先级分组，再处理超长段
     */
    int[] adjust(List<String> segments, List<Integer> basePenalties, List<Integer> keys, int lineOffset) {
        int n = basePenalties.size();
        int[] pen = new int[n];
        for (int i = 0; i < n; i++) {
            pen[i] = basePenalties.get(i);
        }
        int groupMin = config.getTier(0);
        int top = config.getTopPenalty();
        int maxWidth = config.getMaxLineWidth();
        for (int i = 0; i <= n; i++) {
            if (i < n && (i == 0 || pen[i - 1] <= 1)) {
                int startKey = i == 0 ? -1 : keys.get(i - 1);
                long length = segmentLength(segments.get(i)) + (i == 0 ? lineOffset : 0);
                int end = n;
                for (int j = i; j < n; j++) {
                    int key = keys.get(j);
                    if (pen[j] <= 1 && key == startKey && length >= groupMin) {
                        end = j;
                        break;
                    } else if (key < startKey) {
                        length = Long.MAX_VALUE;
                        break;
                    } else {
                        length += segmentLength(segments.get(j + 1));
                    }
                }
                if (length <= maxWidth) {
                    for (int j = i; j < end; j++) {
                        pen[j] = top;
                    }
                    if (i > 0) {
                        pen[i - 1] = 0;
                    }
                    if (end < n) {
                        pen[end] = 0;
                    }
                }
            }
            // 超长且不可拆分的段必须另起一行
            if (i > 0 && segments.get(i).length() > config.getLongSegmentThreshold() && pen[i - 1] > 0) {
                pen[i - 1] = 0;
            }
        }
        return pen;
    }

    private static int segmentLength(String segment) {
        return segment.length() + 1;
    }

    private void emit(List<String> segments, int[] penalties) {
        boolean wrapped = false;
        for (int i = 0; i < segments.size(); i++) {
            out.write(segments.get(i));
            if (i >= penalties.length) {
                break;
            }
            String next = segments.get(i + 1);
            if (out.currentColumn() + 1 + firstLineLength(next) > config.getTier(penalties[i])) {
                out.breakLine(0);
                if (!wrapped) {
                    out.indent();
                    wrapped = true;
                }
            } else {
                out.write(" ");
            }
        }
        if (wrapped) {
            out.dedent();
        }
    }

    private static int firstLineLength(String text) {
        int nl = text.indexOf('\n');
        return nl >= 0 ? nl : text.length();
    }

    private static String join(List<String> parts) {
        StringBuilder sb = new StringBuilder();
        Iterator<String> it = parts.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append(' ');
            }
        }
        return sb.toString();
    }

    /**
     * 一条未提交的表达式链
     */
    private static final class ChainCapture {
        final int depth;
        final int lineOffset;
        final boolean outermost;
        final List<String> segments = new ArrayList<String>();
        final List<Integer> penalties = new ArrayList<Integer>();
        final List<Integer> keys = new ArrayList<Integer>();
        boolean flushed;

        ChainCapture(int depth, int lineOffset, boolean outermost) {
            this.depth = depth;
            this.lineOffset = lineOffset;
            this.outermost = outermost;
        }
    }
}
