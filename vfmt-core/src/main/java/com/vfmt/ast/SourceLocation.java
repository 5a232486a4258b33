package com.vfmt.ast;

/**
 * 源码位置信息
 *
 * <p>{@code offset} 与 {@code length} 为字节偏移，用于注释归属判断；
 * {@code line} 与 {@code lastLine} 为 1 起始的行号，用于空行保留与行尾注释识别。</p>
 */
public final class SourceLocation {
    private final int line;
    private final int lastLine;
    private final int column;
    private final int offset;
    private final int length;

    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, 0, 0, 0);

    public SourceLocation(int line, int lastLine, int column, int offset, int length) {
        this.line = line;
        this.lastLine = Math.max(line, lastLine);
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public SourceLocation(int line, int offset, int length) {
        this(line, line, 0, offset, length);
    }

    public int getLine() {
        return line;
    }

    public int getLastLine() {
        return lastLine;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public int getEndOffset() {
        return offset + length;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return line + ":" + column + "@" + offset;
    }
}
