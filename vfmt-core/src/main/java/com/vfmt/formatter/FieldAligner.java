package com.vfmt.formatter;

import com.vfmt.ast.Comment;

import java.util.Collection;
import java.util.List;

/**
 * 字段组对齐：所有名称补齐到同一宽度，使类型从同一列开始
 */
public final class FieldAligner {
    private final int width;

    private FieldAligner(int width) {
        this.width = width;
    }

    public static FieldAligner of(Collection<Integer> displayLengths) {
        int max = 0;
        for (int len : displayLengths) {
            max = Math.max(max, len);
        }
        return new FieldAligner(max);
    }

    /**
     * 名称的显示宽度，包含名称与类型之间的行内注释
     */
    public static int displayLength(String name, List<Comment> inlineComments) {
        int len = name.length();
        for (Comment c : inlineComments) {
            len += 1 + CommentWriter.inlineForm(c).length();
        }
        return len;
    }

    public int getWidth() {
        return width;
    }

    /** 补齐到组内最大宽度所需的空格 */
    public String padding(int displayLength) {
        StringBuilder sb = new StringBuilder();
        for (int i = displayLength; i < width; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
