package com.vfmt.formatter;

/**
 * V 字符串字面量的引号选择与转义
 */
final class VStringUtils {

    private VStringUtils() {}

    /**
     * 默认单引号；内容含单引号且不含双引号时用双引号
     */
    static char chooseQuote(String value) {
        return value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
    }

    /** 带引号的字面量，raw 字符串加 r 前缀且不转义 */
    static String quote(String value, boolean raw) {
        char q = chooseQuote(value);
        if (raw) {
            return "r" + q + value + q;
        }
        return q + escapeQuote(value, q) + q;
    }

    /**
     * 转义内容中未转义的引号字符，已有的转义序列原样保留
     */
    static String escapeQuote(String value, char quote) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                sb.append(c).append(value.charAt(i + 1));
                i++;
            } else if (c == quote) {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 紧跟在 $name 之后会被当作名称一部分的字符 */
    static boolean continuesName(String text) {
        if (text.isEmpty()) {
            return false;
        }
        char c = text.charAt(0);
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
