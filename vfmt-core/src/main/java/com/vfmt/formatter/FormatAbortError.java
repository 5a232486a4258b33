package com.vfmt.formatter;

/**
 * 遇到不可能出现的语法树结构时中止格式化，不应被捕获
 */
public class FormatAbortError extends Error {

    public FormatAbortError(String message) {
        super(message);
    }
}
