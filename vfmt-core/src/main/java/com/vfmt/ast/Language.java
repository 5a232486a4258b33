package com.vfmt.ast;

/**
 * 声明所属的语言前缀（{@code C.puts}、{@code JS.log}）
 */
public enum Language {
    V(""),
    C("C."),
    JS("JS.");

    private final String prefix;

    Language(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
