package com.vfmt.formatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 格式化结果：输出文本与 import 使用情况
 */
public class FormatResult {
    private final String text;
    private final Set<String> usedModules;
    private final List<String> autoImports;

    public FormatResult(String text, Set<String> usedModules, List<String> autoImports) {
        this.text = text;
        this.usedModules = Collections.unmodifiableSet(new LinkedHashSet<String>(usedModules));
        this.autoImports = Collections.unmodifiableList(new ArrayList<String>(autoImports));
    }

    public String getText() {
        return text;
    }

    /** 被引用过的模块路径，如 {@code crypto.sha256} */
    public Set<String> getUsedModules() {
        return usedModules;
    }

    /** 自动补上的 import */
    public List<String> getAutoImports() {
        return autoImports;
    }
}
