package com.vfmt.formatter;

import com.vfmt.ast.decl.ImportDecl;

import java.util.Map;

/**
 * 遍历结束后渲染 import 块
 */
final class ImportBlockRenderer {

    private ImportBlockRenderer() {}

    /**
     * 每个模块一行，别名与路径末段不同时写 {@code as}；非空时以空行结尾
     */
    static String render(ImportTracker tracker, FormatConfig config) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : tracker.getDeclared().entrySet()) {
            String module = entry.getKey();
            String alias = entry.getValue();
            if (config.isRemoveUnusedImports() && !tracker.isAuto(module) && !tracker.isUsed(alias)) {
                continue;
            }
            sb.append("import ").append(module);
            if (!alias.equals(ImportDecl.lastComponent(module))) {
                sb.append(" as ").append(alias);
            }
            sb.append('\n');
        }
        if (sb.length() > 0) {
            sb.append('\n');
        }
        return sb.toString();
    }
}
