package com.vfmt.formatter;

import com.vfmt.ast.SourceFile;
import com.vfmt.ast.decl.ImportDecl;
import com.vfmt.ast.type.TypeTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次格式化运行中不变的环境：类型表、配置、import 别名与当前模块
 */
public final class FormatEnvironment {
    private final TypeTable table;
    private final FormatConfig config;
    private final Map<String, String> aliases;  // 模块路径 -> 别名
    private final String moduleName;

    public FormatEnvironment(TypeTable table, FormatConfig config, Map<String, String> aliases, String moduleName) {
        this.table = table;
        this.config = config;
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<String, String>(aliases));
        this.moduleName = moduleName;
    }

    /**
     * 遍历前根据文件中的 import 建立别名表
     */
    public static FormatEnvironment of(SourceFile file, TypeTable table, FormatConfig config) {
        Map<String, String> aliases = new LinkedHashMap<String, String>();
        for (ImportDecl imp : file.getImports()) {
            if (!aliases.containsKey(imp.getModule())) {
                aliases.put(imp.getModule(), imp.getAlias());
            }
        }
        return new FormatEnvironment(table, config, aliases, file.getModuleName());
    }

    public TypeTable getTable() {
        return table;
    }

    public FormatConfig getConfig() {
        return config;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public String getModuleName() {
        return moduleName;
    }

    /** name 是否为某个已导入模块的别名 */
    public boolean isAlias(String name) {
        return aliases.containsValue(name);
    }
}
