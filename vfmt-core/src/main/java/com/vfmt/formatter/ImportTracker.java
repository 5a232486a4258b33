package com.vfmt.formatter;

import com.vfmt.ast.decl.ImportDecl;
import com.vfmt.ast.expr.Identifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 遍历过程中累积 import 使用情况
 */
public class ImportTracker {
    private final Set<String> autoModules;
    private final Map<String, String> declared = new LinkedHashMap<String, String>();  // 路径 -> 别名，按路径去重
    private final Set<String> used = new LinkedHashSet<String>();
    private final List<String> autoImports = new ArrayList<String>();

    public ImportTracker(List<ImportDecl> imports, Collection<String> autoModules) {
        this.autoModules = new LinkedHashSet<String>(autoModules);
        for (ImportDecl imp : imports) {
            if (!declared.containsKey(imp.getModule())) {
                declared.put(imp.getModule(), imp.getAlias());
            }
        }
    }

    /** 记录一次通过别名的模块引用 */
    public void markUsed(String alias) {
        used.add(alias);
    }

    public boolean isUsed(String alias) {
        return used.contains(alias);
    }

    /** name 是否为已声明（含自动补上）的 import 别名 */
    public boolean isKnownAlias(String name) {
        return declared.containsValue(name);
    }

    /**
     * 标识符上的方法调用：常用模块名未导入时自动补 import
     */
    public void noteMethodCall(Identifier receiver) {
        String name = receiver.getName();
        if (receiver.getIdentKind() == Identifier.IdentKind.VARIABLE || !autoModules.contains(name)) {
            return;
        }
        used.add(name);
        if (declared.containsKey(name) || declared.containsValue(name)) {
            return;
        }
        declared.put(name, name);
        autoImports.add(name);
    }

    public Map<String, String> getDeclared() {
        return Collections.unmodifiableMap(declared);
    }

    public Set<String> getUsed() {
        return Collections.unmodifiableSet(used);
    }

    /** 被引用过的模块路径；没有对应 import 的别名原样保留 */
    public Set<String> getUsedModules() {
        Set<String> modules = new LinkedHashSet<String>();
        for (String alias : used) {
            modules.add(moduleOf(alias));
        }
        return Collections.unmodifiableSet(modules);
    }

    private String moduleOf(String alias) {
        for (Map.Entry<String, String> entry : declared.entrySet()) {
            if (alias.equals(entry.getValue())) {
                return entry.getKey();
            }
        }
        return alias;
    }

    public List<String> getAutoImports() {
        return Collections.unmodifiableList(autoImports);
    }

    public boolean isAuto(String module) {
        return autoImports.contains(module);
    }
}
