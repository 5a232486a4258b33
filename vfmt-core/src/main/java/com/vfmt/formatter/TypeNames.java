package com.vfmt.formatter;

import com.vfmt.ast.type.FnSignature;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析类型与符号的显示名，按 import 别名缩短模块限定
 */
final class TypeNames {

    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)+");

    private final FormatEnvironment env;
    private final ImportTracker imports;

    TypeNames(FormatEnvironment env, ImportTracker imports) {
        this.env = env;
        this.imports = imports;
    }

    String type(int typeId) {
        return shorten(env.getTable().typeName(typeId));
    }

    String signature(FnSignature signature) {
        return shorten(env.getTable().signature(signature));
    }

    /**
     * 缩短文本中所有带模块限定的名称
     */
    String shorten(String text) {
        Matcher m = QUALIFIED.matcher(text);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(shortenName(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private String shortenName(String name) {
        String[] parts = name.split("\\.");
        // 最长的已导入模块前缀优先
        for (int k = parts.length - 1; k >= 1; k--) {
            String prefix = join(parts, 0, k);
            String alias = env.getAliases().get(prefix);
            if (alias != null) {
                imports.markUsed(alias);
                return alias + "." + join(parts, k, parts.length);
            }
            if (prefix.equals(env.getModuleName())) {
                return join(parts, k, parts.length);
            }
        }
        if (imports.isKnownAlias(parts[0])) {
            imports.markUsed(parts[0]);
        }
        return name;
    }

    private static String join(String[] parts, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (i > from) sb.append('.');
            sb.append(parts[i]);
        }
        return sb.toString();
    }
}
