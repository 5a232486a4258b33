package com.vfmt.ast.type;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于内存映射的类型表，供 CLI 与测试使用
 */
public class SimpleTypeTable implements TypeTable {
    private final Map<Integer, String> names = new HashMap<Integer, String>();

    public SimpleTypeTable() {
        names.put(VOID, "void");
    }

    /**
     * 注册类型 id 与显示名
     *
     * @return this，便于链式注册
     */
    public SimpleTypeTable register(int typeId, String name) {
        if (typeId == VOID) {
            throw new IllegalArgumentException("类型 id 0 保留给 void");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("类型名为空: id=" + typeId);
        }
        names.put(typeId, name);
        return this;
    }

    @Override
    public String typeName(int typeId) {
        String name = names.get(typeId);
        if (name == null) {
            throw new IllegalArgumentException("未知类型 id: " + typeId);
        }
        return name;
    }

    @Override
    public String signature(FnSignature sig) {
        StringBuilder sb = new StringBuilder();
        if (sig.isPub()) {
            sb.append("pub ");
        }
        sb.append("fn ");
        if (sig.getReceiver() != null) {
            sb.append('(');
            appendParam(sb, sig.getReceiver(), false);
            sb.append(") ");
        }
        if (!sig.isAnonymous()) {
            sb.append(sig.getLanguage().getPrefix());
            sb.append(sig.getName());
            List<String> generics = sig.getGenericNames();
            if (!generics.isEmpty()) {
                sb.append('<');
                for (int i = 0; i < generics.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(generics.get(i));
                }
                sb.append('>');
            }
        }
        sb.append('(');
        List<FnSignature.Param> params = sig.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            appendParam(sb, params.get(i), sig.isVariadic() && i == params.size() - 1);
        }
        sb.append(')');
        if (sig.getReturnType() != VOID) {
            sb.append(' ');
            sb.append(typeName(sig.getReturnType()));
        }
        return sb.toString();
    }

    private void appendParam(StringBuilder sb, FnSignature.Param param, boolean variadic) {
        if (param.isMut()) {
            sb.append("mut ");
        }
        if (!param.getName().isEmpty()) {
            sb.append(param.getName());
            sb.append(' ');
        }
        if (variadic) {
            sb.append("...");
        }
        sb.append(typeName(param.getTypeId()));
    }
}
