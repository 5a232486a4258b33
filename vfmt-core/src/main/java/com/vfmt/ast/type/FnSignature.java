package com.vfmt.ast.type;

import com.vfmt.ast.Language;

import java.util.Collections;
import java.util.List;

/**
 * 函数签名：函数声明、匿名函数、函数类型与接口方法共用
 */
public class FnSignature {
    private final boolean isPub;
    private final Language language;
    private final Param receiver;      // 可选，方法接收者
    private final String name;         // 匿名函数与函数类型为 null
    private final List<String> genericNames;
    private final List<Param> params;
    private final boolean isVariadic;  // 最后一个参数为 ...T
    private final int returnType;

    public FnSignature(boolean isPub, Language language, Param receiver, String name,
                       List<String> genericNames, List<Param> params, boolean isVariadic, int returnType) {
        this.isPub = isPub;
        this.language = language;
        this.receiver = receiver;
        this.name = name;
        this.genericNames = genericNames;
        this.params = params;
        this.isVariadic = isVariadic;
        this.returnType = returnType;
    }

    /** 匿名函数 / 函数类型签名 */
    public static FnSignature anonymous(List<Param> params, int returnType) {
        return new FnSignature(false, Language.V, null, null, null, params, false, returnType);
    }

    public boolean isPub() {
        return isPub;
    }

    public Language getLanguage() {
        return language != null ? language : Language.V;
    }

    public Param getReceiver() {
        return receiver;
    }

    public boolean isMethod() {
        return receiver != null;
    }

    public String getName() {
        return name;
    }

    public boolean isAnonymous() {
        return name == null || name.isEmpty();
    }

    public List<String> getGenericNames() {
        return genericNames != null ? genericNames : Collections.<String>emptyList();
    }

    public List<Param> getParams() {
        return params != null ? params : Collections.<Param>emptyList();
    }

    public boolean isVariadic() {
        return isVariadic;
    }

    public int getReturnType() {
        return returnType;
    }

    /**
     * 参数或接收者
     */
    public static final class Param {
        private final String name;   // 函数类型中可以省略
        private final int typeId;
        private final boolean isMut;

        public Param(String name, int typeId, boolean isMut) {
            this.name = name;
            this.typeId = typeId;
            this.isMut = isMut;
        }

        public String getName() {
            return name != null ? name : "";
        }

        public int getTypeId() {
            return typeId;
        }

        public boolean isMut() {
            return isMut;
        }
    }
}
