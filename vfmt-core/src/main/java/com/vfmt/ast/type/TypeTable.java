package com.vfmt.ast.type;

/**
 * 类型/符号表的只读视图，由类型检查阶段提供
 *
 * <p>返回的名称可以带模块限定（如 {@code []os.File}），
 * 由格式化器按 import 别名缩短。</p>
 */
public interface TypeTable {

    /** 无类型 / void */
    int VOID = 0;

    /**
     * 类型 id 的显示名
     *
     * @throws IllegalArgumentException 未知类型 id
     */
    String typeName(int typeId);

    /**
     * 渲染函数、方法或函数类型签名，如 {@code pub fn (mut p Point) move(dx int) ?bool}
     */
    String signature(FnSignature signature);
}
