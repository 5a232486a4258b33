package com.vfmt.formatter;

import com.vfmt.ast.SourceFile;
import com.vfmt.ast.type.TypeTable;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * V 源码格式化器
 *
 * <p>输入解析并完成类型解析的语法树，按统一的缩进、对齐与行宽规则重新输出源码。
 * 同一棵树多次格式化得到完全相同的文本。</p>
 */
public class SourceFormatter {

    private static final Logger LOG = Logger.getLogger(SourceFormatter.class.getName());

    /**
     * 使用默认配置格式化
     */
    public String format(SourceFile file, TypeTable table) {
        return format(file, table, new FormatConfig());
    }

    /**
     * 使用默认配置格式化，debug 为 true 时以 INFO 级别输出每条顶层语句
     */
    public String format(SourceFile file, TypeTable table, boolean debug) {
        FormatConfig config = new FormatConfig();
        config.setDebug(debug);
        return format(file, table, config);
    }

    /**
     * 格式化源文件
     */
    public String format(SourceFile file, TypeTable table, FormatConfig config) {
        return formatWithReport(file, table, config).getText();
    }

    /**
     * 格式化并返回 import 使用情况
     *
     * @throws IllegalArgumentException 配置非法或类型 id 未知
     * @throws FormatAbortError         语法树中出现不可能的结构
     */
    public FormatResult formatWithReport(SourceFile file, TypeTable table, FormatConfig config) {
        config.validate();
        Level level = config.isDebug() ? Level.INFO : Level.FINE;
        LOG.log(level, "开始格式化 " + file.getPath() + "，共 " + file.getStmts().size() + " 条顶层语句");
        FormatEnvironment env = FormatEnvironment.of(file, table, config);
        FormatRun run = new FormatRun(file, env);
        run.formatFile(file);
        FormatResult result = run.finish();
        if (!result.getAutoImports().isEmpty()) {
            LOG.log(level, "自动导入模块 " + result.getAutoImports());
        }
        return result;
    }
}
