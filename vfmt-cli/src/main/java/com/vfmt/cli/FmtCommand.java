package com.vfmt.cli;

import com.google.gson.JsonParseException;
import com.vfmt.formatter.FormatConfig;
import com.vfmt.formatter.FormatResult;
import com.vfmt.formatter.SourceFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * picocli 命令：格式化 JSON 序列化的 V 语法树
 */
@Command(name = "vfmt", version = "vfmt 0.1.0",
         mixinStandardHelpOptions = true,
         description = "按统一风格重新输出 V 源码（输入为解析后的语法树 JSON）")
public class FmtCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(FmtCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "语法树 JSON 文件")
    Path tree;

    @Option(names = {"-w", "--write"}, description = "写回语法树中记录的源文件路径")
    boolean write;

    @Option(names = {"-o", "--output"}, description = "输出文件")
    Path output;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进宽度（默认 4）")
    int indentSize;

    @Option(names = "--use-spaces", description = "使用空格缩进（默认 Tab）")
    boolean useSpaces;

    @Option(names = "--max-width", defaultValue = "100", description = "最大行宽（默认 100）")
    int maxWidth;

    @Option(names = "--remove-unused-imports", description = "删除未使用的 import")
    boolean removeUnusedImports;

    @Option(names = "--debug", description = "输出每条顶层语句与换行决策")
    boolean debug;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (write && output != null) {
            err.println("错误: -w 与 -o 不能同时使用");
            return 2;
        }
        try {
            TreeDocument document = new AstJsonReader().read(tree);
            FormatResult result = new SourceFormatter()
                    .formatWithReport(document.getFile(), document.getTypes(), buildConfig());
            if (write) {
                Path target = Paths.get(document.getFile().getPath());
                Files.write(target, result.getText().getBytes(StandardCharsets.UTF_8));
                out.println("已格式化: " + target);
            } else if (output != null) {
                Files.write(output, result.getText().getBytes(StandardCharsets.UTF_8));
                out.println("已格式化: " + output);
            } else {
                out.print(result.getText());
                out.flush();
            }
            return 0;
        } catch (IOException e) {
            return fail("读写文件失败", e);
        } catch (JsonParseException e) {
            return fail("语法树 JSON 无效", e);
        } catch (IllegalArgumentException e) {
            return fail("格式化错误", e);
        }
    }

    FormatConfig buildConfig() {
        FormatConfig config = new FormatConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(useSpaces);
        config.setMaxLineWidth(maxWidth);
        config.setRemoveUnusedImports(removeUnusedImports);
        config.setDebug(debug);
        return config;
    }

    private int fail(String what, Exception e) {
        LOG.log(Level.WARNING, what + ": " + tree + " - " + e.getMessage());
        LOG.log(Level.FINE, what, e);
        spec.commandLine().getErr().println("错误: " + what + " - " + e.getMessage());
        return 1;
    }
}
