package com.vfmt.formatter;

import com.vfmt.ast.SourceFile;
import com.vfmt.ast.decl.FnDecl;
import com.vfmt.ast.decl.ImportDecl;
import com.vfmt.ast.decl.ModuleDecl;
import com.vfmt.ast.decl.StructDecl;
import com.vfmt.ast.expr.OrBlock;
import com.vfmt.ast.expr.OrExpr;
import com.vfmt.ast.stmt.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static com.vfmt.formatter.Trees.*;
import static org.assertj.core.api.Assertions.*;

/**
 * 整文件格式化测试：文件结构、import 块、空行与注释、配置与错误
 */
class SourceFormatterTest {

    private SourceFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new SourceFormatter();
    }

    private String format(Statement... stmts) {
        return formatter.format(file(stmts), types());
    }

    private static FnDecl fn(String name, int line) {
        return new FnDecl(at(line), null, sig(name), Collections.<Statement>emptyList(), false);
    }

    @Nested
    @DisplayName("文件结构")
    class StructureTests {

        @Test
        @DisplayName("空文件输出为空")
        void testEmptyFile() {
            assertThat(format()).isEmpty();
        }

        @Test
        @DisplayName("顶层声明之间空一行，文件以单个换行结尾")
        void testDeclarationsSeparated() {
            String result = format(new ModuleDecl(at(1), "geo"), fn("area", 2), fn("perimeter", 3));
            assertThat(result).isEqualTo("module geo\n\nfn area() {}\n\nfn perimeter() {}\n");
        }

        @Test
        @DisplayName("文件开头的注释保留在 module 之前")
        void testHeaderComment() {
            String result = format(comment("vfmt test", 1), new ModuleDecl(at(2), "geo"), fn("area", 4));
            assertThat(result).isEqualTo("// vfmt test\nmodule geo\n\nfn area() {}\n");
        }

        @Test
        @DisplayName("多次格式化同一棵树结果相同")
        void testDeterministic() {
            SourceFile file = file(importDecl("os", 1),
                    main(decl("t", method(id("time"), "now")), stmt(call("println", var("t")), 3)));
            String first = formatter.format(file, types());
            String second = formatter.format(file, types());
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("空格缩进")
        void testSpaceIndent() {
            FormatConfig config = new FormatConfig();
            config.setUseSpaces(true);
            config.setIndentSize(2);
            String result = formatter.format(file(main(decl("x", num("1")))), types(), config);
            assertThat(result).isEqualTo("fn main() {\n  x := 1\n}\n");
        }
    }

    @Nested
    @DisplayName("import 块")
    class ImportTests {

        @Test
        @DisplayName("import 块放在 module 之后")
        void testImportsAfterModule() {
            String result = format(new ModuleDecl(at(1), "geo"), importDecl("os", 3),
                    new FnDecl(at(5), null, sig("area"), Collections.<Statement>emptyList(), false));
            assertThat(result).isEqualTo("module geo\n\nimport os\n\nfn area() {}\n");
        }

        @Test
        @DisplayName("没有 module 时 import 块在文件开头")
        void testImportsWithoutModule() {
            String result = format(importDecl("os", 1), importDecl("strings", 2), fn("f", 4));
            assertThat(result).isEqualTo("import os\nimport strings\n\nfn f() {}\n");
        }

        @Test
        @DisplayName("常用模块缺少 import 时自动补上")
        void testAutoImport() {
            FormatResult result = formatter.formatWithReport(
                    file(main(decl("t", method(id("time"), "now")))), types(), new FormatConfig());
            assertThat(result.getText()).isEqualTo("import time\n\nfn main() {\n\tt := time.now()\n}\n");
            assertThat(result.getAutoImports()).containsExactly("time");
            assertThat(result.getUsedModules()).contains("time");
        }

        @Test
        @DisplayName("默认保留未使用的 import")
        void testKeepUnused() {
            String result = format(importDecl("os", 1), importDecl("strings", 2),
                    main(stmt(method(id("strings"), "trim_space", var("s")))));
            assertThat(result).isEqualTo("import os\nimport strings\n\nfn main() {\n\tstrings.trim_space(s)\n}\n");
        }

        @Test
        @DisplayName("开启后删除未使用的 import")
        void testRemoveUnused() {
            FormatConfig config = new FormatConfig();
            config.setRemoveUnusedImports(true);
            String result = formatter.format(file(importDecl("os", 1), importDecl("strings", 2),
                    main(stmt(method(id("strings"), "trim_space", var("s"))))), types(), config);
            assertThat(result).isEqualTo("import strings\n\nfn main() {\n\tstrings.trim_space(s)\n}\n");
        }

        @Test
        @DisplayName("类型名按 import 别名缩短并计为已使用")
        void testAliasShortensType() {
            FormatConfig config = new FormatConfig();
            config.setRemoveUnusedImports(true);
            StructDecl struct = new StructDecl(lines(3, 5), null, false, false, null, "Log", null,
                    Arrays.asList(field("out", T_OS_FILE, 4)), -1, -1, -1, null);
            FormatResult result = formatter.formatWithReport(
                    file(new ImportDecl(at(1), "os", "o"), struct), types(), config);
            assertThat(result.getText()).isEqualTo("import os as o\n\nstruct Log {\n\tout o.File\n}\n");
            assertThat(result.getUsedModules()).containsExactly("os");
        }
    }

    @Nested
    @DisplayName("空行与注释")
    class LayoutTests {

        @Test
        @DisplayName("保留语句之间的单个空行")
        void testPreserveBlankLine() {
            String result = format(main(decl("x", num("1"), 2), decl("y", num("2"), 4)));
            assertThat(result).isEqualTo(inMain("x := 1", "", "y := 2").replace("\t\n", "\n"));
        }

        @Test
        @DisplayName("关闭空行保留")
        void testDropBlankLine() {
            FormatConfig config = new FormatConfig();
            config.setPreserveBlankLines(false);
            String result = formatter.format(file(main(decl("x", num("1"), 2), decl("y", num("2"), 4))),
                    types(), config);
            assertThat(result).isEqualTo(inMain("x := 1", "y := 2"));
        }

        @Test
        @DisplayName("同一行的注释接在语句末尾")
        void testSameLineComment() {
            String result = format(main(decl("x", num("1"), 2), comment("note", 2)));
            assertThat(result).isEqualTo(inMain("x := 1 // note"));
        }

        @Test
        @DisplayName("独立注释单独成行")
        void testStandaloneComment() {
            String result = format(main(comment("setup", 2), decl("x", num("1"), 3)));
            assertThat(result).isEqualTo(inMain("// setup", "x := 1"));
        }
    }

    @Nested
    @DisplayName("配置与错误")
    class ErrorTests {

        @Test
        @DisplayName("非法配置在格式化前报错")
        void testInvalidConfig() {
            FormatConfig config = new FormatConfig();
            config.setWidthTiers(new int[]{60, 35});
            assertThatThrownBy(() -> formatter.format(file(), types(), config))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("未知类型 id 报错")
        void testUnknownType() {
            StructDecl struct = new StructDecl(lines(1, 3), null, false, false, null, "Foo", null,
                    Arrays.asList(field("a", 99, 2)), -1, -1, -1, null);
            assertThatThrownBy(() -> format(struct))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("99");
        }

        @Test
        @DisplayName("游离的 or 块中止格式化")
        void testDetachedOrBlock() {
            assertThatThrownBy(() -> format(main(stmt(new OrExpr(at(2), OrBlock.PROPAGATE)))))
                    .isInstanceOf(FormatAbortError.class);
        }
    }

    @Nested
    @DisplayName("调试日志")
    class DebugTests {

        @Test
        @DisplayName("debug 模式以 INFO 级别记录每条顶层语句")
        void testDebugLogging() {
            Logger logger = Logger.getLogger(FormatRun.class.getName());
            RecordingHandler handler = new RecordingHandler();
            logger.addHandler(handler);
            try {
                formatter.format(file(new ModuleDecl(at(1), "geo"), fn("area", 3)), types(), true);
            } finally {
                logger.removeHandler(handler);
            }
            assertThat(handler.messages).hasSize(2);
            assertThat(handler.messages.get(0)).contains("ModuleDecl");
            assertThat(handler.messages.get(1)).contains("FnDecl");
        }

        @Test
        @DisplayName("非 debug 模式不输出 INFO 日志")
        void testQuietByDefault() {
            Logger logger = Logger.getLogger(FormatRun.class.getName());
            RecordingHandler handler = new RecordingHandler();
            logger.addHandler(handler);
            try {
                formatter.format(file(fn("area", 1)), types(), false);
            } finally {
                logger.removeHandler(handler);
            }
            assertThat(handler.messages).isEmpty();
        }
    }

    private static final class RecordingHandler extends Handler {
        final List<String> messages = new ArrayList<String>();

        @Override
        public void publish(LogRecord record) {
            if (record.getLevel().intValue() >= Level.INFO.intValue()) {
                messages.add(record.getMessage());
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
