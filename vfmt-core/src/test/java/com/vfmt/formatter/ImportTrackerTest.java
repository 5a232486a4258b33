package com.vfmt.formatter;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.decl.ImportDecl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * import 跟踪与 import 块渲染测试
 */
class ImportTrackerTest {

    private ImportTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ImportTracker(Arrays.asList(
                Trees.importDecl("os", 1),
                Trees.importDecl("net.http", 2),
                new ImportDecl(Trees.at(3), "crypto.sha256", "sha"),
                Trees.importDecl("os", 4)
        ), FormatConfig.DEFAULT_AUTO_IMPORT_MODULES);
    }

    @Nested
    @DisplayName("跟踪")
    class TrackingTests {

        @Test
        @DisplayName("重复的 import 只保留第一个")
        void testDeduplicate() {
            assertThat(tracker.getDeclared()).containsOnlyKeys("os", "net.http", "crypto.sha256");
            assertThat(tracker.getDeclared().get("crypto.sha256")).isEqualTo("sha");
            assertThat(tracker.isKnownAlias("http")).isTrue();
            assertThat(tracker.isKnownAlias("sha256")).isFalse();
        }

        @Test
        @DisplayName("常用模块上的方法调用自动补 import")
        void testAutoImport() {
            tracker.noteMethodCall(Trees.id("time"));
            assertThat(tracker.getAutoImports()).containsExactly("time");
            assertThat(tracker.isAuto("time")).isTrue();
            assertThat(tracker.isUsed("time")).isTrue();
            assertThat(tracker.getDeclared()).containsKey("time");
        }

        @Test
        @DisplayName("已导入的模块只记为已使用")
        void testAlreadyImported() {
            tracker.noteMethodCall(Trees.id("os"));
            assertThat(tracker.getAutoImports()).isEmpty();
            assertThat(tracker.isUsed("os")).isTrue();
        }

        @Test
        @DisplayName("同名局部变量不触发自动导入")
        void testVariableReceiver() {
            tracker.noteMethodCall(Trees.var("time"));
            assertThat(tracker.getAutoImports()).isEmpty();
            assertThat(tracker.isUsed("time")).isFalse();
        }

        @Test
        @DisplayName("已使用的模块按路径报告")
        void testUsedModulePaths() {
            tracker.markUsed("sha");
            tracker.markUsed("http");
            tracker.markUsed("C");
            assertThat(tracker.getUsed()).containsExactly("sha", "http", "C");
            assertThat(tracker.getUsedModules()).containsExactly("crypto.sha256", "net.http", "C");
        }

        @Test
        @DisplayName("不在白名单中的名称不处理")
        void testUnknownModule() {
            tracker.noteMethodCall(Trees.id("foo"));
            assertThat(tracker.getAutoImports()).isEmpty();
            assertThat(tracker.getUsed()).isEmpty();
        }
    }

    @Nested
    @DisplayName("渲染")
    class RenderTests {

        @Test
        @DisplayName("默认保留所有 import，别名不同于末段时写 as")
        void testRenderAll() {
            tracker.noteMethodCall(Trees.id("time"));
            assertThat(ImportBlockRenderer.render(tracker, new FormatConfig())).isEqualTo(
                    "import os\nimport net.http\nimport crypto.sha256 as sha\nimport time\n\n");
        }

        @Test
        @DisplayName("开启删除后只保留用到的与自动补上的")
        void testRemoveUnused() {
            FormatConfig config = new FormatConfig();
            config.setRemoveUnusedImports(true);
            tracker.markUsed("os");
            tracker.noteMethodCall(Trees.id("time"));
            assertThat(ImportBlockRenderer.render(tracker, config)).isEqualTo("import os\nimport time\n\n");
        }

        @Test
        @DisplayName("没有 import 时输出为空")
        void testEmpty() {
            ImportTracker empty = new ImportTracker(Arrays.<ImportDecl>asList(), FormatConfig.DEFAULT_AUTO_IMPORT_MODULES);
            assertThat(ImportBlockRenderer.render(empty, new FormatConfig())).isEmpty();
        }

        @Test
        @DisplayName("显式别名与末段相同时不写 as")
        void testRedundantAlias() {
            ImportTracker t = new ImportTracker(Arrays.asList(
                    new ImportDecl(new SourceLocation(1, 100, 10), "net.http", "http")),
                    FormatConfig.DEFAULT_AUTO_IMPORT_MODULES);
            assertThat(ImportBlockRenderer.render(t, new FormatConfig())).isEqualTo("import net.http\n\n");
        }
    }
}
