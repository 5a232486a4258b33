package com.vfmt.formatter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Emitter 缩进、行宽与缓冲测试
 */
class EmitterTest {

    private FormatConfig config;
    private Emitter out;

    @BeforeEach
    void setUp() {
        config = new FormatConfig();
        out = new Emitter(config);
        new LineBreaker(out);
    }

    @Nested
    @DisplayName("缩进")
    class IndentTests {

        @Test
        @DisplayName("每个物理行只注入一次缩进")
        void testIndentOncePerLine() {
            out.indent();
            out.write("a");
            out.write(" := ");
            out.write("1");
            out.newLine();
            assertThat(out.getRest()).isEqualTo("\ta := 1\n");
        }

        @Test
        @DisplayName("制表符按 indentSize 计入行宽")
        void testTabWidth() {
            out.indent();
            out.indent();
            out.write("x");
            assertThat(out.getLineLength()).isEqualTo(9);
        }

        @Test
        @DisplayName("使用空格缩进")
        void testSpaces() {
            config.setUseSpaces(true);
            config.setIndentSize(2);
            Emitter spaced = new Emitter(config);
            spaced.indent();
            spaced.writeln("x");
            assertThat(spaced.getRest()).isEqualTo("  x\n");
        }

        @Test
        @DisplayName("空行不写缩进")
        void testEmptyLineHasNoIndent() {
            out.indent();
            out.newLine();
            out.writeln("x");
            assertThat(out.getRest()).isEqualTo("\n\tx\n");
        }
    }

    @Nested
    @DisplayName("空行与回退")
    class BlankLineTests {

        @Test
        @DisplayName("不产生连续空行")
        void testNoDoubleBlankLine() {
            out.writeln("a");
            out.blankLine();
            out.blankLine();
            out.writeln("b");
            assertThat(out.getRest()).isEqualTo("a\n\nb\n");
        }

        @Test
        @DisplayName("未换行时 blankLine 先结束当前行")
        void testBlankLineEndsLine() {
            out.write("a");
            out.blankLine();
            out.write("b");
            assertThat(out.getRest()).isEqualTo("a\n\nb");
        }

        @Test
        @DisplayName("去掉行尾空白后回到上一行末尾")
        void testRemoveTrailingWhitespace() {
            out.indent();
            out.writeln("x := 1");
            out.blankLine();
            out.removeTrailingWhitespace();
            assertThat(out.getRest()).isEqualTo("\tx := 1");
            assertThat(out.getLineLength()).isEqualTo(10);
            assertThat(out.isAtLineStart()).isFalse();
            out.write(" // note");
            assertThat(out.getRest()).isEqualTo("\tx := 1 // note");
        }
    }

    @Nested
    @DisplayName("缓冲")
    class CaptureTests {

        @Test
        @DisplayName("capture 返回原样文本且不影响真实输出")
        void testCapture() {
            out.indent();
            out.write("a");
            String text = out.capture(() -> {
                out.write("b");
                out.write("c");
            });
            assertThat(text).isEqualTo("bc");
            assertThat(out.getRest()).isEqualTo("\ta");
            assertThat(out.getLineLength()).isEqualTo(5);
        }

        @Test
        @DisplayName("缓冲期间换行原样写入缓冲")
        void testNewLineWhileCapturing() {
            String text = out.capture(() -> {
                out.indent();
                out.writeln("x");
                out.dedent();
            });
            assertThat(text).isEqualTo("x\n");
            assertThat(out.isNoWrap()).isFalse();
            assertThat(out.isBuffering()).isFalse();
        }
    }

    @Nested
    @DisplayName("长行折断")
    class WrapTests {

        @Test
        @DisplayName("超过档位时断行并多缩进一层")
        void testWrapLongLine() {
            out.indent();
            out.write(repeat('a', 58) + ", ");
            assertThat(out.wrapLongLine(2)).isFalse();
            out.write(repeat('b', 20) + ", ");
            assertThat(out.wrapLongLine(2)).isTrue();
            out.write("c");
            out.newLine();
            out.write("d");
            assertThat(out.getRest()).isEqualTo(
                    "\t" + repeat('a', 58) + ", " + repeat('b', 20) + ",\n\t\tc\n\td");
        }

        @Test
        @DisplayName("capture 中不折行")
        void testNoWrapInCapture() {
            String text = out.capture(() -> {
                out.write(repeat('a', 120));
                assertThat(out.wrapLongLine(0)).isFalse();
            });
            assertThat(text).hasSize(120);
        }
    }

    @Test
    @DisplayName("import 插入点把已有输出划为前导部分")
    void testImportAnchor() {
        out.writeln("module geo");
        out.blankLine();
        out.markImportAnchor();
        out.writeln("fn f() {}");
        assertThat(out.getLeading()).isEqualTo("module geo\n\n");
        assertThat(out.getRest()).isEqualTo("fn f() {}\n");
    }

    static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            sb.append(c);
        }
        return sb.toString();
    }
}
