package com.vfmt.formatter;

import com.vfmt.ast.Comment;
import com.vfmt.ast.Language;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.decl.AliasTypeDecl;
import com.vfmt.ast.decl.ConstDecl;
import com.vfmt.ast.decl.EnumDecl;
import com.vfmt.ast.decl.FieldDecl;
import com.vfmt.ast.decl.FnDecl;
import com.vfmt.ast.decl.FnTypeDecl;
import com.vfmt.ast.decl.GlobalDecl;
import com.vfmt.ast.decl.InterfaceDecl;
import com.vfmt.ast.decl.StructDecl;
import com.vfmt.ast.decl.SumTypeDecl;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.expr.InfixExpr;
import com.vfmt.ast.expr.Literal;
import com.vfmt.ast.expr.PostfixExpr;
import com.vfmt.ast.stmt.AssertStmt;
import com.vfmt.ast.stmt.BreakStmt;
import com.vfmt.ast.stmt.CompileTimeIf;
import com.vfmt.ast.stmt.DeferStmt;
import com.vfmt.ast.stmt.ForCStmt;
import com.vfmt.ast.stmt.ForCondStmt;
import com.vfmt.ast.stmt.ForInStmt;
import com.vfmt.ast.stmt.GotoStmt;
import com.vfmt.ast.stmt.HashStmt;
import com.vfmt.ast.stmt.LabelStmt;
import com.vfmt.ast.stmt.ReturnStmt;
import com.vfmt.ast.stmt.SqlStmt;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.stmt.UnsafeStmt;
import com.vfmt.ast.type.FnSignature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.vfmt.formatter.Trees.*;
import static org.assertj.core.api.Assertions.*;

/**
 * 声明与语句的格式化测试
 */
class StatementFormattingTest {

    private static String format(Statement... stmts) {
        return new SourceFormatter().format(file(stmts), types());
    }

    private static StructDecl struct(String name, int mutPos, int pubMutPos, FieldDecl... fields) {
        return new StructDecl(lines(1, fields.length + 2), null, false, false, null, name, null,
                Arrays.asList(fields), mutPos, -1, pubMutPos, null);
    }

    @Nested
    @DisplayName("结构体")
    class StructTests {

        @Test
        @DisplayName("字段类型按最长名称对齐")
        void testAlignment() {
            String result = format(struct("Foo", -1, -1, field("a", T1, 2), field("bb", T2, 3), field("ccc", T3, 4)));
            assertThat(result).isEqualTo("struct Foo {\n\ta   T1\n\tbb  T2\n\tccc T3\n}\n");
        }

        @Test
        @DisplayName("可见性分区标记与结构体同级")
        void testSections() {
            String result = format(struct("Foo", 0, 2, field("a", T1, 2), field("bb", T2, 3), field("ccc", T3, 4)));
            assertThat(result).isEqualTo("struct Foo {\nmut:\n\ta   T1\n\tbb  T2\npub mut:\n\tccc T3\n}\n");
        }

        @Test
        @DisplayName("空结构体与泛型参数")
        void testEmptyGeneric() {
            StructDecl box = new StructDecl(at(1), null, true, false, null, "Box", Arrays.asList("T"),
                    Collections.<FieldDecl>emptyList(), -1, -1, -1, null);
            assertThat(format(box)).isEqualTo("pub struct Box<T> {}\n");
        }

        @Test
        @DisplayName("属性、联合体与 C 结构体")
        void testAttrsUnionAndC() {
            StructDecl union = new StructDecl(lines(1, 3), Arrays.asList("typedef"), false, true, Language.C,
                    "Value", null, Arrays.asList(field("i", T_INT, 2)), -1, -1, -1, null);
            assertThat(format(union)).isEqualTo("[typedef]\nunion C.Value {\n\ti int\n}\n");
        }

        @Test
        @DisplayName("字段默认值")
        void testDefaultValue() {
            FieldDecl name = new FieldDecl(new SourceLocation(2, 200, 8), "name", T_STRING, str("x"), null);
            FieldDecl age = new FieldDecl(new SourceLocation(3, 300, 8), "age", T_INT, num("18"), null);
            assertThat(format(struct("User", -1, -1, name, age)))
                    .isEqualTo("struct User {\n\tname string = 'x'\n\tage  int = 18\n}\n");
        }

        @Test
        @DisplayName("行内注释计入对齐宽度，行尾注释接在类型之后")
        void testFieldComments() {
            Comment inline = new Comment(new SourceLocation(2, 205, 2), "id");
            Comment trailing = new Comment(new SourceLocation(2, 220, 5), "primary");
            FieldDecl name = new FieldDecl(new SourceLocation(2, 200, 8), "name", T_STRING, null,
                    Arrays.asList(inline, trailing));
            String result = format(struct("Row", -1, -1, name, field("x", T_INT, 3)));
            assertThat(result).isEqualTo("struct Row {\n\tname /* id */ string // primary\n\tx             int\n}\n");
        }

        @Test
        @DisplayName("字段前的注释单独成行")
        void testCommentBeforeField() {
            Comment doc = new Comment(new SourceLocation(2, 150, 6), "count");
            FieldDecl count = new FieldDecl(new SourceLocation(3, 300, 9), "count", T_INT, null, Arrays.asList(doc));
            assertThat(format(struct("Stats", -1, -1, count))).isEqualTo("struct Stats {\n\t// count\n\tcount int\n}\n");
        }
    }

    @Nested
    @DisplayName("其他声明")
    class DeclarationTests {

        @Test
        @DisplayName("枚举")
        void testEnum() {
            EnumDecl color = new EnumDecl(lines(1, 4), null, false, "Color", Arrays.asList(
                    new EnumDecl.EnumField(at(2), "red", null, null),
                    new EnumDecl.EnumField(at(3), "green", num("2"), null)), null);
            assertThat(format(color)).isEqualTo("enum Color {\n\tred\n\tgreen = 2\n}\n");
        }

        @Test
        @DisplayName("单个常量写在一行")
        void testSingleConst() {
            ConstDecl pi = new ConstDecl(at(1), false, Arrays.asList(
                    new ConstDecl.ConstField(at(1), "pi", new Literal(at(1), Literal.LiteralKind.FLOAT, "3.14"), null)),
                    null);
            assertThat(format(pi)).isEqualTo("const pi = 3.14\n");
        }

        @Test
        @DisplayName("常量组按名称对齐")
        void testConstGroup() {
            ConstDecl group = new ConstDecl(lines(1, 4), true, Arrays.asList(
                    new ConstDecl.ConstField(at(2), "a", num("1"), null),
                    new ConstDecl.ConstField(at(3), "bbb", num("2"), null)), null);
            assertThat(format(group)).isEqualTo("pub const (\n\ta   = 1\n\tbbb = 2\n)\n");
        }

        @Test
        @DisplayName("常量名与值之间的注释写在行内并计入对齐宽度")
        void testConstInlineComment() {
            Comment inline = new Comment(new SourceLocation(2, 202, 5), "c");
            Comment trailing = new Comment(new SourceLocation(3, 320, 6), "last");
            ConstDecl group = new ConstDecl(lines(1, 4), false, Arrays.asList(
                    new ConstDecl.ConstField(new SourceLocation(2, 200, 10), "a", num("1"), Arrays.asList(inline)),
                    new ConstDecl.ConstField(new SourceLocation(3, 300, 9), "bbb", num("2"), Arrays.asList(trailing))),
                    null);
            assertThat(format(group)).isEqualTo("const (\n\ta /* c */ = 1\n\tbbb       = 2 // last\n)\n");
        }

        @Test
        @DisplayName("枚举成员名与值之间的注释写在行内")
        void testEnumInlineComment() {
            Comment inline = new Comment(new SourceLocation(2, 204, 5), "first");
            EnumDecl level = new EnumDecl(lines(1, 3), null, false, "Level", Arrays.asList(
                    new EnumDecl.EnumField(new SourceLocation(2, 200, 12), "low", num("1"), Arrays.asList(inline))),
                    null);
            assertThat(format(level)).isEqualTo("enum Level {\n\tlow /* first */ = 1\n}\n");
        }

        @Test
        @DisplayName("全局变量")
        void testGlobal() {
            assertThat(format(new GlobalDecl(at(1), Arrays.asList(field("counter", T_INT, 1)))))
                    .isEqualTo("__global counter int\n");
            GlobalDecl group = new GlobalDecl(lines(1, 4), Arrays.asList(field("a", T_INT, 2), field("name", T_STRING, 3)));
            assertThat(format(group)).isEqualTo("__global (\n\ta    int\n\tname string\n)\n");
        }

        @Test
        @DisplayName("接口方法省略 fn 关键字")
        void testInterface() {
            FnSignature area = new FnSignature(false, Language.V, null, "area", null,
                    Collections.<FnSignature.Param>emptyList(), false, T_INT);
            InterfaceDecl shape = new InterfaceDecl(lines(1, 3), true, "Shape", Arrays.asList(area));
            assertThat(format(shape)).isEqualTo("pub interface Shape {\n\tarea() int\n}\n");
        }

        @Test
        @DisplayName("和类型的变体按名称排序")
        void testSumType() {
            assertThat(format(new SumTypeDecl(at(1), false, "Expr", Arrays.asList(T2, T1, T3))))
                    .isEqualTo("type Expr = T1 | T2 | T3\n");
        }

        @Test
        @DisplayName("类型别名与函数类型")
        void testTypeAliases() {
            assertThat(format(new AliasTypeDecl(at(1), true, "Ints", T_INT_ARRAY))).isEqualTo("pub type Ints = []int\n");
            FnSignature callback = FnSignature.anonymous(
                    Arrays.asList(new FnSignature.Param("x", T_INT, false)), T_BOOL);
            assertThat(format(new FnTypeDecl(at(1), false, "Callback", callback)))
                    .isEqualTo("type Callback = fn (x int) bool\n");
        }

        @Test
        @DisplayName("方法、无函数体的 C 函数与属性")
        void testFunctions() {
            FnSignature move = new FnSignature(true, Language.V, new FnSignature.Param("p", T_POINT, true), "move",
                    null, Arrays.asList(new FnSignature.Param("dx", T_INT, false)), false, 0);
            assertThat(format(new FnDecl(at(1), null, move, null, false)))
                    .isEqualTo("pub fn (mut p Point) move(dx int) {}\n");

            FnSignature puts = new FnSignature(false, Language.C, null, "puts", null,
                    Arrays.asList(new FnSignature.Param("s", T_STRING, false)), false, T_INT);
            assertThat(format(new FnDecl(at(1), null, puts, null, true))).isEqualTo("fn C.puts(s string) int\n");

            assertThat(format(new FnDecl(at(1), Arrays.asList("inline"), sig("f"), null, false)))
                    .isEqualTo("[inline]\nfn f() {}\n");
        }

        @Test
        @DisplayName("可变参数")
        void testVariadic() {
            FnSignature sum = new FnSignature(false, Language.V, null, "sum", null,
                    Arrays.asList(new FnSignature.Param("xs", T_INT, false)), true, T_INT);
            assertThat(format(new FnDecl(at(1), null, sum, null, false))).isEqualTo("fn sum(xs ...int) int {}\n");
        }
    }

    @Nested
    @DisplayName("循环")
    class LoopTests {

        @Test
        @DisplayName("带键的 for-in")
        void testForInWithKey() {
            ForInStmt loop = new ForInStmt(at(2), null, "i", "x", false, var("xs"), null,
                    Arrays.<Statement>asList(stmt(call("println", var("x")), 3)));
            assertThat(format(main(loop))).isEqualTo(inMain("for i, x in xs {", "\tprintln(x)", "}"));
        }

        @Test
        @DisplayName("区间循环与可变迭代变量")
        void testForInRange() {
            ForInStmt range = new ForInStmt(at(2), null, null, "i", false, num("0"), num("10"),
                    Collections.<Statement>emptyList());
            assertThat(format(main(range))).isEqualTo(inMain("for i in 0 .. 10 {}"));
            ForInStmt mutable = new ForInStmt(at(2), null, null, "p", true, var("points"), null,
                    Collections.<Statement>emptyList());
            assertThat(format(main(mutable))).isEqualTo(inMain("for mut p in points {}"));
        }

        @Test
        @DisplayName("C 风格 for")
        void testForC() {
            Expression cond = infix(var("i"), InfixExpr.InfixOp.LT, num("10"));
            Statement inc = stmt(new PostfixExpr(at(2), var("i"), PostfixExpr.PostfixOp.INC));
            ForCStmt loop = new ForCStmt(at(2), null, decl("i", num("0")), cond, inc,
                    Collections.<Statement>emptyList());
            assertThat(format(main(loop))).isEqualTo(inMain("for i := 0; i < 10; i++ {}"));
        }

        @Test
        @DisplayName("带标签的无限循环")
        void testLabeledInfiniteLoop() {
            ForCondStmt loop = new ForCondStmt(at(2), "outer", null,
                    Arrays.<Statement>asList(new BreakStmt(at(3), "outer")));
            assertThat(format(main(loop))).isEqualTo(inMain("outer: for {", "\tbreak outer", "}"));
        }

        @Test
        @DisplayName("条件循环")
        void testForCond() {
            ForCondStmt loop = new ForCondStmt(at(2), null, var("running"),
                    Arrays.<Statement>asList(stmt(call("step"), 3)));
            assertThat(format(main(loop))).isEqualTo(inMain("for running {", "\tstep()", "}"));
        }
    }

    @Nested
    @DisplayName("其他语句")
    class OtherStatementTests {

        @Test
        @DisplayName("编译期条件")
        void testCompileTimeIf() {
            CompileTimeIf ct = new CompileTimeIf(at(2), "windows", false, false,
                    Arrays.<Statement>asList(stmt(call("a"), 3)), Arrays.<Statement>asList(stmt(call("b"), 5)), true);
            assertThat(format(main(ct))).isEqualTo(inMain("$if windows {", "\ta()", "} $else {", "\tb()", "}"));
            CompileTimeIf optional = new CompileTimeIf(at(2), "debug", true, true,
                    Collections.<Statement>emptyList(), null, false);
            assertThat(format(main(optional))).isEqualTo(inMain("$if !debug ? {}"));
        }

        @Test
        @DisplayName("return、defer、unsafe 与 assert")
        void testSimpleStatements() {
            assertThat(format(main(new ReturnStmt(at(2), Arrays.<Expression>asList(var("a"), var("b"))))))
                    .isEqualTo(inMain("return a, b"));
            assertThat(format(main(new ReturnStmt(at(2), null)))).isEqualTo(inMain("return"));
            assertThat(format(main(new DeferStmt(at(2), Arrays.<Statement>asList(stmt(call("close"), 3))))))
                    .isEqualTo(inMain("defer {", "\tclose()", "}"));
            assertThat(format(main(new UnsafeStmt(at(2), Collections.<Statement>emptyList()))))
                    .isEqualTo(inMain("unsafe {}"));
            assertThat(format(main(new AssertStmt(at(2), infix(var("n"), InfixExpr.InfixOp.GT, num("0"))))))
                    .isEqualTo(inMain("assert n > 0"));
        }

        @Test
        @DisplayName("goto 与标签")
        void testGotoAndLabel() {
            assertThat(format(main(new LabelStmt(at(2), "retry"), new GotoStmt(at(3), "retry"))))
                    .isEqualTo(inMain("retry:", "goto retry"));
        }

        @Test
        @DisplayName("# 指令原样输出")
        void testHash() {
            assertThat(format(new HashStmt(at(1), "include <stdio.h>"), new HashStmt(at(2), "flag -lm")))
                    .isEqualTo("#include <stdio.h>\n#flag -lm\n");
        }

        @Test
        @DisplayName("sql 块逐行去掉首尾空白并跳过空行")
        void testSql() {
            SqlStmt sql = new SqlStmt(at(2), var("db"), Arrays.asList("  select from User  ", "", " where id == 1"));
            assertThat(format(main(sql))).isEqualTo(inMain("sql db {", "\tselect from User", "\twhere id == 1", "}"));
        }
    }
}
