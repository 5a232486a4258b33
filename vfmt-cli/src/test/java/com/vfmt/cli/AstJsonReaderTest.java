package com.vfmt.cli;

import com.google.gson.JsonParseException;
import com.google.gson.JsonSyntaxException;
import com.vfmt.ast.decl.FnDecl;
import com.vfmt.ast.decl.ModuleDecl;
import com.vfmt.ast.decl.StructDecl;
import com.vfmt.ast.expr.CallExpr;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.expr.Identifier;
import com.vfmt.ast.expr.IfExpr;
import com.vfmt.ast.expr.InfixExpr;
import com.vfmt.ast.expr.Literal;
import com.vfmt.ast.expr.MatchExpr;
import com.vfmt.ast.expr.OrBlock;
import com.vfmt.ast.stmt.AssignStmt;
import com.vfmt.ast.stmt.ForInStmt;
import com.vfmt.ast.stmt.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * 语法树 JSON 读取测试
 */
class AstJsonReaderTest {

    private AstJsonReader reader;

    @BeforeEach
    void setUp() {
        reader = new AstJsonReader();
    }

    @Nested
    @DisplayName("整棵树")
    class DocumentTests {

        @Test
        @DisplayName("读取文件路径、类型表与顶层语句")
        void testReadFixture() throws Exception {
            TreeDocument document;
            try (Reader in = new InputStreamReader(
                    AstJsonReaderTest.class.getResourceAsStream("/trees/point.json"), StandardCharsets.UTF_8)) {
                document = reader.read(in);
            }
            assertThat(document.getFile().getPath()).isEqualTo("point.v");
            assertThat(document.getFile().getModuleName()).isEqualTo("geo");
            assertThat(document.getFile().getImports()).hasSize(2);
            assertThat(document.getTypes().typeName(3)).isEqualTo("f64");
            assertThat(document.getFile().getStmts()).hasSize(5);
            assertThat(document.getFile().getStmts().get(0)).isInstanceOf(ModuleDecl.class);

            StructDecl point = (StructDecl) document.getFile().getStmts().get(3);
            assertThat(point.isPub()).isTrue();
            assertThat(point.getPubMutPos()).isZero();
            assertThat(point.getMutPos()).isEqualTo(-1);
            assertThat(point.getFields()).extracting("name").containsExactly("x", "y_pos");
            assertThat(point.getFields().get(1).getLocation().getOffset()).isEqualTo(900);

            FnDecl dist = (FnDecl) document.getFile().getStmts().get(4);
            assertThat(dist.getSignature().getReceiver().getName()).isEqualTo("p");
            assertThat(dist.getBody()).hasSize(2);
        }

        @Test
        @DisplayName("缺少 path 与 types 时使用默认值")
        void testDefaults() {
            TreeDocument document = reader.read("{\"stmts\": []}");
            assertThat(document.getFile().getPath()).isEqualTo("<stdin>");
            assertThat(document.getFile().getStmts()).isEmpty();
            assertThat(document.getTypes().typeName(0)).isEqualTo("void");
        }
    }

    @Nested
    @DisplayName("节点")
    class NodeTests {

        @Test
        @DisplayName("赋值语句与运算符")
        void testAssign() {
            Statement stmt = reader.readStatement("{\"node\": \"AssignStmt\", \"op\": \"+=\","
                    + " \"left\": [{\"node\": \"Identifier\", \"name\": \"x\"}],"
                    + " \"right\": [{\"node\": \"InfixExpr\", \"op\": \"<<\","
                    + "   \"left\": {\"node\": \"Literal\", \"kind\": \"INT\", \"value\": \"1\"},"
                    + "   \"right\": {\"node\": \"Identifier\", \"name\": \"n\", \"kind\": \"VARIABLE\"}}]}");
            assertThat(stmt).isInstanceOf(AssignStmt.class);
            AssignStmt assign = (AssignStmt) stmt;
            assertThat(assign.getOperator()).isEqualTo(AssignStmt.AssignOp.PLUS_ASSIGN);
            InfixExpr shift = (InfixExpr) assign.getRight().get(0);
            assertThat(shift.getOperator()).isEqualTo(InfixExpr.InfixOp.LEFT_SHIFT);
            assertThat(((Literal) shift.getLeft()).getKind()).isEqualTo(Literal.LiteralKind.INT);
            assertThat(((Identifier) shift.getRight()).getIdentKind()).isEqualTo(Identifier.IdentKind.VARIABLE);
        }

        @Test
        @DisplayName("调用的 or 块")
        void testOrBlock() {
            Expression expr = reader.readExpression("{\"node\": \"CallExpr\", \"name\": \"read\","
                    + " \"or\": {\"kind\": \"BLOCK\", \"stmts\": [{\"node\": \"ReturnStmt\"}]}}");
            CallExpr call = (CallExpr) expr;
            assertThat(call.getOrBlock().getKind()).isEqualTo(OrBlock.Kind.BLOCK);
            assertThat(call.getOrBlock().getStmts()).hasSize(1);
            assertThat(call.isMethod()).isFalse();

            CallExpr propagate = (CallExpr) reader.readExpression(
                    "{\"node\": \"CallExpr\", \"name\": \"read\", \"or\": {\"kind\": \"PROPAGATE\"}}");
            assertThat(propagate.getOrBlock()).isSameAs(OrBlock.PROPAGATE);
        }

        @Test
        @DisplayName("if 分支与 for-in 区间")
        void testIfAndForIn() {
            IfExpr ifExpr = (IfExpr) reader.readExpression("{\"node\": \"IfExpr\", \"hasElse\": true, \"expr\": true,"
                    + " \"branches\": [{\"cond\": {\"node\": \"Identifier\", \"name\": \"c\"}, \"stmts\": []},"
                    + " {\"stmts\": []}]}");
            assertThat(ifExpr.isExpr()).isTrue();
            assertThat(ifExpr.getBranches()).hasSize(2);
            assertThat(ifExpr.getBranches().get(1).getCondition()).isNull();

            ForInStmt loop = (ForInStmt) reader.readStatement("{\"node\": \"ForInStmt\", \"value\": \"i\","
                    + " \"iterable\": {\"node\": \"Literal\", \"kind\": \"INT\", \"value\": \"0\"},"
                    + " \"high\": {\"node\": \"Literal\", \"kind\": \"INT\", \"value\": \"10\"}}");
            assertThat(loop.isRange()).isTrue();
            assertThat(loop.getBody()).isEmpty();
        }

        @Test
        @DisplayName("match 的表达式位置标记")
        void testMatchExprFlag() {
            MatchExpr match = (MatchExpr) reader.readExpression("{\"node\": \"MatchExpr\", \"expr\": true,"
                    + " \"subject\": {\"node\": \"Identifier\", \"name\": \"x\", \"kind\": \"VARIABLE\"},"
                    + " \"branches\": [{\"else\": true, \"stmts\": [{\"node\": \"ReturnStmt\"}]}]}");
            assertThat(match.isExpr()).isTrue();
            assertThat(match.getBranches().get(0).isElse()).isTrue();
            MatchExpr plain = (MatchExpr) reader.readExpression("{\"node\": \"MatchExpr\","
                    + " \"subject\": {\"node\": \"Identifier\", \"name\": \"x\"}}");
            assertThat(plain.isExpr()).isFalse();
        }
    }

    @Nested
    @DisplayName("错误输入")
    class ErrorTests {

        @Test
        @DisplayName("JSON 语法错误")
        void testSyntaxError() {
            assertThatThrownBy(() -> reader.read("{\"stmts\": [")).isInstanceOf(JsonParseException.class);
            assertThatThrownBy(() -> reader.read("[1, 2]")).isInstanceOf(JsonParseException.class);
        }

        @Test
        @DisplayName("未知节点类型")
        void testUnknownNode() {
            assertThatThrownBy(() -> reader.read("{\"stmts\": [{\"node\": \"WhileStmt\"}]}"))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("WhileStmt");
        }

        @Test
        @DisplayName("缺少 node 字段")
        void testMissingNode() {
            assertThatThrownBy(() -> reader.readStatement("{\"name\": \"geo\"}"))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("node");
        }

        @Test
        @DisplayName("未知运算符")
        void testUnknownOperator() {
            assertThatThrownBy(() -> reader.readExpression("{\"node\": \"InfixExpr\", \"op\": \"<=>\","
                    + " \"left\": {\"node\": \"Identifier\", \"name\": \"a\"},"
                    + " \"right\": {\"node\": \"Identifier\", \"name\": \"b\"}}"))
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("<=>");
        }

        @Test
        @DisplayName("非法类型表")
        void testBadTypes() {
            assertThatThrownBy(() -> reader.read("{\"types\": {\"x\": \"int\"}}"))
                    .isInstanceOf(JsonParseException.class);
            assertThatThrownBy(() -> reader.read("{\"types\": {\"0\": \"int\"}}"))
                    .isInstanceOf(JsonParseException.class);
        }

        @Test
        @DisplayName("语法错误是 JsonParseException 的子类")
        void testSyntaxExceptionType() {
            assertThat(JsonParseException.class).isAssignableFrom(JsonSyntaxException.class);
        }
    }
}
