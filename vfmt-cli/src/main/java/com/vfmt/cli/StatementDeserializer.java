package com.vfmt.cli;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.decl.AliasTypeDecl;
import com.vfmt.ast.decl.ConstDecl;
import com.vfmt.ast.decl.EnumDecl;
import com.vfmt.ast.decl.FieldDecl;
import com.vfmt.ast.decl.FnDecl;
import com.vfmt.ast.decl.FnTypeDecl;
import com.vfmt.ast.decl.GlobalDecl;
import com.vfmt.ast.decl.ImportDecl;
import com.vfmt.ast.decl.InterfaceDecl;
import com.vfmt.ast.decl.ModuleDecl;
import com.vfmt.ast.decl.StructDecl;
import com.vfmt.ast.decl.SumTypeDecl;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.stmt.AssertStmt;
import com.vfmt.ast.stmt.AssignStmt;
import com.vfmt.ast.stmt.Block;
import com.vfmt.ast.stmt.BreakStmt;
import com.vfmt.ast.stmt.CommentStmt;
import com.vfmt.ast.stmt.CompileTimeIf;
import com.vfmt.ast.stmt.ContinueStmt;
import com.vfmt.ast.stmt.DeferStmt;
import com.vfmt.ast.stmt.ExpressionStmt;
import com.vfmt.ast.stmt.ForCStmt;
import com.vfmt.ast.stmt.ForCondStmt;
import com.vfmt.ast.stmt.ForInStmt;
import com.vfmt.ast.stmt.GoStmt;
import com.vfmt.ast.stmt.GotoStmt;
import com.vfmt.ast.stmt.HashStmt;
import com.vfmt.ast.stmt.LabelStmt;
import com.vfmt.ast.stmt.ReturnStmt;
import com.vfmt.ast.stmt.SqlStmt;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.stmt.UnsafeStmt;
import com.vfmt.ast.type.FnSignature;
import com.vfmt.ast.type.TypeTable;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

import static com.vfmt.cli.JsonFields.*;

/**
 * 语句与声明节点，按 {@code "node"} 字段分派
 */
class StatementDeserializer implements JsonDeserializer<Statement> {

    @Override
    public Statement deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext ctx)
            throws JsonParseException {
        JsonObject obj = object(json, "语句");
        String kind = string(obj, "node");
        SourceLocation loc = location(obj);
        switch (kind) {
            // 声明
            case "ModuleDecl":
                return new ModuleDecl(loc, string(obj, "name"));
            case "ImportDecl":
                return new ImportDecl(loc, string(obj, "module"), optString(obj, "alias"));
            case "ConstDecl":
                return constDecl(obj, loc, ctx);
            case "EnumDecl":
                return enumDecl(obj, loc, ctx);
            case "FnDecl":
                return new FnDecl(loc, strings(obj, "attrs"), signature(object(obj.get("signature"), "signature")),
                        nodes(obj, "body", Statement.class, ctx), bool(obj, "noBody"));
            case "GlobalDecl":
                return new GlobalDecl(loc, fields(obj, ctx));
            case "InterfaceDecl": {
                List<FnSignature> methods = new ArrayList<FnSignature>();
                for (JsonElement e : array(obj, "methods")) {
                    methods.add(signature(object(e, "method")));
                }
                return new InterfaceDecl(loc, bool(obj, "pub"), string(obj, "name"), methods);
            }
            case "StructDecl":
                return structDecl(obj, loc, ctx);
            case "AliasTypeDecl":
                return new AliasTypeDecl(loc, bool(obj, "pub"), string(obj, "name"),
                        integer(obj, "parentType", TypeTable.VOID));
            case "FnTypeDecl":
                return new FnTypeDecl(loc, bool(obj, "pub"), string(obj, "name"),
                        signature(object(obj.get("signature"), "signature")));
            case "SumTypeDecl":
                return new SumTypeDecl(loc, bool(obj, "pub"), string(obj, "name"), ints(obj, "variants"));

            // 语句
            case "AssignStmt":
                return new AssignStmt(loc, nodes(obj, "left", Expression.class, ctx),
                        constant(AssignStmt.AssignOp.values(), AssignStmt.AssignOp::toSourceString, string(obj, "op")),
                        nodes(obj, "right", Expression.class, ctx));
            case "AssertStmt":
                return new AssertStmt(loc, required(obj, "cond", Expression.class, ctx));
            case "Block":
                return new Block(loc, nodes(obj, "stmts", Statement.class, ctx));
            case "BreakStmt":
                return new BreakStmt(loc, optString(obj, "label"));
            case "ContinueStmt":
                return new ContinueStmt(loc, optString(obj, "label"));
            case "GotoStmt":
                return new GotoStmt(loc, string(obj, "label"));
            case "LabelStmt":
                return new LabelStmt(loc, string(obj, "name"));
            case "CommentStmt":
                return new CommentStmt(loc, comment(object(obj.get("comment"), "comment")));
            case "CompileTimeIf":
                return new CompileTimeIf(loc, string(obj, "cond"), bool(obj, "negated"), bool(obj, "optional"),
                        nodes(obj, "then", Statement.class, ctx), nodes(obj, "else", Statement.class, ctx),
                        bool(obj, "hasElse"));
            case "DeferStmt":
                return new DeferStmt(loc, nodes(obj, "stmts", Statement.class, ctx));
            case "ExpressionStmt":
                return new ExpressionStmt(loc, required(obj, "expr", Expression.class, ctx));
            case "ForCStmt":
                return new ForCStmt(loc, optString(obj, "label"), node(obj, "init", Statement.class, ctx),
                        node(obj, "cond", Expression.class, ctx), node(obj, "inc", Statement.class, ctx),
                        nodes(obj, "body", Statement.class, ctx));
            case "ForInStmt":
                return new ForInStmt(loc, optString(obj, "label"), optString(obj, "key"), string(obj, "value"),
                        bool(obj, "mut"), required(obj, "iterable", Expression.class, ctx),
                        node(obj, "high", Expression.class, ctx), nodes(obj, "body", Statement.class, ctx));
            case "ForCondStmt":
                return new ForCondStmt(loc, optString(obj, "label"), node(obj, "cond", Expression.class, ctx),
                        nodes(obj, "body", Statement.class, ctx));
            case "GoStmt":
                return new GoStmt(loc, required(obj, "call", Expression.class, ctx));
            case "HashStmt":
                return new HashStmt(loc, string(obj, "value"));
            case "ReturnStmt":
                return new ReturnStmt(loc, nodes(obj, "values", Expression.class, ctx));
            case "UnsafeStmt":
                return new UnsafeStmt(loc, nodes(obj, "stmts", Statement.class, ctx));
            case "SqlStmt":
                return new SqlStmt(loc, required(obj, "db", Expression.class, ctx), strings(obj, "lines"));
            default:
                throw new JsonParseException("未知语句类型: " + kind);
        }
    }

    private static ConstDecl constDecl(JsonObject obj, SourceLocation loc, JsonDeserializationContext ctx) {
        List<ConstDecl.ConstField> fields = new ArrayList<ConstDecl.ConstField>();
        for (JsonElement e : array(obj, "fields")) {
            JsonObject f = object(e, "const 字段");
            fields.add(new ConstDecl.ConstField(location(f), string(f, "name"),
                    required(f, "value", Expression.class, ctx), comments(f, "comments")));
        }
        return new ConstDecl(loc, bool(obj, "pub"), fields, comments(obj, "endComments"));
    }

    private static EnumDecl enumDecl(JsonObject obj, SourceLocation loc, JsonDeserializationContext ctx) {
        List<EnumDecl.EnumField> fields = new ArrayList<EnumDecl.EnumField>();
        for (JsonElement e : array(obj, "fields")) {
            JsonObject f = object(e, "enum 字段");
            fields.add(new EnumDecl.EnumField(location(f), string(f, "name"),
                    node(f, "value", Expression.class, ctx), comments(f, "comments")));
        }
        return new EnumDecl(loc, strings(obj, "attrs"), bool(obj, "pub"), string(obj, "name"), fields,
                comments(obj, "endComments"));
    }

    private static StructDecl structDecl(JsonObject obj, SourceLocation loc, JsonDeserializationContext ctx) {
        return new StructDecl(loc, strings(obj, "attrs"), bool(obj, "pub"), bool(obj, "union"), language(obj),
                string(obj, "name"), strings(obj, "generics"), fields(obj, ctx),
                integer(obj, "mutPos", -1), integer(obj, "pubPos", -1), integer(obj, "pubMutPos", -1),
                comments(obj, "endComments"));
    }

    private static List<FieldDecl> fields(JsonObject obj, JsonDeserializationContext ctx) {
        List<FieldDecl> fields = new ArrayList<FieldDecl>();
        for (JsonElement e : array(obj, "fields")) {
            JsonObject f = object(e, "字段");
            fields.add(new FieldDecl(location(f), string(f, "name"), integer(f, "type", TypeTable.VOID),
                    node(f, "default", Expression.class, ctx), comments(f, "comments")));
        }
        return fields;
    }
}
