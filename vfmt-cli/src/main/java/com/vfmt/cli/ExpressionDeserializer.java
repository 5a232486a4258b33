package com.vfmt.cli;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.expr.AnonFn;
import com.vfmt.ast.expr.ArrayInit;
import com.vfmt.ast.expr.CallExpr;
import com.vfmt.ast.expr.CastExpr;
import com.vfmt.ast.expr.EnumValue;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.expr.Identifier;
import com.vfmt.ast.expr.IfExpr;
import com.vfmt.ast.expr.IndexExpr;
import com.vfmt.ast.expr.InfixExpr;
import com.vfmt.ast.expr.LikelyExpr;
import com.vfmt.ast.expr.Literal;
import com.vfmt.ast.expr.LockExpr;
import com.vfmt.ast.expr.MapInit;
import com.vfmt.ast.expr.MatchExpr;
import com.vfmt.ast.expr.OrBlock;
import com.vfmt.ast.expr.OrExpr;
import com.vfmt.ast.expr.ParExpr;
import com.vfmt.ast.expr.PostfixExpr;
import com.vfmt.ast.expr.PrefixExpr;
import com.vfmt.ast.expr.RangeExpr;
import com.vfmt.ast.expr.SelectorExpr;
import com.vfmt.ast.expr.SizeOfExpr;
import com.vfmt.ast.expr.StringInterpolation;
import com.vfmt.ast.expr.StructInit;
import com.vfmt.ast.expr.TypeExpr;
import com.vfmt.ast.expr.TypeOfExpr;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.type.TypeTable;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

import static com.vfmt.cli.JsonFields.*;

/**
 * 表达式节点，按 {@code "node"} 字段分派
 */
class ExpressionDeserializer implements JsonDeserializer<Expression> {

    @Override
    public Expression deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext ctx)
            throws JsonParseException {
        JsonObject obj = object(json, "表达式");
        String kind = string(obj, "node");
        SourceLocation loc = location(obj);
        switch (kind) {
            case "Literal":
                return new Literal(loc,
                        constant(Literal.LiteralKind.values(), Literal.LiteralKind::name, string(obj, "kind")),
                        string(obj, "value"), bool(obj, "raw"));
            case "StringInterpolation":
                return new StringInterpolation(loc, strings(obj, "vals"), nodes(obj, "exprs", Expression.class, ctx),
                        strings(obj, "formats"));
            case "ArrayInit":
                return new ArrayInit(loc, type(obj), nodes(obj, "exprs", Expression.class, ctx),
                        node(obj, "len", Expression.class, ctx), node(obj, "cap", Expression.class, ctx),
                        node(obj, "init", Expression.class, ctx), bool(obj, "fixed"));
            case "MapInit":
                return new MapInit(loc, type(obj), nodes(obj, "keys", Expression.class, ctx),
                        nodes(obj, "values", Expression.class, ctx));
            case "StructInit":
                return structInit(obj, loc, ctx);
            case "AnonFn":
                return new AnonFn(loc, signature(object(obj.get("signature"), "signature")),
                        nodes(obj, "body", Statement.class, ctx));
            case "CallExpr":
                return callExpr(obj, loc, ctx);
            case "OrExpr":
                return new OrExpr(loc, orBlock(obj, ctx));
            case "CastExpr":
                return new CastExpr(loc, type(obj), required(obj, "expr", Expression.class, ctx),
                        node(obj, "arg", Expression.class, ctx));
            case "IfExpr":
                return ifExpr(obj, loc, ctx);
            case "MatchExpr":
                return matchExpr(obj, loc, ctx);
            case "LockExpr":
                return new LockExpr(loc, bool(obj, "rlock"), nodes(obj, "lockeds", Expression.class, ctx),
                        nodes(obj, "stmts", Statement.class, ctx));
            case "Identifier": {
                Identifier.IdentKind identKind = has(obj, "kind")
                        ? constant(Identifier.IdentKind.values(), Identifier.IdentKind::name, string(obj, "kind"))
                        : Identifier.IdentKind.UNRESOLVED;
                return new Identifier(loc, string(obj, "name"), identKind, bool(obj, "mut"));
            }
            case "InfixExpr":
                return new InfixExpr(loc, required(obj, "left", Expression.class, ctx),
                        constant(InfixExpr.InfixOp.values(), InfixExpr.InfixOp::toSourceString, string(obj, "op")),
                        required(obj, "right", Expression.class, ctx));
            case "PrefixExpr":
                return new PrefixExpr(loc,
                        constant(PrefixExpr.PrefixOp.values(), PrefixExpr.PrefixOp::toSourceString, string(obj, "op")),
                        required(obj, "operand", Expression.class, ctx));
            case "PostfixExpr":
                return new PostfixExpr(loc, required(obj, "operand", Expression.class, ctx),
                        constant(PostfixExpr.PostfixOp.values(), PostfixExpr.PostfixOp::toSourceString,
                                string(obj, "op")));
            case "IndexExpr":
                return new IndexExpr(loc, required(obj, "left", Expression.class, ctx),
                        required(obj, "index", Expression.class, ctx));
            case "RangeExpr":
                return new RangeExpr(loc, node(obj, "low", Expression.class, ctx),
                        node(obj, "high", Expression.class, ctx));
            case "SelectorExpr":
                return new SelectorExpr(loc, required(obj, "target", Expression.class, ctx), string(obj, "field"));
            case "ParExpr":
                return new ParExpr(loc, required(obj, "expr", Expression.class, ctx));
            case "EnumValue":
                return new EnumValue(loc, optString(obj, "enum"), string(obj, "value"));
            case "TypeExpr":
                return new TypeExpr(loc, type(obj));
            case "SizeOfExpr":
                return new SizeOfExpr(loc, type(obj));
            case "TypeOfExpr":
                return new TypeOfExpr(loc, required(obj, "expr", Expression.class, ctx));
            case "LikelyExpr":
                return new LikelyExpr(loc, required(obj, "expr", Expression.class, ctx), !bool(obj, "unlikely"));
            default:
                throw new JsonParseException("未知表达式类型: " + kind);
        }
    }

    private static int type(JsonObject obj) {
        return integer(obj, "type", TypeTable.VOID);
    }

    private static StructInit structInit(JsonObject obj, SourceLocation loc, JsonDeserializationContext ctx) {
        List<StructInit.Field> fields = new ArrayList<StructInit.Field>();
        for (JsonElement e : array(obj, "fields")) {
            JsonObject f = object(e, "结构体字段");
            fields.add(new StructInit.Field(location(f), optString(f, "name"),
                    required(f, "value", Expression.class, ctx)));
        }
        return new StructInit(loc, type(obj), fields, bool(obj, "short"), bool(obj, "shortArgs"));
    }

    private static CallExpr callExpr(JsonObject obj, SourceLocation loc, JsonDeserializationContext ctx) {
        List<CallExpr.CallArg> args = new ArrayList<CallExpr.CallArg>();
        for (JsonElement e : array(obj, "args")) {
            JsonObject a = object(e, "实参");
            args.add(new CallExpr.CallArg(location(a), required(a, "expr", Expression.class, ctx), bool(a, "mut")));
        }
        return new CallExpr(loc, node(obj, "receiver", Expression.class, ctx), string(obj, "name"),
                bool(obj, "method"), args, ints(obj, "generics"), orBlock(obj, ctx));
    }

    /**
     * {@code "or": {"kind": "PROPAGATE"}} 或 {@code {"kind": "BLOCK", "stmts": [...]}}，缺省为无
     */
    private static OrBlock orBlock(JsonObject obj, JsonDeserializationContext ctx) {
        if (!has(obj, "or")) {
            return OrBlock.ABSENT;
        }
        JsonObject or = object(obj.get("or"), "or");
        OrBlock.Kind kind = constant(OrBlock.Kind.values(), OrBlock.Kind::name, string(or, "kind"));
        switch (kind) {
            case PROPAGATE:
                return OrBlock.PROPAGATE;
            case BLOCK:
                return OrBlock.block(nodes(or, "stmts", Statement.class, ctx));
            default:
                return OrBlock.ABSENT;
        }
    }

    private static IfExpr ifExpr(JsonObject obj, SourceLocation loc, JsonDeserializationContext ctx) {
        List<IfExpr.IfBranch> branches = new ArrayList<IfExpr.IfBranch>();
        for (JsonElement e : array(obj, "branches")) {
            JsonObject b = object(e, "if 分支");
            branches.add(new IfExpr.IfBranch(location(b), node(b, "cond", Expression.class, ctx),
                    nodes(b, "stmts", Statement.class, ctx), comments(b, "comments")));
        }
        return new IfExpr(loc, branches, bool(obj, "hasElse"), bool(obj, "expr"));
    }

    private static MatchExpr matchExpr(JsonObject obj, SourceLocation loc, JsonDeserializationContext ctx) {
        List<MatchExpr.MatchBranch> branches = new ArrayList<MatchExpr.MatchBranch>();
        for (JsonElement e : array(obj, "branches")) {
            JsonObject b = object(e, "match 分支");
            branches.add(new MatchExpr.MatchBranch(location(b), nodes(b, "patterns", Expression.class, ctx),
                    bool(b, "else"), nodes(b, "stmts", Statement.class, ctx), comments(b, "comments")));
        }
        return new MatchExpr(loc, required(obj, "subject", Expression.class, ctx), bool(obj, "mut"), branches,
                bool(obj, "expr"));
    }
}
