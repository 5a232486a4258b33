package com.vfmt.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.vfmt.ast.Comment;
import com.vfmt.ast.Language;
import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.type.FnSignature;
import com.vfmt.ast.type.TypeTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 语法树 JSON 的字段读取工具
 *
 * <p>缺省的布尔字段为 false，缺省的列表为空；必需字段缺失时抛出 {@link JsonParseException}。</p>
 */
final class JsonFields {

    private JsonFields() {}

    static JsonObject object(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException(what + " 应为 JSON 对象: " + element);
        }
        return element.getAsJsonObject();
    }

    static boolean has(JsonObject obj, String name) {
        return obj.has(name) && !obj.get(name).isJsonNull();
    }

    static String string(JsonObject obj, String name) {
        if (!has(obj, name)) {
            throw new JsonParseException("缺少字段 '" + name + "': " + obj);
        }
        return obj.get(name).getAsString();
    }

    static String optString(JsonObject obj, String name) {
        return has(obj, name) ? obj.get(name).getAsString() : null;
    }

    static boolean bool(JsonObject obj, String name) {
        return has(obj, name) && obj.get(name).getAsBoolean();
    }

    static int integer(JsonObject obj, String name, int defaultValue) {
        return has(obj, name) ? obj.get(name).getAsInt() : defaultValue;
    }

    static List<String> strings(JsonObject obj, String name) {
        List<String> result = new ArrayList<String>();
        for (JsonElement e : array(obj, name)) {
            result.add(e.getAsString());
        }
        return result;
    }

    static List<Integer> ints(JsonObject obj, String name) {
        List<Integer> result = new ArrayList<Integer>();
        for (JsonElement e : array(obj, name)) {
            result.add(e.getAsInt());
        }
        return result;
    }

    static JsonArray array(JsonObject obj, String name) {
        if (!has(obj, name)) {
            return new JsonArray();
        }
        JsonElement e = obj.get(name);
        if (!e.isJsonArray()) {
            throw new JsonParseException("字段 '" + name + "' 应为数组: " + e);
        }
        return e.getAsJsonArray();
    }

    /** 可选的子节点，缺省为 null */
    static <T> T node(JsonObject obj, String name, Class<T> type, JsonDeserializationContext ctx) {
        if (!has(obj, name)) {
            return null;
        }
        return ctx.deserialize(obj.get(name), type);
    }

    static <T> T required(JsonObject obj, String name, Class<T> type, JsonDeserializationContext ctx) {
        T value = node(obj, name, type, ctx);
        if (value == null) {
            throw new JsonParseException("缺少字段 '" + name + "': " + obj);
        }
        return value;
    }

    static <T> List<T> nodes(JsonObject obj, String name, Class<T> type, JsonDeserializationContext ctx) {
        List<T> result = new ArrayList<T>();
        for (JsonElement e : array(obj, name)) {
            T value = ctx.deserialize(e, type);
            result.add(value);
        }
        return result;
    }

    /**
     * {@code "pos": {"line", "lastLine", "column", "offset", "length"}}，缺省为未知位置
     */
    static SourceLocation location(JsonObject obj) {
        if (!has(obj, "pos")) {
            return SourceLocation.UNKNOWN;
        }
        JsonObject pos = object(obj.get("pos"), "pos");
        int line = integer(pos, "line", 0);
        return new SourceLocation(line, integer(pos, "lastLine", line), integer(pos, "column", 0),
                integer(pos, "offset", 0), integer(pos, "length", 0));
    }

    static List<Comment> comments(JsonObject obj, String name) {
        if (!has(obj, name)) {
            return Collections.emptyList();
        }
        List<Comment> result = new ArrayList<Comment>();
        for (JsonElement e : array(obj, name)) {
            result.add(comment(object(e, "comment")));
        }
        return result;
    }

    static Comment comment(JsonObject obj) {
        return new Comment(location(obj), string(obj, "text"));
    }

    static FnSignature signature(JsonObject obj) {
        List<FnSignature.Param> params = new ArrayList<FnSignature.Param>();
        for (JsonElement e : array(obj, "params")) {
            params.add(param(object(e, "param")));
        }
        FnSignature.Param receiver = has(obj, "receiver") ? param(object(obj.get("receiver"), "receiver")) : null;
        return new FnSignature(bool(obj, "pub"), language(obj), receiver, optString(obj, "name"),
                strings(obj, "generics"), params, bool(obj, "variadic"), integer(obj, "returnType", TypeTable.VOID));
    }

    /** 缺省为 V */
    static Language language(JsonObject obj) {
        return has(obj, "language") ? constant(Language.values(), Language::name, string(obj, "language")) : Language.V;
    }

    static FnSignature.Param param(JsonObject obj) {
        return new FnSignature.Param(optString(obj, "name"), integer(obj, "type", TypeTable.VOID), bool(obj, "mut"));
    }

    /**
     * 按源码文本查找枚举常量（运算符、字面量种类等）
     */
    static <E extends Enum<E>> E constant(E[] values, Function<E, String> text, String source) {
        for (E value : values) {
            if (text.apply(value).equals(source)) {
                return value;
            }
        }
        throw new JsonParseException("未知取值: '" + source + "'");
    }
}
