package com.vfmt.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.vfmt.ast.SourceFile;
import com.vfmt.ast.expr.Expression;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.type.SimpleTypeTable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 读取 JSON 序列化的语法树
 *
 * <pre>
 * {
 *   "path": "geo/point.v",
 *   "types": {"1": "int", "2": "Point"},
 *   "stmts": [{"node": "ModuleDecl", "pos": {"line": 1}, "name": "geo"}, ...]
 * }
 * </pre>
 *
 * <p>每个节点以 {@code "node"} 字段标明类型，可选的 {@code "pos"} 给出源码位置。</p>
 */
public class AstJsonReader {

    private final Gson gson;

    public AstJsonReader() {
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Statement.class, new StatementDeserializer())
                .registerTypeAdapter(Expression.class, new ExpressionDeserializer())
                .create();
    }

    public TreeDocument read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public TreeDocument read(String json) {
        return read(new StringReader(json));
    }

    /**
     * @throws JsonParseException JSON 语法错误、缺少必需字段或未知节点类型
     */
    public TreeDocument read(Reader reader) {
        JsonObject root = JsonFields.object(gson.fromJson(reader, JsonElement.class), "语法树");
        SimpleTypeTable types = readTypes(root);
        String path = JsonFields.optString(root, "path");
        List<Statement> stmts = new ArrayList<Statement>();
        for (JsonElement e : JsonFields.array(root, "stmts")) {
            stmts.add(gson.fromJson(e, Statement.class));
        }
        return new TreeDocument(new SourceFile(path != null ? path : "<stdin>", stmts), types);
    }

    public Statement readStatement(String json) {
        return gson.fromJson(json, Statement.class);
    }

    public Expression readExpression(String json) {
        return gson.fromJson(json, Expression.class);
    }

    private static SimpleTypeTable readTypes(JsonObject root) {
        SimpleTypeTable table = new SimpleTypeTable();
        if (!JsonFields.has(root, "types")) {
            return table;
        }
        for (Map.Entry<String, JsonElement> entry : JsonFields.object(root.get("types"), "types").entrySet()) {
            try {
                table.register(Integer.parseInt(entry.getKey()), entry.getValue().getAsString());
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("非法类型表项 " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return table;
    }
}
