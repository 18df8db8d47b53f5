package com.pyastng.compiler.parsetree;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

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
 * 从 JSON 读取解析树
 *
 * <p>每个对象带 {@code _type}，可选 {@code lineno}/{@code fromlineno}/{@code tolineno}；
 * 也可以用 {@code {"frontEnd": "compiler"|"ast", "tree": {...}}} 包裹以指定前端。</p>
 */
public final class ParseTreeReader {

    private static final String TYPE = "_type";
    private static final String LINENO = "lineno";
    private static final String FROM_LINENO = "fromlineno";
    private static final String TO_LINENO = "tolineno";

    public ParseTree read(Reader reader, String path) {
        JsonElement element;
        try {
            element = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new MalformedTreeException("无法解析 JSON 解析树: " + path, e);
        }
        if (!element.isJsonObject()) {
            throw new MalformedTreeException("解析树必须是 JSON 对象: " + path);
        }
        JsonObject object = element.getAsJsonObject();
        if (object.has("tree")) {
            RawNode root = toNode(object.getAsJsonObject("tree"));
            if (object.has("frontEnd")) {
                return new ParseTree(FrontEnd.fromId(object.get("frontEnd").getAsString()), root, path);
            }
            return new ParseTree(root, path);
        }
        return new ParseTree(toNode(object), path);
    }

    public ParseTree read(String json, String path) {
        return read(new StringReader(json), path);
    }

    public ParseTree read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (IOException e) {
            throw new MalformedTreeException("无法读取解析树 " + file, e);
        }
    }

    private RawNode toNode(JsonObject object) {
        JsonElement type = object.get(TYPE);
        if (type == null || !type.isJsonPrimitive()) {
            throw new MalformedTreeException("节点缺少 _type: " + object);
        }
        RawNode node = new RawNode(type.getAsString());
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            String key = entry.getKey();
            if (TYPE.equals(key)) {
                continue;
            }
            if (LINENO.equals(key)) {
                node.setLineno(toLine(entry.getValue()));
            } else if (FROM_LINENO.equals(key)) {
                node.setFromLineno(toLine(entry.getValue()));
            } else if (TO_LINENO.equals(key)) {
                node.setToLineno(toLine(entry.getValue()));
            } else {
                node.with(key, toValue(entry.getValue()));
            }
        }
        return node;
    }

    private static Integer toLine(JsonElement element) {
        return element.isJsonNull() ? null : element.getAsInt();
    }

    private Object toValue(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonObject()) {
            return toNode(element.getAsJsonObject());
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            List<Object> values = new ArrayList<Object>(array.size());
            for (JsonElement item : array) {
                values.add(toValue(item));
            }
            return values;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            String text = primitive.getAsString();
            if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
                return primitive.getAsLong();
            }
            return primitive.getAsDouble();
        }
        return primitive.getAsString();
    }
}
