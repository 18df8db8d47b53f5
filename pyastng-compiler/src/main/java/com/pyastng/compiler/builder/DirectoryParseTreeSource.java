package com.pyastng.compiler.builder;

import com.pyastng.compiler.parsetree.ParseTree;
import com.pyastng.compiler.parsetree.ParseTreeReader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * 目录中的 JSON 解析树
 *
 * <p>模块 {@code a.b} 对应 {@code a/b.json}，包 {@code a.b} 对应 {@code a/b/__init__.json}，
 * 两者都存在时模块文件优先。</p>
 */
public class DirectoryParseTreeSource implements ParseTreeSource {
    private static final Logger LOG = Logger.getLogger(DirectoryParseTreeSource.class.getName());

    private static final String EXTENSION = ".json";

    private final Path root;
    private final ParseTreeReader reader;

    public DirectoryParseTreeSource(Path root) {
        this(root, new ParseTreeReader());
    }

    public DirectoryParseTreeSource(Path root, ParseTreeReader reader) {
        this.root = root;
        this.reader = reader;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public ParseTree find(String modname) {
        if (modname == null || modname.isEmpty()) {
            return null;
        }
        Path base = root;
        String[] parts = modname.split("\\.");
        for (int i = 0; i < parts.length - 1; i++) {
            base = base.resolve(parts[i]);
        }
        String last = parts[parts.length - 1];
        Path module = base.resolve(last + EXTENSION);
        if (Files.isRegularFile(module)) {
            LOG.fine("模块 " + modname + " -> " + module);
            return reader.read(module);
        }
        Path packageInit = base.resolve(last).resolve("__init__" + EXTENSION);
        if (Files.isRegularFile(packageInit)) {
            LOG.fine("包 " + modname + " -> " + packageInit);
            return reader.read(packageInit);
        }
        return null;
    }
}
