package com.exformatter.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.exformatter.util.LoggerUtil;

/**
 * Kinds of source files the formatter recognises. Detection looks at the
 * extension first and falls back to the first lines of the file.
 */
public enum FileType {
    ELIXIR("ex"),
    ELIXIR_SCRIPT("exs"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int HEAD_BYTES = 4096;
    private static final int HEAD_LINES = 20;

    private static final Pattern SHEBANG = Pattern.compile("^#!\\s*\\S*(?:/env\\s+|/)elixir\\b");
    private static final Pattern MODULE_DEFINITION = Pattern.compile("^\\s*defmodule\\s+[A-Z]", Pattern.MULTILINE);

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public boolean isElixir() {
        return this != UNKNOWN;
    }

    /**
     * Detects the type of {@code filePath}. Results are cached per path.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType detected = detectByExtension(filePath);
        if (detected == UNKNOWN) {
            detected = detectByContent(filePath);
        }
        typeCache.put(filePath, detected);
        return detected;
    }

    static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        return switch (fileName.substring(dot + 1)) {
            case "ex" -> ELIXIR;
            case "exs" -> ELIXIR_SCRIPT;
            default -> UNKNOWN;
        };
    }

    static FileType detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try {
            List<String> lines = readFirstLines(filePath);
            if (lines.isEmpty()) {
                return UNKNOWN;
            }
            if (SHEBANG.matcher(lines.get(0)).find()) {
                return ELIXIR_SCRIPT;
            }
            if (MODULE_DEFINITION.matcher(String.join("\n", lines)).find()) {
                return ELIXIR;
            }
            return UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    /**
     * Reads at most {@value #HEAD_LINES} lines from the first {@value #HEAD_BYTES} bytes.
     */
    private static List<String> readFirstLines(Path filePath) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(filePath)) {
            head = in.readNBytes(HEAD_BYTES);
        }
        String content = new String(head, StandardCharsets.UTF_8);

        List<String> lines = new ArrayList<>();
        String[] contentLines = content.split("\n", HEAD_LINES + 1);
        for (int i = 0; i < contentLines.length && i < HEAD_LINES; i++) {
            lines.add(contentLines[i]);
        }
        return lines;
    }

    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    public String getDescription() {
        return switch (this) {
            case ELIXIR -> "Elixir source file";
            case ELIXIR_SCRIPT -> "Elixir script";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
