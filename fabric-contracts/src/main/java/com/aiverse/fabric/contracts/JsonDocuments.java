package com.aiverse.fabric.contracts;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads sets of JSON definition files (registry cards, feedback signals) from a directory or from the classpath.
 * On the classpath a set is described by {@code <base>/index.json}: {@code {"files": ["a.json", ...]}}.
 */
public final class JsonDocuments {

    public static final String INDEX_FILE = "index.json";

    /** One definition file: its file name and raw content. */
    public record Document(String name, String content) { }

    private JsonDocuments() {
    }

    /** All {@code *.json} files of the directory except the index, sorted by name. */
    public static List<Document> fromDirectory(Path dir) throws IOException {
        List<Document> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            List<Path> sorted = files
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(p -> !INDEX_FILE.equals(p.getFileName().toString()))
                    .sorted()
                    .toList();
            for (Path p : sorted) {
                out.add(new Document(p.getFileName().toString(), Files.readString(p, StandardCharsets.UTF_8)));
            }
        }
        return out;
    }

    /**
     * Files listed by {@code <base>/index.json}. Returns an empty list when the index is absent.
     *
     * @throws IOException if the index is malformed or lists a missing file
     */
    public static List<Document> fromClasspath(ClassLoader loader, String base) throws IOException {
        String index = read(loader, base + "/" + INDEX_FILE);
        if (index == null) return List.of();
        JsonNode files = FabricJson.mapper().readTree(index).path("files");
        if (!files.isArray()) {
            throw new IOException("Index " + base + "/" + INDEX_FILE + " has no files array");
        }
        List<Document> out = new ArrayList<>();
        for (JsonNode f : files) {
            String name = f.asText();
            String content = read(loader, base + "/" + name);
            if (content == null) {
                throw new IOException("Resource listed in index not found: " + base + "/" + name);
            }
            out.add(new Document(name, content));
        }
        return out;
    }

    private static String read(ClassLoader loader, String resource) throws IOException {
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) return null;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
