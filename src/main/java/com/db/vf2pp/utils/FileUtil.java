package com.db.vf2pp.utils;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FileUtil {
    public static JSONArray readJsonArray(String filePath) {
        String content = readFile(filePath);
        try {
            return new JSONArray(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed JSON array in " + filePath, e);
        }
    }

    public static JSONObject readJsonObject(String filePath) {
        String content = readFile(filePath);
        try {
            return new JSONObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed JSON object in " + filePath, e);
        }
    }

    private static String readFile(String filePath) {
        try {
            return new String(Files.readAllBytes(Paths.get(filePath)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading JSON file " + filePath, e);
        }
    }

    public static void writeJson(JSONArray data, String filePath) {
        try {
            Path path = Paths.get(filePath);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, data.toString(2).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing JSON file " + filePath, e);
        }
    }

    /**
     * Resolves {@code path} against the directory of {@code base} unless it is absolute.
     */
    public static String resolveSibling(String base, String path) {
        Path candidate = Paths.get(path);
        if (candidate.isAbsolute()) {
            return path;
        }
        Path parent = Paths.get(base).toAbsolutePath().getParent();
        return parent == null ? path : parent.resolve(candidate).toString();
    }
}
