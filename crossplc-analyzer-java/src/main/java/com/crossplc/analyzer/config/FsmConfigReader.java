package com.crossplc.analyzer.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads FSM hints from JSON. The file is either a single hint object or
 * {@code {"controllers": {"<controller>": {...}, "default": {...}}}}, in which case the
 * controller's own section wins over {@code default}.
 */
public class FsmConfigReader {

    private static final Gson GSON = new Gson();
    static final String DEFAULT_SECTION = "default";

    /**
     * @throws FsmConfigReadException if the file is missing or malformed
     */
    public FsmConfig read(Path configPath, String controllerName) {
        if (!configPath.toFile().exists()) {
            throw new FsmConfigReadException("FSM config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile())) {
            JsonElement root = JsonParser.parseReader(reader);
            if (root == null || !root.isJsonObject()) {
                throw new FsmConfigReadException("FSM config file is empty or not a JSON object: " + configPath);
            }
            JsonObject section = selectSection(root.getAsJsonObject(), controllerName);
            FsmConfig config = section != null ? GSON.fromJson(section, FsmConfig.class) : null;
            return config != null ? config : FsmConfig.empty();
        } catch (FileNotFoundException e) {
            throw new FsmConfigReadException("FSM config file not found: " + configPath, e);
        } catch (IOException | JsonParseException | IllegalStateException | ClassCastException e) {
            throw new FsmConfigReadException("Failed to read FSM config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Like {@link #read} but a missing or unusable file only produces a warning and an
     * empty config. A null path means no hints were supplied.
     */
    public FsmConfig readOrDefault(Path configPath, String controllerName) {
        if (configPath == null) {
            return FsmConfig.empty();
        }
        try {
            return read(configPath, controllerName);
        } catch (FsmConfigReadException e) {
            System.err.println("[crossplc] WARNING: " + e.getMessage() + " (continuing without FSM hints)");
            return FsmConfig.empty();
        }
    }

    private static JsonObject selectSection(JsonObject root, String controllerName) {
        if (!root.has("controllers")) {
            return root;
        }
        JsonObject controllers = root.getAsJsonObject("controllers");
        if (controllerName != null && controllers.has(controllerName)) {
            return controllers.getAsJsonObject(controllerName);
        }
        return controllers.has(DEFAULT_SECTION) ? controllers.getAsJsonObject(DEFAULT_SECTION) : null;
    }

    public static class FsmConfigReadException extends RuntimeException {
        public FsmConfigReadException(String message) { super(message); }
        public FsmConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
