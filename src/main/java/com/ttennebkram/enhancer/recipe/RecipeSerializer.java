package com.ttennebkram.enhancer.recipe;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handles serialization and deserialization of recipes to/from JSON.
 *
 * <pre>
 * { "name": "xray",
 *   "steps": [ {"operation": "clahe_enhance", "params": {"clip_limit": "3.0"}} ] }
 * </pre>
 *
 * Parameter values may be written as JSON strings, numbers or booleans; arrays
 * (such as control points) are kept as their JSON text.
 */
public class RecipeSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static Recipe load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    /**
     * @throws JsonParseException if the document is not a valid recipe
     */
    public static Recipe load(Reader reader) {
        JsonElement parsed = JsonParser.parseReader(reader);
        if (!parsed.isJsonObject()) {
            throw new JsonParseException("Recipe must be a JSON object");
        }
        JsonObject root = parsed.getAsJsonObject();
        String name = root.has("name") ? root.get("name").getAsString() : "";

        List<RecipeStep> steps = new ArrayList<>();
        if (root.has("steps")) {
            JsonArray stepsArray = root.getAsJsonArray("steps");
            for (int i = 0; i < stepsArray.size(); i++) {
                steps.add(parseStep(stepsArray.get(i), i));
            }
        }
        return new Recipe(name, steps);
    }

    private static RecipeStep parseStep(JsonElement element, int index) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("Step " + index + " must be an object");
        }
        JsonObject stepJson = element.getAsJsonObject();
        if (!stepJson.has("operation")) {
            throw new JsonParseException("Step " + index + " has no operation");
        }
        String operation = stepJson.get("operation").getAsString();

        Map<String, String> params = new LinkedHashMap<>();
        if (stepJson.has("params")) {
            for (Map.Entry<String, JsonElement> entry : stepJson.getAsJsonObject("params").entrySet()) {
                JsonElement value = entry.getValue();
                if (value.isJsonNull()) {
                    continue;
                }
                params.put(entry.getKey(), value.isJsonPrimitive() ? value.getAsString() : value.toString());
            }
        }
        return new RecipeStep(operation, params);
    }

    public static void save(Recipe recipe, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            save(recipe, writer);
        }
    }

    public static void save(Recipe recipe, Writer writer) {
        GSON.toJson(toJson(recipe), writer);
    }

    public static JsonObject toJson(Recipe recipe) {
        JsonObject root = new JsonObject();
        root.addProperty("name", recipe.getName());
        JsonArray stepsArray = new JsonArray();
        for (RecipeStep step : recipe.getSteps()) {
            JsonObject stepJson = new JsonObject();
            stepJson.addProperty("operation", step.getOperation());
            JsonObject params = new JsonObject();
            for (Map.Entry<String, String> entry : step.getParams().entrySet()) {
                params.addProperty(entry.getKey(), entry.getValue());
            }
            stepJson.add("params", params);
            stepsArray.add(stepJson);
        }
        root.add("steps", stepsArray);
        return root;
    }
}
