package com.ttennebkram.enhancer.image;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dominant colors of an image, most dominant first.
 */
public final class Palette {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final List<Swatch> swatches;

    public Palette(List<Swatch> swatches) {
        this.swatches = Collections.unmodifiableList(new ArrayList<>(swatches));
    }

    public List<Swatch> swatches() {
        return swatches;
    }

    public int size() {
        return swatches.size();
    }

    public Swatch get(int index) {
        return swatches.get(index);
    }

    public List<String> hexColors() {
        List<String> out = new ArrayList<>(swatches.size());
        for (Swatch s : swatches) {
            out.add(s.hex());
        }
        return out;
    }

    public JsonObject toJsonObject() {
        JsonObject root = new JsonObject();
        JsonArray colors = new JsonArray();
        JsonArray details = new JsonArray();
        for (Swatch s : swatches) {
            colors.add(s.hex());
            JsonObject entry = new JsonObject();
            entry.addProperty("hex", s.hex());
            entry.addProperty("r", s.red());
            entry.addProperty("g", s.green());
            entry.addProperty("b", s.blue());
            entry.addProperty("pixels", s.pixelCount());
            entry.addProperty("coverage", s.coverage());
            details.add(entry);
        }
        root.add("colors", colors);
        root.add("swatches", details);
        return root;
    }

    public String toJson() {
        return GSON.toJson(toJsonObject());
    }

    @Override
    public String toString() {
        return "Palette" + hexColors();
    }
}
