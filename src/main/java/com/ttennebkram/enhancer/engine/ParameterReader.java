package com.ttennebkram.enhancer.engine;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.opencv.core.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Coerces the raw string parameters of one call into typed values.
 *
 * A default is used only when the key is absent. A key that is present with a
 * blank or malformed value is rejected with {@link InvalidParameterException}.
 */
public class ParameterReader {

    // Plain decimal or scientific notation; no hex, no d/f suffix, no NaN or Infinity words
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final String operation;
    private final Map<String, String> raw;

    public ParameterReader(String operation, Map<String, String> raw) {
        this.operation = operation;
        this.raw = raw != null ? raw : Collections.emptyMap();
    }

    public String getOperation() {
        return operation;
    }

    public boolean has(String key) {
        return raw.containsKey(key);
    }

    /** The untouched value, or null if absent. */
    public String raw(String key) {
        return raw.get(key);
    }

    public double getDouble(String key, double defaultValue) throws InvalidParameterException {
        if (!has(key)) {
            return defaultValue;
        }
        String value = trimmed(key, raw(key));
        if (!DECIMAL.matcher(value).matches()) {
            throw invalid(key, "not a number");
        }
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw invalid(key, "must be a finite number");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw invalid(key, "not a number");
        }
    }

    public int getInt(String key, int defaultValue) throws InvalidParameterException {
        if (!has(key)) {
            return defaultValue;
        }
        String value = raw(key);
        try {
            return Integer.parseInt(trimmed(key, value));
        } catch (NumberFormatException e) {
            throw invalid(key, "not an integer");
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) throws InvalidParameterException {
        if (!has(key)) {
            return defaultValue;
        }
        switch (trimmed(key, raw(key)).toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "on":
                return true;
            case "false":
            case "0":
            case "no":
            case "off":
                return false;
            default:
                throw invalid(key, "not a boolean");
        }
    }

    /**
     * Match the value against the enum constant names, ignoring case.
     */
    public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) throws InvalidParameterException {
        if (!has(key)) {
            return defaultValue;
        }
        String value = trimmed(key, raw(key));
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        List<String> names = new ArrayList<>();
        for (E constant : type.getEnumConstants()) {
            names.add(constant.name().toLowerCase(Locale.ROOT));
        }
        throw invalid(key, "expected one of " + names);
    }

    /**
     * Read a list of (x, y) pairs, either as a JSON array of pairs
     * ({@code [[0,0],[255,255]]}) or as {@code 0,0;255,255}.
     */
    public List<Point> getPoints(String key, List<Point> defaultValue) throws InvalidParameterException {
        if (!has(key)) {
            return defaultValue;
        }
        String value = trimmed(key, raw(key));
        return value.startsWith("[") ? parseJsonPoints(key, value) : parsePairList(key, value);
    }

    private List<Point> parseJsonPoints(String key, String value) throws InvalidParameterException {
        List<Point> points = new ArrayList<>();
        try {
            JsonArray array = JsonParser.parseString(value).getAsJsonArray();
            for (JsonElement element : array) {
                JsonArray pair = element.getAsJsonArray();
                if (pair.size() != 2) {
                    throw invalid(key, "each point needs exactly two coordinates");
                }
                points.add(new Point(pair.get(0).getAsDouble(), pair.get(1).getAsDouble()));
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw invalid(key, "not a list of [x, y] pairs");
        }
        return points;
    }

    private List<Point> parsePairList(String key, String value) throws InvalidParameterException {
        List<Point> points = new ArrayList<>();
        for (String pair : value.split(";")) {
            String[] xy = pair.trim().split(",");
            if (xy.length != 2) {
                throw invalid(key, "expected x,y pairs separated by ';'");
            }
            String x = xy[0].trim();
            String y = xy[1].trim();
            if (!DECIMAL.matcher(x).matches() || !DECIMAL.matcher(y).matches()) {
                throw invalid(key, "not a number in point '" + pair.trim() + "'");
            }
            points.add(new Point(Double.parseDouble(x), Double.parseDouble(y)));
        }
        return points;
    }

    private String trimmed(String key, String value) throws InvalidParameterException {
        if (value == null || value.trim().isEmpty()) {
            throw invalid(key, "empty value");
        }
        return value.trim();
    }

    // Domain checks, called by processors after coercion

    public void requireAtLeast(String key, double value, double min) throws InvalidParameterException {
        if (value < min) {
            throw invalid(key, "must be >= " + format(min));
        }
    }

    public void requirePositive(String key, double value) throws InvalidParameterException {
        if (value <= 0) {
            throw invalid(key, "must be > 0");
        }
    }

    public void requireRange(String key, double value, double min, double max) throws InvalidParameterException {
        if (value < min || value > max) {
            throw invalid(key, "must be between " + format(min) + " and " + format(max));
        }
    }

    public InvalidParameterException invalid(String key, String reason) {
        String value = has(key) ? raw(key) : "<default>";
        return new InvalidParameterException(operation, key, value, reason);
    }

    private static String format(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }
}
