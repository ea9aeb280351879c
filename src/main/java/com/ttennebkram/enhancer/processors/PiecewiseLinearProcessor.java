package com.ttennebkram.enhancer.processors;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ttennebkram.enhancer.engine.EnhancementResult;
import com.ttennebkram.enhancer.engine.InvalidParameterException;
import com.ttennebkram.enhancer.engine.ParameterReader;
import com.ttennebkram.enhancer.image.GrayImage;
import com.ttennebkram.enhancer.image.RasterImage;
import org.opencv.core.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Piecewise linear intensity mapping through (x, y) control points.
 *
 * Points are sorted by x and joined by straight segments. Intensities left of
 * the first point take its y, right of the last point take the last y.
 * Segments whose endpoints share an x are skipped.
 */
@ProcessorInfo(
    operation = "piecewise_linear_transform",
    category = "Tonal",
    description = "Piecewise linear LUT on grayscale\npoints = [[x0,y0],[x1,y1],...] or x0,y0;x1,y1;..."
)
public class PiecewiseLinearProcessor extends ProcessorBase<PiecewiseLinearProcessor.Params> {

    static final List<Point> IDENTITY = Collections.unmodifiableList(Arrays.asList(new Point(0, 0), new Point(255, 255)));

    public static final class Params {
        /** Sorted by x */
        public final List<Point> points;

        public Params(List<Point> points) {
            List<Point> sorted = new ArrayList<>(points);
            sorted.sort(Comparator.comparingDouble(p -> p.x));
            this.points = Collections.unmodifiableList(sorted);
        }
    }

    @Override
    public Params parseParameters(ParameterReader reader) throws InvalidParameterException {
        List<Point> points = reader.getPoints("points", IDENTITY);
        if (points.size() < 2) {
            throw reader.invalid("points", "at least two control points are required");
        }
        return new Params(points);
    }

    @Override
    public EnhancementResult process(RasterImage input, Params params) {
        GrayImage gray = input.toGray();
        try {
            return result(restoreChannels(applyLut(gray.mat(), buildTable(params.points)), input));
        } finally {
            releaseIfDerived(gray, input);
        }
    }

    static int[] buildTable(List<Point> sorted) {
        Point first = sorted.get(0);
        Point last = sorted.get(sorted.size() - 1);
        int[] table = new int[LUT_SIZE];
        for (int i = 0; i < LUT_SIZE; i++) {
            if (i <= first.x) {
                table[i] = clampToByte(first.y);
            } else if (i >= last.x) {
                table[i] = clampToByte(last.y);
            } else {
                table[i] = clampToByte(interpolate(sorted, i));
            }
        }
        return table;
    }

    private static double interpolate(List<Point> sorted, int x) {
        for (int k = 0; k < sorted.size() - 1; k++) {
            Point p1 = sorted.get(k);
            Point p2 = sorted.get(k + 1);
            if (p2.x == p1.x) {
                continue;
            }
            if (x >= p1.x && x <= p2.x) {
                return p1.y + (x - p1.x) * (p2.y - p1.y) / (p2.x - p1.x);
            }
        }
        // Unreachable for first.x < x < last.x; keep the value unchanged
        return x;
    }

    @Override
    public void serializeParameters(Params params, JsonObject json) {
        JsonArray points = new JsonArray();
        for (Point p : params.points) {
            JsonArray pair = new JsonArray();
            pair.add(p.x);
            pair.add(p.y);
            points.add(pair);
        }
        json.add("points", points);
    }
}
