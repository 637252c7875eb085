package com.levelestimator.model;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reference level curve over one cycle, as ordered (cycle day, level) pairs.
 */
public final class TargetCurve {
    private static final Gson GSON = new Gson();
    private static final String MENSTRUAL_RESOURCE = "/menstrual_cycle.json";

    private final double[] days;
    private final double[] levels;
    private final int cycleLengthDays;

    private static final class ReferenceDocument {
        int cycleLengthDays;
        double[] days;
        double[] mean;
        double[] p5;
        double[] p95;
    }

    public TargetCurve(double[] days, double[] levels, int cycleLengthDays) {
        if (days.length != levels.length || days.length == 0) {
            throw new IllegalArgumentException("Target curve needs matching, non-empty day and level arrays");
        }
        for (int i = 1; i < days.length; i++) {
            if (days[i] <= days[i - 1]) {
                throw new IllegalArgumentException("Target curve days must be strictly increasing");
            }
        }
        this.days = days.clone();
        this.levels = levels.clone();
        this.cycleLengthDays = cycleLengthDays;
    }

    /**
     * Curve given as one level per whole cycle day starting at day 0.
     */
    public static TargetCurve daily(double... levels) {
        double[] days = new double[levels.length];
        for (int i = 0; i < days.length; i++) {
            days[i] = i;
        }
        return new TargetCurve(days, levels, levels.length);
    }

    public static TargetCurve constant(double level, int cycleLengthDays) {
        double[] levels = new double[cycleLengthDays];
        Arrays.fill(levels, level);
        return daily(levels);
    }

    /**
     * Mean serum level across a 28-day menstrual cycle.
     */
    public static TargetCurve menstrualMean() {
        ReferenceDocument doc = loadReference();
        return new TargetCurve(doc.days, doc.mean, doc.cycleLengthDays);
    }

    public static TargetCurve menstrualPercentile5() {
        ReferenceDocument doc = loadReference();
        return new TargetCurve(doc.days, doc.p5, doc.cycleLengthDays);
    }

    public static TargetCurve menstrualPercentile95() {
        ReferenceDocument doc = loadReference();
        return new TargetCurve(doc.days, doc.p95, doc.cycleLengthDays);
    }

    public int getCycleLengthDays() {
        return cycleLengthDays;
    }

    public int size() {
        return days.length;
    }

    public double dayAt(int i) {
        return days[i];
    }

    public double levelAt(int i) {
        return levels[i];
    }

    /**
     * Level at each whole day {@code 0..nDays-1}, linearly interpolated between
     * samples and held constant beyond the first and last sample.
     */
    public double[] sample(int nDays) {
        double[] out = new double[nDays];
        if (days.length == 1) {
            Arrays.fill(out, levels[0]);
            return out;
        }
        PolynomialSplineFunction f = new LinearInterpolator().interpolate(days, levels);
        double first = days[0];
        double last = days[days.length - 1];
        for (int day = 0; day < nDays; day++) {
            if (day <= first) {
                out[day] = levels[0];
            } else if (day >= last) {
                out[day] = levels[levels.length - 1];
            } else {
                out[day] = f.value(day);
            }
        }
        return out;
    }

    private static ReferenceDocument loadReference() {
        try (InputStream in = TargetCurve.class.getResourceAsStream(MENSTRUAL_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing reference curve " + MENSTRUAL_RESOURCE);
            }
            ReferenceDocument doc = GSON.fromJson(new InputStreamReader(in, StandardCharsets.UTF_8),
                    ReferenceDocument.class);
            if (doc == null || doc.days == null || doc.mean == null) {
                throw new IllegalStateException("Reference curve " + MENSTRUAL_RESOURCE + " is empty");
            }
            return doc;
        } catch (IOException | JsonParseException e) {
            throw new IllegalStateException("Failed to read reference curve " + MENSTRUAL_RESOURCE, e);
        }
    }
}
