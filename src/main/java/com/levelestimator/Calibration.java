package com.levelestimator;

import com.levelestimator.config.EstimatorConfig;
import com.levelestimator.model.BloodTest;
import com.levelestimator.model.DoseRecord;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a scale factor for the model from measured levels, weighting recent
 * tests more heavily.
 */
public class Calibration {

    /**
     * Weighted mean of measured/predicted ratios and its weighted variance.
     */
    public static class Result {
        public static final Result UNCALIBRATED = new Result(1.0, 0.0, 0);

        public final double factor;
        public final double variance;
        public final int usableTests;

        public Result(double factor, double variance, int usableTests) {
            this.factor = factor;
            this.variance = variance;
            this.usableTests = usableTests;
        }

        public boolean isUncalibrated() {
            return factor == 1.0 && variance == 0.0;
        }

        @Override
        public String toString() {
            return String.format("factor=%.4f, variance=%.4f (%d tests)", factor, variance, usableTests);
        }
    }

    private final LevelAggregator aggregator;
    private final double minPredictedLevel;
    private final double maxFactor;

    public Calibration(LevelAggregator aggregator, double minPredictedLevel, double maxFactor) {
        this.aggregator = aggregator;
        this.minPredictedLevel = minPredictedLevel;
        this.maxFactor = maxFactor;
    }

    public Calibration(LevelAggregator aggregator, EstimatorConfig config) {
        this(aggregator, config.getMinPredictedLevel(), config.getMaxScaleFactor());
    }

    /**
     * Calibrate against {@code tests}. Each test's weight is
     * {@code exp(-decayLambda * ageDays)} with age measured from {@code now}.
     * Tests the model predicts below the minimum level are ignored; with no usable
     * test the result is {@link Result#UNCALIBRATED}. The factor is clamped to
     * {@code [0, maxFactor]}.
     */
    public Result calibrate(List<BloodTest> tests, List<DoseRecord> doses, double now, double decayLambda) {
        if (tests.isEmpty()) {
            return Result.UNCALIBRATED;
        }

        List<Double> ratios = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        double weightTotal = 0.0;

        for (BloodTest test : tests) {
            double predicted = aggregator.levelAt(test.timestamp, doses, 1.0);
            if (predicted < minPredictedLevel) {
                continue;
            }
            double ageDays = (now - test.timestamp) / LevelAggregator.SECONDS_PER_DAY;
            double weight = Math.exp(-decayLambda * ageDays);
            if (Double.isNaN(weight) || Double.isInfinite(weight)) {
                continue;
            }
            ratios.add(test.measuredLevel / predicted);
            weights.add(weight);
            weightTotal += weight;
        }

        if (weightTotal <= 0) {
            LevelEstimator.LOGGER.debug("No usable blood tests out of {}", tests.size());
            return Result.UNCALIBRATED;
        }

        double[] r = toArray(ratios);
        double[] w = toArray(weights);
        double factor = new Mean().evaluate(r, w);
        double variance = new Variance(false).evaluate(r, w, factor);

        Result result = new Result(Math.max(0.0, Math.min(maxFactor, factor)), variance, r.length);
        LevelEstimator.LOGGER.debug("Calibration: {}", result);
        return result;
    }

    /**
     * Residual level anchored to the latest test when the model predicts nothing at
     * any test time: the test level decayed by {@code exp(-k3 * ageDays)}. Zero when
     * the anchor does not apply.
     */
    public double baselineLevel(List<BloodTest> tests, List<DoseRecord> doses, Result calibration, double now,
                                double eliminationRate) {
        if (tests.isEmpty() || !calibration.isUncalibrated()) {
            return 0.0;
        }
        for (BloodTest test : tests) {
            if (aggregator.levelAt(test.timestamp, doses, 1.0) > 0) {
                return 0.0;
            }
        }
        BloodTest latest = latest(tests);
        double ageDays = (now - latest.timestamp) / LevelAggregator.SECONDS_PER_DAY;
        if (ageDays < 0 || eliminationRate <= 0) {
            return 0.0;
        }
        return latest.measuredLevel * Math.exp(-eliminationRate * ageDays);
    }

    public static BloodTest latest(List<BloodTest> tests) {
        BloodTest latest = null;
        for (BloodTest test : tests) {
            if (latest == null || test.timestamp > latest.timestamp) {
                latest = test;
            }
        }
        return latest;
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
