package com.levelestimator;

import com.levelestimator.config.EstimatorConfig;
import com.levelestimator.config.ModelRegistry;
import com.levelestimator.math.LinearSolvers;
import com.levelestimator.model.PkModel;
import com.levelestimator.model.Schedule;
import com.levelestimator.model.TargetCurve;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Approximates a reference curve over one cycle with up to a few periodic schedules
 * of the same model, chosen by greedy forward selection with an NNLS refit per step.
 */
public class CycleFitSolver {

    /** Intervals tried in addition to the model's preferred ones. */
    public static final double[] AUXILIARY_INTERVALS = { 3.5, 4.0, 5.0, 7.0, 9.0, 10.0, 14.0, 28.0 };

    private static final double MIN_INTERVAL = 2.0;
    private static final double MAX_INTERVAL = 28.0;

    /**
     * Schedules found, the level curve they produce with their rounded doses and its
     * RMS deviation from the target.
     */
    public static class FitResult {
        public final List<Schedule> schedules;
        public final double residualRms;
        private final double[] fittedCurve;

        public FitResult(List<Schedule> schedules, double residualRms, double[] fittedCurve) {
            this.schedules = Collections.unmodifiableList(schedules);
            this.residualRms = residualRms;
            this.fittedCurve = fittedCurve.clone();
        }

        /**
         * Level on each cycle day; a copy, one entry per day of the target's cycle.
         */
        public double[] getFittedCurve() {
            return fittedCurve.clone();
        }

        @Override
        public String toString() {
            return String.format("%d schedule(s), RMS=%.2f: %s", schedules.size(), residualRms, schedules);
        }
    }

    /**
     * One (interval, phase) candidate and its unit-dose steady-state curve.
     */
    static class Candidate {
        final double interval;
        final double phase;
        final RealVector basis;

        Candidate(double interval, double phase, RealVector basis) {
            this.interval = interval;
            this.phase = phase;
            this.basis = basis;
        }
    }

    private final ModelRegistry registry;
    private final EstimatorConfig config;

    public CycleFitSolver(ModelRegistry registry, EstimatorConfig config) {
        this.registry = registry;
        this.config = config;
    }

    public FitResult fitCycle(String modelKey, TargetCurve target) {
        return fitCycle(modelKey, target, config.getMaxSchedules());
    }

    /**
     * Fit {@code target} over its own cycle length with at most {@code maxSchedules}
     * schedules. Intervals longer than the cycle are not tried.
     *
     * @return the fit, or null for an unknown model, a model without distinct rate
     *         constants, or when no schedule improves on dosing nothing
     */
    public FitResult fitCycle(String modelKey, TargetCurve target, int maxSchedules) {
        PkModel model = registry.model(modelKey);
        if (model == null) {
            LevelEstimator.LOGGER.warn("No PK parameters for model '{}'", modelKey);
            return null;
        }
        if (model.rateCase() != RateCase.ALL_DISTINCT) {
            LevelEstimator.LOGGER.warn("Cycle fit needs distinct rate constants, {} has {}",
                    modelKey, model.rateCase().description);
            return null;
        }
        int nDays = target.getCycleLengthDays();
        if (maxSchedules <= 0 || nDays <= 0) {
            return null;
        }

        RealVector targetVector = new ArrayRealVector(target.sample(nDays), false);
        List<Candidate> candidates = candidates(model, nDays);

        List<Integer> selected = selectGreedy(candidates, targetVector, maxSchedules);
        if (selected.isEmpty()) {
            LevelEstimator.LOGGER.info("Cycle fit for {}: no schedule improves on zero dosing", modelKey);
            return null;
        }

        // Final refit on the selected set, then drop negligible and round the rest
        RealVector finalDoses = LinearSolvers.nnls(designMatrix(candidates, selected, null, nDays), targetVector);
        List<Schedule> schedules = new ArrayList<>();
        List<Candidate> kept = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            double raw = finalDoses.getEntry(i);
            if (raw < config.getNegligibleDose()) {
                continue;
            }
            Candidate c = candidates.get(selected.get(i));
            schedules.add(new Schedule(config.roundDose(raw), c.interval, c.phase, modelKey));
            kept.add(c);
        }
        if (schedules.isEmpty()) {
            LevelEstimator.LOGGER.info("Cycle fit for {}: all doses negligible", modelKey);
            return null;
        }

        // Report quality for the doses that will actually be given
        RealVector fitted = new ArrayRealVector(nDays);
        for (int i = 0; i < schedules.size(); i++) {
            fitted = fitted.add(kept.get(i).basis.mapMultiply(schedules.get(i).doseMg));
        }
        double rms = Math.sqrt(LinearSolvers.meanSquare(targetVector.subtract(fitted)));

        FitResult result = new FitResult(schedules, rms, fitted.toArray());
        LevelEstimator.LOGGER.info("Cycle fit for {}: {}", modelKey, result);
        return result;
    }

    /**
     * Greedy forward selection. Each step adds the candidate whose NNLS refit has
     * the lowest mean-square error; stops when nothing improves, when the relative
     * gain drops under the configured minimum after the first pick, or at the cap.
     */
    List<Integer> selectGreedy(List<Candidate> candidates, RealVector target, int maxSchedules) {
        int nDays = target.getDimension();
        List<Integer> selected = new ArrayList<>();
        double previousMse = LinearSolvers.meanSquare(target);

        for (int step = 0; step < maxSchedules; step++) {
            int best = -1;
            double bestMse = previousMse;
            for (int ci = 0; ci < candidates.size(); ci++) {
                if (selected.contains(ci)) {
                    continue;
                }
                RealMatrix a = designMatrix(candidates, selected, ci, nDays);
                RealVector x = LinearSolvers.nnls(a, target);
                double mse = LinearSolvers.meanSquare(target.subtract(a.operate(x)));
                if (mse < bestMse) {
                    bestMse = mse;
                    best = ci;
                }
            }

            if (best < 0) {
                break;
            }
            if (step > 0 && previousMse > 0
                    && (previousMse - bestMse) / previousMse < config.getMinRelativeImprovement()) {
                LevelEstimator.LOGGER.debug("Step {}: improvement {} below threshold, stopping", step,
                        String.format("%.4f", (previousMse - bestMse) / previousMse));
                break;
            }
            selected.add(best);
            Candidate c = candidates.get(best);
            LevelEstimator.LOGGER.debug("Step {}: interval={}d phase={} MSE {} -> {}", step, c.interval, c.phase,
                    String.format("%.3f", previousMse), String.format("%.3f", bestMse));
            previousMse = bestMse;
        }
        return selected;
    }

    /**
     * Preferred intervals plus the auxiliary set, limited to [2, 28] days and to the
     * cycle length, with one candidate per whole-day phase within each interval.
     */
    List<Candidate> candidates(PkModel model, int nDays) {
        TreeSet<Double> intervals = new TreeSet<>(registry.preferredIntervals(model.key));
        for (double interval : AUXILIARY_INTERVALS) {
            intervals.add(interval);
        }

        List<Candidate> candidates = new ArrayList<>();
        for (double interval : intervals) {
            if (interval < MIN_INTERVAL || interval > Math.min(MAX_INTERVAL, nDays)) {
                continue;
            }
            int phases = Math.max(1, (int) Math.ceil(interval));
            for (int phase = 0; phase < phases; phase++) {
                candidates.add(new Candidate(interval, phase, basisCurve(model, interval, phase, nDays)));
            }
        }
        LevelEstimator.LOGGER.debug("{} cycle-fit candidates over {} intervals", candidates.size(), intervals.size());
        return candidates;
    }

    /**
     * Steady-state level on each cycle day from a unit dose every {@code interval}
     * days, first given on day {@code phase}.
     */
    static RealVector basisCurve(PkModel model, double interval, double phase, int nDays) {
        double[] values = new double[nDays];
        for (int day = 0; day < nDays; day++) {
            double tMod = (day - phase) % interval;
            if (tMod < 0) {
                tMod += interval;
            }
            values[day] = CompartmentCurve.steadyStateUnitLevel(tMod, interval, model.d, model.k1, model.k2,
                    model.k3);
        }
        return new ArrayRealVector(values, false);
    }

    private static RealMatrix designMatrix(List<Candidate> candidates, List<Integer> selected, Integer extra,
                                           int nDays) {
        List<RealVector> cols = new ArrayList<>(selected.size() + 1);
        for (int si : selected) {
            cols.add(candidates.get(si).basis);
        }
        if (extra != null) {
            cols.add(candidates.get(extra).basis);
        }
        return LinearSolvers.columns(cols, nDays);
    }
}
