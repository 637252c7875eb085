package com.levelestimator;

import com.levelestimator.config.EstimatorConfig;
import com.levelestimator.config.ModelRegistry;
import com.levelestimator.model.BloodTest;
import com.levelestimator.model.DoseRecord;
import com.levelestimator.model.DosingPlan;
import com.levelestimator.model.PkModel;
import com.levelestimator.model.Schedule;
import com.levelestimator.model.TargetCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs one estimation pass over a dose and blood test history: recurring dose
 * expansion, calibration, current level and regimen suggestions.
 * Stateless between passes; the same inputs always give the same estimate.
 */
public class LevelEstimator {
    public static final String ID = "level_estimator";
    public static final Logger LOGGER = LoggerFactory.getLogger(ID);

    /**
     * Outcome of one pass. Levels are in the configured display unit.
     */
    public static class Estimate {
        public final double currentLevel;
        public final Calibration.Result calibration;
        public final double baselineLevel;
        public final double baselineTestTimestamp;
        public final Schedule suggestedRegimen;
        public final CycleFitSolver.FitResult cycleFit;
        public final List<DoseRecord> manualDoses;
        public final List<DoseRecord> automaticDoses;

        public Estimate(double currentLevel, Calibration.Result calibration, double baselineLevel,
                        double baselineTestTimestamp, Schedule suggestedRegimen, CycleFitSolver.FitResult cycleFit,
                        List<DoseRecord> manualDoses, List<DoseRecord> automaticDoses) {
            this.currentLevel = currentLevel;
            this.calibration = calibration;
            this.baselineLevel = baselineLevel;
            this.baselineTestTimestamp = baselineTestTimestamp;
            this.suggestedRegimen = suggestedRegimen;
            this.cycleFit = cycleFit;
            this.manualDoses = Collections.unmodifiableList(manualDoses);
            this.automaticDoses = Collections.unmodifiableList(automaticDoses);
        }
    }

    /**
     * Suggested regimen: exactly one of a single schedule or a cycle fit.
     */
    public static class Regimen {
        public final Schedule single;
        public final CycleFitSolver.FitResult cycleFit;

        Regimen(Schedule single, CycleFitSolver.FitResult cycleFit) {
            this.single = single;
            this.cycleFit = cycleFit;
        }
    }

    private final ModelRegistry registry;
    private final EstimatorConfig config;
    private final LevelAggregator aggregator;
    private final Calibration calibration;
    private final RegimenSolver regimenSolver;
    private final CycleFitSolver cycleFitSolver;
    private final DoseScheduleExpander expander;

    public LevelEstimator(ModelRegistry registry, EstimatorConfig config) {
        this.registry = registry;
        this.config = config;
        this.aggregator = new LevelAggregator(registry);
        this.calibration = new Calibration(aggregator, config);
        this.regimenSolver = new RegimenSolver(registry, config);
        this.cycleFitSolver = new CycleFitSolver(registry, config);
        this.expander = new DoseScheduleExpander(config.getCycleLengthDays(), config.getLookaheadDays());
    }

    public LevelAggregator getAggregator() {
        return aggregator;
    }

    /**
     * Estimate at {@code now} (seconds since epoch). The first configured plan is the
     * primary one: it drives the suggested regimen and the baseline model.
     */
    public Estimate estimate(double now, List<DoseRecord> manualDoses, List<BloodTest> bloodTests) {
        List<DoseRecord> manual = aggregator.pruneStale(manualDoses, now, config.getEliminationHalfLives());

        List<DosingPlan> plans = config.getPlans();
        Regimen primaryRegimen = null;
        List<DoseRecord> automatic = new ArrayList<>();
        for (int i = 0; i < plans.size(); i++) {
            DosingPlan plan = plans.get(i);
            Regimen regimen = plan.isAutoRegimen() ? suggest(plan) : null;
            if (i == 0) {
                primaryRegimen = regimen;
            }
            automatic.addAll(automaticDoses(plan, regimen, now));
        }

        List<DoseRecord> combined = new ArrayList<>(manual);
        combined.addAll(automatic);

        Calibration.Result scale = calibration.calibrate(bloodTests, combined, now,
                config.getCalibrationDecayLambda());
        double level = aggregator.levelAt(now, combined, scale.factor);

        double baseline = 0.0;
        double baselineTimestamp = 0.0;
        DosingPlan primary = plans.isEmpty() ? null : plans.get(0);
        PkModel primaryModel = primary == null ? null
                : registry.model(registry.resolveModelKey(primary.getEster(), primary.getMethod(),
                primary.getIntervalDays()));
        if (primaryModel != null) {
            baseline = calibration.baselineLevel(bloodTests, combined, scale, now, primaryModel.k3);
            if (baseline > 0) {
                baselineTimestamp = Calibration.latest(bloodTests).timestamp;
                LOGGER.info("No dose explains the blood tests; anchoring baseline {} to latest test",
                        String.format("%.2f", baseline));
            }
        }

        double display = config.getUnit().fromPgPerMl(level + baseline);
        LOGGER.info("Estimated level {} {} from {} manual and {} automatic doses ({})",
                String.format("%.1f", display), config.getUnit().label, manual.size(), automatic.size(), scale);

        return new Estimate(display, scale, baseline, baselineTimestamp,
                primaryRegimen == null ? null : primaryRegimen.single,
                primaryRegimen == null ? null : primaryRegimen.cycleFit,
                manual, automatic);
    }

    /**
     * Regimen for a plan's target: a cycle fit for cycle-shaped targets, otherwise a
     * single schedule reaching the target trough.
     *
     * @return the regimen, or null when the combination is unsupported or nothing fits
     */
    public Regimen suggest(DosingPlan plan) {
        String modelKey = registry.regimenModelKey(plan.getEster(), plan.getMethod());
        if (modelKey == null) {
            LOGGER.warn("Unsupported combination {} {}", plan.getEster(), plan.getMethod());
            return null;
        }
        if (plan.getTargetType().cycleFit) {
            CycleFitSolver.FitResult fit = cycleFitSolver.fitCycle(modelKey, TargetCurve.menstrualMean());
            return fit == null ? null : new Regimen(null, fit);
        }
        Schedule schedule = regimenSolver.suggestRegimen(modelKey, plan.getTargetType().troughLevel);
        return schedule == null ? null : new Regimen(schedule, null);
    }

    /**
     * Upcoming automatic doses for a plan in automatic or both mode. A non-null
     * regimen replaces the configured dose and interval.
     */
    public List<DoseRecord> automaticDoses(DosingPlan plan, Regimen regimen, double now) {
        if (!plan.getMode().generatesDoses()) {
            return new ArrayList<>();
        }
        if (regimen != null && regimen.cycleFit != null) {
            return expander.expandAll(regimen.cycleFit.schedules, now, plan.doseTimeOfDay());
        }

        double dose = regimen != null ? regimen.single.doseMg : plan.getDoseMg();
        double interval = regimen != null ? regimen.single.intervalDays : plan.getIntervalDays();
        String modelKey = registry.resolveModelKey(plan.getEster(), plan.getMethod(), interval);
        if (modelKey == null) {
            LOGGER.warn("Plan {} {} has no PK model, no automatic doses", plan.getEster(), plan.getMethod());
            return new ArrayList<>();
        }
        Schedule schedule = new Schedule(dose, interval, plan.getPhaseDays(), modelKey);
        return expander.expand(schedule, now, plan.doseTimeOfDay());
    }
}
