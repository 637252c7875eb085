package com.levelestimator;

import com.levelestimator.config.EstimatorConfig;
import com.levelestimator.config.ModelRegistry;
import com.levelestimator.model.PkModel;
import com.levelestimator.model.Schedule;

/**
 * Picks a dosing interval and the dose that reaches a trough level at steady state.
 */
public class RegimenSolver {

    private final ModelRegistry registry;
    private final EstimatorConfig config;

    public RegimenSolver(ModelRegistry registry, EstimatorConfig config) {
        this.registry = registry;
        this.config = config;
    }

    /**
     * Schedule reaching {@code targetTrough} with the first preferred interval that is
     * allowed and feasible. Intervals are tried in order of clinical preference and the
     * first success wins.
     *
     * @return the schedule, or null for an unknown model, a non-positive target or when
     *         no interval is feasible
     */
    public Schedule suggestRegimen(String modelKey, double targetTrough) {
        PkModel model = registry.model(modelKey);
        if (model == null) {
            LevelEstimator.LOGGER.warn("No PK parameters for model '{}'", modelKey);
            return null;
        }
        if (!(targetTrough > 0)) {
            return null;
        }

        for (double interval : registry.preferredIntervals(modelKey)) {
            if (interval <= 0 || 7.0 / interval > config.getMaxAdministrationsPerWeek()) {
                LevelEstimator.LOGGER.debug("{}: skipping {}d interval ({} administrations/week)",
                        modelKey, interval, String.format("%.1f", 7.0 / interval));
                continue;
            }

            double troughPerUnit = troughPerUnitDose(model, interval);
            if (troughPerUnit <= 0) {
                continue;
            }

            double dose = config.roundDose(targetTrough / troughPerUnit);
            Schedule schedule = new Schedule(dose, interval, 0.0, modelKey);
            LevelEstimator.LOGGER.info("Suggested regimen for trough {}: {} (trough per unit dose {})",
                    targetTrough, schedule, String.format("%.4f", troughPerUnit));
            return schedule;
        }

        LevelEstimator.LOGGER.info("No feasible interval for model '{}'", modelKey);
        return null;
    }

    /**
     * Steady-state trough from a unit dose every {@code interval} days: the sum of the
     * single-dose response at each whole multiple of the interval over the horizon.
     */
    public double troughPerUnitDose(PkModel model, double interval) {
        double trough = 0.0;
        for (int n = 1; n <= config.getTroughHorizonPeriods(); n++) {
            trough += CompartmentCurve.level(n * interval, 1.0, model);
        }
        return trough;
    }
}
