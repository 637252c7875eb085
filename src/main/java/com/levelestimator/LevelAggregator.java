package com.levelestimator;

import com.levelestimator.config.ModelRegistry;
import com.levelestimator.model.DoseRecord;
import com.levelestimator.model.PkModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Sums the contributions of a dose history at a query time.
 */
public class LevelAggregator {
    public static final double SECONDS_PER_DAY = 86400.0;

    private final ModelRegistry registry;

    public LevelAggregator(ModelRegistry registry) {
        this.registry = registry;
    }

    /**
     * Estimated level at {@code queryTime} (seconds since epoch), multiplied by
     * {@code scale}. Doses with an unknown model key are skipped.
     */
    public double levelAt(double queryTime, List<DoseRecord> doses, double scale) {
        double total = 0.0;
        for (DoseRecord dose : doses) {
            PkModel model = registry.model(dose.modelKey);
            if (model == null) {
                LevelEstimator.LOGGER.debug("Skipping dose with unknown model '{}'", dose.modelKey);
                continue;
            }
            double elapsedDays = (queryTime - dose.timestamp) / SECONDS_PER_DAY;
            total += CompartmentCurve.level(elapsedDays, dose.amountMg, model);
        }
        return total * scale;
    }

    public double levelAt(double queryTime, List<DoseRecord> doses) {
        return levelAt(queryTime, doses, 1.0);
    }

    /**
     * Level sampled every {@code stepDays} from {@code start} to {@code end} inclusive.
     */
    public double[] curve(double start, double end, double stepDays, List<DoseRecord> doses, double scale) {
        if (end < start || stepDays <= 0) {
            return new double[0];
        }
        double stepSeconds = stepDays * SECONDS_PER_DAY;
        int n = (int) Math.floor((end - start) / stepSeconds) + 1;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = levelAt(start + i * stepSeconds, doses, scale);
        }
        return out;
    }

    /**
     * Doses still contributing at {@code now}: drops records older than their model's
     * terminal elimination time. Unknown models are kept.
     */
    public List<DoseRecord> pruneStale(List<DoseRecord> doses, double now, double halfLives) {
        List<DoseRecord> kept = new ArrayList<>(doses.size());
        int dropped = 0;
        for (DoseRecord dose : doses) {
            PkModel model = registry.model(dose.modelKey);
            if (model != null) {
                double maxAgeDays = CompartmentCurve.terminalEliminationDays(model, halfLives);
                if (dose.timestamp < now - maxAgeDays * SECONDS_PER_DAY) {
                    dropped++;
                    continue;
                }
            }
            kept.add(dose);
        }
        if (dropped > 0) {
            LevelEstimator.LOGGER.debug("Pruned {} stale doses", dropped);
        }
        return kept;
    }
}
