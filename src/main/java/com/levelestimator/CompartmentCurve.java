package com.levelestimator;

import com.levelestimator.model.PkModel;

/**
 * Closed-form impulse responses of the three-compartment model.
 * All times are in days since administration.
 */
public final class CompartmentCurve {

    private CompartmentCurve() {
    }

    /**
     * Level at elapsed time {@code t} after a bolus (injection or oral) dose.
     * Zero before and at administration, for non-positive doses and on numeric overflow.
     */
    public static double singleDoseLevel(double t, double dose, double d, double k1, double k2, double k3) {
        if (t <= 0 || dose <= 0 || d <= 0) {
            return 0.0;
        }

        double value;
        switch (RateCase.of(k1, k2, k3)) {
            case ALL_EQUAL:
                value = dose * d * k1 * k1 * t * t * Math.exp(-k1 * t) / 2.0;
                break;
            case K1_EQUALS_K2:
                value = dose * d * k1 * k1
                        * (Math.exp(-k3 * t) - Math.exp(-k1 * t) * (1 + (k1 - k3) * t))
                        / ((k1 - k3) * (k1 - k3));
                break;
            case K1_EQUALS_K3:
                value = dose * d * k1 * k2
                        * (Math.exp(-k2 * t) - Math.exp(-k1 * t) * (1 + (k1 - k2) * t))
                        / ((k1 - k2) * (k1 - k2));
                break;
            case K2_EQUALS_K3:
                value = dose * d * k1 * k2
                        * (Math.exp(-k1 * t) - Math.exp(-k2 * t) * (1 - (k1 - k2) * t))
                        / ((k1 - k2) * (k1 - k2));
                break;
            default:
                value = dose * d * k1 * k2 * (
                        Math.exp(-k1 * t) / (k1 - k2) / (k1 - k3)
                        - Math.exp(-k2 * t) / (k1 - k2) / (k2 - k3)
                        + Math.exp(-k3 * t) / (k1 - k3) / (k2 - k3));
                break;
        }
        return finiteNonNegative(value);
    }

    public static double singleDoseLevel(double t, double dose, PkModel model) {
        return singleDoseLevel(t, dose, model.d, model.k1, model.k2, model.k3);
    }

    /**
     * Level at elapsed time {@code t} after applying a patch worn for {@code wearDays}.
     * While worn it follows the bolus curve; after removal the two downstream
     * compartments decay freely from their state at removal.
     */
    public static double patchLevel(double t, double dose, double d, double k1, double k2, double k3,
                                    double wearDays) {
        if (t < 0) {
            return 0.0;
        }
        if (t <= wearDays) {
            return singleDoseLevel(t, dose, d, k1, k2, k3);
        }

        double secondaryAtRemoval = secondaryCompartmentLevel(wearDays, dose, d, k1, k2);
        double levelAtRemoval = singleDoseLevel(wearDays, dose, d, k1, k2, k3);
        double after = t - wearDays;

        double value = 0.0;
        if (secondaryAtRemoval > 0) {
            if (RateCase.coincide(k2, k3)) {
                value += secondaryAtRemoval * k2 * after * Math.exp(-k2 * after);
            } else {
                value += secondaryAtRemoval * k2 / (k2 - k3) * (Math.exp(-k3 * after) - Math.exp(-k2 * after));
            }
        }
        if (levelAtRemoval > 0) {
            value += levelAtRemoval * Math.exp(-k3 * after);
        }
        return finiteNonNegative(value);
    }

    public static double patchLevel(double t, double dose, PkModel model) {
        return patchLevel(t, dose, model.d, model.k1, model.k2, model.k3, model.wearDays);
    }

    /**
     * Level contributed by one dose of {@code model}, dispatching on delivery type.
     */
    public static double level(double t, double dose, PkModel model) {
        return model.isPatch() ? patchLevel(t, dose, model) : singleDoseLevel(t, dose, model);
    }

    /**
     * State of the second compartment after a bolus, used to seed the post-removal
     * decay of a patch.
     */
    static double secondaryCompartmentLevel(double t, double dose, double d, double k1, double k2) {
        if (t < 0 || dose <= 0 || d <= 0) {
            return 0.0;
        }
        double value;
        if (RateCase.coincide(k1, k2)) {
            value = dose * d * k1 * t * Math.exp(-k1 * t);
        } else {
            value = dose * d * k1 / (k1 - k2) * (Math.exp(-k2 * t) - Math.exp(-k1 * t));
        }
        return finiteNonNegative(value);
    }

    /**
     * Steady-state level at {@code tMod} days into the interval of a unit dose repeated
     * every {@code interval} days forever. Uses the geometric series of the
     * all-distinct closed form, so only meaningful for {@link RateCase#ALL_DISTINCT}.
     */
    public static double steadyStateUnitLevel(double tMod, double interval, double d, double k1, double k2,
                                              double k3) {
        if (interval <= 0 || d <= 0) {
            return 0.0;
        }
        double value = d * k1 * k2 * (
                geometric(k1, tMod, interval) / (k1 - k2) / (k1 - k3)
                - geometric(k2, tMod, interval) / (k1 - k2) / (k2 - k3)
                + geometric(k3, tMod, interval) / (k1 - k3) / (k2 - k3));
        return finiteNonNegative(value);
    }

    /**
     * Age in days after which a dose counts as eliminated: {@code halfLives} half-lives
     * of each of the three rates, summed. Used for pruning.
     */
    public static double terminalEliminationDays(PkModel model, double halfLives) {
        return halfLives * Math.log(2) * (1.0 / model.k1 + 1.0 / model.k2 + 1.0 / model.k3);
    }

    // sum over n >= 0 of exp(-k * (t + n * interval))
    private static double geometric(double k, double t, double interval) {
        return Math.exp(-k * t) / (1.0 - Math.exp(-k * interval));
    }

    private static double finiteNonNegative(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, value);
    }
}
