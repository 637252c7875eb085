package com.levelestimator;

/**
 * Which of the three rate constants coincide. Each case has its own closed form
 * in {@link CompartmentCurve}.
 */
public enum RateCase {
    ALL_EQUAL("k1 = k2 = k3"),
    K1_EQUALS_K2("k1 = k2 != k3"),
    K1_EQUALS_K3("k1 = k3 != k2"),
    K2_EQUALS_K3("k2 = k3 != k1"),
    ALL_DISTINCT("k1, k2, k3 distinct");

    /** Relative gap under which two rate constants are treated as equal. */
    public static final double RELATIVE_TOLERANCE = 1e-9;

    public final String description;

    RateCase(String description) {
        this.description = description;
    }

    public static RateCase of(double k1, double k2, double k3) {
        if (coincide(k1, k2)) {
            return coincide(k2, k3) ? ALL_EQUAL : K1_EQUALS_K2;
        }
        if (coincide(k1, k3)) {
            return K1_EQUALS_K3;
        }
        if (coincide(k2, k3)) {
            return K2_EQUALS_K3;
        }
        return ALL_DISTINCT;
    }

    /**
     * Whether two rate constants are close enough that the distinct-rate closed
     * form would lose its precision to cancellation.
     */
    public static boolean coincide(double a, double b) {
        return Math.abs(a - b) <= RELATIVE_TOLERANCE * Math.max(Math.abs(a), Math.abs(b));
    }
}
