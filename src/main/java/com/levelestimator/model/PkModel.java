package com.levelestimator.model;

import com.levelestimator.RateCase;

/**
 * Three-compartment pharmacokinetic parameter set for one model key.
 * A positive wear duration marks a sustained-release (patch) model.
 */
public final class PkModel {
    public final String key;
    public final double d;
    public final double k1;
    public final double k2;
    public final double k3;
    public final double wearDays; // 0 for bolus models

    public PkModel(String key, double d, double k1, double k2, double k3) {
        this(key, d, k1, k2, k3, 0.0);
    }

    public PkModel(String key, double d, double k1, double k2, double k3, double wearDays) {
        this.key = key;
        this.d = d;
        this.k1 = k1;
        this.k2 = k2;
        this.k3 = k3;
        this.wearDays = wearDays;
    }

    public boolean isPatch() {
        return wearDays > 0;
    }

    public RateCase rateCase() {
        return RateCase.of(k1, k2, k3);
    }

    @Override
    public String toString() {
        return String.format("%s[d=%s, k1=%s, k2=%s, k3=%s%s]", key, d, k1, k2, k3,
                isPatch() ? ", wear=" + wearDays + "d" : "");
    }
}
