package com.levelestimator.model;

import java.util.Objects;

/**
 * Periodic dosing plan: {@code doseMg} every {@code intervalDays}, first dose on
 * cycle day {@code phaseDays}.
 */
public final class Schedule {
    public final double doseMg;
    public final double intervalDays;
    public final double phaseDays;
    public final String modelKey;

    public Schedule(double doseMg, double intervalDays, double phaseDays, String modelKey) {
        this.doseMg = doseMg;
        this.intervalDays = intervalDays;
        this.phaseDays = phaseDays;
        this.modelKey = modelKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schedule)) {
            return false;
        }
        Schedule other = (Schedule) o;
        return Double.compare(doseMg, other.doseMg) == 0
                && Double.compare(intervalDays, other.intervalDays) == 0
                && Double.compare(phaseDays, other.phaseDays) == 0
                && Objects.equals(modelKey, other.modelKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(doseMg, intervalDays, phaseDays, modelKey);
    }

    @Override
    public String toString() {
        return String.format("%s: %.1f every %.1fd (phase %.0f)", modelKey, doseMg, intervalDays, phaseDays);
    }
}
