package com.levelestimator.model;

import com.google.gson.annotations.SerializedName;

import java.time.DateTimeException;
import java.time.LocalTime;

/**
 * One configured recurring regimen. Automatic and both modes generate dose records
 * from it; manual mode only records what the user logs.
 */
public class DosingPlan {

    public enum Mode {
        @SerializedName("manual")
        MANUAL,
        @SerializedName("automatic")
        AUTOMATIC,
        @SerializedName("both")
        BOTH;

        public boolean generatesDoses() {
            return this != MANUAL;
        }
    }

    private static final LocalTime DEFAULT_DOSE_TIME = LocalTime.of(8, 0);

    private String ester = "EEn";
    private String method = "im";
    private double doseMg = 4.0;
    private double intervalDays = 7.0;
    private Mode mode = Mode.MANUAL;
    private String doseTime = "08:00";
    private boolean autoRegimen = false;
    private TargetType targetType = TargetType.TARGET_RANGE;
    private double phaseDays = 0.0;

    public DosingPlan() {
    }

    public DosingPlan(String ester, String method, double doseMg, double intervalDays, Mode mode) {
        this.ester = ester;
        this.method = method;
        this.doseMg = doseMg;
        this.intervalDays = intervalDays;
        this.mode = mode;
    }

    public String getEster() {
        return ester;
    }

    public String getMethod() {
        return method;
    }

    public double getDoseMg() {
        return doseMg;
    }

    public double getIntervalDays() {
        return intervalDays;
    }

    public Mode getMode() {
        return mode == null ? Mode.MANUAL : mode;
    }

    public String getDoseTime() {
        return doseTime;
    }

    /**
     * Dose time of day; a malformed value falls back to 08:00.
     */
    public LocalTime doseTimeOfDay() {
        if (doseTime == null) {
            return DEFAULT_DOSE_TIME;
        }
        String[] parts = doseTime.trim().split(":");
        try {
            int hour = Integer.parseInt(parts[0]);
            int minute = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return LocalTime.of(hour, minute);
        } catch (NumberFormatException | DateTimeException e) {
            return DEFAULT_DOSE_TIME;
        }
    }

    public boolean isAutoRegimen() {
        return autoRegimen;
    }

    public TargetType getTargetType() {
        return targetType == null ? TargetType.TARGET_RANGE : targetType;
    }

    public double getPhaseDays() {
        return phaseDays;
    }

    public DosingPlan setDoseTime(String doseTime) {
        this.doseTime = doseTime;
        return this;
    }

    public DosingPlan setAutoRegimen(boolean autoRegimen, TargetType targetType) {
        this.autoRegimen = autoRegimen;
        this.targetType = targetType;
        return this;
    }

    public DosingPlan setPhaseDays(double phaseDays) {
        this.phaseDays = Math.max(0.0, phaseDays);
        return this;
    }
}
