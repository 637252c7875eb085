package com.levelestimator.model;

import com.google.gson.annotations.SerializedName;

/**
 * A single administration. Contributes linearly (scaled by amount) to every
 * level query at or after its timestamp.
 */
public final class DoseRecord {

    public enum Source {
        @SerializedName("manual")
        MANUAL,
        @SerializedName("automatic")
        AUTOMATIC
    }

    public final double timestamp; // seconds since epoch
    public final String modelKey;
    public final double amountMg;
    public final Source source;

    public DoseRecord(double timestamp, String modelKey, double amountMg, Source source) {
        this.timestamp = timestamp;
        this.modelKey = modelKey;
        this.amountMg = amountMg;
        this.source = source;
    }

    public static DoseRecord manual(double timestamp, String modelKey, double amountMg) {
        return new DoseRecord(timestamp, modelKey, amountMg, Source.MANUAL);
    }

    public DoseRecord withAmount(double amount) {
        return new DoseRecord(timestamp, modelKey, amount, source);
    }

    @Override
    public String toString() {
        return String.format("DoseRecord[%s %.2fmg @ %.0f, %s]", modelKey, amountMg, timestamp, source);
    }
}
