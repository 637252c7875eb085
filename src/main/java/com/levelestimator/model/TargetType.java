package com.levelestimator.model;

import com.google.gson.annotations.SerializedName;

/**
 * What an automatic regimen aims for. Target range is a single trough level;
 * menstrual range fits the reference cycle curve.
 */
public enum TargetType {
    @SerializedName("target_range")
    TARGET_RANGE("target_range", 200.0, false),
    @SerializedName("menstrual_range")
    MENSTRUAL_RANGE("menstrual_range", 100.0, true);

    public final String id;
    public final double troughLevel; // pg/mL
    public final boolean cycleFit;

    TargetType(String id, double troughLevel, boolean cycleFit) {
        this.id = id;
        this.troughLevel = troughLevel;
        this.cycleFit = cycleFit;
    }

    public static TargetType fromId(String id) {
        for (TargetType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        return TARGET_RANGE;
    }
}
