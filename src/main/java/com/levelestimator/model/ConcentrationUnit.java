package com.levelestimator.model;

import org.apache.commons.math3.util.Precision;

/**
 * Display units for serum levels. Internal computation is always in pg/mL.
 */
public enum ConcentrationUnit {
    PG_PER_ML("pg/mL", 1.0, 0),
    PMOL_PER_L("pmol/L", 3.6713, 0);

    public final String label;
    public final double conversionFactor;
    public final int precision;

    ConcentrationUnit(String label, double conversionFactor, int precision) {
        this.label = label;
        this.conversionFactor = conversionFactor;
        this.precision = precision;
    }

    public double fromPgPerMl(double level) {
        return level * conversionFactor;
    }

    public double toPgPerMl(double level) {
        return level / conversionFactor;
    }

    public double display(double levelPgPerMl) {
        return Precision.round(fromPgPerMl(levelPgPerMl), precision);
    }

    /**
     * Unit for a label such as {@code "pmol/L"}; falls back to pg/mL.
     */
    public static ConcentrationUnit fromLabel(String label) {
        for (ConcentrationUnit unit : values()) {
            if (unit.label.equals(label)) {
                return unit;
            }
        }
        return PG_PER_ML;
    }
}
