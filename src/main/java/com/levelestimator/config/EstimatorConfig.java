package com.levelestimator.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.levelestimator.LevelEstimator;
import com.levelestimator.model.ConcentrationUnit;
import com.levelestimator.model.DosingPlan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the estimator: the dosing plans plus every tunable heuristic
 * used by calibration and the regimen solvers.
 */
public class EstimatorConfig {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    public static final Path DEFAULT_PATH = Paths.get("config", "level_estimator.json");

    private String units = "pg/mL";

    // Calibration
    private double calibrationDecayLambda = 0.02; // per day
    private double minPredictedLevel = 1.0; // tests predicted below this are ignored
    private double maxScaleFactor = 2.0;

    // Regimen solvers
    private double maxAdministrationsPerWeek = 4.0;
    private int troughHorizonPeriods = 60;
    private double doseStep = 0.5;
    private double minDose = 0.5;
    private double maxDose = 20.0;
    private double negligibleDose = 0.25;
    private double minRelativeImprovement = 0.01;
    private int maxSchedules = 4;
    private int cycleLengthDays = 28;

    // Recurring doses and pruning
    private double lookaheadDays = 90.0;
    private double eliminationHalfLives = 5.0;

    private List<DosingPlan> plans = new ArrayList<>();

    public EstimatorConfig() {
    }

    public static EstimatorConfig load() {
        return load(DEFAULT_PATH);
    }

    public static EstimatorConfig load(Path path) {
        try {
            if (Files.exists(path)) {
                String json = Files.readString(path);
                EstimatorConfig config = GSON.fromJson(json, EstimatorConfig.class);
                if (config != null) {
                    LevelEstimator.LOGGER.info("Loaded config from {}", path);
                    return config;
                }
            }
        } catch (IOException | JsonParseException e) {
            LevelEstimator.LOGGER.error("Failed to load config", e);
        }

        LevelEstimator.LOGGER.info("Using default config");
        return new EstimatorConfig();
    }

    public void save(Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, GSON.toJson(this));
            LevelEstimator.LOGGER.info("Saved config to {}", path);
        } catch (IOException e) {
            LevelEstimator.LOGGER.error("Failed to save config", e);
        }
    }

    // Getters and setters

    public ConcentrationUnit getUnit() {
        return ConcentrationUnit.fromLabel(units);
    }

    public void setUnit(ConcentrationUnit unit) {
        this.units = unit.label;
    }

    public double getCalibrationDecayLambda() {
        return calibrationDecayLambda;
    }

    public void setCalibrationDecayLambda(double lambda) {
        this.calibrationDecayLambda = Math.max(0.0, lambda);
    }

    public double getMinPredictedLevel() {
        return minPredictedLevel;
    }

    public void setMinPredictedLevel(double level) {
        this.minPredictedLevel = Math.max(0.0, level);
    }

    public double getMaxScaleFactor() {
        return maxScaleFactor;
    }

    public double getMaxAdministrationsPerWeek() {
        return maxAdministrationsPerWeek;
    }

    public void setMaxAdministrationsPerWeek(double perWeek) {
        this.maxAdministrationsPerWeek = Math.max(1.0, Math.min(14.0, perWeek));
    }

    public int getTroughHorizonPeriods() {
        return troughHorizonPeriods;
    }

    public double getNegligibleDose() {
        return negligibleDose;
    }

    public double getMinRelativeImprovement() {
        return minRelativeImprovement;
    }

    public int getMaxSchedules() {
        return maxSchedules;
    }

    public void setMaxSchedules(int maxSchedules) {
        this.maxSchedules = Math.max(1, Math.min(8, maxSchedules)); // 1 to 8 schedules
    }

    public int getCycleLengthDays() {
        return cycleLengthDays;
    }

    public double getLookaheadDays() {
        return lookaheadDays;
    }

    public void setLookaheadDays(double days) {
        this.lookaheadDays = Math.max(0.0, days);
    }

    public double getEliminationHalfLives() {
        return eliminationHalfLives;
    }

    public List<DosingPlan> getPlans() {
        return plans == null ? List.of() : plans;
    }

    public void addPlan(DosingPlan plan) {
        if (plans == null) {
            plans = new ArrayList<>();
        }
        plans.add(plan);
    }

    /**
     * Round a raw dose to the dose step and clamp it to the allowed range.
     */
    public double roundDose(double rawDose) {
        double rounded = Math.round(rawDose / doseStep) * doseStep;
        return Math.max(minDose, Math.min(maxDose, rounded));
    }
}
