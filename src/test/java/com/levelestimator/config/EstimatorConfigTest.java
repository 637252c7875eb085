package com.levelestimator.config;

import com.levelestimator.model.ConcentrationUnit;
import com.levelestimator.model.DosingPlan;
import com.levelestimator.model.TargetType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EstimatorConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() {
        EstimatorConfig config = EstimatorConfig.load(dir.resolve("absent.json"));
        assertEquals(ConcentrationUnit.PG_PER_ML, config.getUnit());
        assertEquals(0.02, config.getCalibrationDecayLambda());
        assertEquals(4, config.getMaxSchedules());
        assertEquals(28, config.getCycleLengthDays());
        assertTrue(config.getPlans().isEmpty());
    }

    @Test
    void malformedFileGivesDefaults() throws IOException {
        Path path = dir.resolve("broken.json");
        Files.writeString(path, "{\"maxSchedules\": ");
        EstimatorConfig config = EstimatorConfig.load(path);
        assertEquals(4, config.getMaxSchedules());
    }

    @Test
    void partialFileKeepsOtherDefaults() throws IOException {
        Path path = dir.resolve("partial.json");
        Files.writeString(path, "{\"units\": \"pmol/L\", \"maxSchedules\": 2}");
        EstimatorConfig config = EstimatorConfig.load(path);
        assertEquals(ConcentrationUnit.PMOL_PER_L, config.getUnit());
        assertEquals(2, config.getMaxSchedules());
        assertEquals(60, config.getTroughHorizonPeriods());
        assertEquals(90.0, config.getLookaheadDays());
    }

    @Test
    void parsesPlans() throws IOException {
        Path path = dir.resolve("plans.json");
        Files.writeString(path, "{\"plans\": [{\"ester\": \"EV\", \"method\": \"im\", \"doseMg\": 5.0,"
                + " \"intervalDays\": 5.0, \"mode\": \"automatic\", \"autoRegimen\": true,"
                + " \"targetType\": \"menstrual_range\"}]}");
        EstimatorConfig config = EstimatorConfig.load(path);
        assertEquals(1, config.getPlans().size());
        DosingPlan plan = config.getPlans().get(0);
        assertEquals("EV", plan.getEster());
        assertEquals(DosingPlan.Mode.AUTOMATIC, plan.getMode());
        assertTrue(plan.isAutoRegimen());
        assertEquals(TargetType.MENSTRUAL_RANGE, plan.getTargetType());
        assertEquals("08:00", plan.getDoseTime());
    }

    @Test
    void saveThenLoad() {
        EstimatorConfig config = new EstimatorConfig();
        config.setUnit(ConcentrationUnit.PMOL_PER_L);
        config.setMaxSchedules(3);
        config.addPlan(new DosingPlan("EEn", "im", 4.0, 7.0, DosingPlan.Mode.BOTH).setPhaseDays(3.0));

        Path path = dir.resolve("nested").resolve("level_estimator.json");
        config.save(path);
        assertTrue(Files.exists(path));

        EstimatorConfig loaded = EstimatorConfig.load(path);
        assertEquals(ConcentrationUnit.PMOL_PER_L, loaded.getUnit());
        assertEquals(3, loaded.getMaxSchedules());
        assertEquals(DosingPlan.Mode.BOTH, loaded.getPlans().get(0).getMode());
        assertEquals(3.0, loaded.getPlans().get(0).getPhaseDays());
    }

    @Test
    void settersClamp() {
        EstimatorConfig config = new EstimatorConfig();
        config.setMaxSchedules(20);
        assertEquals(8, config.getMaxSchedules());
        config.setMaxSchedules(0);
        assertEquals(1, config.getMaxSchedules());
        config.setCalibrationDecayLambda(-1.0);
        assertEquals(0.0, config.getCalibrationDecayLambda());
        config.setMaxAdministrationsPerWeek(0.0);
        assertEquals(1.0, config.getMaxAdministrationsPerWeek());
    }

    @Test
    void roundDoseStepsAndClamps() {
        EstimatorConfig config = new EstimatorConfig();
        assertEquals(3.0, config.roundDose(3.133));
        assertEquals(3.5, config.roundDose(3.3));
        assertEquals(0.5, config.roundDose(0.1));
        assertEquals(20.0, config.roundDose(57.0));
    }
}
