package com.levelestimator;

import com.levelestimator.config.EstimatorConfig;
import com.levelestimator.config.ModelRegistry;
import com.levelestimator.model.BloodTest;
import com.levelestimator.model.ConcentrationUnit;
import com.levelestimator.model.DoseRecord;
import com.levelestimator.model.DosingPlan;
import com.levelestimator.model.Schedule;
import com.levelestimator.model.TargetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LevelEstimatorTest {
    private static final double DAY = LevelAggregator.SECONDS_PER_DAY;
    private static final double NOW = 20000 * DAY + 12 * 3600;

    private ModelRegistry registry;
    private EstimatorConfig config;

    @BeforeEach
    void setUp() {
        registry = ModelRegistry.loadDefault();
        config = new EstimatorConfig();
    }

    @Test
    void levelFromManualDoses() {
        LevelEstimator estimator = new LevelEstimator(registry, config);
        LevelEstimator.Estimate estimate = estimator.estimate(NOW,
                List.of(DoseRecord.manual(NOW - 7 * DAY, "EEn im", 10.0)), List.of());

        assertEquals(311.77505115897, estimate.currentLevel, 1e-6);
        assertTrue(estimate.calibration.isUncalibrated());
        assertEquals(0.0, estimate.baselineLevel);
        assertNull(estimate.suggestedRegimen);
        assertNull(estimate.cycleFit);
        assertTrue(estimate.automaticDoses.isEmpty());
    }

    @Test
    void appliesCalibration() {
        LevelEstimator estimator = new LevelEstimator(registry, config);
        List<DoseRecord> doses = List.of(DoseRecord.manual(NOW - 14 * DAY, "EEn im", 10.0));
        List<BloodTest> tests = List.of(new BloodTest(NOW - 7 * DAY, 1.5 * 311.77505115897));

        LevelEstimator.Estimate estimate = estimator.estimate(NOW, doses, tests);

        assertEquals(1.5, estimate.calibration.factor, 1e-9);
        double uncalibrated = estimator.getAggregator().levelAt(NOW, doses);
        assertEquals(1.5 * uncalibrated, estimate.currentLevel, 1e-6);
    }

    @Test
    void reportsInDisplayUnit() {
        config.setUnit(ConcentrationUnit.PMOL_PER_L);
        LevelEstimator estimator = new LevelEstimator(registry, config);
        LevelEstimator.Estimate estimate = estimator.estimate(NOW,
                List.of(DoseRecord.manual(NOW - 7 * DAY, "EEn im", 10.0)), List.of());
        assertEquals(311.77505115897 * 3.6713, estimate.currentLevel, 1e-5);
    }

    @Test
    void anchorsBaselineWhenNoDoseExplainsTests() {
        config.addPlan(new DosingPlan());
        LevelEstimator estimator = new LevelEstimator(registry, config);
        LevelEstimator.Estimate estimate = estimator.estimate(NOW, List.of(),
                List.of(new BloodTest(NOW - 10 * DAY, 120.0), new BloodTest(NOW - 4 * DAY, 80.0)));

        double expected = 80.0 * Math.exp(-0.402 * 4);
        assertEquals(expected, estimate.baselineLevel, 1e-9);
        assertEquals(NOW - 4 * DAY, estimate.baselineTestTimestamp);
        assertEquals(expected, estimate.currentLevel, 1e-9);
    }

    @Test
    void prunesStaleDoses() {
        LevelEstimator estimator = new LevelEstimator(registry, config);
        DoseRecord recent = DoseRecord.manual(NOW - 7 * DAY, "EEn im", 10.0);
        LevelEstimator.Estimate estimate = estimator.estimate(NOW,
                List.of(DoseRecord.manual(NOW - 200 * DAY, "EEn im", 10.0), recent), List.of());
        assertEquals(List.of(recent), estimate.manualDoses);
    }

    @Test
    void manualPlanGeneratesNoDoses() {
        config.addPlan(new DosingPlan("EEn", "im", 4.0, 7.0, DosingPlan.Mode.MANUAL));
        LevelEstimator.Estimate estimate = new LevelEstimator(registry, config).estimate(NOW, List.of(), List.of());
        assertTrue(estimate.automaticDoses.isEmpty());
        assertEquals(0.0, estimate.currentLevel);
    }

    @Test
    void automaticPlanUsesConfiguredDose() {
        config.addPlan(new DosingPlan("E", "patch", 100.0, 7.0, DosingPlan.Mode.AUTOMATIC));
        LevelEstimator.Estimate estimate = new LevelEstimator(registry, config).estimate(NOW, List.of(), List.of());

        assertEquals(12, estimate.automaticDoses.size());
        for (DoseRecord dose : estimate.automaticDoses) {
            assertEquals("patch ow", dose.modelKey);
            assertEquals(100.0, dose.amountMg);
            assertEquals(DoseRecord.Source.AUTOMATIC, dose.source);
            assertTrue(dose.timestamp > NOW);
        }
        assertEquals(0.0, estimate.currentLevel);
    }

    @Test
    void targetRangeRegimenReplacesConfiguredDose() {
        config.addPlan(new DosingPlan("EEn", "im", 4.0, 10.0, DosingPlan.Mode.AUTOMATIC)
                .setAutoRegimen(true, TargetType.TARGET_RANGE));
        LevelEstimator.Estimate estimate = new LevelEstimator(registry, config).estimate(NOW, List.of(), List.of());

        assertEquals(new Schedule(3.0, 7.0, 0.0, "EEn im"), estimate.suggestedRegimen);
        assertNull(estimate.cycleFit);
        assertFalse(estimate.automaticDoses.isEmpty());
        for (DoseRecord dose : estimate.automaticDoses) {
            assertEquals(3.0, dose.amountMg);
        }
        double gap = estimate.automaticDoses.get(1).timestamp - estimate.automaticDoses.get(0).timestamp;
        assertEquals(7 * DAY, gap, 1e-6);
    }

    @Test
    void menstrualRegimenExpandsEverySchedule() {
        config.addPlan(new DosingPlan("EEn", "im", 4.0, 7.0, DosingPlan.Mode.BOTH)
                .setAutoRegimen(true, TargetType.MENSTRUAL_RANGE));
        LevelEstimator.Estimate estimate = new LevelEstimator(registry, config).estimate(NOW, List.of(), List.of());

        assertNull(estimate.suggestedRegimen);
        assertNotNull(estimate.cycleFit);
        assertFalse(estimate.cycleFit.schedules.isEmpty());

        Set<Double> scheduledDoses = new HashSet<>();
        for (Schedule schedule : estimate.cycleFit.schedules) {
            scheduledDoses.add(schedule.doseMg);
        }
        assertTrue(estimate.automaticDoses.size() >= estimate.cycleFit.schedules.size());
        for (DoseRecord dose : estimate.automaticDoses) {
            assertTrue(scheduledDoses.contains(dose.amountMg));
            assertEquals("EEn im", dose.modelKey);
        }
    }

    @Test
    void suggestReturnsNullForUnsupportedCombination() {
        LevelEstimator estimator = new LevelEstimator(registry, config);
        assertNull(estimator.suggest(new DosingPlan("EX", "im", 4.0, 7.0, DosingPlan.Mode.AUTOMATIC)));
        assertNull(estimator.suggest(new DosingPlan("E", "oral", 2.0, 1.0, DosingPlan.Mode.AUTOMATIC)));
    }

    @Test
    void sameInputsGiveSameEstimate() {
        config.addPlan(new DosingPlan("EV", "im", 5.0, 5.0, DosingPlan.Mode.BOTH));
        LevelEstimator estimator = new LevelEstimator(registry, config);
        List<DoseRecord> doses = List.of(DoseRecord.manual(NOW - 3 * DAY, "EV im", 5.0));
        List<BloodTest> tests = List.of(new BloodTest(NOW - DAY, 150.0));

        LevelEstimator.Estimate first = estimator.estimate(NOW, doses, tests);
        LevelEstimator.Estimate second = estimator.estimate(NOW, doses, tests);
        assertEquals(first.currentLevel, second.currentLevel);
        assertEquals(first.calibration.factor, second.calibration.factor);
        assertEquals(first.automaticDoses.size(), second.automaticDoses.size());
    }
}
