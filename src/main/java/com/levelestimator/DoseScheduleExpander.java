package com.levelestimator;

import com.levelestimator.model.DoseRecord;
import com.levelestimator.model.Schedule;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns periodic schedules into the upcoming automatic dose records.
 * Day boundaries and the dose time of day are in UTC.
 */
public class DoseScheduleExpander {

    /** Shortest interval expanded; anything shorter is treated as a misconfiguration. */
    public static final double MIN_INTERVAL_DAYS = 1.0 / 24.0;
    /** Upper bound on the records produced for one schedule. */
    public static final int MAX_RECORDS = 5000;

    private final int cycleLengthDays;
    private final double lookaheadDays;

    public DoseScheduleExpander(int cycleLengthDays, double lookaheadDays) {
        this.cycleLengthDays = cycleLengthDays;
        this.lookaheadDays = lookaheadDays;
    }

    /**
     * Doses after {@code now} up to the lookahead. A schedule with a phase is anchored
     * to the cycle; one without is anchored to today's dose time.
     */
    public List<DoseRecord> expand(Schedule schedule, double now, LocalTime doseTime) {
        if (schedule.phaseDays > 0) {
            return expandCycleAnchored(schedule, now, doseTime);
        }
        if (!isExpandable(schedule)) {
            return new ArrayList<>();
        }
        double intervalSeconds = schedule.intervalDays * LevelAggregator.SECONDS_PER_DAY;
        double todayDose = epochDay(now) * LevelAggregator.SECONDS_PER_DAY + doseTime.toSecondOfDay();
        double anchor = todayDose > now ? todayDose - intervalSeconds : todayDose;
        return generate(schedule, anchor + intervalSeconds, now);
    }

    /**
     * Doses anchored to the most recent day whose day-of-cycle equals the schedule's
     * phase, stepped forward past {@code now}.
     */
    public List<DoseRecord> expandCycleAnchored(Schedule schedule, double now, LocalTime doseTime) {
        if (!isExpandable(schedule)) {
            return new ArrayList<>();
        }
        double intervalSeconds = schedule.intervalDays * LevelAggregator.SECONDS_PER_DAY;
        long epochDayNow = epochDay(now);
        long cycleDayNow = Math.floorMod(epochDayNow, (long) cycleLengthDays);
        long daysBack = Math.floorMod(cycleDayNow - (long) schedule.phaseDays, (long) cycleLengthDays);
        double anchor = (epochDayNow - daysBack) * LevelAggregator.SECONDS_PER_DAY + doseTime.toSecondOfDay();
        double steps = anchor > now ? 0 : Math.floor((now - anchor) / intervalSeconds) + 1;
        return generate(schedule, anchor + steps * intervalSeconds, now);
    }

    public List<DoseRecord> expandAll(List<Schedule> schedules, double now, LocalTime doseTime) {
        List<DoseRecord> doses = new ArrayList<>();
        for (Schedule schedule : schedules) {
            doses.addAll(expandCycleAnchored(schedule, now, doseTime));
        }
        return doses;
    }

    private List<DoseRecord> generate(Schedule schedule, double first, double now) {
        double intervalSeconds = schedule.intervalDays * LevelAggregator.SECONDS_PER_DAY;
        double limit = now + lookaheadDays * LevelAggregator.SECONDS_PER_DAY;
        List<DoseRecord> doses = new ArrayList<>();
        for (int i = 0; i < MAX_RECORDS; i++) {
            double t = first + i * intervalSeconds;
            if (t > limit) {
                return doses;
            }
            doses.add(new DoseRecord(t, schedule.modelKey, schedule.doseMg, DoseRecord.Source.AUTOMATIC));
        }
        LevelEstimator.LOGGER.warn("{} every {}d: stopped after {} doses", schedule.modelKey,
                schedule.intervalDays, MAX_RECORDS);
        return doses;
    }

    private boolean isExpandable(Schedule schedule) {
        if (!(schedule.intervalDays >= MIN_INTERVAL_DAYS) || Double.isInfinite(schedule.intervalDays)) {
            LevelEstimator.LOGGER.warn("{}: interval {}d cannot be expanded", schedule.modelKey,
                    schedule.intervalDays);
            return false;
        }
        return schedule.doseMg > 0 && cycleLengthDays > 0;
    }

    private static long epochDay(double epochSeconds) {
        return (long) Math.floor(epochSeconds / LevelAggregator.SECONDS_PER_DAY);
    }
}
