package com.project.regimen.backend.algorithm;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PlanStore} over plain maps. Plans are built with {@link #addPlan},
 * workout records with {@link #putRecord}.
 */
class InMemoryPlanStore implements PlanStore {

    private final Map<UUID, List<ScheduledDay>> plans = new HashMap<>();
    private final Map<String, WorkoutRecordStatus> records = new HashMap<>();
    private final List<String> deletedRecords = new ArrayList<>();

    @Getter
    @AllArgsConstructor
    static class Day implements ScheduledDay {
        private final UUID id;
        private final int position;
        private final boolean restDay;
        private final int exerciseCount;
    }

    @Getter
    @AllArgsConstructor
    static class Slot implements CycleSlot {
        private final UUID id;
        private final int position;
        private final UUID planId;
    }

    /** Adds a plan with {@code workoutDays} training days. */
    UUID addPlan(int workoutDays) {
        return addPlan(new boolean[workoutDays]);
    }

    /** Adds a plan, one day per flag; true marks a rest day. */
    UUID addPlan(boolean... restDays) {
        UUID planId = UUID.randomUUID();
        List<ScheduledDay> days = new ArrayList<>();
        for (int i = 0; i < restDays.length; i++) {
            days.add(new Day(UUID.randomUUID(), i + 1, restDays[i], restDays[i] ? 0 : 3));
        }
        plans.put(planId, days);
        return planId;
    }

    List<ScheduledDay> days(UUID planId) {
        return plans.get(planId);
    }

    void deletePlan(UUID planId) {
        plans.remove(planId);
    }

    static List<CycleSlot> slots(UUID... planIds) {
        List<CycleSlot> slots = new ArrayList<>();
        for (int i = 0; i < planIds.length; i++) {
            slots.add(new Slot(UUID.randomUUID(), i, planIds[i]));
        }
        return slots;
    }

    void putRecord(Integer profileId, UUID planId, LocalDate programDay, WorkoutRecordStatus status) {
        records.put(key(profileId, planId, programDay), status);
    }

    boolean wasDeleted(Integer profileId, UUID planId, LocalDate programDay) {
        return deletedRecords.contains(key(profileId, planId, programDay));
    }

    @Override
    public Optional<List<ScheduledDay>> daysOf(UUID planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    @Override
    public WorkoutRecordStatus workoutRecordStatus(Integer profileId, UUID planId, LocalDate programDay) {
        return records.getOrDefault(key(profileId, planId, programDay), WorkoutRecordStatus.ABSENT);
    }

    @Override
    public void deleteWorkoutRecord(Integer profileId, UUID planId, LocalDate programDay) {
        String key = key(profileId, planId, programDay);
        if (records.remove(key) != null) {
            deletedRecords.add(key);
        }
    }

    private static String key(Integer profileId, UUID planId, LocalDate programDay) {
        return profileId + ":" + planId + ":" + programDay;
    }
}
