package com.project.regimen.backend.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * The workout of one program day. A profile has at most one per day.
 */
@Getter
@Setter
@Entity
@Table(name = "workout_days",
        uniqueConstraints = @UniqueConstraint(columnNames = {"profile_id", "program_day"}))
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class WorkoutDay {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @Column(name = "profile_id", nullable = false)
    Integer profileId;

    @Column(name = "program_day", nullable = false)
    LocalDate date;

    // plan the workout was materialized from, null for a free workout
    @Column(name = "plan_id")
    UUID planId;

    @Column(name = "cycle_id")
    UUID cycleId;

    @Column(name = "plan_day_id")
    UUID planDayId;

    @Column(name = "day_name")
    String dayName;

    @Builder.Default
    @OneToMany(mappedBy = "workoutDay", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("orderIndex ASC")
    List<WorkoutEntry> entries = new ArrayList<>();

    public List<WorkoutEntry> getSortedEntries() {
        return entries.stream().sorted(Comparator.comparingInt(WorkoutEntry::getOrderIndex)).toList();
    }

    public void addEntry(WorkoutEntry entry) {
        entry.setWorkoutDay(this);
        entries.add(entry);
    }

    public void clearEntries() {
        entries.forEach(entry -> entry.setWorkoutDay(null));
        entries.clear();
    }

    public int getTotalCompletedSets() {
        return entries.stream().mapToInt(WorkoutEntry::getCompletedSetCount).sum();
    }

    /**
     * True when the workout came from a plan and every entry with planned
     * sets has all of them logged.
     */
    public boolean isRoutineCompleted() {
        if (planId == null) {
            return false;
        }
        return entries.stream().allMatch(WorkoutEntry::isPlannedSetsCompleted);
    }
}
