package com.project.regimen.backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "workout_entries")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class WorkoutEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workout_day_id")
    WorkoutDay workoutDay;

    @Column(name = "exercise_name", nullable = false)
    String exerciseName;

    @Column(name = "order_index")
    int orderIndex;

    @Column(name = "planned_set_count")
    int plannedSetCount;

    @Column(name = "completed_set_count")
    int completedSetCount;

    /** Entries without planned sets never hold a workout back. */
    public boolean isPlannedSetsCompleted() {
        return plannedSetCount == 0 || completedSetCount >= plannedSetCount;
    }

    public void completeSet() {
        completedSetCount++;
    }
}
