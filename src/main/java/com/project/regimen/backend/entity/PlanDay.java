package com.project.regimen.backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.project.regimen.backend.algorithm.ScheduledDay;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "plan_days")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class PlanDay implements ScheduledDay {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "plan_id")
    WorkoutPlan plan;

    // 1-indexed
    @Column(name = "day_index", nullable = false)
    int position;

    @Column(name = "name")
    String name;

    @Column(name = "rest_day")
    boolean restDay;

    @Builder.Default
    @OneToMany(mappedBy = "day", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("orderIndex ASC")
    List<PlanExercise> exercises = new ArrayList<>();

    @Override
    public int getExerciseCount() {
        return exercises.size();
    }

    @JsonIgnore
    public List<PlanExercise> getSortedExercises() {
        return exercises.stream().sorted(Comparator.comparingInt(PlanExercise::getOrderIndex)).toList();
    }

    public void addExercise(PlanExercise exercise) {
        int last = exercises.stream().mapToInt(PlanExercise::getOrderIndex).max().orElse(-1);
        exercise.setDay(this);
        exercise.setOrderIndex(last + 1);
        exercises.add(exercise);
    }
}
