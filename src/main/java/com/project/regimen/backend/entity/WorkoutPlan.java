package com.project.regimen.backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.project.regimen.backend.algorithm.PositionedEntry;
import com.project.regimen.backend.algorithm.ReindexReconciler;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A user's training plan: an ordered list of days, repeated forever.
 */
@Getter
@Setter
@Entity
@Table(name = "workout_plans")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class WorkoutPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @Column(name = "profile_id", nullable = false)
    Integer profileId;

    @Column(name = "name", nullable = false)
    String name;

    @Column(name = "note", length = 1000)
    String note;

    @Column(name = "archived")
    boolean archived;

    @Column(name = "created_at")
    Instant createdAt;

    @Column(name = "updated_at")
    Instant updatedAt;

    @Builder.Default
    @OneToMany(mappedBy = "plan", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    List<PlanDay> days = new ArrayList<>();

    @JsonIgnore
    public List<PlanDay> getSortedDays() {
        return days.stream().sorted(PositionedEntry.BY_POSITION).toList();
    }

    /**
     * Day at a 1-indexed ordinal of the sorted list.
     */
    public Optional<PlanDay> dayAt(int dayIndex) {
        List<PlanDay> sorted = getSortedDays();
        if (dayIndex < 1 || dayIndex > sorted.size()) {
            return Optional.empty();
        }
        return Optional.of(sorted.get(dayIndex - 1));
    }

    public Optional<PlanDay> findDay(UUID dayId) {
        return days.stream().filter(day -> day.getId().equals(dayId)).findFirst();
    }

    /** Appends a day after the current last one. */
    public void addDay(PlanDay day) {
        int last = days.stream().mapToInt(PlanDay::getPosition).max().orElse(0);
        day.setPlan(this);
        day.setPosition(last + 1);
        days.add(day);
    }

    public void removeDay(PlanDay day) {
        days.remove(day);
        day.setPlan(null);
    }

    /**
     * Moves a day to a 1-indexed position and renumbers the others.
     */
    public void moveDay(PlanDay day, int newPosition) {
        List<PlanDay> sorted = new ArrayList<>(getSortedDays());
        sorted.remove(day);
        int target = Math.max(0, Math.min(newPosition - 1, sorted.size()));
        sorted.add(target, day);
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setPosition(i + 1);
        }
    }

    /** Closes gaps so positions run 1..n. */
    public void reindexDays() {
        ReindexReconciler.densify(days, 1, PlanDay::setPosition);
    }

    @PrePersist
    @PreUpdate
    public void touch() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }
}
