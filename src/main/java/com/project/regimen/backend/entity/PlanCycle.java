package com.project.regimen.backend.entity;

import com.project.regimen.backend.algorithm.PositionedEntry;
import com.project.regimen.backend.algorithm.ReindexReconciler;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A rotation through several plans. At most one cycle per profile is active.
 */
@Getter
@Setter
@Entity
@Table(name = "plan_cycles")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class PlanCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @Column(name = "profile_id", nullable = false)
    Integer profileId;

    @Column(name = "name", nullable = false)
    String name;

    @Column(name = "active")
    boolean active;

    @Column(name = "created_at")
    Instant createdAt;

    @Builder.Default
    @OneToMany(mappedBy = "cycle", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    List<PlanCycleItem> items = new ArrayList<>();

    @JsonIgnore
    public List<PlanCycleItem> getSortedItems() {
        return items.stream().sorted(PositionedEntry.BY_POSITION).toList();
    }

    public Optional<PlanCycleItem> findItem(UUID itemId) {
        return items.stream().filter(item -> item.getId().equals(itemId)).findFirst();
    }

    public void addItem(PlanCycleItem item) {
        int last = items.stream().mapToInt(PlanCycleItem::getPosition).max().orElse(-1);
        item.setCycle(this);
        item.setPosition(last + 1);
        items.add(item);
    }

    public void removeItem(PlanCycleItem item) {
        items.remove(item);
        item.setCycle(null);
    }

    /**
     * Moves an item to a 0-indexed position and renumbers the others.
     */
    public void moveItem(PlanCycleItem item, int newPosition) {
        List<PlanCycleItem> sorted = new ArrayList<>(getSortedItems());
        sorted.remove(item);
        int target = Math.max(0, Math.min(newPosition, sorted.size()));
        sorted.add(target, item);
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setPosition(i);
        }
    }

    /** Closes gaps so positions run 0..n-1. */
    public void reindexItems() {
        ReindexReconciler.densify(items, 0, PlanCycleItem::setPosition);
    }

    public boolean references(UUID planId) {
        return items.stream().anyMatch(item -> planId.equals(item.getPlanId()));
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
