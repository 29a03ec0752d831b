package com.project.regimen.backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.project.regimen.backend.algorithm.CycleSlot;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "plan_cycle_items")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class PlanCycleItem implements CycleSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "cycle_id")
    PlanCycle cycle;

    // 0-indexed
    @Column(name = "item_order", nullable = false)
    int position;

    // not a foreign key: the plan may be deleted while the item stays
    @Column(name = "plan_id", nullable = false)
    UUID planId;

    @Column(name = "note")
    String note;
}
