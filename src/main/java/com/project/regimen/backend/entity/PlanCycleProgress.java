package com.project.regimen.backend.entity;

import com.project.regimen.backend.algorithm.CycleProgress;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "plan_cycle_progress")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class PlanCycleProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @Column(name = "cycle_id", nullable = false, unique = true)
    UUID cycleId;

    @Embedded
    @Builder.Default
    CycleProgress state = new CycleProgress();
}
