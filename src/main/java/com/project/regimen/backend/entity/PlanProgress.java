package com.project.regimen.backend.entity;

import com.project.regimen.backend.algorithm.SinglePlanProgress;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "plan_progress",
        uniqueConstraints = @UniqueConstraint(columnNames = {"profile_id", "plan_id"}))
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class PlanProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @Column(name = "profile_id", nullable = false)
    Integer profileId;

    @Column(name = "plan_id", nullable = false)
    UUID planId;

    @Embedded
    @Builder.Default
    SinglePlanProgress state = new SinglePlanProgress();
}
