package com.project.regimen.backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "plan_exercises")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class PlanExercise {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "plan_day_id")
    PlanDay day;

    @Column(name = "name", nullable = false)
    String name;

    @Column(name = "order_index")
    int orderIndex;

    @Column(name = "planned_set_count")
    int plannedSetCount;
}
