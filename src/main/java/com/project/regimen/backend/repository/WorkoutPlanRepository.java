package com.project.regimen.backend.repository;

import com.project.regimen.backend.entity.WorkoutPlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkoutPlanRepository extends JpaRepository<WorkoutPlan, UUID> {
    public List<WorkoutPlan> findByProfileIdOrderByCreatedAtAsc(Integer profileId);
    public Optional<WorkoutPlan> findByIdAndProfileId(UUID id, Integer profileId);
}
