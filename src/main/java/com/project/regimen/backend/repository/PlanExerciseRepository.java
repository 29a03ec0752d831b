package com.project.regimen.backend.repository;

import com.project.regimen.backend.entity.PlanExercise;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PlanExerciseRepository extends JpaRepository<PlanExercise, UUID> {
}
