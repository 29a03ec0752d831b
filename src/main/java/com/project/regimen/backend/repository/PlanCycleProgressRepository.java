package com.project.regimen.backend.repository;

import com.project.regimen.backend.entity.PlanCycleProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlanCycleProgressRepository extends JpaRepository<PlanCycleProgress, UUID> {
    public Optional<PlanCycleProgress> findByCycleId(UUID cycleId);
    public void deleteByCycleId(UUID cycleId);
}
