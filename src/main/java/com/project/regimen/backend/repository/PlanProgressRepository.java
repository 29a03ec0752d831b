package com.project.regimen.backend.repository;

import com.project.regimen.backend.entity.PlanProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlanProgressRepository extends JpaRepository<PlanProgress, UUID> {
    public Optional<PlanProgress> findByProfileIdAndPlanId(Integer profileId, UUID planId);
    public List<PlanProgress> findByPlanId(UUID planId);
    public void deleteByPlanId(UUID planId);
}
