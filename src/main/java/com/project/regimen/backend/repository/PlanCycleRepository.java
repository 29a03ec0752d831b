package com.project.regimen.backend.repository;

import com.project.regimen.backend.entity.PlanCycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlanCycleRepository extends JpaRepository<PlanCycle, UUID> {
    public List<PlanCycle> findByProfileIdOrderByCreatedAtAsc(Integer profileId);
    public Optional<PlanCycle> findByIdAndProfileId(UUID id, Integer profileId);
    public Optional<PlanCycle> findFirstByProfileIdAndActiveTrue(Integer profileId);

    @Query("SELECT DISTINCT c FROM PlanCycle c JOIN c.items i WHERE i.planId = :planId")
    public List<PlanCycle> findReferencingPlan(@Param("planId") UUID planId);
}
