package com.project.regimen.backend.repository;

import com.project.regimen.backend.entity.WorkoutDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkoutDayRepository extends JpaRepository<WorkoutDay, UUID> {
    public Optional<WorkoutDay> findByProfileIdAndDate(Integer profileId, LocalDate date);
    public Optional<WorkoutDay> findByIdAndProfileId(UUID id, Integer profileId);
}
