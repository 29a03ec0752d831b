package com.project.regimen.backend.component;

import com.project.regimen.backend.algorithm.PlanStore;
import com.project.regimen.backend.algorithm.ScheduledDay;
import com.project.regimen.backend.algorithm.WorkoutRecordStatus;
import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.repository.WorkoutDayRepository;
import com.project.regimen.backend.repository.WorkoutPlanRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PlanStore} backed by the JPA repositories. Must be called inside a
 * transaction, the day collections are loaded lazily.
 */
@Slf4j
@Component
public class JpaPlanStore implements PlanStore {

    private final WorkoutPlanRepository workoutPlanRepository;
    private final WorkoutDayRepository workoutDayRepository;

    JpaPlanStore(WorkoutPlanRepository workoutPlanRepository, WorkoutDayRepository workoutDayRepository) {
        this.workoutPlanRepository = workoutPlanRepository;
        this.workoutDayRepository = workoutDayRepository;
    }

    @Override
    public Optional<List<ScheduledDay>> daysOf(UUID planId) {
        if (planId == null) {
            return Optional.empty();
        }
        return workoutPlanRepository.findById(planId)
                .map(plan -> plan.getSortedDays().stream().map(ScheduledDay.class::cast).toList());
    }

    @Override
    public WorkoutRecordStatus workoutRecordStatus(Integer profileId, UUID planId, LocalDate programDay) {
        Optional<WorkoutDay> record = findRecord(profileId, planId, programDay);
        if (record.isEmpty()) {
            return WorkoutRecordStatus.ABSENT;
        }
        return record.get().isRoutineCompleted() ? WorkoutRecordStatus.COMPLETE : WorkoutRecordStatus.INCOMPLETE;
    }

    @Override
    public void deleteWorkoutRecord(Integer profileId, UUID planId, LocalDate programDay) {
        findRecord(profileId, planId, programDay).ifPresent(record -> {
            log.info("Discarding incomplete workout {} of profile {} on {}", record.getId(), profileId, programDay);
            workoutDayRepository.delete(record);
        });
    }

    // a record materialized from another plan does not count for this one
    private Optional<WorkoutDay> findRecord(Integer profileId, UUID planId, LocalDate programDay) {
        return workoutDayRepository.findByProfileIdAndDate(profileId, programDay)
                .filter(record -> planId.equals(record.getPlanId()));
    }
}
