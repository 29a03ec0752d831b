package com.project.regimen.backend.service;

import com.project.regimen.backend.entity.PlanDay;
import com.project.regimen.backend.entity.PlanExercise;
import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.entity.WorkoutEntry;
import com.project.regimen.backend.repository.WorkoutDayRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("WorkoutService Tests")
class WorkoutServiceTest {

    private static final Integer PROFILE = 8;
    private static final LocalDate DAY = LocalDate.of(2025, 12, 16);

    private WorkoutDayRepository workoutDayRepository;
    private WorkoutService service;
    private PlanDay planDay;

    @BeforeEach
    void setUp() {
        workoutDayRepository = mock(WorkoutDayRepository.class);
        service = new WorkoutService(workoutDayRepository);
        when(workoutDayRepository.save(any(WorkoutDay.class))).thenAnswer(returnsFirstArg());

        planDay = PlanDay.builder().id(UUID.randomUUID()).position(1).name("Push").build();
        planDay.addExercise(PlanExercise.builder().name("Bench").plannedSetCount(3).build());
        planDay.addExercise(PlanExercise.builder().name("Dips").plannedSetCount(2).build());
    }

    @Test
    @DisplayName("A new workout gets one entry per planned exercise")
    void shouldMaterializeNewWorkout() {
        UUID planId = UUID.randomUUID();
        when(workoutDayRepository.findByProfileIdAndDate(PROFILE, DAY)).thenReturn(Optional.empty());

        WorkoutDay workout = service.getOrCreateWorkout(PROFILE, DAY, planId, null, planDay);

        assertEquals(planId, workout.getPlanId());
        assertEquals(planDay.getId(), workout.getPlanDayId());
        assertEquals("Push", workout.getDayName());
        List<WorkoutEntry> entries = workout.getSortedEntries();
        assertEquals(2, entries.size());
        assertEquals("Bench", entries.get(0).getExerciseName());
        assertEquals(3, entries.get(0).getPlannedSetCount());
        assertEquals(0, entries.get(0).getCompletedSetCount());
        assertFalse(workout.isRoutineCompleted());
    }

    @Test
    @DisplayName("An existing workout of the same plan is returned untouched")
    void shouldKeepExistingWorkout() {
        UUID planId = UUID.randomUUID();
        WorkoutDay existing = WorkoutDay.builder().profileId(PROFILE).date(DAY).planId(planId).build();
        when(workoutDayRepository.findByProfileIdAndDate(PROFILE, DAY)).thenReturn(Optional.of(existing));

        WorkoutDay workout = service.getOrCreateWorkout(PROFILE, DAY, planId, null, planDay);

        assertSame(existing, workout);
        assertTrue(workout.getEntries().isEmpty());
        verify(workoutDayRepository, never()).save(any());
    }

    @Test
    @DisplayName("An empty free workout is taken over by the plan")
    void shouldTakeOverEmptyFreeWorkout() {
        UUID planId = UUID.randomUUID();
        UUID cycleId = UUID.randomUUID();
        WorkoutDay existing = WorkoutDay.builder().profileId(PROFILE).date(DAY).entries(new ArrayList<>()).build();
        when(workoutDayRepository.findByProfileIdAndDate(PROFILE, DAY)).thenReturn(Optional.of(existing));

        WorkoutDay workout = service.getOrCreateWorkout(PROFILE, DAY, planId, cycleId, planDay);

        assertSame(existing, workout);
        assertEquals(planId, workout.getPlanId());
        assertEquals(cycleId, workout.getCycleId());
        assertEquals(2, workout.getEntries().size());
    }

    @Test
    @DisplayName("A free workout never counts as a completed routine")
    void shouldNotCompleteFreeWorkout() {
        WorkoutDay free = WorkoutDay.builder().profileId(PROFILE).date(DAY).build();

        assertFalse(free.isRoutineCompleted());
    }
}
