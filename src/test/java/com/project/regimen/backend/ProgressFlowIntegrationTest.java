package com.project.regimen.backend;

import com.project.regimen.backend.algorithm.ProgramDayCalendar;
import com.project.regimen.backend.algorithm.SinglePlanProgress;
import com.project.regimen.backend.algorithm.TransitionReason;
import com.project.regimen.backend.dto.CreateExerciseRequestDto;
import com.project.regimen.backend.dto.CreatePlanDayRequestDto;
import com.project.regimen.backend.dto.CreatePlanRequestDto;
import com.project.regimen.backend.dto.ProfileSettingsDto;
import com.project.regimen.backend.dto.RegistrationRequestDto;
import com.project.regimen.backend.dto.TodayWorkoutDto;
import com.project.regimen.backend.entity.AppUser;
import com.project.regimen.backend.entity.PlanDay;
import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.entity.WorkoutEntry;
import com.project.regimen.backend.entity.WorkoutPlan;
import com.project.regimen.backend.service.AppUserService;
import com.project.regimen.backend.service.PlanProgressService;
import com.project.regimen.backend.service.WorkoutLogService;
import com.project.regimen.backend.service.WorkoutPlanService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Clock;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@DisplayName("Single-plan flow against the in-memory database")
class ProgressFlowIntegrationTest {

    @Autowired
    private AppUserService appUserService;

    @Autowired
    private WorkoutPlanService workoutPlanService;

    @Autowired
    private PlanProgressService planProgressService;

    @Autowired
    private WorkoutLogService workoutLogService;

    @Autowired
    private Clock clock;

    @Test
    @DisplayName("Open, log every set, and see the completion recorded for the next open")
    void shouldRunSinglePlanFlow() {
        AppUser user = appUserService.register(
                new RegistrationRequestDto("flow-lifter", "secret1", null, null, null, 0));
        Integer profileId = user.getUid();

        WorkoutPlan plan = workoutPlanService.createPlan(profileId, new CreatePlanRequestDto("Full body", null));
        PlanDay first = workoutPlanService.addDay(profileId, plan.getId(), new CreatePlanDayRequestDto("A", false));
        PlanDay second = workoutPlanService.addDay(profileId, plan.getId(), new CreatePlanDayRequestDto("B", false));
        workoutPlanService.addExercise(profileId, plan.getId(), first.getId(), new CreateExerciseRequestDto("Squat", 1));
        workoutPlanService.addExercise(profileId, plan.getId(), second.getId(), new CreateExerciseRequestDto("Deadlift", 1));

        appUserService.updateSettings(profileId, ProfileSettingsDto.builder().activePlanId(plan.getId()).build());

        TodayWorkoutDto today = planProgressService.openToday(profileId);
        LocalDate programDay = ProgramDayCalendar.today(clock, 0);

        assertEquals(TransitionReason.FIRST_OPEN.name(), today.getReason());
        assertEquals(1, today.getDayIndex());
        assertEquals(programDay, today.getProgramDay());
        WorkoutDay workout = today.getWorkout();
        assertNotNull(workout);
        assertEquals("A", workout.getDayName());

        WorkoutEntry squat = workout.getSortedEntries().get(0);
        WorkoutDay logged = workoutLogService.completeSet(profileId, workout.getId(), squat.getId());
        assertEquals(1, logged.getTotalCompletedSets());

        SinglePlanProgress progress = planProgressService.getProgress(profileId, plan.getId());
        // today's own completion waits for the next open
        assertEquals(1, progress.getCurrentDayIndex());
        assertEquals(programDay, progress.getLastCompletedDate());
        assertEquals(programDay, progress.getLastOpenedDate());
    }
}
