package com.project.regimen.backend.controller;

import com.project.regimen.backend.entity.WorkoutDay;
import com.project.regimen.backend.response.ApiResponse;
import com.project.regimen.backend.response.ResponseMessage;
import com.project.regimen.backend.service.WorkoutLogService;
import com.project.regimen.backend.service.WorkoutService;
import com.project.regimen.backend.service.security.AppUserDetails;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/workouts")
public class WorkoutController {

    private final WorkoutService workoutService;
    private final WorkoutLogService workoutLogService;

    public WorkoutController(WorkoutService workoutService, WorkoutLogService workoutLogService) {
        this.workoutService = workoutService;
        this.workoutLogService = workoutLogService;
    }

    @GetMapping("/{workoutId}")
    public ResponseEntity<ApiResponse> getWorkout(@AuthenticationPrincipal AppUserDetails appUser,
                                                  @PathVariable UUID workoutId) {
        WorkoutDay workout = workoutService.getWorkout(appUser.getUserId(), workoutId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, workout));
    }

    @PostMapping("/{workoutId}/entries/{entryId}/complete-set")
    public ResponseEntity<ApiResponse> completeSet(@AuthenticationPrincipal AppUserDetails appUser,
                                                   @PathVariable UUID workoutId,
                                                   @PathVariable UUID entryId) {
        WorkoutDay workout = workoutLogService.completeSet(appUser.getUserId(), workoutId, entryId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, workout));
    }
}
