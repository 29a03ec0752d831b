package com.project.regimen.backend.controller;

import com.project.regimen.backend.dto.CreateExerciseRequestDto;
import com.project.regimen.backend.dto.CreatePlanDayRequestDto;
import com.project.regimen.backend.dto.CreatePlanRequestDto;
import com.project.regimen.backend.dto.MovePositionRequestDto;
import com.project.regimen.backend.entity.PlanDay;
import com.project.regimen.backend.entity.PlanExercise;
import com.project.regimen.backend.entity.WorkoutPlan;
import com.project.regimen.backend.response.ApiResponse;
import com.project.regimen.backend.response.ResponseMessage;
import com.project.regimen.backend.service.WorkoutPlanService;
import com.project.regimen.backend.service.security.AppUserDetails;
import com.project.regimen.backend.utils.EntityValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/plans")
public class PlanController {

    private final WorkoutPlanService workoutPlanService;
    private final EntityValidator entityValidator;

    public PlanController(WorkoutPlanService workoutPlanService, EntityValidator entityValidator) {
        this.workoutPlanService = workoutPlanService;
        this.entityValidator = entityValidator;
    }

    @PostMapping
    public ResponseEntity<ApiResponse> createPlan(@AuthenticationPrincipal AppUserDetails appUser,
                                                  @RequestBody CreatePlanRequestDto request) {
        entityValidator.validate(request);
        WorkoutPlan plan = workoutPlanService.createPlan(appUser.getUserId(), request);
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.SUCCESS, plan), HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<ApiResponse> getPlans(@AuthenticationPrincipal AppUserDetails appUser) {
        List<WorkoutPlan> plans = workoutPlanService.getPlans(appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, plans));
    }

    @GetMapping("/{planId}")
    public ResponseEntity<ApiResponse> getPlan(@AuthenticationPrincipal AppUserDetails appUser,
                                               @PathVariable UUID planId) {
        WorkoutPlan plan = workoutPlanService.getPlan(appUser.getUserId(), planId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, plan));
    }

    @DeleteMapping("/{planId}")
    public ResponseEntity<ApiResponse> deletePlan(@AuthenticationPrincipal AppUserDetails appUser,
                                                  @PathVariable UUID planId) {
        workoutPlanService.deletePlan(appUser.getUserId(), planId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS));
    }

    @PostMapping("/{planId}/days")
    public ResponseEntity<ApiResponse> addDay(@AuthenticationPrincipal AppUserDetails appUser,
                                              @PathVariable UUID planId,
                                              @RequestBody CreatePlanDayRequestDto request) {
        entityValidator.validate(request);
        PlanDay day = workoutPlanService.addDay(appUser.getUserId(), planId, request);
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.SUCCESS, day), HttpStatus.CREATED);
    }

    @DeleteMapping("/{planId}/days/{dayId}")
    public ResponseEntity<ApiResponse> removeDay(@AuthenticationPrincipal AppUserDetails appUser,
                                                 @PathVariable UUID planId,
                                                 @PathVariable UUID dayId) {
        WorkoutPlan plan = workoutPlanService.removeDay(appUser.getUserId(), planId, dayId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, plan));
    }

    @PutMapping("/{planId}/days/{dayId}/position")
    public ResponseEntity<ApiResponse> moveDay(@AuthenticationPrincipal AppUserDetails appUser,
                                               @PathVariable UUID planId,
                                               @PathVariable UUID dayId,
                                               @RequestBody MovePositionRequestDto request) {
        entityValidator.validate(request);
        WorkoutPlan plan = workoutPlanService.moveDay(appUser.getUserId(), planId, dayId, request.getPosition());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, plan));
    }

    @PostMapping("/{planId}/days/{dayId}/exercises")
    public ResponseEntity<ApiResponse> addExercise(@AuthenticationPrincipal AppUserDetails appUser,
                                                   @PathVariable UUID planId,
                                                   @PathVariable UUID dayId,
                                                   @RequestBody CreateExerciseRequestDto request) {
        entityValidator.validate(request);
        PlanExercise exercise = workoutPlanService.addExercise(appUser.getUserId(), planId, dayId, request);
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.SUCCESS, exercise), HttpStatus.CREATED);
    }
}
