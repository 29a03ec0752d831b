package com.project.regimen.backend.controller;

import com.project.regimen.backend.algorithm.ChangeDayOutcome;
import com.project.regimen.backend.algorithm.ProgressTransition;
import com.project.regimen.backend.algorithm.SinglePlanProgress;
import com.project.regimen.backend.dto.ChangeDayRequestDto;
import com.project.regimen.backend.dto.ChangeDayResponseDto;
import com.project.regimen.backend.dto.CompletionRequestDto;
import com.project.regimen.backend.dto.PreviewDto;
import com.project.regimen.backend.dto.TodayWorkoutDto;
import com.project.regimen.backend.response.ApiResponse;
import com.project.regimen.backend.response.ResponseMessage;
import com.project.regimen.backend.service.PlanProgressService;
import com.project.regimen.backend.service.security.AppUserDetails;
import com.project.regimen.backend.utils.EntityValidator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/progress")
public class ProgressController {

    private final PlanProgressService planProgressService;
    private final EntityValidator entityValidator;

    public ProgressController(PlanProgressService planProgressService, EntityValidator entityValidator) {
        this.planProgressService = planProgressService;
        this.entityValidator = entityValidator;
    }

    @PostMapping("/today")
    public ResponseEntity<ApiResponse> openToday(@AuthenticationPrincipal AppUserDetails appUser) {
        TodayWorkoutDto today = planProgressService.openToday(appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, today));
    }

    @GetMapping("/plans/{planId}")
    public ResponseEntity<ApiResponse> getProgress(@AuthenticationPrincipal AppUserDetails appUser,
                                                   @PathVariable UUID planId) {
        SinglePlanProgress progress = planProgressService.getProgress(appUser.getUserId(), planId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, progress));
    }

    @PostMapping("/plans/{planId}/completions")
    public ResponseEntity<ApiResponse> recordCompletion(@AuthenticationPrincipal AppUserDetails appUser,
                                                        @PathVariable UUID planId,
                                                        @RequestBody CompletionRequestDto request) {
        entityValidator.validate(request);
        ProgressTransition transition = planProgressService.recordCompletion(appUser.getUserId(), planId, request.getDate());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, transition));
    }

    @PostMapping("/plans/{planId}/change-day")
    public ResponseEntity<ApiResponse> changeDay(@AuthenticationPrincipal AppUserDetails appUser,
                                                 @PathVariable UUID planId,
                                                 @RequestBody ChangeDayRequestDto request) {
        entityValidator.validate(request);
        ChangeDayResponseDto result = planProgressService.changeDay(appUser.getUserId(), planId,
                request.getDayIndex(), request.isSkipAndAdvance());
        return changeDayResponse(result);
    }

    @GetMapping("/plans/{planId}/preview")
    public ResponseEntity<ApiResponse> preview(@AuthenticationPrincipal AppUserDetails appUser,
                                               @PathVariable UUID planId,
                                               @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        PreviewDto preview = planProgressService.preview(appUser.getUserId(), planId, date);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, preview));
    }

    static ResponseEntity<ApiResponse> changeDayResponse(ChangeDayResponseDto result) {
        if (result.getOutcome() == ChangeDayOutcome.REJECTED_WORK_IN_PROGRESS) {
            return new ResponseEntity<>(new ApiResponse(ResponseMessage.DAY_CHANGE_REJECTED, result), HttpStatus.CONFLICT);
        }
        if (result.getOutcome() == ChangeDayOutcome.INVALID) {
            return new ResponseEntity<>(new ApiResponse(ResponseMessage.BAD_REQUEST, result), HttpStatus.BAD_REQUEST);
        }
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, result));
    }
}
