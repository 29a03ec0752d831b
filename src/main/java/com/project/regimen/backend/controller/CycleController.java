package com.project.regimen.backend.controller;

import com.project.regimen.backend.dto.ChangeDayRequestDto;
import com.project.regimen.backend.dto.ChangeDayResponseDto;
import com.project.regimen.backend.dto.CompletionRequestDto;
import com.project.regimen.backend.dto.CreateCycleItemRequestDto;
import com.project.regimen.backend.dto.CreateCycleRequestDto;
import com.project.regimen.backend.dto.CycleStateDto;
import com.project.regimen.backend.dto.MovePositionRequestDto;
import com.project.regimen.backend.dto.PreviewDto;
import com.project.regimen.backend.entity.PlanCycle;
import com.project.regimen.backend.entity.PlanCycleItem;
import com.project.regimen.backend.response.ApiResponse;
import com.project.regimen.backend.response.ResponseMessage;
import com.project.regimen.backend.service.CycleService;
import com.project.regimen.backend.service.security.AppUserDetails;
import com.project.regimen.backend.utils.EntityValidator;
import org.springframework.format.annotation.DateTimeFormat;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/cycles")
public class CycleController {

    private final CycleService cycleService;
    private final EntityValidator entityValidator;

    public CycleController(CycleService cycleService, EntityValidator entityValidator) {
        this.cycleService = cycleService;
        this.entityValidator = entityValidator;
    }

    @PostMapping
    public ResponseEntity<ApiResponse> createCycle(@AuthenticationPrincipal AppUserDetails appUser,
                                                   @RequestBody CreateCycleRequestDto request) {
        entityValidator.validate(request);
        PlanCycle cycle = cycleService.createCycle(appUser.getUserId(), request);
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.SUCCESS, cycle), HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<ApiResponse> getCycles(@AuthenticationPrincipal AppUserDetails appUser) {
        List<PlanCycle> cycles = cycleService.getCycles(appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, cycles));
    }

    @GetMapping("/{cycleId}")
    public ResponseEntity<ApiResponse> getCycle(@AuthenticationPrincipal AppUserDetails appUser,
                                                @PathVariable UUID cycleId) {
        PlanCycle cycle = cycleService.getCycle(appUser.getUserId(), cycleId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, cycle));
    }

    @GetMapping("/{cycleId}/state")
    public ResponseEntity<ApiResponse> getState(@AuthenticationPrincipal AppUserDetails appUser,
                                                @PathVariable UUID cycleId) {
        CycleStateDto state = cycleService.getState(appUser.getUserId(), cycleId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, state));
    }

    @DeleteMapping("/{cycleId}")
    public ResponseEntity<ApiResponse> deleteCycle(@AuthenticationPrincipal AppUserDetails appUser,
                                                   @PathVariable UUID cycleId) {
        cycleService.deleteCycle(appUser.getUserId(), cycleId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS));
    }

    @PostMapping("/{cycleId}/activate")
    public ResponseEntity<ApiResponse> activate(@AuthenticationPrincipal AppUserDetails appUser,
                                                @PathVariable UUID cycleId) {
        PlanCycle cycle = cycleService.activate(appUser.getUserId(), cycleId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, cycle));
    }

    @PostMapping("/{cycleId}/deactivate")
    public ResponseEntity<ApiResponse> deactivate(@AuthenticationPrincipal AppUserDetails appUser,
                                                  @PathVariable UUID cycleId) {
        PlanCycle cycle = cycleService.deactivate(appUser.getUserId(), cycleId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, cycle));
    }

    @PostMapping("/{cycleId}/items")
    public ResponseEntity<ApiResponse> addItem(@AuthenticationPrincipal AppUserDetails appUser,
                                               @PathVariable UUID cycleId,
                                               @RequestBody CreateCycleItemRequestDto request) {
        entityValidator.validate(request);
        PlanCycleItem item = cycleService.addItem(appUser.getUserId(), cycleId, request);
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.SUCCESS, item), HttpStatus.CREATED);
    }

    @DeleteMapping("/{cycleId}/items/{itemId}")
    public ResponseEntity<ApiResponse> removeItem(@AuthenticationPrincipal AppUserDetails appUser,
                                                  @PathVariable UUID cycleId,
                                                  @PathVariable UUID itemId) {
        PlanCycle cycle = cycleService.removeItem(appUser.getUserId(), cycleId, itemId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, cycle));
    }

    @PutMapping("/{cycleId}/items/{itemId}/position")
    public ResponseEntity<ApiResponse> moveItem(@AuthenticationPrincipal AppUserDetails appUser,
                                                @PathVariable UUID cycleId,
                                                @PathVariable UUID itemId,
                                                @RequestBody MovePositionRequestDto request) {
        entityValidator.validate(request);
        PlanCycle cycle = cycleService.moveItem(appUser.getUserId(), cycleId, itemId, request.getPosition());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, cycle));
    }

    @PostMapping("/{cycleId}/advance")
    public ResponseEntity<ApiResponse> advance(@AuthenticationPrincipal AppUserDetails appUser,
                                               @PathVariable UUID cycleId) {
        CycleStateDto state = cycleService.advance(appUser.getUserId(), cycleId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, state));
    }

    @PostMapping("/{cycleId}/reset")
    public ResponseEntity<ApiResponse> reset(@AuthenticationPrincipal AppUserDetails appUser,
                                             @PathVariable UUID cycleId) {
        CycleStateDto state = cycleService.reset(appUser.getUserId(), cycleId);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, state));
    }

    @PostMapping("/{cycleId}/completions")
    public ResponseEntity<ApiResponse> recordCompletion(@AuthenticationPrincipal AppUserDetails appUser,
                                                        @PathVariable UUID cycleId,
                                                        @RequestBody CompletionRequestDto request) {
        entityValidator.validate(request);
        CycleStateDto state = cycleService.recordCompletion(appUser.getUserId(), cycleId, request.getDate());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, state));
    }

    @PostMapping("/{cycleId}/change-day")
    public ResponseEntity<ApiResponse> changeDay(@AuthenticationPrincipal AppUserDetails appUser,
                                                 @PathVariable UUID cycleId,
                                                 @RequestBody ChangeDayRequestDto request) {
        entityValidator.validate(request);
        ChangeDayResponseDto result = cycleService.changeDay(appUser.getUserId(), cycleId,
                request.getDayIndex(), request.isSkipAndAdvance());
        return ProgressController.changeDayResponse(result);
    }

    @GetMapping("/{cycleId}/preview")
    public ResponseEntity<ApiResponse> preview(@AuthenticationPrincipal AppUserDetails appUser,
                                               @PathVariable UUID cycleId,
                                               @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        PreviewDto preview = cycleService.preview(appUser.getUserId(), cycleId, date);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, preview));
    }
}
