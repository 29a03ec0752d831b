package com.project.regimen.backend.controller;

import com.project.regimen.backend.algorithm.ChangeDayOutcome;
import com.project.regimen.backend.config.SecurityConfiguration;
import com.project.regimen.backend.dto.ChangeDayResponseDto;
import com.project.regimen.backend.dto.PreviewDto;
import com.project.regimen.backend.dto.TodayWorkoutDto;
import com.project.regimen.backend.entity.ExecutionMode;
import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.PlanDoesNotExistException;
import com.project.regimen.backend.service.AppUserService;
import com.project.regimen.backend.service.PlanProgressService;
import com.project.regimen.backend.service.security.AppUserDetails;
import com.project.regimen.backend.utils.EntityValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProgressController.class)
@Import({SecurityConfiguration.class, EntityValidator.class})
@DisplayName("ProgressController Tests")
class ProgressControllerTest {

    private static final AppUserDetails LIFTER = new AppUserDetails(11, "lifter", "{noop}pw");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlanProgressService planProgressService;

    @MockBean
    private AppUserService appUserService;

    @Test
    @DisplayName("Requests without credentials get a 401")
    void shouldRequireAuthentication() throws Exception {
        mockMvc.perform(post("/api/progress/today"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(planProgressService);
    }

    @Test
    @DisplayName("Opening today returns the resolved workout for the principal's profile")
    void shouldOpenToday() throws Exception {
        UUID planId = UUID.randomUUID();
        when(planProgressService.openToday(11)).thenReturn(TodayWorkoutDto.builder()
                .programDay(LocalDate.of(2025, 12, 16))
                .mode(ExecutionMode.SINGLE)
                .planId(planId)
                .dayIndex(4)
                .outcome("ADVANCED")
                .reason("PREVIOUS_DAY_COMPLETED")
                .build());

        mockMvc.perform(post("/api/progress/today").with(user(LIFTER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.dayIndex").value(4))
                .andExpect(jsonPath("$.mainBody.programDay").value("2025-12-16"))
                .andExpect(jsonPath("$.mainBody.planId").value(planId.toString()));
    }

    @Test
    @DisplayName("A day change refused for logged sets is a 409")
    void shouldReturnConflictForRejectedChange() throws Exception {
        UUID planId = UUID.randomUUID();
        when(planProgressService.changeDay(eq(11), eq(planId), anyInt(), anyBoolean()))
                .thenReturn(new ChangeDayResponseDto(ChangeDayOutcome.REJECTED_WORK_IN_PROGRESS, 2, null));

        mockMvc.perform(post("/api/progress/plans/{planId}/change-day", planId)
                        .with(user(LIFTER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dayIndex\": 3, \"skipAndAdvance\": true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.mainBody.outcome").value("REJECTED_WORK_IN_PROGRESS"));
    }

    @Test
    @DisplayName("A completion without a date fails validation")
    void shouldValidateCompletion() throws Exception {
        mockMvc.perform(post("/api/progress/plans/{planId}/completions", UUID.randomUUID())
                        .with(user(LIFTER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.mainBody.date").value("date is required"));

        verifyNoInteractions(planProgressService);
    }

    @Test
    @DisplayName("Previews take an ISO date")
    void shouldPreview() throws Exception {
        UUID planId = UUID.randomUUID();
        LocalDate date = LocalDate.of(2025, 12, 18);
        when(planProgressService.preview(11, planId, date))
                .thenReturn(new PreviewDto(date, 2, planId, 4, 4, "Legs"));

        mockMvc.perform(get("/api/progress/plans/{planId}/preview", planId)
                        .param("date", "2025-12-18")
                        .with(user(LIFTER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mainBody.dayIndex").value(4))
                .andExpect(jsonPath("$.mainBody.dayName").value("Legs"));

        mockMvc.perform(get("/api/progress/plans/{planId}/preview", planId)
                        .param("date", "tomorrow")
                        .with(user(LIFTER)))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown plans are a 404")
    void shouldReturnNotFoundForUnknownPlan() throws Exception {
        UUID planId = UUID.randomUUID();
        when(planProgressService.getProgress(any(), eq(planId)))
                .thenThrow(new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));

        mockMvc.perform(get("/api/progress/plans/{planId}", planId).with(user(LIFTER)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Plan does not exist"));
    }
}
