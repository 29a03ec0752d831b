package com.project.regimen.backend.service;

import com.project.regimen.backend.config.ProgressConfiguration;
import com.project.regimen.backend.dto.ProfileSettingsDto;
import com.project.regimen.backend.dto.RegistrationRequestDto;
import com.project.regimen.backend.entity.AppUser;
import com.project.regimen.backend.entity.ExecutionMode;
import com.project.regimen.backend.entity.WorkoutPlan;
import com.project.regimen.backend.exception.PlanDoesNotExistException;
import com.project.regimen.backend.exception.UserDoesNotExistException;
import com.project.regimen.backend.exception.ValidationFailureException;
import com.project.regimen.backend.repository.AppUserRepository;
import com.project.regimen.backend.repository.WorkoutPlanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AppUserService Tests")
class AppUserServiceTest {

    private static final Integer PROFILE = 1;

    private AppUserRepository appUserRepository;
    private WorkoutPlanRepository workoutPlanRepository;
    private PasswordEncoder passwordEncoder;
    private AppUserService service;

    @BeforeEach
    void setUp() {
        appUserRepository = mock(AppUserRepository.class);
        workoutPlanRepository = mock(WorkoutPlanRepository.class);
        passwordEncoder = new BCryptPasswordEncoder();
        service = new AppUserService(appUserRepository, workoutPlanRepository, passwordEncoder,
                new ProgressConfiguration("UTC", 4));
        when(appUserRepository.save(any(AppUser.class))).thenAnswer(returnsFirstArg());
    }

    @Test
    @DisplayName("Registration hashes the password and applies the default boundary hour")
    void shouldRegisterWithDefaults() {
        RegistrationRequestDto request = new RegistrationRequestDto("lifter", "secret1", "Ada", "L", "ada@example.com", null);

        AppUser user = service.register(request);

        assertEquals("lifter", user.getUsername());
        assertTrue(passwordEncoder.matches("secret1", user.getPassword()));
        assertEquals(4, user.getDayBoundaryHour());
        assertEquals(ExecutionMode.SINGLE, user.getExecutionMode());
    }

    @Test
    @DisplayName("A taken username fails validation")
    void shouldRejectDuplicateUsername() {
        when(appUserRepository.existsByUsername("lifter")).thenReturn(true);
        RegistrationRequestDto request = new RegistrationRequestDto("lifter", "secret1", null, null, null, 2);

        ValidationFailureException e = assertThrows(ValidationFailureException.class, () -> service.register(request));

        assertTrue(e.getErrors().hasFieldErrors("username"));
        verify(appUserRepository, never()).save(any());
    }

    @Test
    @DisplayName("Settings are updated field by field")
    void shouldUpdateSettingsPartially() {
        UUID planId = UUID.randomUUID();
        AppUser user = AppUser.builder().uid(PROFILE).dayBoundaryHour(3).build();
        when(appUserRepository.findById(PROFILE)).thenReturn(Optional.of(user));
        when(workoutPlanRepository.findByIdAndProfileId(planId, PROFILE))
                .thenReturn(Optional.of(WorkoutPlan.builder().id(planId).build()));

        service.updateSettings(PROFILE, ProfileSettingsDto.builder().activePlanId(planId).build());
        assertEquals(planId, user.getActivePlanId());
        assertEquals(3, user.getDayBoundaryHour());

        service.updateSettings(PROFILE, ProfileSettingsDto.builder()
                .dayBoundaryHour(5)
                .executionMode(ExecutionMode.CYCLE)
                .clearActivePlan(true)
                .build());
        assertEquals(5, user.getDayBoundaryHour());
        assertEquals(ExecutionMode.CYCLE, user.getExecutionMode());
        assertNull(user.getActivePlanId());
    }

    @Test
    @DisplayName("Only the profile's own plans can become active")
    void shouldRejectForeignActivePlan() {
        UUID planId = UUID.randomUUID();
        when(appUserRepository.findById(PROFILE)).thenReturn(Optional.of(AppUser.builder().uid(PROFILE).build()));
        when(workoutPlanRepository.findByIdAndProfileId(planId, PROFILE)).thenReturn(Optional.empty());

        assertThrows(PlanDoesNotExistException.class,
                () -> service.updateSettings(PROFILE, ProfileSettingsDto.builder().activePlanId(planId).build()));
    }

    @Test
    @DisplayName("Unknown users are reported")
    void shouldReportUnknownUser() {
        when(appUserRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThrows(UserDoesNotExistException.class, () -> service.loadUserByUsername("ghost"));
    }
}
