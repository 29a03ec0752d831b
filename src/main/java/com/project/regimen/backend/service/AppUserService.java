package com.project.regimen.backend.service;

import com.project.regimen.backend.algorithm.ProgramDayCalendar;
import com.project.regimen.backend.config.ProgressConfiguration;
import com.project.regimen.backend.dto.ProfileSettingsDto;
import com.project.regimen.backend.dto.RegistrationRequestDto;
import com.project.regimen.backend.entity.AppUser;
import com.project.regimen.backend.entity.ExecutionMode;
import com.project.regimen.backend.exception.ExceptionMessage;
import com.project.regimen.backend.exception.PlanDoesNotExistException;
import com.project.regimen.backend.exception.UserDoesNotExistException;
import com.project.regimen.backend.exception.ValidationFailureException;
import com.project.regimen.backend.repository.AppUserRepository;
import com.project.regimen.backend.repository.WorkoutPlanRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindingResult;

@Slf4j
@Service
public class AppUserService {

    private final AppUserRepository appUserRepository;
    private final WorkoutPlanRepository workoutPlanRepository;
    private final PasswordEncoder passwordEncoder;
    private final ProgressConfiguration progressConfiguration;

    AppUserService(AppUserRepository appUserRepository,
                   WorkoutPlanRepository workoutPlanRepository,
                   PasswordEncoder passwordEncoder,
                   ProgressConfiguration progressConfiguration) {
        this.appUserRepository = appUserRepository;
        this.workoutPlanRepository = workoutPlanRepository;
        this.passwordEncoder = passwordEncoder;
        this.progressConfiguration = progressConfiguration;
    }

    public AppUser loadUserByUsername(String username) {
        if(username == null) {
            throw new UserDoesNotExistException("Username is null");
        }
        return appUserRepository.findByUsername(username)
                .orElseThrow(() -> new UserDoesNotExistException(ExceptionMessage.USER_DOES_NOT_EXIST));
    }

    public AppUser loadUserById(Integer uid) {
        return appUserRepository.findById(uid)
                .orElseThrow(() -> new UserDoesNotExistException(ExceptionMessage.USER_DOES_NOT_EXIST));
    }

    @Transactional
    public AppUser register(RegistrationRequestDto request) {
        if(appUserRepository.existsByUsername(request.getUsername())) {
            BindingResult errors = new BeanPropertyBindingResult(request, "object");
            errors.rejectValue("username", "duplicate", ExceptionMessage.USERNAME_ALREADY_TAKEN.toString());
            throw new ValidationFailureException(ExceptionMessage.VALIDATION_FAILED, errors);
        }

        int boundaryHour = request.getDayBoundaryHour() != null
                ? request.getDayBoundaryHour()
                : progressConfiguration.getDefaultDayBoundaryHour();

        AppUser user = AppUser.builder()
                .username(request.getUsername())
                .password(passwordEncoder.encode(request.getPassword()))
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .email(request.getEmail())
                .dayBoundaryHour(boundaryHour)
                .executionMode(ExecutionMode.SINGLE)
                .build();

        AppUser saved = appUserRepository.save(user);
        log.info("Registered user {} with day boundary hour {}", saved.getUsername(), boundaryHour);
        return saved;
    }

    @Transactional
    public AppUser updateSettings(Integer uid, ProfileSettingsDto settings) {
        AppUser user = loadUserById(uid);

        if(settings.getDayBoundaryHour() != null) {
            ProgramDayCalendar.checkBoundaryHour(settings.getDayBoundaryHour());
            user.setDayBoundaryHour(settings.getDayBoundaryHour());
        }
        if(settings.getExecutionMode() != null) {
            user.setExecutionMode(settings.getExecutionMode());
        }
        if(settings.isClearActivePlan()) {
            user.setActivePlanId(null);
        } else if(settings.getActivePlanId() != null) {
            workoutPlanRepository.findByIdAndProfileId(settings.getActivePlanId(), uid)
                    .orElseThrow(() -> new PlanDoesNotExistException(ExceptionMessage.PLAN_DOES_NOT_EXIST));
            user.setActivePlanId(settings.getActivePlanId());
        }

        log.info("Updated settings of user {}: boundary hour {}, mode {}, active plan {}",
                uid, user.getDayBoundaryHour(), user.getExecutionMode(), user.getActivePlanId());
        return appUserRepository.save(user);
    }
}
