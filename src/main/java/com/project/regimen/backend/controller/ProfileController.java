package com.project.regimen.backend.controller;

import com.project.regimen.backend.dto.ProfileSettingsDto;
import com.project.regimen.backend.dto.RegistrationRequestDto;
import com.project.regimen.backend.entity.AppUser;
import com.project.regimen.backend.response.ApiResponse;
import com.project.regimen.backend.response.ResponseMessage;
import com.project.regimen.backend.service.AppUserService;
import com.project.regimen.backend.service.security.AppUserDetails;
import com.project.regimen.backend.utils.EntityValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AppUserService appUserService;
    private final EntityValidator entityValidator;

    public ProfileController(AppUserService appUserService, EntityValidator entityValidator) {
        this.appUserService = appUserService;
        this.entityValidator = entityValidator;
    }

    @PostMapping("/register")
    public ResponseEntity<ApiResponse> register(@RequestBody RegistrationRequestDto request) {
        entityValidator.validate(request);
        AppUser user = appUserService.register(request);
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.REGISTRATION_SUCCESSFUL, user), HttpStatus.CREATED);
    }

    @GetMapping("/api/profile/settings")
    public ResponseEntity<ApiResponse> getSettings(@AuthenticationPrincipal AppUserDetails appUser) {
        AppUser user = appUserService.loadUserById(appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, user));
    }

    @PutMapping("/api/profile/settings")
    public ResponseEntity<ApiResponse> updateSettings(@AuthenticationPrincipal AppUserDetails appUser,
                                                      @RequestBody ProfileSettingsDto settings) {
        entityValidator.validate(settings);
        AppUser user = appUserService.updateSettings(appUser.getUserId(), settings);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, user));
    }
}
