package com.project.regimen.backend.controller;

import com.project.regimen.backend.response.ApiResponse;
import com.project.regimen.backend.response.ResponseMessage;
import com.project.regimen.backend.service.security.AppUserDetails;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.web.authentication.logout.SecurityContextLogoutHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Slf4j
public class LoginLogoutController {
    @GetMapping("/login")
    public ResponseEntity<ApiResponse> tryLogin(@AuthenticationPrincipal AppUserDetails appUser) {
        log.info("Profile {} ({}) logged in", appUser.getUserId(), appUser.getUsername());
        return new ResponseEntity<ApiResponse>(new ApiResponse(ResponseMessage.LOGIN_SUCCESSFUL, appUser.getUserId()), HttpStatus.OK);
    }

    @GetMapping("/api/logout")
    public ResponseEntity<ApiResponse> logout(HttpServletRequest request, HttpServletResponse response, Authentication authentication) {
        if(authentication != null){
            // also invalidates the session
            new SecurityContextLogoutHandler().logout(request, response, authentication);
            log.info("Profile {} logged out", authentication.getName());
        }
        return ResponseEntity.ok().body(new ApiResponse(ResponseMessage.LOGOUT_SUCCESSFUL));
    }

    @GetMapping("/isAuthenticated")
    public ResponseEntity<ApiResponse> isAuthenticated(Authentication authentication) {

        if (authentication != null && !authentication.getName().equals("anonymous") && !authentication.getName().equals("anonymousUser")) {
            if (authentication.isAuthenticated()) {
                log.info("The user: {} is authenticated", authentication.getName());
                return ResponseEntity.ok(new ApiResponse("true"));
            }
        }
        return new ResponseEntity<ApiResponse>(new ApiResponse("false"), HttpStatus.UNAUTHORIZED);
    }
}
