package com.project.regimen.backend.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class RegistrationRequestDto {
    @NotEmpty(message="username is required")
    @Size(max = 50, message="username should be at most 50 characters")
    String username;

    @NotEmpty(message="password is required")
    @Size(min = 6, message="password should be at least 6 characters")
    String password;

    String firstName;

    String lastName;

    @Email(message="email is not valid")
    String email;

    // falls back to the configured default when absent
    @Min(value = 0, message="day boundary hour should be between 0 and 23")
    @Max(value = 23, message="day boundary hour should be between 0 and 23")
    Integer dayBoundaryHour;
}
