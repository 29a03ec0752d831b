package com.project.regimen.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class CompletionRequestDto {
    // program day the workout was completed on
    @NotNull(message="date is required")
    LocalDate date;
}
