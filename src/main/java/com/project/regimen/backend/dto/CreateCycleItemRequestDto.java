package com.project.regimen.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class CreateCycleItemRequestDto {
    @NotNull(message="plan id is required")
    UUID planId;

    String note;
}
