package com.project.regimen.backend.dto;

import com.project.regimen.backend.algorithm.ChangeDayOutcome;
import com.project.regimen.backend.entity.WorkoutDay;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ChangeDayResponseDto {
    private final ChangeDayOutcome outcome;
    private final int dayIndex;
    private final WorkoutDay workout;
}
