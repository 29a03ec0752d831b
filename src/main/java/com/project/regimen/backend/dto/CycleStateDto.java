package com.project.regimen.backend.dto;

import com.project.regimen.backend.algorithm.CycleAdvanceOutcome;
import com.project.regimen.backend.algorithm.CycleProgress;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Getter
@AllArgsConstructor
public class CycleStateDto {
    private final UUID cycleId;
    private final CycleAdvanceOutcome outcome;
    private final int currentItemIndex;
    private final int currentDayIndex;
    private final Instant lastAdvancedAt;
    private final LocalDate lastOpenedDate;
    private final LocalDate lastCompletedDate;

    public static CycleStateDto of(UUID cycleId, CycleAdvanceOutcome outcome, CycleProgress progress) {
        return new CycleStateDto(cycleId, outcome, progress.getCurrentItemIndex(), progress.getCurrentDayIndex(),
                progress.getLastAdvancedAt(), progress.getLastOpenedDate(), progress.getLastCompletedDate());
    }
}
