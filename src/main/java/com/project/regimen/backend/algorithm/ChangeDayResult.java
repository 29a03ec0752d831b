package com.project.regimen.backend.algorithm;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ChangeDayResult {

    private final ChangeDayOutcome outcome;

    /** The day to materialize, only set when the change went through. */
    private final ScheduledDay targetDay;

    /** Stored pointer after the change, in the index base of the caller. */
    private final int dayIndex;

    static ChangeDayResult changed(ScheduledDay targetDay, int dayIndex) {
        return new ChangeDayResult(ChangeDayOutcome.CHANGED, targetDay, dayIndex);
    }

    static ChangeDayResult rejected() {
        return new ChangeDayResult(ChangeDayOutcome.REJECTED_WORK_IN_PROGRESS, null, -1);
    }

    static ChangeDayResult invalid() {
        return new ChangeDayResult(ChangeDayOutcome.INVALID, null, -1);
    }

    public Optional<ScheduledDay> target() {
        return Optional.ofNullable(targetDay);
    }

    public boolean isChanged() {
        return outcome == ChangeDayOutcome.CHANGED;
    }
}
