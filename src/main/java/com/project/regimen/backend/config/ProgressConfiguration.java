package com.project.regimen.backend.config;

import com.project.regimen.backend.algorithm.CycleProgressTracker;
import com.project.regimen.backend.algorithm.PlanStore;
import com.project.regimen.backend.algorithm.ProgramDayCalendar;
import com.project.regimen.backend.algorithm.SinglePlanProgressTracker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the progression engine and its settings.
 *
 * {@code regimen.progress.zone-id} is the zone program days are computed in;
 * left blank the JVM default is used. {@code regimen.progress.default-day-boundary-hour}
 * is what new profiles start with.
 */
@Slf4j
@Getter
@Configuration
public class ProgressConfiguration {

    private final ZoneId zoneId;

    private final int defaultDayBoundaryHour;

    public ProgressConfiguration(@Value("${regimen.progress.zone-id:}") String zoneId,
                                 @Value("${regimen.progress.default-day-boundary-hour:3}") int defaultDayBoundaryHour) {
        ProgramDayCalendar.checkBoundaryHour(defaultDayBoundaryHour);
        this.zoneId = zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
        this.defaultDayBoundaryHour = defaultDayBoundaryHour;
        log.info("Program days computed in zone {}, default boundary hour {}", this.zoneId, defaultDayBoundaryHour);
    }

    @Bean
    public ZoneId programZone() {
        return zoneId;
    }

    @Bean
    public Clock clock() {
        return Clock.system(zoneId);
    }

    @Bean
    public SinglePlanProgressTracker singlePlanProgressTracker(PlanStore planStore) {
        return new SinglePlanProgressTracker(planStore);
    }

    @Bean
    public CycleProgressTracker cycleProgressTracker(PlanStore planStore) {
        return new CycleProgressTracker(planStore);
    }
}
