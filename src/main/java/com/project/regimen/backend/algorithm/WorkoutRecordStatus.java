package com.project.regimen.backend.algorithm;

/**
 * State of the workout record for one (profile, plan, program day).
 *
 * <pre>
 *  ABSENT     – no record, or the record belongs to another plan.
 *  INCOMPLETE – a record exists but some planned set is not logged yet.
 *  COMPLETE   – every planned set of every entry is logged.
 * </pre>
 */
public enum WorkoutRecordStatus {

    ABSENT,
    INCOMPLETE,
    COMPLETE
}
