package com.project.regimen.backend.entity;

/**
 * Whether "today" comes from a single active plan or from the active cycle.
 */
public enum ExecutionMode {
    SINGLE,
    CYCLE
}
