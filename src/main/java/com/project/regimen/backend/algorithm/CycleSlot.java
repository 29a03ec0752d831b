package com.project.regimen.backend.algorithm;

import java.util.UUID;

/**
 * Read-only view of one cycle item: a reference to a plan at a 0-indexed
 * position inside the cycle. The referenced plan may have been deleted.
 */
public interface CycleSlot extends PositionedEntry {

    UUID getPlanId();
}
