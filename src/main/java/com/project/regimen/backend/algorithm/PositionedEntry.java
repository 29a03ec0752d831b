package com.project.regimen.backend.algorithm;

import java.util.Comparator;
import java.util.UUID;

/**
 * An element of an ordered, user-editable list (a plan's days or a cycle's
 * items). The id never changes; the position does, whenever the list is
 * edited.
 */
public interface PositionedEntry {

    /** Orders entries by position, ties broken by id so the order is stable. */
    Comparator<PositionedEntry> BY_POSITION = Comparator
            .comparingInt(PositionedEntry::getPosition)
            .thenComparing(PositionedEntry::getId);

    UUID getId();

    int getPosition();
}
