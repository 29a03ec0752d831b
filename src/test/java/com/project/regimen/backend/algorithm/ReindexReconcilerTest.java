package com.project.regimen.backend.algorithm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@DisplayName("ReindexReconciler Tests")
class ReindexReconcilerTest {

    private static List<ScheduledDay> days(UUID... ids) {
        List<ScheduledDay> days = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            days.add(new InMemoryPlanStore.Day(ids[i], i + 1, false, 1));
        }
        return days;
    }

    private static UUID[] ids(int count) {
        UUID[] ids = new UUID[count];
        for (int i = 0; i < count; i++) {
            ids[i] = UUID.randomUUID();
        }
        return ids;
    }

    @Test
    @DisplayName("Deleting a day before the pointer keeps it on the same day")
    void shouldFollowDayAfterEarlierDeletion() {
        UUID[] ids = ids(4);

        int pointer = ReindexReconciler.reconcile(days(ids), 3, 1, () -> days(ids[0], ids[2], ids[3]));

        assertEquals(2, pointer);
    }

    @Test
    @DisplayName("Reordering moves the pointer with its day")
    void shouldFollowDayAcrossReorder() {
        UUID[] ids = ids(3);

        int pointer = ReindexReconciler.reconcile(days(ids), 1, 1, () -> days(ids[1], ids[2], ids[0]));

        assertEquals(3, pointer);
    }

    @Test
    @DisplayName("Deleting the current day clamps the pointer into range")
    void shouldClampWhenDayRemoved() {
        UUID[] ids = ids(3);

        assertEquals(2, ReindexReconciler.reconcile(days(ids), 3, 1, () -> days(ids[0], ids[1])));
        assertEquals(2, ReindexReconciler.reconcile(days(ids), 2, 1, () -> days(ids[0], ids[2])));
    }

    @Test
    @DisplayName("Inserting a day before the pointer shifts it")
    void shouldShiftAfterInsert() {
        UUID[] ids = ids(3);
        UUID inserted = UUID.randomUUID();

        int pointer = ReindexReconciler.reconcile(days(ids), 2, 1, () -> days(ids[0], inserted, ids[1], ids[2]));

        assertEquals(3, pointer);
    }

    @Test
    @DisplayName("Zero-based pointers work the same way")
    void shouldSupportZeroBase() {
        UUID[] ids = ids(3);

        ReindexReconciler.PointerAnchor anchor = ReindexReconciler.capture(days(ids), 2, 0);

        assertEquals(ids[2], anchor.getEntryId());
        assertEquals(0, ReindexReconciler.resolve(anchor, days(ids[2], ids[0])));
    }

    @Test
    @DisplayName("An out-of-range pointer has no anchor and is clamped")
    void shouldClampOutOfRangePointer() {
        UUID[] ids = ids(2);

        ReindexReconciler.PointerAnchor anchor = ReindexReconciler.capture(days(ids), 7, 1);

        assertNull(anchor.getEntryId());
        assertEquals(2, ReindexReconciler.resolve(anchor, days(ids)));
    }

    @Test
    @DisplayName("An emptied list keeps the old pointer")
    void shouldKeepPointerForEmptyList() {
        UUID[] ids = ids(2);

        assertEquals(2, ReindexReconciler.reconcile(days(ids), 2, 1, List::of));
    }

    @Test
    @DisplayName("densify closes gaps in the current order")
    void shouldDensifyPositions() {
        UUID[] ids = ids(3);
        List<ScheduledDay> gapped = List.of(
                new InMemoryPlanStore.Day(ids[0], 2, false, 1),
                new InMemoryPlanStore.Day(ids[1], 9, false, 1),
                new InMemoryPlanStore.Day(ids[2], 5, false, 1));
        Map<UUID, Integer> positions = new HashMap<>();

        ReindexReconciler.densify(gapped, 1, (day, position) -> positions.put(day.getId(), position));

        assertEquals(1, positions.get(ids[0]));
        assertEquals(3, positions.get(ids[1]));
        assertEquals(2, positions.get(ids[2]));
    }
}
