package com.project.regimen.backend.algorithm;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.UUID;
import java.util.function.ObjIntConsumer;
import java.util.function.Supplier;

/**
 * Keeps a numeric pointer on the same entry while the list it points into is
 * edited.
 *
 * Progress stores positions (day 3, item 1), but days and items can be
 * inserted, deleted or reordered at any time. Before an edit the pointer is
 * turned into an anchor on the entry's identity; after the edit the anchor is
 * resolved back to whatever ordinal that entry now has. If the entry is gone
 * the old pointer is clamped into the new range.
 *
 * {@code base} is 1 for plan days and 0 for cycle items.
 */
public final class ReindexReconciler {

    private ReindexReconciler() {
    }

    /**
     * The identity a pointer referred to before an edit.
     */
    @Getter
    @ToString
    @AllArgsConstructor
    public static final class PointerAnchor {

        /** Id of the entry under the pointer, null when the pointer was out of range. */
        private final UUID entryId;

        private final int pointer;

        private final int base;
    }

    public static PointerAnchor capture(List<? extends PositionedEntry> entries, int pointer, int base) {
        List<PositionedEntry> ordered = ordered(entries);
        int ordinal = pointer - base;
        UUID id = ordinal >= 0 && ordinal < ordered.size() ? ordered.get(ordinal).getId() : null;
        return new PointerAnchor(id, pointer, base);
    }

    /**
     * Pointer that refers to the anchored entry in {@code entriesAfter}.
     *
     * @return the entry's new ordinal (plus base) if it survived, otherwise
     *         the old pointer clamped to {@code [base, size - 1 + base]}.
     *         With an empty list there is no valid position and the old
     *         pointer is returned as is.
     */
    public static int resolve(PointerAnchor anchor, List<? extends PositionedEntry> entriesAfter) {
        List<PositionedEntry> ordered = ordered(entriesAfter);
        if (ordered.isEmpty()) {
            return anchor.getPointer();
        }
        if (anchor.getEntryId() != null) {
            for (int i = 0; i < ordered.size(); i++) {
                if (anchor.getEntryId().equals(ordered.get(i).getId())) {
                    return i + anchor.getBase();
                }
            }
        }
        int max = ordered.size() - 1 + anchor.getBase();
        return Math.max(anchor.getBase(), Math.min(anchor.getPointer(), max));
    }

    /**
     * Capture, run the edit, resolve.
     *
     * @param mutation applies the edit and returns the list as it is afterwards.
     */
    public static int reconcile(List<? extends PositionedEntry> entriesBefore, int pointer, int base,
                                Supplier<? extends List<? extends PositionedEntry>> mutation) {
        PointerAnchor anchor = capture(entriesBefore, pointer, base);
        return resolve(anchor, mutation.get());
    }

    /**
     * Renumbers the entries to {@code base, base + 1, ...} in their current
     * order, closing any gaps left by deletions.
     *
     * @param setPosition writes the new position into an entry.
     */
    public static <T extends PositionedEntry> void densify(List<T> entries, int base, ObjIntConsumer<T> setPosition) {
        List<T> ordered = entries.stream().sorted(PositionedEntry.BY_POSITION).toList();
        for (int i = 0; i < ordered.size(); i++) {
            setPosition.accept(ordered.get(i), i + base);
        }
    }

    private static List<PositionedEntry> ordered(List<? extends PositionedEntry> entries) {
        return entries.stream().sorted(PositionedEntry.BY_POSITION).map(PositionedEntry.class::cast).toList();
    }
}
