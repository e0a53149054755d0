package com.subledger.control;

import com.subledger.ledger.PositionKey;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/** A position on one date; undated feed rows sort first. */
record SnapshotKey(PositionKey key, LocalDate date) implements Comparable<SnapshotKey> {

    private static final Comparator<SnapshotKey> ORDER =
            Comparator.comparing(SnapshotKey::key)
                    .thenComparing(SnapshotKey::date, Comparator.nullsFirst(Comparator.naturalOrder()));

    SnapshotKey {
        Objects.requireNonNull(key, "key");
    }

    @Override
    public int compareTo(SnapshotKey other) {
        return ORDER.compare(this, other);
    }
}
