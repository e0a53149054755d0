package com.subledger.ledger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/** Splits record sets by position key; groups come back in key order, members in input order. */
public final class Partitions {

    private Partitions() {}

    public static <T> SortedMap<PositionKey, List<T>> byPosition(
            Collection<T> records, Function<T, PositionKey> keyFunction) {
        SortedMap<PositionKey, List<T>> groups = new TreeMap<>();
        for (T record : records) {
            groups.computeIfAbsent(keyFunction.apply(record), ignored -> new ArrayList<>()).add(record);
        }
        return groups;
    }
}
