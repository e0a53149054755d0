package com.subledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Signed daily movements per series key, with running balances derived by cumulative sum in date
 * order. Shared by the thin ledger (keyed by account/currency) and the MTM control (keyed by
 * position).
 *
 * @param <K> series key; iteration follows its natural order so output is deterministic
 */
public final class DailyMovements<K extends Comparable<K>> {

    private final Map<K, NavigableMap<LocalDate, BigDecimal>> changes = new TreeMap<>();

    public void add(K key, LocalDate date, BigDecimal signedAmount) {
        changes.computeIfAbsent(key, ignored -> new TreeMap<>()).merge(date, signedAmount, BigDecimal::add);
    }

    public List<K> keys() {
        return List.copyOf(changes.keySet());
    }

    public NavigableMap<LocalDate, BigDecimal> dayChanges(K key) {
        NavigableMap<LocalDate, BigDecimal> series = changes.get(key);
        return series == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(series);
    }

    public BigDecimal dayChange(K key, LocalDate date) {
        BigDecimal change = dayChanges(key).get(date);
        return change != null ? change : BigDecimal.ZERO;
    }

    /** Balance carried into {@code date}, including that day's movement; zero before the first movement. */
    public BigDecimal balanceAsOf(K key, LocalDate date) {
        BigDecimal running = BigDecimal.ZERO;
        for (BigDecimal change : dayChanges(key).headMap(date, true).values()) {
            running = running.add(change);
        }
        return running;
    }
}
