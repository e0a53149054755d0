package com.subledger.jdbc.calcite;

import com.subledger.engine.SubledgerResult;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Process-wide handles for completed runs, referenced by id from Calcite model operands. */
public final class SubledgerRunRegistry {

    private static final Map<String, SubledgerResult> RUNS = new ConcurrentHashMap<>();

    private SubledgerRunRegistry() {}

    /** Registers the run under a fresh id and returns the id. */
    public static String register(SubledgerResult result) {
        String id = UUID.randomUUID().toString();
        register(id, result);
        return id;
    }

    public static void register(String id, SubledgerResult result) {
        RUNS.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(result, "result"));
    }

    public static SubledgerResult get(String id) {
        return id == null ? null : RUNS.get(id);
    }

    public static SubledgerResult remove(String id) {
        return id == null ? null : RUNS.remove(id);
    }
}
