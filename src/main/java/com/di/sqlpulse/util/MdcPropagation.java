package com.di.sqlpulse.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Carries SLF4J MDC onto timer threads so that collection ticks log with the context of the
 * request that started the schedule, plus their own {@code connectionId}.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap before scheduling: {@code executor.scheduleAtFixedRate(MdcPropagation.wrapRunnable(task), ...)}</li>
 *   <li>Add keys for the task only: {@code MdcPropagation.wrapRunnable(Map.of("connectionId", id), task)}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String CONNECTION_ID = "connectionId";
    public static final String RUN_ID = "runId";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of
     * the task and clears it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        return wrapRunnable(Collections.emptyMap(), task);
    }

    /**
     * Same as {@link #wrapRunnable(Runnable)}, with {@code extra} keys layered over the captured MDC.
     */
    public static Runnable wrapRunnable(Map<String, String> extra, Runnable task) {
        Map<String, String> contextMap = new HashMap<>(copyMdc());
        contextMap.putAll(extra);
        return () -> runWithMdcContext(contextMap, task);
    }

    /**
     * Runs the task in the current thread with {@code contextMap} set in MDC, restoring any
     * previous values of those keys afterwards.
     */
    public static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        Map<String, String> previous = new HashMap<>();
        contextMap.keySet().forEach(key -> {
            String value = MDC.get(key);
            if (value != null) {
                previous.put(key, value);
            }
        });
        contextMap.forEach(MDC::put);
        try {
            task.run();
        } finally {
            contextMap.keySet().forEach(MDC::remove);
            previous.forEach(MDC::put);
        }
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }
}
