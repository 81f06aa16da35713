package com.dealflow.orchestrator.stage;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the submitting thread's MDC (runId, stage, jobId) into tasks run on
 * the shared stage pool, and clears it again when the task ends.
 */
public final class MdcPropagation {

    private MdcPropagation() {}

    public static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    /** Same as {@link #wrap(Callable)} with an extra MDC entry for the task. */
    public static <T> Callable<T> wrap(String key, String value, Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            MDC.put(key, value);
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }
}
