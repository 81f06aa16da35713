package com.dealflow.orchestrator.pipeline;

import com.dealflow.orchestrator.model.ProgressSnapshot;

/**
 * Receives every progress snapshot of a run, synchronously and in order.
 * Exceptions thrown here are logged and otherwise ignored.
 */
@FunctionalInterface
public interface ProgressObserver {

    void onProgress(ProgressSnapshot snapshot);
}
