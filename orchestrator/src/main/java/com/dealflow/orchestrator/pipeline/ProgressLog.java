package com.dealflow.orchestrator.pipeline;

import com.dealflow.orchestrator.model.ProgressSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, synchronized record of a run's snapshots.
 *
 * Percentages never go backwards: an append below the last recorded value is
 * clamped up to it.
 */
class ProgressLog {

    private final List<ProgressSnapshot> entries = new ArrayList<>();

    synchronized ProgressSnapshot append(ProgressSnapshot snapshot) {
        ProgressSnapshot entry = snapshot;
        if (!entries.isEmpty()) {
            double floor = entries.get(entries.size() - 1).percentage();
            if (snapshot.percentage() < floor) {
                entry = new ProgressSnapshot(snapshot.phase(), floor, snapshot.message(),
                        snapshot.stages(), snapshot.startedAt(), snapshot.estimatedCompletion(),
                        snapshot.pipelineState());
            }
        }
        entries.add(entry);
        return entry;
    }

    synchronized Optional<ProgressSnapshot> latest() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    synchronized List<ProgressSnapshot> snapshot() {
        return List.copyOf(entries);
    }
}
