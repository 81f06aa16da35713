package com.dealflow.orchestrator.stage;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.model.PipelineInput;

/**
 * The stage every other stage depends on. It runs alone, first, and has no
 * fallback: if it fails the run is aborted.
 */
public interface FoundationalStage {

    String name();

    /**
     * @throws StageException to steer the runner's retry decision; any other
     *                        exception is treated as an unexpected, retryable failure
     */
    Fragment execute(PipelineInput input);
}
