package com.dealflow.orchestrator.stage;

import com.dealflow.orchestrator.fragment.Fragment;

/**
 * A stage that runs concurrently with its siblings once the foundational stage
 * has succeeded. Its slot in the report is filled by a fallback if it fails.
 */
public interface FanOutStage {

    String name();

    Fragment execute(FanOutInput input);
}
