package com.dealflow.orchestrator.stage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class MdcPropagationTest {

    private final ExecutorService pool = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        MDC.clear();
        pool.shutdownNow();
    }

    @Test
    void wrap_copiesCallerContextAndAddsEntry() throws Exception {
        MDC.put("jobId", "job-1");

        String seen = pool.submit(MdcPropagation.wrap("stage", "risk",
                () -> MDC.get("jobId") + "/" + MDC.get("stage"))).get();

        assertThat(seen).isEqualTo("job-1/risk");
        assertThat(MDC.get("stage")).isNull();
    }

    @Test
    void wrap_clearsContextOnPooledThreadAfterTask() throws Exception {
        MDC.put("runId", "run-1");
        pool.submit(MdcPropagation.wrap(() -> MDC.get("runId"))).get();
        MDC.clear();

        String leaked = pool.submit(() -> MDC.get("runId")).get();

        assertThat(leaked).isNull();
    }
}
