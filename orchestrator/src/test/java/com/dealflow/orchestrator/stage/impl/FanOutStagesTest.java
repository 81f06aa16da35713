package com.dealflow.orchestrator.stage.impl;

import com.dealflow.orchestrator.fragment.Fragment;
import com.dealflow.orchestrator.reasoning.ReasoningClient;
import com.dealflow.orchestrator.reasoning.ReasoningException;
import com.dealflow.orchestrator.reasoning.ReasoningOptions;
import com.dealflow.orchestrator.stage.FanOutInput;
import com.dealflow.orchestrator.stage.StageException;
import com.dealflow.orchestrator.stage.StageNames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the analysis, risk and valuation stages with a mocked
 * reasoning client.
 */
@ExtendWith(MockitoExtension.class)
class FanOutStagesTest {

    private static final ReasoningOptions OPTIONS = new ReasoningOptions(null, 0.2);

    @Mock ReasoningClient client;

    private static final Fragment FOUNDATION =
            Fragment.mapping(Map.of("company_name", Fragment.scalar("Acme")));

    @Test
    void stages_haveFixedNames() {
        assertThat(new AnalysisStage(client, OPTIONS).name()).isEqualTo(StageNames.ANALYSIS);
        assertThat(new RiskStage(client, OPTIONS).name()).isEqualTo(StageNames.RISK);
        assertThat(new ValuationStage(client, OPTIONS).name()).isEqualTo(StageNames.VALUATION);
    }

    @Test
    void analysis_sendsFoundationAndReturnsMapping() {
        Fragment answer = Fragment.mapping(Map.of("analysis_confidence", Fragment.scalar(0.7)));
        when(client.invoke(anyString(), eq(StagePrompts.ANALYSIS_SCHEMA), eq(OPTIONS))).thenReturn(answer);

        Fragment result = new AnalysisStage(client, OPTIONS).execute(FanOutInput.of(FOUNDATION));

        assertThat(result).isEqualTo(answer);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(client).invoke(prompt.capture(), any(), any());
        assertThat(prompt.getValue()).contains("{\"company_name\":\"Acme\"}");
    }

    @Test
    void risk_unparsableAnswer_isRetryableOperationError() {
        when(client.invoke(anyString(), any(), any())).thenReturn(Fragment.unparsable("no"));

        assertThatThrownBy(() -> new RiskStage(client, OPTIONS).execute(FanOutInput.of(FOUNDATION)))
                .isInstanceOf(StageException.class)
                .hasMessageContaining("unparsable text")
                .satisfies(e -> assertThat(((StageException) e).getKind())
                        .isEqualTo(StageException.Kind.OPERATION_ERROR));
    }

    @Test
    void risk_arrayAnswer_isRejected() {
        when(client.invoke(anyString(), any(), any()))
                .thenReturn(Fragment.sequence(List.of(Fragment.scalar("x"))));

        assertThatThrownBy(() -> new RiskStage(client, OPTIONS).execute(FanOutInput.of(FOUNDATION)))
                .hasMessageContaining("a JSON array");
    }

    @Test
    void valuation_withoutEnrichment_hasNoAnalystContext() {
        when(client.invoke(anyString(), any(), any())).thenReturn(Fragment.emptyMapping());

        new ValuationStage(client, OPTIONS).execute(FanOutInput.of(FOUNDATION));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(client).invoke(prompt.capture(), any(), any());
        assertThat(prompt.getValue()).doesNotContain("ANALYST ASSESSMENT");
    }

    @Test
    void valuation_withEnrichment_appendsAnalysisToPrompt() {
        when(client.invoke(anyString(), any(), any())).thenReturn(Fragment.emptyMapping());
        Fragment analysis = Fragment.mapping(Map.of("investment_thesis", Fragment.scalar("Strong moat")));

        new ValuationStage(client, OPTIONS).execute(new FanOutInput(FOUNDATION, analysis));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(client).invoke(prompt.capture(), any(), any());
        assertThat(prompt.getValue()).contains("ANALYST ASSESSMENT", "Strong moat");
    }

    @Test
    void valuation_transientFailure_isRetryable() {
        when(client.invoke(anyString(), any(), any()))
                .thenThrow(new ReasoningException(ReasoningException.Kind.TRANSIENT, 503, "unavailable"));

        assertThatThrownBy(() -> new ValuationStage(client, OPTIONS).execute(FanOutInput.of(FOUNDATION)))
                .isInstanceOf(StageException.class)
                .satisfies(e -> assertThat(((StageException) e).getKind())
                        .isEqualTo(StageException.Kind.OPERATION_ERROR))
                .hasCauseInstanceOf(ReasoningException.class);
    }
}
