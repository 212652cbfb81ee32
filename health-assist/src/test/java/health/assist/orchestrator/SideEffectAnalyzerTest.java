package health.assist.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import health.assist.api.model.SymptomReport;
import health.assist.domain.triage.Severity;
import health.assist.domain.triage.TriageNormalizer;
import health.assist.domain.triage.TriagePromptBuilder;
import health.assist.domain.triage.TriageResult;
import health.assist.domain.triage.TriageRuleEngine;
import health.assist.domain.triage.Urgency;
import health.assist.llm.LlmClient;
import health.assist.llm.LlmJsonReader;
import health.assist.llm.LlmOutcome;
import health.assist.policy.ResponsePolicyEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SideEffectAnalyzerTest {
    private AiOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    @Test
    void shouldNormalizeModelOutput() {
        SideEffectAnalyzer analyzer = analyzer(prompt -> LlmOutcome.success("""
                Here you go: {"severity":"high","urgency":"self_monitor","doctor_consultation_needed":false,
                "possible_reasons":["Allergic reaction"],"recommendation":"","confidence":"0.8"}
                """));

        AnalysisOutput<TriageResult> output = analyzer.analyze(report("itching", "rash"));

        assertEquals(AnalysisOutput.Source.LLM, output.source());
        assertEquals(LlmOutcome.NONE, output.fallbackReason());
        assertEquals(Severity.HIGH, output.result().severity());
        assertEquals(Urgency.SEEK_URGENT_CARE, output.result().urgency());
        assertTrue(output.result().doctorConsultationNeeded());
        assertEquals(0.8, output.result().confidence(), 1e-9);
        assertEquals(List.of("Allergic reaction"), output.result().possibleReasons());
        assertEquals(TriageRuleEngine.recommendationFor(Severity.HIGH), output.result().recommendation());
    }

    @Test
    void shouldFallBackWhenModelReturnsNoJson() {
        SideEffectAnalyzer analyzer = analyzer(prompt -> LlmOutcome.success("I am not able to answer that."));

        AnalysisOutput<TriageResult> output = analyzer.analyze(report("shortness of breath"));

        assertEquals(AnalysisOutput.Source.FALLBACK, output.source());
        assertEquals(LlmOutcome.LLM_OUTPUT_INVALID, output.fallbackReason());
        assertEquals(Severity.EMERGENCY, output.result().severity());
        assertEquals(0.45, output.result().confidence(), 1e-9);
    }

    @Test
    void shouldFallBackOnUpstreamFailure() {
        SideEffectAnalyzer analyzer = analyzer(prompt -> LlmOutcome.failure(LlmOutcome.LLM_HTTP_ERROR));

        AnalysisOutput<TriageResult> output = analyzer.analyze(report("nausea"));

        assertTrue(output.fallbackUsed());
        assertEquals(LlmOutcome.LLM_HTTP_ERROR, output.fallbackReason());
        assertEquals(Severity.LOW, output.result().severity());
    }

    @Test
    void shouldNeverThrowWhenClientThrows() {
        SideEffectAnalyzer analyzer = analyzer(prompt -> {
            throw new IllegalStateException("socket closed");
        });

        AnalysisOutput<TriageResult> output = analyzer.analyze(report("high fever"));

        assertTrue(output.fallbackUsed());
        assertEquals(Severity.HIGH, output.result().severity());
    }

    @Test
    void shouldAlwaysProduceCanonicalSeverityUrgencyPairs() {
        List<String> replies = List.of(
                "{\"severity\":\"emergency\",\"urgency\":\"call_doctor_24h\"}",
                "{\"severity\":\"low\",\"urgency\":\"emergency_now\",\"confidence\":12}",
                "{\"severity\":null,\"urgency\":null,\"confidence\":null}",
                "{\"severity\":[\"high\"],\"doctor_consultation_needed\":\"no\"}"
        );
        for (String reply : replies) {
            SideEffectAnalyzer analyzer = analyzer(prompt -> LlmOutcome.success(reply));
            TriageResult result = analyzer.analyze(report("nausea")).result();

            assertEquals(result.severity().urgency(), result.urgency(), reply);
            assertTrue(result.confidence() >= 0.0 && result.confidence() <= 1.0, reply);
            if (result.severity() == Severity.HIGH || result.severity() == Severity.EMERGENCY) {
                assertTrue(result.doctorConsultationNeeded(), reply);
            }
            orchestrator.shutdown();
        }
    }

    private SideEffectAnalyzer analyzer(LlmClient client) {
        orchestrator = new AiOrchestrator(client, true, 1_000, 1);
        return new SideEffectAnalyzer(
                orchestrator,
                new TriagePromptBuilder(),
                new LlmJsonReader(new ObjectMapper()),
                new TriageNormalizer(),
                new TriageRuleEngine(),
                new ResponsePolicyEngine()
        );
    }

    private static SymptomReport report(String... symptoms) {
        return new SymptomReport("Amoxicillin", "500mg", null, List.of(symptoms), 34, "female", List.of(), "");
    }
}
