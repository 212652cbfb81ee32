package health.assist.orchestrator;

import health.assist.llm.LlmClient;
import health.assist.llm.LlmOutcome;
import health.assist.llm.LlmPrompt;
import health.assist.llm.NoopLlmClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AiOrchestratorTest {
    private static final LlmPrompt PROMPT = LlmPrompt.text("hello", 0.1);

    @Test
    void shouldNotCallClientWhenDisabled() {
        AiOrchestrator orchestrator = new AiOrchestrator(prompt -> {
            throw new AssertionError("client must not be called");
        }, false, 100, 1);
        try {
            assertEquals(LlmOutcome.LLM_DISABLED, orchestrator.invoke(PROMPT).failureReason());
        } finally {
            orchestrator.shutdown();
        }
    }

    @Test
    void shouldReportNotConfiguredClient() {
        AiOrchestrator orchestrator = new AiOrchestrator(new LlmClient() {
            @Override
            public LlmOutcome generate(LlmPrompt prompt) {
                throw new AssertionError("client must not be called");
            }

            @Override
            public boolean isConfigured() {
                return false;
            }
        }, true, 100, 1);
        try {
            assertEquals(LlmOutcome.LLM_NOT_CONFIGURED, orchestrator.invoke(PROMPT).failureReason());
        } finally {
            orchestrator.shutdown();
        }
    }

    @Test
    void shouldTimeOutSlowClient() {
        AiOrchestrator orchestrator = new AiOrchestrator(prompt -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return LlmOutcome.success("{}");
        }, true, 50, 1);
        try {
            assertEquals(LlmOutcome.LLM_TIMEOUT, orchestrator.invoke(PROMPT).failureReason());
        } finally {
            orchestrator.shutdown();
        }
    }

    @Test
    void shouldMapClientExceptionToError() {
        AiOrchestrator orchestrator = new AiOrchestrator(prompt -> {
            throw new IllegalStateException("boom");
        }, true, 500, 1);
        try {
            assertEquals(LlmOutcome.LLM_ERROR, orchestrator.invoke(PROMPT).failureReason());
        } finally {
            orchestrator.shutdown();
        }
    }

    @Test
    void shouldTreatBlankSuccessAsEmpty() {
        AiOrchestrator orchestrator = new AiOrchestrator(prompt -> LlmOutcome.success("  "), true, 500, 1);
        try {
            assertEquals(LlmOutcome.LLM_EMPTY, orchestrator.invoke(PROMPT).failureReason());
        } finally {
            orchestrator.shutdown();
        }
    }

    @Test
    void shouldTreatNoopClientAsNotConfigured() {
        AiOrchestrator orchestrator = new AiOrchestrator(new NoopLlmClient(), true, 500, 1);
        try {
            assertEquals(LlmOutcome.LLM_NOT_CONFIGURED, orchestrator.invoke(PROMPT).failureReason());
        } finally {
            orchestrator.shutdown();
        }
    }
}
