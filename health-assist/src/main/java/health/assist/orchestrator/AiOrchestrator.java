package health.assist.orchestrator;

import health.assist.llm.LlmClient;
import health.assist.llm.LlmOutcome;
import health.assist.llm.LlmPrompt;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.*;

@Component
public class AiOrchestrator {
    private final LlmClient llmClient;
    private final boolean llmEnabled;
    private final long timeoutMs;
    private final ExecutorService executor;

    public AiOrchestrator(
            LlmClient llmClient,
            @Value("${health.assist.llm.enabled:true}") boolean llmEnabled,
            @Value("${health.assist.llm.timeout-ms:20000}") long timeoutMs,
            @Value("${health.assist.llm.pool-size:8}") int poolSize
    ) {
        this.llmClient = llmClient;
        this.llmEnabled = llmEnabled;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    public LlmOutcome invoke(LlmPrompt prompt) {
        if (!llmEnabled) {
            return LlmOutcome.failure(LlmOutcome.LLM_DISABLED);
        }
        if (!llmClient.isConfigured()) {
            return LlmOutcome.failure(LlmOutcome.LLM_NOT_CONFIGURED);
        }

        Future<LlmOutcome> future = null;
        try {
            future = executor.submit(() -> llmClient.generate(prompt));
            LlmOutcome outcome = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (outcome == null) {
                return LlmOutcome.failure(LlmOutcome.LLM_EMPTY);
            }
            if (!outcome.isSuccess() && LlmOutcome.NONE.equals(outcome.failureReason())) {
                return LlmOutcome.failure(LlmOutcome.LLM_EMPTY);
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            return LlmOutcome.failure(LlmOutcome.LLM_TIMEOUT);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return LlmOutcome.failure(LlmOutcome.LLM_INTERRUPTED);
        } catch (ExecutionException | RejectedExecutionException e) {
            return LlmOutcome.failure(LlmOutcome.LLM_ERROR);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
