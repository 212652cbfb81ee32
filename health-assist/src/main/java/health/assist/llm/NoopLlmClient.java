package health.assist.llm;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "health.assist.llm", name = "provider", havingValue = "none")
public class NoopLlmClient implements LlmClient {
    @Override
    public LlmOutcome generate(LlmPrompt prompt) {
        return LlmOutcome.failure(LlmOutcome.LLM_DISABLED);
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
