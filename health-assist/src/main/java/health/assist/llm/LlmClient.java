package health.assist.llm;

public interface LlmClient {
    LlmOutcome generate(LlmPrompt prompt);

    default boolean isConfigured() {
        return true;
    }
}
