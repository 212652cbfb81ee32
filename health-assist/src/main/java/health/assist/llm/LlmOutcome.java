package health.assist.llm;

public record LlmOutcome(String text, String failureReason) {
    public static final String NONE = "NONE";
    public static final String LLM_DISABLED = "LLM_DISABLED";
    public static final String LLM_NOT_CONFIGURED = "LLM_NOT_CONFIGURED";
    public static final String LLM_TIMEOUT = "LLM_TIMEOUT";
    public static final String LLM_INTERRUPTED = "LLM_INTERRUPTED";
    public static final String LLM_HTTP_ERROR = "LLM_HTTP_ERROR";
    public static final String LLM_EMPTY = "LLM_EMPTY";
    public static final String LLM_ERROR = "LLM_ERROR";
    public static final String LLM_OUTPUT_INVALID = "LLM_OUTPUT_INVALID";

    public static LlmOutcome success(String text) {
        return new LlmOutcome(text, NONE);
    }

    public static LlmOutcome failure(String reason) {
        return new LlmOutcome(null, reason);
    }

    public boolean isSuccess() {
        return text != null && !text.isBlank();
    }
}
