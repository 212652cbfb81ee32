package health.assist.orchestrator;

import health.assist.llm.LlmOutcome;

public record AnalysisOutput<T>(
        T result,
        Source source,
        String fallbackReason
) {
    public enum Source {
        LLM("llm"),
        FALLBACK("fallback");

        private final String wireValue;

        Source(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }

    public static <T> AnalysisOutput<T> fromLlm(T result) {
        return new AnalysisOutput<>(result, Source.LLM, LlmOutcome.NONE);
    }

    public static <T> AnalysisOutput<T> fallback(T result, String reason) {
        return new AnalysisOutput<>(result, Source.FALLBACK, reason);
    }

    public boolean fallbackUsed() {
        return source == Source.FALLBACK;
    }
}
