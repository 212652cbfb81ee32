package health.assist.llm;

public class LlmOutputException extends Exception {
    public LlmOutputException(String message) {
        super(message);
    }

    public LlmOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
