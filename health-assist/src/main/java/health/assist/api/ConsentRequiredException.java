package health.assist.api;

public class ConsentRequiredException extends RuntimeException {
    public ConsentRequiredException() {
        super("AI consent required for assistant processing.");
    }
}
