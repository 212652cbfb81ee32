package health.assist.voice;

public class CallNotFoundException extends RuntimeException {
    public CallNotFoundException(String callSid) {
        super("Call result not found: " + callSid);
    }
}
