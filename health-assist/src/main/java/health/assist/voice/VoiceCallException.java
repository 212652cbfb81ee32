package health.assist.voice;

public class VoiceCallException extends RuntimeException {
    public VoiceCallException(String message) {
        super(message);
    }

    public VoiceCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
