package health.assist.voice;

public class TelephonyException extends VoiceCallException {
    public TelephonyException(String message) {
        super(message);
    }

    public TelephonyException(String message, Throwable cause) {
        super(message, cause);
    }
}
