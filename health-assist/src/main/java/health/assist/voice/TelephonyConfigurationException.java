package health.assist.voice;

public class TelephonyConfigurationException extends VoiceCallException {
    public TelephonyConfigurationException(String message) {
        super(message);
    }
}
