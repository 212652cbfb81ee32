package health.assist.voice;

public class InvalidPhoneNumberException extends VoiceCallException {
    public InvalidPhoneNumberException(String rawPhone) {
        super("Invalid destination phone: " + rawPhone);
    }
}
