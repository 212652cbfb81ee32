package health.assist.voice;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallResponse {
    PENDING("pending"),
    TAKEN("taken"),
    MISSED("missed");

    private final String wireValue;

    CallResponse(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
