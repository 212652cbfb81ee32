package health.assist.domain.triage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Urgency {
    SELF_MONITOR("self_monitor"),
    CALL_DOCTOR_24H("call_doctor_24h"),
    SEEK_URGENT_CARE("seek_urgent_care"),
    EMERGENCY_NOW("emergency_now");

    private final String wireValue;

    Urgency(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static Optional<Urgency> fromWire(String value) {
        for (Urgency urgency : values()) {
            if (urgency.wireValue.equals(value)) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }
}
