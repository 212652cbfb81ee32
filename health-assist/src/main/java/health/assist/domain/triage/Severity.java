package health.assist.domain.triage;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Severity {
    LOW("low", Urgency.SELF_MONITOR),
    MEDIUM("medium", Urgency.CALL_DOCTOR_24H),
    HIGH("high", Urgency.SEEK_URGENT_CARE),
    EMERGENCY("emergency", Urgency.EMERGENCY_NOW);

    private final String wireValue;
    private final Urgency urgency;

    Severity(String wireValue, Urgency urgency) {
        this.wireValue = wireValue;
        this.urgency = urgency;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public Urgency urgency() {
        return urgency;
    }

    public boolean requiresDoctor() {
        return this == HIGH || this == EMERGENCY;
    }

    public static Optional<Severity> fromWire(String value) {
        for (Severity severity : values()) {
            if (severity.wireValue.equals(value)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
