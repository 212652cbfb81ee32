package health.assist.domain.triage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TriageResult(
        Severity severity,
        boolean doctorConsultationNeeded,
        Urgency urgency,
        List<String> possibleReasons,
        List<String> immediateActions,
        List<String> warningSigns,
        String recommendation,
        double confidence
) {
    public static final String DISCLAIMER = "This is educational support, not a diagnosis. "
            + "If symptoms are severe or worsening, contact a doctor immediately.";

    public TriageResult {
        possibleReasons = List.copyOf(possibleReasons);
        immediateActions = List.copyOf(immediateActions);
        warningSigns = List.copyOf(warningSigns);
        recommendation = recommendation == null ? "" : recommendation;
    }

    @JsonProperty("disclaimer")
    public String disclaimer() {
        return DISCLAIMER;
    }

    public TriageResult withRecommendation(String value) {
        return new TriageResult(severity, doctorConsultationNeeded, urgency,
                possibleReasons, immediateActions, warningSigns, value, confidence);
    }
}
