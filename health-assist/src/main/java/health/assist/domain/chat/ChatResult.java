package health.assist.domain.chat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatResult(
        String reply,
        List<String> medicineUses,
        List<String> healthGuidance,
        List<String> dietGuidance,
        List<String> exerciseGuidance,
        List<String> precautions,
        boolean imageReceived,
        boolean emergency
) {
    public static final String DISCLAIMER = "This assistant provides educational guidance only and does not "
            + "replace a licensed doctor. For emergencies, contact local emergency services immediately.";

    public ChatResult {
        reply = reply == null ? "" : reply;
        medicineUses = List.copyOf(medicineUses);
        healthGuidance = List.copyOf(healthGuidance);
        dietGuidance = List.copyOf(dietGuidance);
        exerciseGuidance = List.copyOf(exerciseGuidance);
        precautions = List.copyOf(precautions);
    }

    @JsonProperty("disclaimer")
    public String disclaimer() {
        return DISCLAIMER;
    }

    public ChatResult withImageReceived(boolean value) {
        return new ChatResult(reply, medicineUses, healthGuidance, dietGuidance,
                exerciseGuidance, precautions, value, emergency);
    }

    public ChatResult withReply(String value) {
        return new ChatResult(value, medicineUses, healthGuidance, dietGuidance,
                exerciseGuidance, precautions, imageReceived, emergency);
    }
}
