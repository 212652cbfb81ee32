package health.assist.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChatTurn(
        @NotNull @Size(min = 2, max = 4000) String userMessage,
        @Size(max = 6000) String prescriptionText,
        @Size(max = 6_000_000) String prescriptionImageBase64,
        @Pattern(regexp = "image/jpeg|image/png|image/jpg") String prescriptionImageMimeType,
        @Size(max = 12) List<String> history,
        Boolean aiConsent
) {
    public ChatTurn {
        userMessage = userMessage == null ? null : userMessage.trim();
        prescriptionText = RequestText.trimToEmpty(prescriptionText);
        prescriptionImageBase64 = RequestText.trimToEmpty(prescriptionImageBase64);
        prescriptionImageMimeType = prescriptionImageMimeType == null || prescriptionImageMimeType.isBlank()
                ? null
                : prescriptionImageMimeType.trim();
        history = RequestText.cleanList(history);
    }

    public boolean hasImagePayload() {
        return !prescriptionImageBase64.isEmpty();
    }

    /** Image is only forwarded to the model when payload and MIME type are both present. */
    public boolean hasAttachableImage() {
        return hasImagePayload() && prescriptionImageMimeType != null;
    }

    public boolean consentGiven() {
        return Boolean.TRUE.equals(aiConsent);
    }
}
