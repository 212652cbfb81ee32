package health.assist.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.time.temporal.TemporalAccessor;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SymptomReport(
        @NotBlank @Size(max = 120) String medicineName,
        @Size(max = 120) String dose,
        @JsonDeserialize(using = TakenAtDeserializer.class) TemporalAccessor takenAt,
        @NotEmpty(message = "At least one symptom is required.") @Size(max = 20) List<String> symptoms,
        @Min(0) @Max(120) Integer patientAge,
        @Size(max = 40) String patientGender,
        @Size(max = 20) List<String> knownConditions,
        @Size(max = 1000) String extraNotes
) {
    public SymptomReport {
        medicineName = medicineName == null ? null : medicineName.trim();
        dose = RequestText.trimToEmpty(dose);
        symptoms = RequestText.cleanList(symptoms);
        patientGender = RequestText.trimToEmpty(patientGender);
        knownConditions = RequestText.cleanList(knownConditions);
        extraNotes = RequestText.trimToEmpty(extraNotes);
    }
}
