package health.assist.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReminderCallRequest(
        @NotBlank @Size(max = 32) String toPhone,
        @Size(max = 120) String patientName,
        @Size(max = 120) String caregiverName,
        @Size(max = 120) String medicineName,
        @Size(max = 120) String dosage,
        @Size(max = 40) String scheduledTime,
        @Size(max = 20) String dateKey,
        @Pattern(regexp = "self_patient|caregiver_patient") String mode
) {
    public static final String MODE_SELF = "self_patient";
    public static final String MODE_CAREGIVER = "caregiver_patient";

    public ReminderCallRequest {
        patientName = RequestText.trimToEmpty(patientName);
        caregiverName = RequestText.trimToEmpty(caregiverName);
        medicineName = RequestText.trimToEmpty(medicineName);
        dosage = RequestText.trimToEmpty(dosage);
        scheduledTime = RequestText.trimToEmpty(scheduledTime);
        dateKey = RequestText.trimToEmpty(dateKey);
        mode = mode == null || mode.isBlank() ? MODE_CAREGIVER : mode.trim();
    }

    public Map<String, String> templateFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("patient_name", patientName);
        fields.put("caregiver_name", caregiverName);
        fields.put("medicine_name", medicineName);
        fields.put("dosage", dosage);
        fields.put("scheduled_time", scheduledTime);
        fields.put("date_key", dateKey);
        fields.put("mode", mode);
        return fields;
    }
}
