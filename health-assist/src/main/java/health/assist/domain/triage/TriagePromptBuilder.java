package health.assist.domain.triage;

import health.assist.api.model.SymptomReport;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

@Component
public class TriagePromptBuilder {
    private static final String INSTRUCTIONS = """
            You are a careful clinical triage assistant.
            Task: Analyze possible side-effects for the medicine and symptoms below.
            Return STRICT JSON only with keys:
            {"severity":"low|medium|high|emergency",\
            "doctor_consultation_needed":true|false,\
            "urgency":"self_monitor|call_doctor_24h|seek_urgent_care|emergency_now",\
            "possible_reasons":["..."],\
            "immediate_actions":["..."],\
            "warning_signs":["..."],\
            "recommendation":"...",\
            "confidence":0.0}
            Safety rules:
            1) If life-threatening symptoms are possible, mark emergency.
            2) Be conservative. If uncertain, increase urgency.
            3) No markdown, no explanation outside JSON.

            """;

    public String build(SymptomReport report) {
        StringBuilder prompt = new StringBuilder(INSTRUCTIONS);
        prompt.append("Medicine name: ").append(report.medicineName()).append('\n');
        prompt.append("Dose: ").append(orPlaceholder(report.dose(), "unknown")).append('\n');
        prompt.append("Taken at: ").append(takenAt(report.takenAt())).append('\n');
        prompt.append("Symptoms: ").append(String.join(", ", report.symptoms())).append('\n');
        prompt.append("Age: ")
                .append(report.patientAge() == null ? "unknown" : report.patientAge().toString())
                .append('\n');
        prompt.append("Gender: ").append(orPlaceholder(report.patientGender(), "unknown")).append('\n');
        prompt.append("Known conditions: ")
                .append(orPlaceholder(String.join(", ", report.knownConditions()), "none"))
                .append('\n');
        prompt.append("Extra notes: ").append(orPlaceholder(report.extraNotes(), "none")).append('\n');
        return prompt.toString();
    }

    private static String takenAt(TemporalAccessor value) {
        if (value == null) {
            return "unknown";
        }
        if (value.isSupported(ChronoField.OFFSET_SECONDS)) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value);
        }
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value);
    }

    private static String orPlaceholder(String value, String placeholder) {
        return value == null || value.isBlank() ? placeholder : value;
    }
}
