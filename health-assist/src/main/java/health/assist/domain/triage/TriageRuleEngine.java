package health.assist.domain.triage;

import health.assist.api.model.SymptomReport;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class TriageRuleEngine {
    static final double FALLBACK_CONFIDENCE = 0.45;
    private static final int MEDIUM_SYMPTOM_COUNT = 3;

    private static final List<String> EMERGENCY_TERMS = List.of(
            "chest pain",
            "shortness of breath",
            "breathlessness",
            "fainting",
            "seizure",
            "unconscious",
            "severe bleeding",
            "swelling of face",
            "swelling of tongue",
            "anaphylaxis"
    );

    private static final List<String> HIGH_TERMS = List.of(
            "high fever",
            "persistent vomiting",
            "bloody stool",
            "black stool",
            "confusion",
            "severe headache",
            "severe rash",
            "yellow eyes",
            "yellow skin"
    );

    private static final Map<Severity, String> RECOMMENDATIONS = new EnumMap<>(Severity.class);

    static {
        RECOMMENDATIONS.put(Severity.LOW,
                "Monitor symptoms, hydrate, and continue tracking. If symptoms persist, consult your doctor.");
        RECOMMENDATIONS.put(Severity.MEDIUM,
                "Consult your doctor within 24 hours for guidance and possible medicine adjustment.");
        RECOMMENDATIONS.put(Severity.HIGH,
                "Seek urgent medical care today and avoid the next dose until advised by a clinician.");
        RECOMMENDATIONS.put(Severity.EMERGENCY,
                "Seek emergency care immediately or call emergency services now.");
    }

    public TriageResult evaluate(SymptomReport report) {
        Severity severity = classify(report.symptoms());
        return new TriageResult(
                severity,
                severity != Severity.LOW,
                severity.urgency(),
                List.of(
                        "Possible medicine side effect",
                        "Interaction with another medicine",
                        "Underlying condition worsening"
                ),
                List.of(
                        "Record exact symptom start time",
                        "Avoid self-medicating additional drugs",
                        "Keep hydration and rest"
                ),
                List.of(
                        "Breathing difficulty",
                        "Chest pain",
                        "Severe swelling/rash"
                ),
                recommendationFor(severity),
                FALLBACK_CONFIDENCE
        );
    }

    Severity classify(List<String> symptoms) {
        String symptomsText = String.join(" | ", symptoms).toLowerCase(Locale.ROOT);

        if (containsAny(symptomsText, EMERGENCY_TERMS)) {
            return Severity.EMERGENCY;
        }
        if (containsAny(symptomsText, HIGH_TERMS)) {
            return Severity.HIGH;
        }
        if (symptoms.size() >= MEDIUM_SYMPTOM_COUNT) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public static String recommendationFor(Severity severity) {
        return RECOMMENDATIONS.get(severity);
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
