package health.assist.domain.triage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriageNormalizerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final TriageNormalizer normalizer = new TriageNormalizer();

    @Test
    void shouldCorrectUrgencyAndDoctorFlagFromSeverity() throws Exception {
        TriageResult result = normalizer.normalize(json("""
                {"severity":"HIGH ","urgency":"self_monitor","doctor_consultation_needed":false,"confidence":0.9}
                """));

        assertEquals(Severity.HIGH, result.severity());
        assertEquals(Urgency.SEEK_URGENT_CARE, result.urgency());
        assertTrue(result.doctorConsultationNeeded());
        assertEquals(0.9, result.confidence(), 1e-9);
    }

    @Test
    void shouldDefaultUnknownSeverityToMedium() throws Exception {
        TriageResult result = normalizer.normalize(json("{\"severity\":\"critical\",\"urgency\":\"asap\"}"));

        assertEquals(Severity.MEDIUM, result.severity());
        assertEquals(Urgency.CALL_DOCTOR_24H, result.urgency());
        assertTrue(result.doctorConsultationNeeded());
    }

    @Test
    void shouldDefaultConfidenceWhenNotANumber() throws Exception {
        TriageResult result = normalizer.normalize(json("{\"severity\":\"low\",\"confidence\":\"not-a-number\"}"));

        assertEquals(0.5, result.confidence(), 1e-9);
        assertFalse(result.doctorConsultationNeeded());
        assertEquals(Urgency.SELF_MONITOR, result.urgency());
    }

    @Test
    void shouldClampConfidence() throws Exception {
        assertEquals(1.0, normalizer.normalize(json("{\"confidence\":7}")).confidence(), 1e-9);
        assertEquals(0.0, normalizer.normalize(json("{\"confidence\":-0.2}")).confidence(), 1e-9);
    }

    @Test
    void shouldKeepLowSeverityDoctorFlagFromModel() throws Exception {
        TriageResult result = normalizer.normalize(json("{\"severity\":\"low\",\"doctor_consultation_needed\":true}"));

        assertTrue(result.doctorConsultationNeeded());
    }

    @Test
    void shouldCoerceListFields() throws Exception {
        TriageResult result = normalizer.normalize(json("""
                {"severity":"medium",
                 "possible_reasons":["a","b","c","d","e","f","g","h","i","j","k","l"],
                 "immediate_actions":"Drink water",
                 "warning_signs":42,
                 "recommendation":"  See a doctor  "}
                """));

        assertEquals(10, result.possibleReasons().size());
        assertEquals(List.of("Drink water"), result.immediateActions());
        assertEquals(List.of(), result.warningSigns());
        assertEquals("See a doctor", result.recommendation());
    }

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) mapper.readTree(text);
    }
}
