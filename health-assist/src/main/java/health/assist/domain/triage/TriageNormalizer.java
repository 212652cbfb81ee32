package health.assist.domain.triage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import static health.assist.llm.FieldCoercion.bool;
import static health.assist.llm.FieldCoercion.lowerText;
import static health.assist.llm.FieldCoercion.probability;
import static health.assist.llm.FieldCoercion.stringList;
import static health.assist.llm.FieldCoercion.text;

@Component
public class TriageNormalizer {
    static final int MAX_LIST_ENTRIES = 10;
    static final double DEFAULT_CONFIDENCE = 0.5;

    public TriageResult normalize(ObjectNode data) {
        Severity severity = Severity.fromWire(lowerText(data.get("severity"))).orElse(Severity.MEDIUM);
        Urgency urgency = Urgency.fromWire(lowerText(data.get("urgency")))
                .filter(value -> value == severity.urgency())
                .orElse(severity.urgency());

        boolean doctorNeeded = bool(data.get("doctor_consultation_needed"), severity != Severity.LOW);
        if (severity.requiresDoctor()) {
            doctorNeeded = true;
        }

        return new TriageResult(
                severity,
                doctorNeeded,
                urgency,
                stringList(data.get("possible_reasons"), MAX_LIST_ENTRIES),
                stringList(data.get("immediate_actions"), MAX_LIST_ENTRIES),
                stringList(data.get("warning_signs"), MAX_LIST_ENTRIES),
                text(data.get("recommendation")),
                probability(data.get("confidence"), DEFAULT_CONFIDENCE)
        );
    }
}
