package health.assist.audit;

import health.assist.api.model.ChatTurn;
import health.assist.api.model.SymptomReport;
import health.assist.domain.chat.ChatResult;
import health.assist.domain.triage.TriageResult;
import health.assist.orchestrator.AnalysisOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AiAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AiAuditLogger.class);

    public void logSideEffectAnalysis(
            String requestId,
            SymptomReport report,
            AnalysisOutput<TriageResult> output,
            long processingMs
    ) {
        log.info(
                "event=side_effect_analysis request_id={} medicine={} symptom_count={} severity={} urgency={} doctor_needed={} confidence={} source={} fallback_reason={} processing_ms={}",
                requestId,
                report.medicineName(),
                report.symptoms().size(),
                output.result().severity().wireValue(),
                output.result().urgency().wireValue(),
                output.result().doctorConsultationNeeded(),
                output.result().confidence(),
                output.source().wireValue(),
                output.fallbackReason(),
                processingMs
        );
    }

    public void logMedicalChat(
            String requestId,
            ChatTurn turn,
            AnalysisOutput<ChatResult> output,
            long processingMs
    ) {
        log.info(
                "event=medical_chat request_id={} message_chars={} history_size={} image_received={} emergency={} source={} fallback_reason={} processing_ms={}",
                requestId,
                turn.userMessage().length(),
                turn.history().size(),
                output.result().imageReceived(),
                output.result().emergency(),
                output.source().wireValue(),
                output.fallbackReason(),
                processingMs
        );
    }

    public void logVoiceCall(String callSid, String maskedPhone, String status, String outcome) {
        log.info(
                "event=voice_reminder_call call_sid={} to={} status={} outcome={}",
                callSid,
                maskedPhone,
                status,
                outcome
        );
    }

    public void logVoiceCallback(String event, String callSid, String value) {
        log.info("event={} call_sid={} value={}", event, callSid, value);
    }
}
