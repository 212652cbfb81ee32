package health.assist.service;

import health.assist.api.model.ChatTurn;
import health.assist.audit.AiAuditLogger;
import health.assist.domain.chat.ChatResult;
import health.assist.orchestrator.AnalysisOutput;
import health.assist.orchestrator.MedicalChatAssistant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
public class MedicalChatService {
    private final MedicalChatAssistant assistant;
    private final AiAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    public MedicalChatService(
            MedicalChatAssistant assistant,
            AiAuditLogger auditLogger,
            MeterRegistry meterRegistry
    ) {
        this.assistant = assistant;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
    }

    public AnalysisOutput<ChatResult> chat(String requestId, ChatTurn turn) {
        long startNs = System.nanoTime();
        AnalysisOutput<ChatResult> output = assistant.chat(turn);
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        Counter.builder("health_assist_chat_total")
                .tag("emergency", String.valueOf(output.result().emergency()))
                .tag("source", output.source().wireValue())
                .register(meterRegistry)
                .increment();
        if (output.fallbackUsed()) {
            Counter.builder("health_assist_chat_fallback_total")
                    .tag("reason", output.fallbackReason())
                    .register(meterRegistry)
                    .increment();
        }
        Timer.builder("health_assist_chat_latency")
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);

        auditLogger.logMedicalChat(requestId, turn, output, processingMs);
        return output;
    }
}
