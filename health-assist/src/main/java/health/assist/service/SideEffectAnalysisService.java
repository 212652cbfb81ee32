package health.assist.service;

import health.assist.api.model.SymptomReport;
import health.assist.audit.AiAuditLogger;
import health.assist.domain.triage.TriageResult;
import health.assist.orchestrator.AnalysisOutput;
import health.assist.orchestrator.SideEffectAnalyzer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
public class SideEffectAnalysisService {
    private final SideEffectAnalyzer analyzer;
    private final AiAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    public SideEffectAnalysisService(
            SideEffectAnalyzer analyzer,
            AiAuditLogger auditLogger,
            MeterRegistry meterRegistry
    ) {
        this.analyzer = analyzer;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
    }

    public AnalysisOutput<TriageResult> analyze(String requestId, SymptomReport report) {
        long startNs = System.nanoTime();
        AnalysisOutput<TriageResult> output = analyzer.analyze(report);
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        recordMetrics(output, processingMs);
        auditLogger.logSideEffectAnalysis(requestId, report, output, processingMs);
        return output;
    }

    private void recordMetrics(AnalysisOutput<TriageResult> output, long processingMs) {
        Counter.builder("health_assist_side_effect_total")
                .tag("severity", output.result().severity().wireValue())
                .tag("source", output.source().wireValue())
                .register(meterRegistry)
                .increment();

        if (output.fallbackUsed()) {
            Counter.builder("health_assist_side_effect_fallback_total")
                    .tag("reason", output.fallbackReason())
                    .register(meterRegistry)
                    .increment();
        }

        Timer.builder("health_assist_side_effect_latency")
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
    }
}
