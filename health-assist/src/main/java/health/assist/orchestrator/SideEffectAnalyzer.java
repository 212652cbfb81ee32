package health.assist.orchestrator;

import health.assist.api.model.SymptomReport;
import health.assist.domain.triage.TriageNormalizer;
import health.assist.domain.triage.TriagePromptBuilder;
import health.assist.domain.triage.TriageResult;
import health.assist.domain.triage.TriageRuleEngine;
import health.assist.llm.LlmJsonReader;
import health.assist.llm.LlmOutcome;
import health.assist.llm.LlmOutputException;
import health.assist.llm.LlmPrompt;
import health.assist.policy.ResponsePolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SideEffectAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SideEffectAnalyzer.class);
    private static final double TEMPERATURE = 0.1;

    private final AiOrchestrator orchestrator;
    private final TriagePromptBuilder promptBuilder;
    private final LlmJsonReader jsonReader;
    private final TriageNormalizer normalizer;
    private final TriageRuleEngine ruleEngine;
    private final ResponsePolicyEngine policyEngine;

    public SideEffectAnalyzer(
            AiOrchestrator orchestrator,
            TriagePromptBuilder promptBuilder,
            LlmJsonReader jsonReader,
            TriageNormalizer normalizer,
            TriageRuleEngine ruleEngine,
            ResponsePolicyEngine policyEngine
    ) {
        this.orchestrator = orchestrator;
        this.promptBuilder = promptBuilder;
        this.jsonReader = jsonReader;
        this.normalizer = normalizer;
        this.ruleEngine = ruleEngine;
        this.policyEngine = policyEngine;
    }

    public AnalysisOutput<TriageResult> analyze(SymptomReport report) {
        try {
            LlmOutcome outcome = orchestrator.invoke(LlmPrompt.text(promptBuilder.build(report), TEMPERATURE));
            if (!outcome.isSuccess()) {
                return AnalysisOutput.fallback(ruleEngine.evaluate(report), outcome.failureReason());
            }
            TriageResult result = normalizer.normalize(jsonReader.readObject(outcome.text()));
            return AnalysisOutput.fromLlm(policyEngine.apply(result));
        } catch (LlmOutputException e) {
            log.warn("event=llm_output_invalid pipeline=side_effect error={}", e.getMessage());
            return AnalysisOutput.fallback(ruleEngine.evaluate(report), LlmOutcome.LLM_OUTPUT_INVALID);
        } catch (RuntimeException e) {
            log.error("event=analyzer_error pipeline=side_effect", e);
            return AnalysisOutput.fallback(ruleEngine.evaluate(report), LlmOutcome.LLM_ERROR);
        }
    }
}
