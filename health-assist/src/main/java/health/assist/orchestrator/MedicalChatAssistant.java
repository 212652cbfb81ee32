package health.assist.orchestrator;

import health.assist.api.model.ChatTurn;
import health.assist.domain.chat.ChatFallbackResponder;
import health.assist.domain.chat.ChatNormalizer;
import health.assist.domain.chat.ChatPromptBuilder;
import health.assist.domain.chat.ChatResult;
import health.assist.llm.LlmJsonReader;
import health.assist.llm.LlmOutcome;
import health.assist.llm.LlmOutputException;
import health.assist.llm.LlmPrompt;
import health.assist.policy.ResponsePolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MedicalChatAssistant {
    private static final Logger log = LoggerFactory.getLogger(MedicalChatAssistant.class);
    private static final double TEMPERATURE = 0.25;

    private final AiOrchestrator orchestrator;
    private final ChatPromptBuilder promptBuilder;
    private final LlmJsonReader jsonReader;
    private final ChatNormalizer normalizer;
    private final ChatFallbackResponder fallbackResponder;
    private final ResponsePolicyEngine policyEngine;

    public MedicalChatAssistant(
            AiOrchestrator orchestrator,
            ChatPromptBuilder promptBuilder,
            LlmJsonReader jsonReader,
            ChatNormalizer normalizer,
            ChatFallbackResponder fallbackResponder,
            ResponsePolicyEngine policyEngine
    ) {
        this.orchestrator = orchestrator;
        this.promptBuilder = promptBuilder;
        this.jsonReader = jsonReader;
        this.normalizer = normalizer;
        this.fallbackResponder = fallbackResponder;
        this.policyEngine = policyEngine;
    }

    public AnalysisOutput<ChatResult> chat(ChatTurn turn) {
        try {
            LlmOutcome outcome = orchestrator.invoke(toPrompt(turn));
            if (!outcome.isSuccess()) {
                return AnalysisOutput.fallback(fallbackResponder.respond(turn), outcome.failureReason());
            }
            ChatResult result = normalizer.normalize(jsonReader.readObject(outcome.text()))
                    .withImageReceived(turn.hasImagePayload());
            return AnalysisOutput.fromLlm(policyEngine.apply(result));
        } catch (LlmOutputException e) {
            log.warn("event=llm_output_invalid pipeline=medical_chat error={}", e.getMessage());
            return AnalysisOutput.fallback(fallbackResponder.respond(turn), LlmOutcome.LLM_OUTPUT_INVALID);
        } catch (RuntimeException e) {
            log.error("event=analyzer_error pipeline=medical_chat", e);
            return AnalysisOutput.fallback(fallbackResponder.respond(turn), LlmOutcome.LLM_ERROR);
        }
    }

    private LlmPrompt toPrompt(ChatTurn turn) {
        LlmPrompt.InlineImage image = turn.hasAttachableImage()
                ? new LlmPrompt.InlineImage(turn.prescriptionImageMimeType(), turn.prescriptionImageBase64())
                : null;
        return new LlmPrompt(promptBuilder.build(turn), image, TEMPERATURE);
    }
}
