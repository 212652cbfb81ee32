package health.assist.policy;

import health.assist.domain.chat.ChatFallbackResponder;
import health.assist.domain.chat.ChatResult;
import health.assist.domain.triage.TriageResult;
import health.assist.domain.triage.TriageRuleEngine;
import org.springframework.stereotype.Component;

@Component
public class ResponsePolicyEngine {
    public TriageResult apply(TriageResult result) {
        if (result.recommendation().isBlank()) {
            return result.withRecommendation(TriageRuleEngine.recommendationFor(result.severity()));
        }
        return result;
    }

    public ChatResult apply(ChatResult result) {
        if (result.reply().isBlank()) {
            return result.withReply(ChatFallbackResponder.genericReply());
        }
        return result;
    }
}
