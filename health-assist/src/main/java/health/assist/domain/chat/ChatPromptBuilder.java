package health.assist.domain.chat;

import health.assist.api.model.ChatTurn;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class ChatPromptBuilder {
    private static final String INSTRUCTIONS = """
            You are an experienced medication and wellness assistant.
            Goals:
            1) Explain medicine usage from the provided prescription/context.
            2) Give practical guidance on health, medicine safety, exercise, food, and diet.
            3) Use simple patient-friendly language.
            4) If you suspect emergency risk, set emergency=true and clearly advise urgent care.

            Return STRICT JSON only with this schema:
            {"reply":"short paragraph answer",\
            "medicine_uses":["..."],\
            "health_guidance":["..."],\
            "diet_guidance":["..."],\
            "exercise_guidance":["..."],\
            "precautions":["..."],\
            "emergency":true|false}
            Rules:
            - No markdown, no extra keys.
            - Never prescribe dosage changes as a doctor replacement.
            - Keep each list concise (max 6 points).

            """;

    public String build(ChatTurn turn) {
        String history = turn.history().isEmpty()
                ? "none"
                : turn.history().stream().map(entry -> "- " + entry).collect(Collectors.joining("\n"));
        String prescription = turn.prescriptionText().isEmpty() ? "none" : turn.prescriptionText();
        String imageNote = turn.hasAttachableImage()
                ? "A prescription image is attached. Extract relevant medicine details from it."
                : "No prescription image attached.";

        return INSTRUCTIONS
                + "Image context: " + imageNote + "\n"
                + "Prescription text:\n" + prescription + "\n\n"
                + "Conversation history:\n" + history + "\n\n"
                + "User question:\n" + turn.userMessage() + "\n";
    }
}
