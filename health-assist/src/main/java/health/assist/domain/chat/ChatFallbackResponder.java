package health.assist.domain.chat;

import health.assist.api.model.ChatTurn;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class ChatFallbackResponder {
    static final String GENERIC_REPLY = "I can help explain medicines from your prescription and provide "
            + "health guidance. Please share medicine names, schedule, and any symptoms for a more accurate answer.";
    static final String EMERGENCY_REPLY = "Your message may include emergency warning signs. "
            + "Please seek immediate medical care or call emergency services now.";

    private static final List<String> EMERGENCY_PHRASES = List.of(
            "chest pain",
            "severe breathlessness",
            "fainting",
            "seizure",
            "unconscious",
            "heavy bleeding"
    );

    public ChatResult respond(ChatTurn turn) {
        boolean emergency = mentionsEmergency(turn.userMessage());
        return new ChatResult(
                emergency ? EMERGENCY_REPLY : GENERIC_REPLY,
                List.of(
                        "Share medicine name and purpose to get use-specific guidance.",
                        "Follow doctor-prescribed timing and dose exactly."
                ),
                List.of(
                        "Track symptoms with date/time and discuss persistent issues with a clinician.",
                        "Do not stop essential medicines abruptly without advice."
                ),
                List.of(
                        "Stay hydrated and maintain balanced meals with protein and fiber.",
                        "Avoid alcohol unless your doctor confirms safety with medicines."
                ),
                List.of(
                        "Use moderate daily activity such as walking unless advised otherwise.",
                        "Pause exercise and seek care if dizziness, chest pain, or severe weakness occurs."
                ),
                List.of(
                        "Check drug interactions before adding OTC medicines or supplements.",
                        "Report allergy symptoms such as rash, swelling, or breathing trouble urgently."
                ),
                turn.hasImagePayload(),
                emergency
        );
    }

    public static String genericReply() {
        return GENERIC_REPLY;
    }

    private static boolean mentionsEmergency(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        for (String phrase : EMERGENCY_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
