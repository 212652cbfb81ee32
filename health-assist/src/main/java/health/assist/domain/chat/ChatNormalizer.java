package health.assist.domain.chat;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import static health.assist.llm.FieldCoercion.bool;
import static health.assist.llm.FieldCoercion.stringList;
import static health.assist.llm.FieldCoercion.text;

@Component
public class ChatNormalizer {
    static final int MAX_LIST_ENTRIES = 6;

    public ChatResult normalize(ObjectNode data) {
        return new ChatResult(
                text(data.get("reply")),
                stringList(data.get("medicine_uses"), MAX_LIST_ENTRIES),
                stringList(data.get("health_guidance"), MAX_LIST_ENTRIES),
                stringList(data.get("diet_guidance"), MAX_LIST_ENTRIES),
                stringList(data.get("exercise_guidance"), MAX_LIST_ENTRIES),
                stringList(data.get("precautions"), MAX_LIST_ENTRIES),
                false,
                bool(data.get("emergency"), false)
        );
    }
}
