package health.assist.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Pulls a JSON object out of free-form model text. The whole text is tried
 * first; if that is not an object, the span from the first '{' to the last
 * '}' is parsed instead.
 */
@Component
public class LlmJsonReader {
    private final ObjectMapper objectMapper;

    public LlmJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode readObject(String rawText) throws LlmOutputException {
        String text = rawText == null ? "" : rawText.trim();

        JsonNode whole = tryParse(text);
        if (whole instanceof ObjectNode) {
            return (ObjectNode) whole;
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start == -1 || end <= start) {
            throw new LlmOutputException("No JSON object found in model output.");
        }

        String snippet = text.substring(start, end + 1);
        JsonNode value;
        try {
            value = objectMapper.readTree(snippet);
        } catch (JsonProcessingException e) {
            throw new LlmOutputException("Model output JSON could not be parsed.", e);
        }
        if (!(value instanceof ObjectNode)) {
            throw new LlmOutputException("Model output JSON is not an object.");
        }
        return (ObjectNode) value;
    }

    private JsonNode tryParse(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
