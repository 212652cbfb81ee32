package health.assist.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Component
@Primary
@ConditionalOnProperty(prefix = "health.assist.llm", name = "provider", havingValue = "gemini", matchIfMissing = true)
public class GeminiLlmClient implements LlmClient {
    private static final Logger log = LoggerFactory.getLogger(GeminiLlmClient.class);

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String apiKey;
    private final String endpoint;
    private final long httpTimeoutMs;

    public GeminiLlmClient(
            ObjectMapper objectMapper,
            @Value("${health.assist.llm.gemini.api-key:}") String apiKey,
            @Value("${health.assist.llm.gemini.api-base:https://generativelanguage.googleapis.com}") String apiBase,
            @Value("${health.assist.llm.gemini.model:gemini-2.5-flash}") String model,
            @Value("${health.assist.llm.gemini.http-timeout-ms:20000}") long httpTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.endpoint = trimTrailingSlash(apiBase) + "/v1beta/models/" + model.trim() + ":generateContent";
        this.httpTimeoutMs = httpTimeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                .build();
    }

    @Override
    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    @Override
    public LlmOutcome generate(LlmPrompt prompt) {
        if (!isConfigured()) {
            return LlmOutcome.failure(LlmOutcome.LLM_NOT_CONFIGURED);
        }

        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint + "?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)))
                    .timeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildPayload(prompt)))
                    .build();

            HttpResponse<String> response = httpClient.send(
                    httpRequest,
                    HttpResponse.BodyHandlers.ofString()
            );
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("event=llm_http_error provider=gemini status={}", response.statusCode());
                return LlmOutcome.failure(LlmOutcome.LLM_HTTP_ERROR);
            }

            String text = extractText(objectMapper.readTree(response.body()));
            if (text.isEmpty()) {
                return LlmOutcome.failure(LlmOutcome.LLM_EMPTY);
            }
            return LlmOutcome.success(text);
        } catch (HttpTimeoutException e) {
            log.warn("event=llm_timeout provider=gemini timeout_ms={}", httpTimeoutMs);
            return LlmOutcome.failure(LlmOutcome.LLM_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmOutcome.failure(LlmOutcome.LLM_INTERRUPTED);
        } catch (IOException | RuntimeException e) {
            log.warn("event=llm_error provider=gemini error={}", e.toString());
            return LlmOutcome.failure(LlmOutcome.LLM_ERROR);
        }
    }

    String buildPayload(LlmPrompt prompt) throws IOException {
        ArrayNode parts = objectMapper.createArrayNode()
                .add(objectMapper.createObjectNode().put("text", prompt.text()));
        if (prompt.hasImage()) {
            ObjectNode inlineData = objectMapper.createObjectNode()
                    .put("mime_type", prompt.image().mimeType())
                    .put("data", prompt.image().base64Data());
            parts.add(objectMapper.createObjectNode().set("inline_data", inlineData));
        }

        ObjectNode content = objectMapper.createObjectNode();
        content.set("parts", parts);

        ObjectNode generationConfig = objectMapper.createObjectNode()
                .put("temperature", prompt.temperature())
                .put("responseMimeType", "application/json");

        ObjectNode body = objectMapper.createObjectNode();
        body.set("contents", objectMapper.createArrayNode().add(content));
        body.set("generationConfig", generationConfig);
        return objectMapper.writeValueAsString(body);
    }

    static String extractText(JsonNode root) {
        JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual()) {
            return "";
        }
        return text.asText().trim();
    }

    private static String trimTrailingSlash(String value) {
        String base = value == null ? "" : value.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
