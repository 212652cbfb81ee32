package health.assist.voice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.StringJoiner;

@Component
public class TwilioTelephonyClient implements TelephonyClient {
    private static final Logger log = LoggerFactory.getLogger(TwilioTelephonyClient.class);

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String apiBase;
    private final String accountSid;
    private final String authToken;
    private final long httpTimeoutMs;

    public TwilioTelephonyClient(
            ObjectMapper objectMapper,
            @Value("${health.assist.voice.twilio.api-base:https://api.twilio.com}") String apiBase,
            @Value("${health.assist.voice.twilio.account-sid:}") String accountSid,
            @Value("${health.assist.voice.twilio.auth-token:}") String authToken,
            @Value("${health.assist.voice.twilio.http-timeout-ms:15000}") long httpTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.accountSid = accountSid == null ? "" : accountSid.trim();
        this.authToken = authToken == null ? "" : authToken.trim();
        this.httpTimeoutMs = httpTimeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                .build();
    }

    @Override
    public boolean isConfigured() {
        return !accountSid.isEmpty() && !authToken.isEmpty();
    }

    @Override
    public PlacedCall createCall(OutboundCall call) {
        String credentials = Base64.getEncoder()
                .encodeToString((accountSid + ":" + authToken).getBytes(StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/2010-04-01/Accounts/" + accountSid + "/Calls.json"))
                .timeout(Duration.ofMillis(Math.max(100, httpTimeoutMs)))
                .header("Authorization", "Basic " + credentials)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formBody(call)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelephonyException("Call placement interrupted", e);
        } catch (IOException e) {
            throw new TelephonyException("Telephony provider unreachable: " + e.getMessage(), e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("event=telephony_http_error provider=twilio status={}", response.statusCode());
            throw new TelephonyException("Telephony provider returned HTTP " + response.statusCode());
        }

        try {
            JsonNode root = objectMapper.readTree(response.body());
            String sid = root.path("sid").asText("").trim();
            if (sid.isEmpty()) {
                throw new TelephonyException("Telephony provider response has no call sid");
            }
            return new PlacedCall(sid, root.path("status").asText("").trim());
        } catch (IOException e) {
            throw new TelephonyException("Telephony provider response could not be parsed", e);
        }
    }

    static String formBody(OutboundCall call) {
        StringJoiner form = new StringJoiner("&");
        form.add(field("To", call.to()));
        form.add(field("From", call.from()));
        form.add(field("Url", call.twimlUrl()));
        form.add(field("Method", "POST"));
        form.add(field("StatusCallback", call.statusCallbackUrl()));
        form.add(field("StatusCallbackMethod", "POST"));
        for (String event : call.statusCallbackEvents()) {
            form.add(field("StatusCallbackEvent", event));
        }
        return form.toString();
    }

    private static String field(String name, String value) {
        return name + "=" + URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
