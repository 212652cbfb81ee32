package health.assist.service;

import health.assist.api.model.ReminderCallData;
import health.assist.api.model.ReminderCallRequest;
import health.assist.audit.AiAuditLogger;
import health.assist.voice.CallNotFoundException;
import health.assist.voice.CallRecord;
import health.assist.voice.CallResponse;
import health.assist.voice.CallTracker;
import health.assist.voice.GatherResponseClassifier;
import health.assist.voice.InvalidPhoneNumberException;
import health.assist.voice.PhoneNumberNormalizer;
import health.assist.voice.ReminderScript;
import health.assist.voice.TelephonyClient;
import health.assist.voice.TelephonyConfigurationException;
import health.assist.voice.TwimlRenderer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ReminderCallService {
    static final String TWIML_PATH = "/api/v1/voice/twiml";
    static final String GATHER_PATH = "/api/v1/voice/gather";
    static final String STATUS_PATH = "/api/v1/voice/status";
    private static final List<String> STATUS_EVENTS = List.of("initiated", "ringing", "answered", "completed");

    private final TelephonyClient telephonyClient;
    private final CallTracker callTracker;
    private final PhoneNumberNormalizer phoneNormalizer;
    private final GatherResponseClassifier responseClassifier;
    private final TwimlRenderer twimlRenderer;
    private final AiAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;
    private final String fromNumber;
    private final String publicBaseUrl;

    public ReminderCallService(
            TelephonyClient telephonyClient,
            CallTracker callTracker,
            PhoneNumberNormalizer phoneNormalizer,
            GatherResponseClassifier responseClassifier,
            TwimlRenderer twimlRenderer,
            AiAuditLogger auditLogger,
            MeterRegistry meterRegistry,
            @Value("${health.assist.voice.from-number:}") String fromNumber,
            @Value("${health.assist.voice.public-base-url:}") String publicBaseUrl
    ) {
        this.telephonyClient = telephonyClient;
        this.callTracker = callTracker;
        this.phoneNormalizer = phoneNormalizer;
        this.responseClassifier = responseClassifier;
        this.twimlRenderer = twimlRenderer;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
        this.fromNumber = fromNumber == null ? "" : fromNumber.trim();
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl == null ? "" : publicBaseUrl.trim());
    }

    public boolean isConfigured() {
        return telephonyClient.isConfigured() && !fromNumber.isEmpty() && !publicBaseUrl.isEmpty();
    }

    public ReminderCallData placeCall(ReminderCallRequest request) {
        if (!isConfigured()) {
            count("not_configured");
            throw new TelephonyConfigurationException("Twilio Voice is not configured. Set PUBLIC_BASE_URL, "
                    + "TWILIO_ACCOUNT_SID, TWILIO_AUTH_TOKEN, TWILIO_VOICE_FROM_NUMBER.");
        }

        String to = phoneNormalizer.normalize(request.toPhone()).orElseThrow(() -> {
            count("invalid_phone");
            return new InvalidPhoneNumberException(request.toPhone());
        });

        TelephonyClient.PlacedCall placed;
        try {
            placed = telephonyClient.createCall(new TelephonyClient.OutboundCall(
                    to,
                    fromNumber,
                    url(TWIML_PATH, request.templateFields()),
                    url(STATUS_PATH, Map.of()),
                    STATUS_EVENTS
            ));
        } catch (RuntimeException e) {
            count("provider_error");
            throw e;
        }

        CallRecord record = callTracker.recordPlaced(placed.callSid(), to, placed.status());
        count("placed");
        auditLogger.logVoiceCall(record.callSid(), PhoneNumberNormalizer.mask(to), record.status(), "placed");
        return new ReminderCallData(record.callSid(), record.status());
    }

    public String reminderTwiml(ReminderScript script) {
        Map<String, String> gatherQuery = new LinkedHashMap<>();
        gatherQuery.put("patient_name", script.patientName());
        gatherQuery.put("medicine_name", script.medicineName());
        gatherQuery.put("scheduled_time", script.scheduledTime());
        gatherQuery.put("date_key", script.dateKey());
        return twimlRenderer.reminder(script, url(GATHER_PATH, gatherQuery));
    }

    public String recordGather(String callSid, String toPhone, String speechResult, String digits) {
        CallResponse response = responseClassifier.classify(speechResult, digits);
        String sid = callSid == null ? "" : callSid.trim();
        if (!sid.isEmpty()) {
            callTracker.recordResponse(
                    sid,
                    toPhone == null ? "" : toPhone.trim(),
                    response,
                    speechResult == null ? "" : speechResult.trim()
            );
            auditLogger.logVoiceCallback("voice_gather", sid, response.wireValue());
        }
        return twimlRenderer.gatherAcknowledgement(response);
    }

    public void recordStatus(String callSid, String callStatus) {
        String sid = callSid == null ? "" : callSid.trim();
        if (sid.isEmpty()) {
            return;
        }
        String status = callStatus == null || callStatus.isBlank() ? "unknown" : callStatus.trim();
        callTracker.recordStatus(sid, status);
        auditLogger.logVoiceCallback("voice_status", sid, status);
    }

    public CallRecord result(String callSid) {
        String sid = callSid == null ? "" : callSid.trim();
        return callTracker.find(sid).orElseThrow(() -> new CallNotFoundException(sid));
    }

    private String url(String path, Map<String, String> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(publicBaseUrl + path);
        query.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
        return builder.encode().buildAndExpand(query).toUriString();
    }

    private void count(String outcome) {
        Counter.builder("health_assist_voice_call_total")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private static String stripTrailingSlash(String value) {
        String out = value;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
