package health.assist.voice;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class CallTracker {
    static final String DEFAULT_STATUS = "queued";
    static final String STATUS_AFTER_RESPONSE = "completed";

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, CallRecord> records = new HashMap<>();

    public CallTracker(Clock clock) {
        this.clock = clock;
    }

    public CallRecord recordPlaced(String callSid, String to, String status) {
        CallRecord record = new CallRecord(
                callSid,
                to,
                status == null || status.isBlank() ? DEFAULT_STATUS : status,
                CallResponse.PENDING,
                "",
                now()
        );
        synchronized (lock) {
            records.put(callSid, record);
        }
        return record;
    }

    public CallRecord recordResponse(String callSid, String to, CallResponse response, String speechResult) {
        String updatedAt = now();
        synchronized (lock) {
            CallRecord existing = records.get(callSid);
            CallRecord record = new CallRecord(
                    callSid,
                    to,
                    existing == null ? STATUS_AFTER_RESPONSE : existing.status(),
                    response,
                    speechResult == null ? "" : speechResult,
                    updatedAt
            );
            records.put(callSid, record);
            return record;
        }
    }

    /** Updates the status only; response and speech already recorded are kept. */
    public CallRecord recordStatus(String callSid, String status) {
        String updatedAt = now();
        synchronized (lock) {
            CallRecord existing = records.get(callSid);
            CallRecord record = existing == null
                    ? new CallRecord(callSid, "", status, CallResponse.PENDING, "", updatedAt)
                    : new CallRecord(callSid, existing.to(), status, existing.response(),
                            existing.speechResult(), updatedAt);
            records.put(callSid, record);
            return record;
        }
    }

    public Optional<CallRecord> find(String callSid) {
        synchronized (lock) {
            return Optional.ofNullable(records.get(callSid));
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
