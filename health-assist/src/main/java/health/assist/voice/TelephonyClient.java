package health.assist.voice;

import java.util.List;

public interface TelephonyClient {
    boolean isConfigured();

    PlacedCall createCall(OutboundCall call);

    record OutboundCall(
            String to,
            String from,
            String twimlUrl,
            String statusCallbackUrl,
            List<String> statusCallbackEvents
    ) {}

    record PlacedCall(String callSid, String status) {}
}
