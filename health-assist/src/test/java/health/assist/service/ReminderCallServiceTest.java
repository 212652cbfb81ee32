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
import health.assist.voice.TelephonyException;
import health.assist.voice.TwimlRenderer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ReminderCallServiceTest {
    private final CallTracker tracker = new CallTracker(Clock.systemUTC());
    private final AtomicReference<TelephonyClient.OutboundCall> lastCall = new AtomicReference<>();

    @Test
    void shouldPlaceCallAndTrackIt() {
        ReminderCallService service = service(new StubTelephonyClient(true), "https://care.example.org/");

        ReminderCallData data = service.placeCall(request("98765 43210"));

        assertEquals("CA100", data.callSid());
        assertEquals("queued", data.status());
        TelephonyClient.OutboundCall call = lastCall.get();
        assertEquals("+919876543210", call.to());
        assertEquals("+15550001111", call.from());
        assertTrue(call.twimlUrl().startsWith("https://care.example.org/api/v1/voice/twiml?patient_name=Asha"));
        assertTrue(call.twimlUrl().contains("medicine_name=Metformin"));
        assertTrue(call.twimlUrl().contains("mode=self_patient"));
        assertEquals("https://care.example.org/api/v1/voice/status", call.statusCallbackUrl());
        assertEquals(4, call.statusCallbackEvents().size());

        CallRecord record = service.result("CA100");
        assertEquals(CallResponse.PENDING, record.response());
        assertEquals("+919876543210", record.to());
    }

    @Test
    void twimlUrlShouldKeepReservedCharactersInFieldValues() {
        ReminderCallService service = service(new StubTelephonyClient(true), "https://care.example.org");

        service.placeCall(new ReminderCallRequest("9876543210", "Asha & Ravi", "", "Metformin", "1+1 tablet",
                "8:00 AM", "2026-05-01", "caregiver_patient"));

        MultiValueMap<String, String> query = UriComponentsBuilder.fromUriString(lastCall.get().twimlUrl())
                .build()
                .getQueryParams();
        assertEquals("1+1 tablet", decode(query.getFirst("dosage")));
        assertEquals("Asha & Ravi", decode(query.getFirst("patient_name")));
        assertEquals("8:00 AM", decode(query.getFirst("scheduled_time")));
        assertEquals("", decode(query.getFirst("caregiver_name")));
    }

    @Test
    void shouldRejectWhenTelephonyNotConfigured() {
        assertThrows(TelephonyConfigurationException.class,
                () -> service(new StubTelephonyClient(false), "https://care.example.org").placeCall(request("9876543210")));
        assertThrows(TelephonyConfigurationException.class,
                () -> service(new StubTelephonyClient(true), "").placeCall(request("9876543210")));
        assertNull(lastCall.get());
    }

    @Test
    void shouldRejectInvalidPhone() {
        ReminderCallService service = service(new StubTelephonyClient(true), "https://care.example.org");

        assertThrows(InvalidPhoneNumberException.class, () -> service.placeCall(request("no digits")));
        assertNull(lastCall.get());
    }

    @Test
    void shouldPropagateProviderFailure() {
        ReminderCallService service = service(new TelephonyClient() {
            @Override
            public boolean isConfigured() {
                return true;
            }

            @Override
            public PlacedCall createCall(OutboundCall call) {
                throw new TelephonyException("Telephony provider returned HTTP 500");
            }
        }, "https://care.example.org");

        assertThrows(TelephonyException.class, () -> service.placeCall(request("9876543210")));
    }

    @Test
    void statusAfterGatherShouldKeepResponse() {
        ReminderCallService service = service(new StubTelephonyClient(true), "https://care.example.org");
        service.placeCall(request("9876543210"));

        String xml = service.recordGather("CA100", "+919876543210", "yes", "");
        service.recordStatus("CA100", "completed");

        assertTrue(xml.contains("recorded as taken"));
        CallRecord record = service.result("CA100");
        assertEquals("completed", record.status());
        assertEquals(CallResponse.TAKEN, record.response());
        assertEquals("yes", record.speechResult());
    }

    @Test
    void shouldDefaultBlankStatusToUnknownAndIgnoreBlankSid() {
        ReminderCallService service = service(new StubTelephonyClient(true), "https://care.example.org");

        service.recordStatus("CA7", " ");
        service.recordStatus(" ", "ringing");
        service.recordGather("", "", "yes", "");

        assertEquals("unknown", service.result("CA7").status());
        assertThrows(CallNotFoundException.class, () -> service.result(""));
    }

    @Test
    void reminderTwimlShouldPointGatherAtPublicUrl() {
        ReminderCallService service = service(new StubTelephonyClient(true), "https://care.example.org");

        String xml = service.reminderTwiml(new ReminderScript("Asha", "", "Metformin", "", "8 AM", "", ""));

        assertTrue(xml.contains("action=\"https://care.example.org/api/v1/voice/gather?patient_name=Asha"
                + "&amp;medicine_name=Metformin&amp;scheduled_time=8%20AM&amp;date_key=today\""));
    }

    private ReminderCallService service(TelephonyClient client, String publicBaseUrl) {
        return new ReminderCallService(
                client,
                tracker,
                new PhoneNumberNormalizer("91"),
                new GatherResponseClassifier(),
                new TwimlRenderer(),
                new AiAuditLogger(),
                new SimpleMeterRegistry(),
                "+15550001111",
                publicBaseUrl
        );
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static ReminderCallRequest request(String phone) {
        return new ReminderCallRequest(phone, "Asha", "Ravi", "Metformin", "500 mg", "8:00 AM", "2026-05-01",
                "self_patient");
    }

    private class StubTelephonyClient implements TelephonyClient {
        private final boolean configured;

        StubTelephonyClient(boolean configured) {
            this.configured = configured;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public PlacedCall createCall(OutboundCall call) {
            lastCall.set(call);
            return new PlacedCall("CA100", "");
        }
    }
}
