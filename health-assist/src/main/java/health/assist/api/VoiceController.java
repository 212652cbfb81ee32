package health.assist.api;

import health.assist.api.model.DataResponse;
import health.assist.api.model.ReminderCallData;
import health.assist.api.model.ReminderCallRequest;
import health.assist.service.ReminderCallService;
import health.assist.voice.CallRecord;
import health.assist.voice.ReminderScript;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/voice")
public class VoiceController {
    private final ReminderCallService service;

    public VoiceController(ReminderCallService service) {
        this.service = service;
    }

    @PostMapping("/reminder/call")
    public ResponseEntity<DataResponse<ReminderCallData>> placeCall(@Valid @RequestBody ReminderCallRequest request) {
        return ResponseEntity.ok(DataResponse.of(service.placeCall(request)));
    }

    @GetMapping("/reminder/result/{callSid}")
    public ResponseEntity<DataResponse<CallRecord>> result(@PathVariable String callSid) {
        return ResponseEntity.ok(DataResponse.of(service.result(callSid)));
    }

    @PostMapping(value = "/twiml", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> twiml(
            @RequestParam(name = "patient_name", defaultValue = "") String patientName,
            @RequestParam(name = "caregiver_name", defaultValue = "") String caregiverName,
            @RequestParam(name = "medicine_name", defaultValue = "medicine") String medicineName,
            @RequestParam(name = "dosage", defaultValue = "") String dosage,
            @RequestParam(name = "scheduled_time", defaultValue = "") String scheduledTime,
            @RequestParam(name = "date_key", defaultValue = "") String dateKey,
            @RequestParam(name = "mode", defaultValue = ReminderCallRequest.MODE_CAREGIVER) String mode
    ) {
        ReminderScript script = new ReminderScript(
                patientName, caregiverName, medicineName, dosage, scheduledTime, dateKey, mode);
        return xml(service.reminderTwiml(script));
    }

    @PostMapping(value = "/gather", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> gather(
            @RequestParam(name = "SpeechResult", defaultValue = "") String speechResult,
            @RequestParam(name = "Digits", defaultValue = "") String digits,
            @RequestParam(name = "CallSid", defaultValue = "") String callSid,
            @RequestParam(name = "To", defaultValue = "") String toPhone
    ) {
        return xml(service.recordGather(callSid, toPhone, speechResult, digits));
    }

    @PostMapping(value = "/status", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> status(
            @RequestParam(name = "CallSid", defaultValue = "") String callSid,
            @RequestParam(name = "CallStatus", defaultValue = "") String callStatus
    ) {
        service.recordStatus(callSid, callStatus);
        return ResponseEntity.ok("ok");
    }

    private static ResponseEntity<String> xml(String body) {
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_XML).body(body);
    }
}
