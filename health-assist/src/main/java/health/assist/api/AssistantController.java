package health.assist.api;

import health.assist.api.model.AnalysisResponse;
import health.assist.api.model.ChatTurn;
import health.assist.domain.chat.ChatResult;
import health.assist.orchestrator.AnalysisOutput;
import health.assist.service.MedicalChatService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/assistant")
public class AssistantController {
    private final MedicalChatService service;

    public AssistantController(MedicalChatService service) {
        this.service = service;
    }

    @PostMapping("/chat")
    public ResponseEntity<AnalysisResponse<ChatResult>> chat(@Valid @RequestBody ChatTurn turn) {
        if (!turn.consentGiven()) {
            throw new ConsentRequiredException();
        }
        AnalysisOutput<ChatResult> output = service.chat(RequestIds.next(), turn);
        return ResponseEntity.ok(new AnalysisResponse<>(
                true,
                output.result(),
                output.source().wireValue(),
                Instant.now()
        ));
    }
}
