package health.assist.api;

import health.assist.api.model.AnalysisResponse;
import health.assist.api.model.SymptomReport;
import health.assist.domain.triage.TriageResult;
import health.assist.orchestrator.AnalysisOutput;
import health.assist.service.SideEffectAnalysisService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/side-effects")
public class SideEffectController {
    private final SideEffectAnalysisService service;

    public SideEffectController(SideEffectAnalysisService service) {
        this.service = service;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse<TriageResult>> analyze(@Valid @RequestBody SymptomReport report) {
        AnalysisOutput<TriageResult> output = service.analyze(RequestIds.next(), report);
        return ResponseEntity.ok(new AnalysisResponse<>(
                true,
                output.result(),
                output.source().wireValue(),
                Instant.now()
        ));
    }
}
