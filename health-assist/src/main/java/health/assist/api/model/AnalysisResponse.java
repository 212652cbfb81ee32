package health.assist.api.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisResponse<T>(
        boolean ok,
        T data,
        String source,
        Instant generatedAt
) {}
