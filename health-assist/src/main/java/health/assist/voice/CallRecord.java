package health.assist.voice;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CallRecord(
        String callSid,
        String to,
        String status,
        CallResponse response,
        String speechResult,
        String updatedAt
) {}
