package health.assist.api.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

class TakenAtDeserializer extends StdDeserializer<TemporalAccessor> {

    public TakenAtDeserializer() {
        super(TemporalAccessor.class);
    }

    @Override
    public TemporalAccessor deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        String text = parser.getValueAsString();
        if (text == null) {
            return (TemporalAccessor) ctxt.handleUnexpectedToken(TemporalAccessor.class, parser);
        }
        if (text.isBlank()) {
            return null;
        }
        try {
            return DateTimeFormatter.ISO_DATE_TIME.parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            return (TemporalAccessor) ctxt.handleWeirdStringValue(
                    TemporalAccessor.class, text, "expected an ISO-8601 date-time");
        }
    }
}
