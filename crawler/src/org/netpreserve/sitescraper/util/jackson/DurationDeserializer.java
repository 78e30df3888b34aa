package org.netpreserve.sitescraper.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads a duration written as milliseconds (250), a short form (20s, 1m30s) or ISO-8601 (PT20S).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toUpperCase(Locale.ROOT);
        try {
            if (text.endsWith("MS")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            }
            if (text.startsWith("PT")) return Duration.parse(text);
            return Duration.parse("PT" + text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new JsonMappingException(jsonParser, "Invalid duration: " + jsonParser.getText(), e);
        }
    }
}
