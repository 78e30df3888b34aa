package org.netpreserve.sitescraper.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads command-line options either as a list of strings or as a single string split the way a shell would,
 * so "--headless=new --user-agent='My Bot'" becomes ["--headless=new", "--user-agent=My Bot"].
 */
public class OptionListDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node.isArray()) {
            List<String> options = new ArrayList<>(node.size());
            node.forEach(element -> options.add(element.asText()));
            return options;
        }
        if (!node.isTextual()) {
            throw new JsonMappingException(jsonParser, "Expected a string or list of strings for options but got " + node.getNodeType());
        }
        try {
            return split(node.asText());
        } catch (IllegalArgumentException e) {
            throw new JsonMappingException(jsonParser, e.getMessage(), e);
        }
    }

    static List<String> split(String line) {
        List<String> options = new ArrayList<>();
        var option = new StringBuilder();
        boolean inOption = false;
        char quote = 0;
        for (char c : line.toCharArray()) {
            if (quote != 0) {
                if (c == quote) quote = 0;
                else option.append(c);
            } else if (c == '"' || c == '\'') {
                quote = c;
                inOption = true;
            } else if (Character.isWhitespace(c)) {
                if (inOption) {
                    options.add(option.toString());
                    option.setLength(0);
                    inOption = false;
                }
            } else {
                option.append(c);
                inOption = true;
            }
        }
        if (quote != 0) throw new IllegalArgumentException("Unterminated quote in options: " + line);
        if (inOption) options.add(option.toString());
        return options;
    }
}
