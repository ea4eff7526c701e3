package com.air.reviewer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns the reviewer's line-delimited stream-json output into plain review text.
 *
 * <p>Text comes from {@code assistant} messages (their {@code text} content
 * items) and from {@code content_block_delta} events. Other events and
 * malformed lines are skipped.
 */
public class StreamJsonConverter {

    private static final Logger log = LoggerFactory.getLogger(StreamJsonConverter.class);

    private final ObjectMapper objectMapper;

    public StreamJsonConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String extractText(List<String> lines) {
        var text = new StringBuilder();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode event;
            try {
                event = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed stream-json line: {}", e.getOriginalMessage());
                continue;
            }
            String type = event.path("type").asText();
            if ("assistant".equals(type)) {
                for (JsonNode item : event.path("message").path("content")) {
                    if ("text".equals(item.path("type").asText())) {
                        text.append(item.path("text").asText(""));
                    }
                }
            } else if ("content_block_delta".equals(type)) {
                text.append(event.path("delta").path("text").asText(""));
            }
        }
        return text.toString();
    }

    /** Reads {@code json} and writes the extracted text to {@code markdown}. */
    public void convert(Path json, Path markdown) throws IOException {
        var lines = new String(Files.readAllBytes(json), StandardCharsets.UTF_8).lines().toList();
        Files.writeString(markdown, extractText(lines), StandardCharsets.UTF_8);
    }
}
