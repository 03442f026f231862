package io.github.hide212131.langchain4j.atelier.runtime.session.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes each event as one JSON object per line: {@code type}, {@code session_id} and {@code timestamp}
 * first, then the payload's fields in snake_case. Null fields are omitted.
 */
public final class NdjsonSessionEventWriter implements SessionEventPublisher {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final Writer writer;
    private final boolean closeWriter;
    private final ObjectMapper objectMapper;

    public NdjsonSessionEventWriter(Writer writer, boolean closeWriter) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.closeWriter = closeWriter;
        this.objectMapper = createObjectMapper();
    }

    /** Writes to {@code out} in UTF-8 without closing it. */
    public NdjsonSessionEventWriter(OutputStream out) {
        this(new OutputStreamWriter(out, StandardCharsets.UTF_8), false);
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    /** Renders one event as a single JSON line, without the trailing newline. */
    public String toJson(SessionEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", event.type().wireName());
        fields.put("session_id", event.sessionId());
        fields.put("timestamp", event.timestamp().toString());
        fields.putAll(objectMapper.convertValue(event.payload(), FIELDS));
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.type().wireName() + " event", e);
        }
    }

    @Override
    public synchronized void publish(SessionEvent event) {
        String line = toJson(event);
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write session event", e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (closeWriter) {
                writer.close();
            } else {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close session event stream", e);
        }
    }
}
