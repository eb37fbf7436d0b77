package com.pulseguard.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pulseguard.core.model.Reading;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes → {@link Reading}.
 * <p>
 * Malformed messages, and readings without a {@code streamId} or
 * {@code value}, are logged and dropped (returns {@code null}) so a single bad
 * record cannot stop the pipeline. Non-finite values are passed through; the
 * detector refuses them downstream.
 * </p>
 */
public class ReadingDeserializationSchema implements DeserializationSchema<Reading> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ReadingDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public Reading deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        Reading reading;
        try {
            reading = objectMapper().readValue(message, Reading.class);
        } catch (IOException e) {
            LOG.warn("Failed to deserialize reading – skipping: {}", e.getMessage());
            return null;
        }
        if (reading == null) {
            return null;
        }
        if (reading.getStreamId() == null || reading.getStreamId().isBlank()) {
            LOG.warn("Reading without streamId – skipping: {}", reading);
            return null;
        }
        if (reading.getValue() == null) {
            LOG.warn("Reading without value on stream '{}' – skipping", reading.getStreamId());
            return null;
        }
        reading.setIngestionTime(Instant.now());
        return reading;
    }

    @Override
    public boolean isEndOfStream(Reading nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<Reading> getProducedType() {
        return TypeInformation.of(Reading.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
