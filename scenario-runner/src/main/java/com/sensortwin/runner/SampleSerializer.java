package com.sensortwin.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sensortwin.core.model.LabeledSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link LabeledSample}s to single-line JSON.
 */
public class SampleSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(SampleSerializer.class);

    private final ObjectMapper mapper;

    public SampleSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @throws IllegalStateException if the sample cannot be serialized
     */
    public String toJson(LabeledSample sample) {
        try {
            return mapper.writeValueAsString(sample);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize sample of sensor {}: {}", sample.getSensorId(), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize sample of sensor " + sample.getSensorId(), e);
        }
    }

    ObjectMapper objectMapper() {
        return mapper;
    }
}
