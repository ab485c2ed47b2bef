package com.supplychain.pipeline.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.supplychain.pipeline.domain.RiskAssessment;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.io.IOException;

/**
 * Cached {@link RiskAssessment} values, written in the same snake_case JSON as the
 * risk-calculated topic and without type metadata.
 */
public class RiskAssessmentRedisSerializer implements RedisSerializer<RiskAssessment> {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public RiskAssessmentRedisSerializer(ObjectMapper mapper) {
        this.writer = mapper.writerFor(RiskAssessment.class);
        this.reader = mapper.readerFor(RiskAssessment.class);
    }

    @Override
    public byte[] serialize(RiskAssessment assessment) throws SerializationException {
        if (assessment == null) {
            return null;
        }
        try {
            return writer.writeValueAsBytes(assessment);
        } catch (IOException e) {
            throw new SerializationException("Cannot cache assessment " + assessment.getId()
                    + " for " + assessment.getRegion() + "/" + assessment.getSector(), e);
        }
    }

    @Override
    public RiskAssessment deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return reader.readValue(bytes);
        } catch (IOException e) {
            throw new SerializationException("Cached assessment is not readable (" + bytes.length + " bytes)", e);
        }
    }
}
