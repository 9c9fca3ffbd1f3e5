package com.gt.curator.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.curator.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RiskLevelSerializer extends JsonSerializer<RiskLevel> {
    @Override
    public void serialize(RiskLevel riskLevel, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(riskLevel.getLabel());
    }
}
