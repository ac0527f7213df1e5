package com.eyelevel.docpipeline.common.json.jackson;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Implementation of the {@link JsonParser} interface using Jackson.
 */
@Component("jacksonJsonParser")
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        if (json == null) {
            throw new JsonParsingException("Cannot parse null JSON into " + valueType.getSimpleName(), null);
        }
        return parseObject(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON to object of type: {}", valueType.getName());
        try {
            return objectMapper.readValue(jsonBytes, valueType);
        } catch (IOException e) {
            log.debug("Error parsing JSON to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }

    @Override
    public Map<String, Object> parseMap(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (IOException e) {
            throw new JsonParsingException("Error parsing JSON object", e);
        }
    }

    @Override
    public <T> T convert(Object source, Class<T> valueType) {
        try {
            return objectMapper.convertValue(source == null ? Map.of() : source, valueType);
        } catch (IllegalArgumentException e) {
            throw new JsonParsingException("Invalid options for " + valueType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
