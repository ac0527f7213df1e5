package com.eyelevel.docpipeline.common.json.jackson;

import com.eyelevel.docpipeline.common.json.JsonSerializer;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} to JSON", object == null ? "null" : object.getClass().getName(), e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }

    @Override
    public Map<String, Object> toMap(Object object) {
        try {
            return objectMapper.convertValue(object, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new JsonParsingException("Error converting Java object to a map", e);
        }
    }
}
