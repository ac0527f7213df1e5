package com.eyelevel.docpipeline.common.json;

import java.util.Map;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object);

    /**
     * Converts an object into a generic map, e.g. to persist it in a JSON column.
     */
    Map<String, Object> toMap(Object object);
}
