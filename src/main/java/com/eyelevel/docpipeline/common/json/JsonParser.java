package com.eyelevel.docpipeline.common.json;

import java.util.Map;

/**
 * Defines the contract for reading JSON and loosely-typed maps into Java objects.
 */
public interface JsonParser {

    /**
     * Parses a JSON string into an object of the given type.
     *
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the JSON cannot be read.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON bytes into an object of the given type.
     *
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the JSON cannot be read.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses a JSON object into a generic map.
     *
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the JSON is not an object.
     */
    Map<String, Object> parseMap(String json);

    /**
     * Binds a loosely-typed value, typically a job's options map, to a typed object.
     * Unknown properties are ignored.
     *
     * @throws com.eyelevel.docpipeline.exception.json.JsonParsingException if the value cannot be bound.
     */
    <T> T convert(Object source, Class<T> valueType);
}
