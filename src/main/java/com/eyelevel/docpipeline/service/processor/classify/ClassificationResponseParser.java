package com.eyelevel.docpipeline.service.processor.classify;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the model's JSON answers, tolerating markdown code fences and missing or out-of-range fields.
 */
@Slf4j
public class ClassificationResponseParser {

    static final String DEFAULT_CATEGORY = "Other";
    private static final int MAX_TAGS = 5;
    private static final int FALLBACK_SUMMARY_LENGTH = 200;
    private static final Pattern OPENING_FENCE = Pattern.compile("^```(?:json)?\\s*\\n?");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\n?\\s*```\\s*$");
    private static final List<String> ENTITY_KEYS = List.of("persons", "organizations", "locations", "dates",
            "amounts", "references");

    private final JsonParser jsonParser;

    public ClassificationResponseParser(JsonParser jsonParser) {
        this.jsonParser = jsonParser;
    }

    /**
     * An unreadable answer yields category "Other" with zero confidence and the raw text as summary.
     */
    public DocumentClassification parseClassification(String response) {
        String raw = response == null ? "" : response;
        try {
            Map<String, Object> parsed = parseObject(raw);
            String category = parsed.get("category") instanceof String value && !value.isBlank()
                    ? value : DEFAULT_CATEGORY;
            double confidence = parsed.get("confidence") instanceof Number number
                    ? Math.max(0, Math.min(1, number.doubleValue())) : 0;
            String language = parsed.get("language") instanceof String value ? value : null;
            String summary = parsed.get("summary") instanceof String value ? value : "";
            List<String> tags = new ArrayList<>();
            if (parsed.get("tags") instanceof List<?> values) {
                for (Object tag : values) {
                    if (tags.size() == MAX_TAGS) {
                        break;
                    }
                    tags.add(String.valueOf(tag));
                }
            }
            return new DocumentClassification(category, confidence, language, tags, summary);
        } catch (JsonParsingException e) {
            log.warn("Failed to parse classification response: {}", e.getMessage());
            String summary = raw.length() > FALLBACK_SUMMARY_LENGTH ? raw.substring(0, FALLBACK_SUMMARY_LENGTH) : raw;
            return new DocumentClassification(DEFAULT_CATEGORY, 0, null, List.of(), summary);
        }
    }

    /**
     * Keeps only the known entity lists; anything unreadable yields an empty map.
     */
    public Map<String, List<String>> parseEntities(String response) {
        Map<String, List<String>> entities = new LinkedHashMap<>();
        try {
            Map<String, Object> parsed = parseObject(response == null ? "" : response);
            for (String key : ENTITY_KEYS) {
                if (parsed.get(key) instanceof List<?> values) {
                    entities.put(key, values.stream().map(String::valueOf).toList());
                }
            }
        } catch (JsonParsingException e) {
            log.warn("Failed to parse entity extraction response: {}", e.getMessage());
            entities.clear();
        }
        return entities;
    }

    private Map<String, Object> parseObject(String response) {
        Map<String, Object> parsed = jsonParser.parseMap(stripFences(response));
        if (parsed == null) {
            throw new JsonParsingException("Response is not a JSON object", null);
        }
        return parsed;
    }

    static String stripFences(String response) {
        String trimmed = response.trim();
        trimmed = OPENING_FENCE.matcher(trimmed).replaceFirst("");
        return CLOSING_FENCE.matcher(trimmed).replaceFirst("").trim();
    }
}
