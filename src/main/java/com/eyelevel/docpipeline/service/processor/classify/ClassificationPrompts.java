package com.eyelevel.docpipeline.service.processor.classify;

import java.util.List;

/**
 * Prompt templates sent to the chat model.
 */
final class ClassificationPrompts {

    private static final String CLASSIFICATION_TEMPLATE = """
            Analyze the following document and provide a classification.

            Document Name: {fileName}
            Content (first 2000 chars): {content}

            Provide a JSON response with:
            - category: The document category (one of: {categories})
            - confidence: Confidence score 0-1
            - language: Detected language code (e.g., "en", "pt", "es")
            - tags: Array of relevant tags (max 5)
            - summary: Brief 1-2 sentence summary

            Respond only with valid JSON.""";

    private static final String ENTITY_TEMPLATE = """
            Extract named entities from the following document.

            Content: {content}

            Provide a JSON response with arrays for:
            - persons: Names of people
            - organizations: Company or organization names
            - locations: Places, addresses, cities, countries
            - dates: Dates mentioned in the document
            - amounts: Monetary amounts or quantities
            - references: Reference numbers, invoice numbers, IDs

            Example: {"persons": ["John Smith"], "organizations": ["Acme Corp"], "locations": [], \
            "dates": ["2024-01-15"], "amounts": ["$1,500.00"], "references": ["INV-001"]}

            Respond only with valid JSON.""";

    private ClassificationPrompts() {
    }

    static String classification(String fileName, String content, List<String> categories) {
        return CLASSIFICATION_TEMPLATE
                .replace("{fileName}", fileName)
                .replace("{categories}", String.join(", ", categories))
                .replace("{content}", content);
    }

    static String entities(String content) {
        return ENTITY_TEMPLATE.replace("{content}", content);
    }
}
