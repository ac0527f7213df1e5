package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.exception.ProcessingException;

import java.util.List;
import java.util.TreeSet;

/**
 * Parses 1-based page selections such as {@code "1-3,5,8-10"} into sorted, distinct 0-based page indexes.
 */
public final class PageRangeParser {

    private PageRangeParser() {
    }

    /**
     * @throws ProcessingException for malformed parts and pages outside {@code 1..totalPages}.
     */
    public static List<Integer> parse(String selection, int totalPages) {
        if (selection == null || selection.isBlank()) {
            throw new ProcessingException("Invalid page range: empty selection");
        }
        TreeSet<Integer> pages = new TreeSet<>();
        for (String rawPart : selection.split(",")) {
            String part = rawPart.trim();
            if (part.isEmpty()) {
                continue;
            }
            int dash = part.indexOf('-');
            if (dash >= 0) {
                int start = parseNumber(part.substring(0, dash), part, true);
                int end = parseNumber(part.substring(dash + 1), part, true);
                if (start < 1 || end > totalPages || start > end) {
                    throw new ProcessingException(String.format(
                            "Page range %s is out of bounds (document has %d pages)", part, totalPages));
                }
                for (int page = start; page <= end; page++) {
                    pages.add(page - 1);
                }
            } else {
                int page = parseNumber(part, part, false);
                if (page < 1 || page > totalPages) {
                    throw new ProcessingException(String.format(
                            "Page range %s is out of bounds (document has %d pages)", part, totalPages));
                }
                pages.add(page - 1);
            }
        }
        if (pages.isEmpty()) {
            throw new ProcessingException("Invalid page range: " + selection);
        }
        return List.copyOf(pages);
    }

    private static int parseNumber(String value, String part, boolean inRange) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ProcessingException((inRange ? "Invalid page range: " : "Invalid page number: ") + part, e);
        }
    }
}
