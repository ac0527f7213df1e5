package com.eyelevel.docpipeline.service.processor.ocr;

import java.util.List;

/**
 * A table detected on one page; {@code rows} is row-major with empty strings for missing cells.
 */
public record OcrTable(String id, int page, int rowCount, int columnCount, List<List<String>> rows,
                       double confidence) {
}
