package com.eyelevel.docpipeline.service.processor.ocr;

public record OcrFormField(String key, String value, double confidence, int page) {
}
