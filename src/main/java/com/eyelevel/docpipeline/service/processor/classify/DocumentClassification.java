package com.eyelevel.docpipeline.service.processor.classify;

import java.util.List;

public record DocumentClassification(String category, double confidence, String language, List<String> tags,
                                     String summary) {
}
