package com.eyelevel.docpipeline.service.processor.ocr;

import com.eyelevel.docpipeline.exception.ProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentRequest;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentResponse;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.DocumentLocation;
import software.amazon.awssdk.services.textract.model.FeatureType;
import software.amazon.awssdk.services.textract.model.GetDocumentAnalysisRequest;
import software.amazon.awssdk.services.textract.model.GetDocumentAnalysisResponse;
import software.amazon.awssdk.services.textract.model.S3Object;
import software.amazon.awssdk.services.textract.model.StartDocumentAnalysisRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link OcrEngine} backed by AWS Textract document analysis.
 */
@Slf4j
@Service
public class TextractOcrEngine implements OcrEngine {

    private static final int MAX_JOB_TAG_LENGTH = 64;
    private static final int MAX_RESULTS_PER_PAGE = 1000;

    private final TextractClient textractClient;
    private final String bucketName;
    private final TextractResultParser parser = new TextractResultParser();

    public TextractOcrEngine(TextractClient textractClient, @Value("${aws.s3.bucket}") String bucketName) {
        this.textractClient = textractClient;
        this.bucketName = bucketName;
    }

    @Override
    public OcrResult analyzeDocument(String s3Key, List<String> features) {
        log.debug("Running synchronous Textract analysis for key: {}", s3Key);
        AnalyzeDocumentRequest request = AnalyzeDocumentRequest.builder()
                .document(software.amazon.awssdk.services.textract.model.Document.builder()
                        .s3Object(s3Object(s3Key))
                        .build())
                .featureTypes(toFeatureTypes(features))
                .build();
        AnalyzeDocumentResponse response = textractClient.analyzeDocument(request);
        return parser.parse(response.blocks());
    }

    @Override
    public String startDocumentAnalysis(String s3Key, List<String> features) {
        StartDocumentAnalysisRequest request = StartDocumentAnalysisRequest.builder()
                .documentLocation(DocumentLocation.builder().s3Object(s3Object(s3Key)).build())
                .featureTypes(toFeatureTypes(features))
                .jobTag(jobTagFor(s3Key))
                .build();
        String jobId = textractClient.startDocumentAnalysis(request).jobId();
        log.info("Started Textract analysis {} for key: {}", jobId, s3Key);
        return jobId;
    }

    @Override
    public Optional<OcrResult> getDocumentAnalysis(String externalJobId) {
        List<Block> blocks = new ArrayList<>();
        String nextToken = null;
        do {
            GetDocumentAnalysisResponse response = textractClient.getDocumentAnalysis(GetDocumentAnalysisRequest.builder()
                    .jobId(externalJobId)
                    .maxResults(MAX_RESULTS_PER_PAGE)
                    .nextToken(nextToken)
                    .build());
            switch (response.jobStatus()) {
                case IN_PROGRESS -> {
                    return Optional.empty();
                }
                case FAILED -> throw new ProcessingException("Textract job failed: "
                        + (response.statusMessage() != null ? response.statusMessage() : "Unknown error"));
                default -> blocks.addAll(response.blocks());
            }
            nextToken = response.nextToken();
        } while (nextToken != null);

        log.debug("Textract analysis {} returned {} blocks.", externalJobId, blocks.size());
        return Optional.of(parser.parse(blocks));
    }

    /**
     * Textract job tags allow letters, digits, '-' and '_' only, up to 64 characters.
     */
    static String jobTagFor(String s3Key) {
        String tag = s3Key.replaceAll("[^a-zA-Z0-9_-]", "_");
        return tag.length() > MAX_JOB_TAG_LENGTH ? tag.substring(0, MAX_JOB_TAG_LENGTH) : tag;
    }

    private S3Object s3Object(String s3Key) {
        return S3Object.builder().bucket(bucketName).name(s3Key).build();
    }

    private static List<FeatureType> toFeatureTypes(List<String> features) {
        List<FeatureType> featureTypes = new ArrayList<>();
        for (String feature : features) {
            FeatureType type = FeatureType.fromValue(feature.toUpperCase(Locale.ROOT));
            if (type == FeatureType.UNKNOWN_TO_SDK_VERSION) {
                throw new ProcessingException("Unsupported OCR feature: " + feature);
            }
            featureTypes.add(type);
        }
        return featureTypes;
    }
}
