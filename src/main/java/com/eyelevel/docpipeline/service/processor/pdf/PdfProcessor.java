package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.DocumentProcessingStatus;
import com.eyelevel.docpipeline.model.DocumentStatus;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.service.error.ErrorClassifier;
import com.eyelevel.docpipeline.service.processor.AbstractJobProcessor;
import com.eyelevel.docpipeline.service.processor.JobExecutionContext;
import com.eyelevel.docpipeline.service.storage.ObjectStore;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs the PDF job types. Every produced PDF is uploaded and registered as a new document in the source's
 * organization, linked back to its source through metadata.
 */
@Slf4j
@Component
public class PdfProcessor extends AbstractJobProcessor {

    private static final String PDF_MIME_TYPE = "application/pdf";
    private static final int MAX_EVERY_N_PAGES = 1000;

    private final ObjectStore objectStore;
    private final PdfOperations pdfOperations;
    private final GhostscriptCompressor ghostscriptCompressor;
    private final PipelineProperties properties;
    private final JsonParser jsonParser;

    public PdfProcessor(ProcessingStore store, ErrorClassifier errorClassifier, Clock clock,
                        ObjectStore objectStore, PdfOperations pdfOperations,
                        GhostscriptCompressor ghostscriptCompressor, PipelineProperties properties,
                        @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        super(store, errorClassifier, clock);
        this.objectStore = objectStore;
        this.pdfOperations = pdfOperations;
        this.ghostscriptCompressor = ghostscriptCompressor;
        this.properties = properties;
        this.jsonParser = jsonParser;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return EnumSet.of(JobType.PDF_SPLIT, JobType.PDF_MERGE, JobType.PDF_WATERMARK, JobType.PDF_COMPRESS,
                JobType.PDF_EXTRACT_PAGES, JobType.PDF_RENDER_PAGE, JobType.PDF_METADATA);
    }

    @Override
    protected Map<String, Object> execute(JobExecutionContext context) throws Exception {
        context.reportProgress(5);
        Document source = requireDocument(context.getDocumentId());
        if (context.getJobType() == JobType.PDF_MERGE) {
            return merge(context, source);
        }

        validate(source);
        String s3Key = context.getS3Key() != null ? context.getS3Key() : source.getS3Key();
        byte[] content = objectStore.getObjectBytes(s3Key);
        context.reportProgress(20);

        return switch (context.getJobType()) {
            case PDF_SPLIT -> split(context, source, content);
            case PDF_WATERMARK -> watermark(context, source, content);
            case PDF_COMPRESS -> compress(context, source, content);
            case PDF_EXTRACT_PAGES -> extractPages(context, source, content);
            case PDF_RENDER_PAGE -> renderPage(context, source, content);
            case PDF_METADATA -> metadata(context, source, content);
            default -> throw new ProcessingException("Unsupported PDF operation: " + context.getJobType());
        };
    }

    private Map<String, Object> split(JobExecutionContext context, Document source, byte[] content) throws IOException {
        PdfJobOptions.Split options = jsonParser.convert(context.getOptions(), PdfJobOptions.Split.class);
        int totalPages = pdfOperations.pageCount(content);
        if (totalPages > properties.getPdf().getMaxPages()) {
            throw new ProcessingException(String.format("Unsupported page count for split: %d. Maximum: %d",
                    totalPages, properties.getPdf().getMaxPages()));
        }

        String type = options.getType() == null ? "pages" : options.getType().toLowerCase(Locale.ROOT);
        List<PdfOperations.PdfPart> parts;
        List<String> names = new ArrayList<>();
        switch (type) {
            case "pages" -> {
                parts = pdfOperations.splitByRanges(content, options.getRanges());
                for (int i = 0; i < parts.size(); i++) {
                    names.add("split_" + (i + 1) + "_pages_" + parts.get(i).label() + ".pdf");
                }
            }
            case "bookmarks" -> {
                parts = pdfOperations.splitByBookmarks(content);
                parts.forEach(part -> names.add(part.label() + ".pdf"));
            }
            case "every_n_pages" -> {
                Integer n = options.getEveryNPages();
                if (n == null || n < 1 || n > MAX_EVERY_N_PAGES) {
                    throw new ProcessingException("Invalid everyNPages: " + n + ". Expected 1.." + MAX_EVERY_N_PAGES);
                }
                parts = pdfOperations.splitEveryNPages(content, n);
                parts.forEach(part -> names.add(part.label() + ".pdf"));
            }
            default -> throw new ProcessingException("Invalid split type: " + options.getType());
        }
        context.reportProgress(40);

        List<Map<String, Object>> outputs = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            PdfOperations.PdfPart part = parts.get(i);
            String filename = options.getOutputPrefix() + "_" + names.get(i);
            Map<String, Object> link = new LinkedHashMap<>();
            link.put("splitFrom", source.getId());
            link.put("pageRange", part.pageRange());
            Document output = createOutputDocument(context, source, filename, part.content(), link);

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("s3Key", output.getS3Key());
            entry.put("pageRange", part.pageRange());
            entry.put("pageCount", part.pageCount());
            entry.put("documentId", output.getId());
            entry.put("filename", filename);
            entry.put("sizeBytes", part.content().length);
            outputs.add(entry);
            context.reportProgress(40 + 55 * (i + 1) / parts.size());
        }
        log.info("[{}] Split into {} document(s).", context.getContextInfo(), outputs.size());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("outputDocuments", outputs);
        result.put("totalSplits", outputs.size());
        result.put("sourceDocumentId", source.getId());
        result.put("sourceTotalPages", totalPages);
        return result;
    }

    private Map<String, Object> merge(JobExecutionContext context, Document primary) throws IOException {
        PdfJobOptions.Merge options = jsonParser.convert(context.getOptions(), PdfJobOptions.Merge.class);
        List<String> documentIds = options.getDocumentIds();
        int maxDocuments = properties.getPdf().getMaxMergeDocuments();
        if (documentIds.size() < 2 || documentIds.size() > maxDocuments) {
            throw new ProcessingException("Invalid merge request: between 2 and " + maxDocuments
                    + " documents are required");
        }
        String organizationId = organizationOf(context, primary);
        Map<String, Document> byId = store.getDocuments(documentIds).stream()
                .filter(document -> Objects.equals(document.getOrganizationId(), organizationId))
                .filter(document -> PDF_MIME_TYPE.equals(document.getMimeType()))
                .collect(Collectors.toMap(Document::getId, document -> document, (a, b) -> a));
        if (!byId.keySet().containsAll(documentIds)) {
            throw new ProcessingException("Some documents were not found or are not PDFs");
        }
        context.reportProgress(10);

        List<byte[]> contents = new ArrayList<>();
        for (int i = 0; i < documentIds.size(); i++) {
            Document document = byId.get(documentIds.get(i));
            validate(document);
            contents.add(objectStore.getObjectBytes(document.getS3Key()));
            context.reportProgress(10 + 50 * (i + 1) / documentIds.size());
        }

        byte[] merged = pdfOperations.merge(contents);
        int pageCount = pdfOperations.pageCount(merged);
        context.reportProgress(80);

        String filename = options.getOutputName() != null ? options.getOutputName() : "merged.pdf";
        Document output = createOutputDocument(context, primary, filename, merged,
                Map.of("mergedFrom", List.copyOf(documentIds)));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("s3Key", output.getS3Key());
        result.put("documentId", output.getId());
        result.put("pageCount", pageCount);
        result.put("sizeBytes", merged.length);
        result.put("sourceDocumentIds", List.copyOf(documentIds));
        result.put("filename", filename);
        return result;
    }

    private Map<String, Object> watermark(JobExecutionContext context, Document source, byte[] content)
            throws IOException {
        PdfJobOptions.Watermark options = jsonParser.convert(context.getOptions(), PdfJobOptions.Watermark.class);
        if (options.getText() == null || options.getText().isBlank()) {
            throw new ProcessingException("Invalid watermark request: text is required");
        }
        PdfOperations.WatermarkResult watermarked = pdfOperations.watermark(content, options);
        context.reportProgress(70);

        Document output = createOutputDocument(context, source, "watermarked_" + source.getName(),
                watermarked.content(), Map.of("watermarkedFrom", source.getId(), "watermarkText", options.getText()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("s3Key", output.getS3Key());
        result.put("documentId", output.getId());
        result.put("pagesWatermarked", watermarked.pagesWatermarked());
        result.put("watermarkText", options.getText());
        result.put("sizeBytes", watermarked.content().length);
        return result;
    }

    private Map<String, Object> compress(JobExecutionContext context, Document source, byte[] content)
            throws IOException, InterruptedException {
        PdfJobOptions.Compress options = jsonParser.convert(context.getOptions(), PdfJobOptions.Compress.class);

        String method = "pdfbox";
        Optional<byte[]> compressed = Optional.empty();
        if (ghostscriptCompressor.isEnabled()) {
            compressed = ghostscriptCompressor.compress(content, options.getQuality(), context.getContextInfo());
            method = "ghostscript";
        }
        if (compressed.isEmpty()) {
            compressed = Optional.of(pdfOperations.compress(content, options.isRemoveMetadata()));
            method = "pdfbox";
        }
        byte[] output = compressed.get().length < content.length ? compressed.get() : content;
        context.reportProgress(70);

        Map<String, Object> link = new LinkedHashMap<>();
        link.put("compressedFrom", source.getId());
        link.put("compressionQuality", options.getQuality());
        link.put("originalSize", content.length);
        Document document = createOutputDocument(context, source, "compressed_" + source.getName(), output, link);

        double ratio = (double) content.length / output.length;
        double saved = 100.0 * (content.length - output.length) / content.length;
        log.info("[{}] Compressed with {}: {} -> {} bytes.", context.getContextInfo(), method, content.length,
                 output.length);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("s3Key", document.getS3Key());
        result.put("documentId", document.getId());
        result.put("originalSizeBytes", content.length);
        result.put("compressedSizeBytes", output.length);
        result.put("compressionRatio", round(ratio));
        result.put("percentageSaved", round(saved));
        result.put("method", method);
        return result;
    }

    private Map<String, Object> extractPages(JobExecutionContext context, Document source, byte[] content)
            throws IOException {
        PdfJobOptions.ExtractPages options = jsonParser.convert(context.getOptions(),
                PdfJobOptions.ExtractPages.class);
        List<Integer> pages = options.getPages();
        if (pages == null || pages.isEmpty()) {
            throw new ProcessingException("Invalid extract request: no pages given");
        }
        int totalPages = pdfOperations.pageCount(content);
        List<Integer> indexes = new ArrayList<>();
        for (int page : pages) {
            if (page < 1 || page > totalPages) {
                throw new ProcessingException(String.format("Page %d is out of bounds (document has %d pages)",
                        page, totalPages));
            }
            indexes.add(page - 1);
        }

        byte[] extracted = pdfOperations.extractPages(content, indexes);
        context.reportProgress(70);
        String filename = options.getOutputName() != null ? options.getOutputName()
                : "extracted_pages_" + pages.stream().map(String::valueOf).collect(Collectors.joining("_")) + ".pdf";
        Document output = createOutputDocument(context, source, filename, extracted,
                Map.of("extractedFrom", source.getId(), "pages", List.copyOf(pages)));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("s3Key", output.getS3Key());
        result.put("documentId", output.getId());
        result.put("pageCount", indexes.size());
        result.put("sizeBytes", extracted.length);
        result.put("filename", filename);
        return result;
    }

    private Map<String, Object> renderPage(JobExecutionContext context, Document source, byte[] content)
            throws IOException {
        PdfJobOptions.RenderPage options = jsonParser.convert(context.getOptions(), PdfJobOptions.RenderPage.class);
        String format = normalizeFormat(options.getFormat());
        int dpi = options.getDpi() != null ? options.getDpi() : properties.getPdf().getRenderDpi();

        PdfOperations.RenderedPage rendered = pdfOperations.renderPage(content, options.getPage() - 1, dpi, format);
        context.reportProgress(70);

        String baseName = FilenameUtils.getBaseName(source.getName());
        String key = String.format("%s/thumbnails/%s/%s_page_%d.%s", organizationOf(context, source),
                UUID.randomUUID(), baseName, options.getPage(), format);
        objectStore.uploadBuffer(key, rendered.content(), "image/" + format);
        context.reportProgress(90);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("s3Key", key);
        result.put("pageNumber", options.getPage());
        result.put("width", rendered.width());
        result.put("height", rendered.height());
        result.put("format", format);
        result.put("sizeBytes", rendered.content().length);
        result.put("downloadUrl", objectStore.getPresignedDownloadUrl(key).toString());
        return result;
    }

    private Map<String, Object> metadata(JobExecutionContext context, Document source, byte[] content)
            throws IOException {
        Map<String, Object> metadata = pdfOperations.metadata(content);
        context.reportProgress(70);
        store.updateDocument(source.getId(), document -> document.putMetadata("pdf", metadata));
        return new LinkedHashMap<>(Map.of("metadata", metadata));
    }

    private Document createOutputDocument(JobExecutionContext context, Document source, String filename,
                                          byte[] content, Map<String, Object> sourceLink) {
        String key = String.format("%s/%s/%s", organizationOf(context, source), UUID.randomUUID(), filename);
        objectStore.uploadBuffer(key, content, PDF_MIME_TYPE);

        Document document = new Document();
        document.setOrganizationId(organizationOf(context, source));
        document.setFolderId(source.getFolderId());
        document.setName(filename);
        document.setOriginalName(filename);
        document.setMimeType(PDF_MIME_TYPE);
        document.setSizeBytes(content.length);
        document.setS3Key(key);
        document.setStatus(DocumentStatus.READY);
        document.setProcessingStatus(DocumentProcessingStatus.COMPLETE);
        document.setCreatedById(source.getCreatedById());
        document.setMetadata(new LinkedHashMap<>(sourceLink));
        return store.createDocument(document);
    }

    private void validate(Document document) {
        if (!PDF_MIME_TYPE.equals(document.getMimeType())) {
            throw new ProcessingException("Unsupported file type for PDF processing: " + document.getMimeType());
        }
        long maxBytes = properties.getPdf().getMaxFileSizeBytes();
        if (document.getSizeBytes() > maxBytes) {
            throw new ProcessingException(String.format(
                    "Unsupported file size for PDF processing: %d bytes. Maximum: %d bytes",
                    document.getSizeBytes(), maxBytes));
        }
    }

    private static String organizationOf(JobExecutionContext context, Document source) {
        return context.getOrganizationId() != null ? context.getOrganizationId() : source.getOrganizationId();
    }

    private static String normalizeFormat(String format) {
        String value = format == null ? "png" : format.toLowerCase(Locale.ROOT);
        return switch (value) {
            case "png" -> "png";
            case "jpg", "jpeg" -> "jpeg";
            default -> throw new ProcessingException("Unsupported render format: " + format);
        };
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
