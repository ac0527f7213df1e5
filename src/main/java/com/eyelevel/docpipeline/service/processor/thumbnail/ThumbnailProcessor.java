package com.eyelevel.docpipeline.service.processor.thumbnail;

import com.eyelevel.docpipeline.common.json.JsonParser;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ProcessingException;
import com.eyelevel.docpipeline.model.Document;
import com.eyelevel.docpipeline.model.JobType;
import com.eyelevel.docpipeline.service.error.ErrorClassifier;
import com.eyelevel.docpipeline.service.processor.AbstractJobProcessor;
import com.eyelevel.docpipeline.service.processor.JobExecutionContext;
import com.eyelevel.docpipeline.service.storage.ObjectStore;
import com.eyelevel.docpipeline.service.store.ProcessingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renders a PNG thumbnail under a key derived only from the document and size, so re-runs overwrite it.
 */
@Slf4j
@Component
public class ThumbnailProcessor extends AbstractJobProcessor {

    private final ObjectStore objectStore;
    private final ThumbnailRenderer renderer;
    private final PipelineProperties properties;
    private final JsonParser jsonParser;

    public ThumbnailProcessor(ProcessingStore store, ErrorClassifier errorClassifier, Clock clock,
                              ObjectStore objectStore, ThumbnailRenderer renderer, PipelineProperties properties,
                              @Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        super(store, errorClassifier, clock);
        this.objectStore = objectStore;
        this.renderer = renderer;
        this.properties = properties;
        this.jsonParser = jsonParser;
    }

    @Override
    public Set<JobType> supportedJobTypes() {
        return Set.of(JobType.THUMBNAIL);
    }

    @Override
    protected Map<String, Object> execute(JobExecutionContext context) throws Exception {
        context.reportProgress(10);
        Document document = requireDocument(context.getDocumentId());
        if (!renderer.supports(document.getMimeType())) {
            throw new ProcessingException("Unsupported file type for thumbnail: " + document.getMimeType());
        }
        long maxBytes = properties.getThumbnail().getMaxFileSizeBytes();
        if (document.getSizeBytes() > maxBytes) {
            throw new ProcessingException(String.format("Unsupported file size for thumbnail: %d bytes. Maximum: %d bytes",
                    document.getSizeBytes(), maxBytes));
        }

        ThumbnailOptions options = jsonParser.convert(context.getOptions(), ThumbnailOptions.class);
        ThumbnailSize size = ThumbnailSize.fromLabel(options.getSize() != null
                ? options.getSize() : properties.getThumbnail().getDefaultSize());

        String s3Key = context.getS3Key() != null ? context.getS3Key() : document.getS3Key();
        byte[] content = objectStore.getObjectBytes(s3Key);
        context.reportProgress(40);

        ThumbnailRenderer.Thumbnail thumbnail = renderer.render(content, document.getMimeType(), size.getMaxDimension());
        context.reportProgress(70);

        String organizationId = context.getOrganizationId() != null
                ? context.getOrganizationId() : document.getOrganizationId();
        String thumbnailKey = thumbnailKey(organizationId, document.getId(), size);
        objectStore.uploadBuffer(thumbnailKey, thumbnail.png(), "image/png");
        store.updateDocument(document.getId(), doc -> doc.setThumbnailKey(thumbnailKey));
        log.info("[{}] Stored {} thumbnail ({}x{}) at {}.", context.getContextInfo(), size.label(),
                 thumbnail.width(), thumbnail.height(), thumbnailKey);
        context.reportProgress(90);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("thumbnailKey", thumbnailKey);
        result.put("size", size.label());
        result.put("dimensions", Map.of("width", thumbnail.width(), "height", thumbnail.height()));
        return result;
    }

    static String thumbnailKey(String organizationId, String documentId, ThumbnailSize size) {
        return String.format("%s/thumbnails/%s_%s.png", organizationId, documentId, size.label());
    }
}
