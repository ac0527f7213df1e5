package com.eyelevel.docpipeline.dto.job.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.HashMap;
import java.util.Map;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to run one processing job against a document.")
public class AddJobRequest {

    @NotBlank
    @Schema(description = "The document to process.", example = "3f1c2a4e-8d7b-4a51-9f0e-6a2b5c7d8e90")
    private String documentId;

    @NotBlank
    @Schema(description = "One of OCR, THUMBNAIL, EMBEDDING, AI_CLASSIFY, PDF_SPLIT, PDF_MERGE, PDF_WATERMARK, "
            + "PDF_COMPRESS, PDF_EXTRACT_PAGES, PDF_RENDER_PAGE, PDF_METADATA.", example = "OCR")
    private String jobType;

    @Builder.Default
    @Schema(description = "Job type specific options.", example = "{\"features\": [\"TABLES\"]}")
    private Map<String, Object> options = new HashMap<>();

    @Schema(description = "Queue priority, lower is more urgent. Defaults to the job type's priority.", example = "2")
    private Integer priority;

    @PositiveOrZero
    @Schema(description = "Delay before the job becomes eligible, in milliseconds.", example = "0")
    private Long delayMs;

    @Min(1)
    @Schema(description = "Total delivery attempts. Defaults to the configured retry attempts.", example = "3")
    private Integer attempts;
}
