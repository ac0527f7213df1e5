package com.eyelevel.docpipeline.common.apiclient.openai.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmbeddingRequest {
    private String model;
    private List<String> input;
    /**
     * Only accepted by the text-embedding-3 family.
     */
    private Integer dimensions;
}
