package com.eyelevel.docpipeline.service.processor.thumbnail;

import lombok.Data;

@Data
public class ThumbnailOptions {
    private String size;
}
