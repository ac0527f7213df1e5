package com.eyelevel.docpipeline.service.processor.pdf;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Options of the PDF job types, one nested class per operation.
 */
public final class PdfJobOptions {

    private PdfJobOptions() {
    }

    @Data
    public static class Split {
        /**
         * One of "pages", "bookmarks" or "every_n_pages".
         */
        private String type = "pages";
        private List<String> ranges = new ArrayList<>();
        private Integer everyNPages;
        private String outputPrefix = "split";
    }

    @Data
    public static class Merge {
        private List<String> documentIds = new ArrayList<>();
        private String outputName = "merged.pdf";
    }

    @Data
    public static class Watermark {
        private String text;
        private String position = "center";
        private double opacity = 0.3;
        private float fontSize = 48;
        private double rotation = -45;
        private boolean allPages = true;
        /**
         * 1-based pages to stamp when {@link #allPages} is false.
         */
        private List<Integer> pages = new ArrayList<>();
    }

    @Data
    public static class Compress {
        /**
         * One of "low", "medium" or "high".
         */
        private String quality = "medium";
        private boolean removeMetadata;
    }

    @Data
    public static class ExtractPages {
        private List<Integer> pages = new ArrayList<>();
        private String outputName;
    }

    @Data
    public static class RenderPage {
        private int page = 1;
        private String format = "png";
        private Integer dpi;
    }
}
