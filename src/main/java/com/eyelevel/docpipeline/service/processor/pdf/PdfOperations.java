package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.exception.FileProtectedException;
import com.eyelevel.docpipeline.exception.ProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdfwriter.compress.CompressParameters;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.state.PDExtendedGraphicsState;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory PDF transformations on top of PDFBox.
 */
@Component
public class PdfOperations {

    public record PdfPart(byte[] content, String pageRange, int pageCount, String label) {
    }

    public record WatermarkResult(byte[] content, int pagesWatermarked) {
    }

    public record RenderedPage(byte[] content, int width, int height) {
    }

    public int pageCount(byte[] pdf) throws IOException {
        try (PDDocument document = load(pdf)) {
            return document.getNumberOfPages();
        }
    }

    /**
     * One part per range selection, e.g. {@code ["1-3", "4,6"]}.
     */
    public List<PdfPart> splitByRanges(byte[] pdf, List<String> ranges) throws IOException {
        if (ranges == null || ranges.isEmpty()) {
            throw new ProcessingException("Invalid split request: no page ranges given");
        }
        try (PDDocument source = load(pdf)) {
            List<PdfPart> parts = new ArrayList<>();
            for (String range : ranges) {
                List<Integer> pages = PageRangeParser.parse(range, source.getNumberOfPages());
                parts.add(new PdfPart(copyPages(source, pages), range, pages.size(), range.replace(",", "_")));
            }
            return parts;
        }
    }

    /**
     * One part per top-level bookmark, running up to the page before the next bookmark.
     */
    public List<PdfPart> splitByBookmarks(byte[] pdf) throws IOException {
        try (PDDocument source = load(pdf)) {
            PDDocumentOutline outline = source.getDocumentCatalog().getDocumentOutline();
            if (outline == null) {
                throw new ProcessingException("Invalid split request: document has no bookmarks");
            }
            List<String> titles = new ArrayList<>();
            List<Integer> starts = new ArrayList<>();
            for (PDOutlineItem item : outline.children()) {
                PDPage page = item.findDestinationPage(source);
                int index = page == null ? -1 : source.getPages().indexOf(page);
                if (index >= 0 && (starts.isEmpty() || index > starts.get(starts.size() - 1))) {
                    titles.add(item.getTitle() == null ? "section" : item.getTitle());
                    starts.add(index);
                }
            }
            if (starts.isEmpty()) {
                throw new ProcessingException("Invalid split request: document has no bookmarks");
            }

            List<PdfPart> parts = new ArrayList<>();
            for (int i = 0; i < starts.size(); i++) {
                int start = starts.get(i);
                int end = i + 1 < starts.size() ? starts.get(i + 1) - 1 : source.getNumberOfPages() - 1;
                List<Integer> pages = new ArrayList<>();
                for (int page = start; page <= end; page++) {
                    pages.add(page);
                }
                String range = (start + 1) + "-" + (end + 1);
                parts.add(new PdfPart(copyPages(source, pages), range, pages.size(), sanitize(titles.get(i))));
            }
            return parts;
        }
    }

    public List<PdfPart> splitEveryNPages(byte[] pdf, int pagesPerPart) throws IOException {
        try (PDDocument source = load(pdf)) {
            int total = source.getNumberOfPages();
            List<PdfPart> parts = new ArrayList<>();
            for (int start = 0, part = 1; start < total; start += pagesPerPart, part++) {
                int end = Math.min(total, start + pagesPerPart) - 1;
                List<Integer> pages = new ArrayList<>();
                for (int page = start; page <= end; page++) {
                    pages.add(page);
                }
                parts.add(new PdfPart(copyPages(source, pages), (start + 1) + "-" + (end + 1), pages.size(),
                        "part_" + part));
            }
            return parts;
        }
    }

    public byte[] merge(List<byte[]> pdfs) throws IOException {
        PDFMergerUtility merger = new PDFMergerUtility();
        try (PDDocument target = new PDDocument()) {
            for (byte[] pdf : pdfs) {
                try (PDDocument source = load(pdf)) {
                    merger.appendDocument(target, source);
                }
            }
            return save(target);
        }
    }

    /**
     * Stamps the text on every page, or only on the listed 1-based pages when {@code allPages} is false.
     */
    public WatermarkResult watermark(byte[] pdf, PdfJobOptions.Watermark options) throws IOException {
        WatermarkPosition position = WatermarkPosition.fromValue(options.getPosition());
        PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        try (PDDocument document = load(pdf)) {
            Set<Integer> selected = new HashSet<>(options.getPages());
            float textWidth;
            try {
                textWidth = font.getStringWidth(options.getText()) / 1000 * options.getFontSize();
            } catch (IllegalArgumentException e) {
                throw new ProcessingException("Invalid watermark text: " + e.getMessage(), e);
            }

            int stamped = 0;
            int pageNumber = 0;
            for (PDPage page : document.getPages()) {
                pageNumber++;
                if (!options.isAllPages() && !selected.contains(pageNumber)) {
                    continue;
                }
                PDRectangle box = page.getMediaBox();
                float[] origin = position.origin(box.getWidth(), box.getHeight(), textWidth, options.getFontSize());
                try (PDPageContentStream stream = new PDPageContentStream(document, page,
                        PDPageContentStream.AppendMode.APPEND, true, true)) {
                    PDExtendedGraphicsState state = new PDExtendedGraphicsState();
                    state.setNonStrokingAlphaConstant((float) options.getOpacity());
                    stream.setGraphicsStateParameters(state);
                    stream.setNonStrokingColor(0.5f, 0.5f, 0.5f);
                    stream.beginText();
                    stream.setFont(font, options.getFontSize());
                    if (position == WatermarkPosition.DIAGONAL) {
                        stream.setTextMatrix(Matrix.getRotateInstance(Math.toRadians(options.getRotation()),
                                origin[0], origin[1]));
                    } else {
                        stream.setTextMatrix(Matrix.getTranslateInstance(origin[0], origin[1]));
                    }
                    stream.showText(options.getText());
                    stream.endText();
                }
                stamped++;
            }
            return new WatermarkResult(save(document), stamped);
        }
    }

    /**
     * Re-saves the document with compressed object streams.
     */
    public byte[] compress(byte[] pdf, boolean removeMetadata) throws IOException {
        try (PDDocument document = load(pdf)) {
            if (removeMetadata) {
                document.setDocumentInformation(new PDDocumentInformation());
                document.getDocumentCatalog().setMetadata(null);
            }
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            document.save(output, CompressParameters.DEFAULT_COMPRESSION);
            return output.toByteArray();
        }
    }

    /**
     * @param pageIndexes 0-based, in output order.
     */
    public byte[] extractPages(byte[] pdf, List<Integer> pageIndexes) throws IOException {
        try (PDDocument source = load(pdf)) {
            return copyPages(source, pageIndexes);
        }
    }

    /**
     * @param pageIndex 0-based.
     * @param format    "png" or "jpeg".
     */
    public RenderedPage renderPage(byte[] pdf, int pageIndex, int dpi, String format) throws IOException {
        try (PDDocument document = load(pdf)) {
            if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
                throw new ProcessingException(String.format("Page %d is out of bounds (document has %d pages)",
                        pageIndex + 1, document.getNumberOfPages()));
            }
            BufferedImage image = new PDFRenderer(document).renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            ImageIO.write(image, format, output);
            return new RenderedPage(output.toByteArray(), image.getWidth(), image.getHeight());
        }
    }

    public Map<String, Object> metadata(byte[] pdf) throws IOException {
        try (PDDocument document = load(pdf)) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("pageCount", document.getNumberOfPages());
            metadata.put("version", document.getVersion());
            metadata.put("encrypted", document.isEncrypted());

            PDDocumentInformation info = document.getDocumentInformation();
            metadata.put("title", info.getTitle());
            metadata.put("author", info.getAuthor());
            metadata.put("subject", info.getSubject());
            metadata.put("keywords", info.getKeywords());
            metadata.put("creator", info.getCreator());
            metadata.put("producer", info.getProducer());
            metadata.put("creationDate", toIsoString(info.getCreationDate()));
            metadata.put("modificationDate", toIsoString(info.getModificationDate()));

            if (document.getNumberOfPages() > 0) {
                PDRectangle box = document.getPage(0).getMediaBox();
                metadata.put("pageSize", Map.of("width", box.getWidth(), "height", box.getHeight()));
            }

            List<String> formFields = new ArrayList<>();
            PDAcroForm acroForm = document.getDocumentCatalog().getAcroForm();
            if (acroForm != null) {
                for (PDField field : acroForm.getFieldTree()) {
                    formFields.add(field.getFullyQualifiedName());
                }
            }
            metadata.put("hasForm", !formFields.isEmpty());
            metadata.put("formFields", formFields);

            List<String> outline = new ArrayList<>();
            PDDocumentOutline documentOutline = document.getDocumentCatalog().getDocumentOutline();
            if (documentOutline != null) {
                for (PDOutlineItem item : documentOutline.children()) {
                    outline.add(item.getTitle());
                }
            }
            metadata.put("outline", outline);
            return metadata;
        }
    }

    private PDDocument load(byte[] pdf) throws IOException {
        try {
            return Loader.loadPDF(pdf);
        } catch (InvalidPasswordException e) {
            throw new FileProtectedException("Invalid PDF: file is password protected");
        } catch (IOException e) {
            throw new ProcessingException("Invalid or corrupt PDF: " + e.getMessage(), e);
        }
    }

    private byte[] copyPages(PDDocument source, List<Integer> pageIndexes) throws IOException {
        try (PDDocument target = new PDDocument()) {
            for (int index : pageIndexes) {
                target.importPage(source.getPage(index));
            }
            return save(target);
        }
    }

    private static byte[] save(PDDocument document) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        document.save(output);
        return output.toByteArray();
    }

    private static String toIsoString(Calendar calendar) {
        return calendar == null ? null : calendar.toInstant().toString();
    }

    private static String sanitize(String title) {
        String cleaned = title.replaceAll("[^a-zA-Z0-9_-]", "_");
        return cleaned.isEmpty() ? "section" : cleaned;
    }
}
