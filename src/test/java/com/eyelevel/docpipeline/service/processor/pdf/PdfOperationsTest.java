package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.exception.ProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageFitDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PdfOperationsTest {

    private final PdfOperations operations = new PdfOperations();

    @Test
    void splitByRangesKeepsSelectedPagesInOrder() throws IOException {
        byte[] pdf = pdfWithPages(6);

        List<PdfOperations.PdfPart> parts = operations.splitByRanges(pdf, List.of("1-2", "6,4"));

        assertEquals(2, parts.size());
        assertEquals(List.of(101f, 102f), pageWidths(parts.get(0).content()));
        assertEquals(List.of(104f, 106f), pageWidths(parts.get(1).content()));
        assertEquals("6_4", parts.get(1).label());
        assertEquals(2, parts.get(1).pageCount());
    }

    @Test
    void splitEveryNPagesLeavesShortLastPart() throws IOException {
        List<PdfOperations.PdfPart> parts = operations.splitEveryNPages(pdfWithPages(5), 2);

        assertThat(parts).extracting(PdfOperations.PdfPart::pageRange).containsExactly("1-2", "3-4", "5-5");
        assertThat(parts).extracting(PdfOperations.PdfPart::label).containsExactly("part_1", "part_2", "part_3");
    }

    @Test
    void splitByBookmarksUsesTopLevelOutline() throws IOException {
        byte[] pdf;
        try (PDDocument document = new PDDocument()) {
            for (int i = 1; i <= 5; i++) {
                document.addPage(new PDPage(new PDRectangle(100 + i, 200)));
            }
            PDDocumentOutline outline = new PDDocumentOutline();
            outline.addLast(bookmark("Intro", document.getPage(0)));
            outline.addLast(bookmark("Chapter 2: Terms", document.getPage(2)));
            document.getDocumentCatalog().setDocumentOutline(outline);
            pdf = save(document);
        }

        List<PdfOperations.PdfPart> parts = operations.splitByBookmarks(pdf);

        assertThat(parts).extracting(PdfOperations.PdfPart::pageRange).containsExactly("1-2", "3-5");
        assertThat(parts).extracting(PdfOperations.PdfPart::label).containsExactly("Intro", "Chapter_2__Terms");
    }

    @Test
    void splitByBookmarksWithoutOutlineIsRejected() throws IOException {
        byte[] pdf = pdfWithPages(2);

        assertThrows(ProcessingException.class, () -> operations.splitByBookmarks(pdf));
    }

    @Test
    void mergeConcatenatesDocuments() throws IOException {
        byte[] merged = operations.merge(List.of(pdfWithPages(2), pdfWithPages(3)));

        assertEquals(List.of(101f, 102f, 101f, 102f, 103f), pageWidths(merged));
    }

    @Test
    void watermarkStampsOnlySelectedPages() throws IOException {
        PdfJobOptions.Watermark options = new PdfJobOptions.Watermark();
        options.setText("CONFIDENTIAL");
        options.setPosition("bottom-right");
        options.setAllPages(false);
        options.setPages(List.of(1, 3));

        PdfOperations.WatermarkResult result = operations.watermark(pdfWithPages(4), options);

        assertEquals(2, result.pagesWatermarked());
        assertEquals(4, operations.pageCount(result.content()));
    }

    @Test
    void extractPagesFollowsRequestedOrder() throws IOException {
        byte[] extracted = operations.extractPages(pdfWithPages(4), List.of(3, 0));

        assertEquals(List.of(104f, 101f), pageWidths(extracted));
    }

    @Test
    void renderPageRejectsPagesOutOfBounds() throws IOException {
        byte[] pdf = pdfWithPages(1);

        PdfOperations.RenderedPage page = operations.renderPage(pdf, 0, 72, "png");
        assertEquals(101, page.width());
        assertTrue(page.content().length > 0);

        ProcessingException error = assertThrows(ProcessingException.class,
                                                 () -> operations.renderPage(pdf, 1, 72, "png"));
        assertEquals("Page 2 is out of bounds (document has 1 pages)", error.getMessage());
    }

    @Test
    void compressCanDropDocumentInformation() throws IOException {
        byte[] pdf;
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            PDDocumentInformation info = new PDDocumentInformation();
            info.setAuthor("Jane Doe");
            document.setDocumentInformation(info);
            pdf = save(document);
        }

        assertEquals("Jane Doe", operations.metadata(pdf).get("author"));
        assertEquals(null, operations.metadata(operations.compress(pdf, true)).get("author"));
        assertEquals("Jane Doe", operations.metadata(operations.compress(pdf, false)).get("author"));
    }

    @Test
    void metadataDescribesDocument() throws IOException {
        Map<String, Object> metadata = operations.metadata(pdfWithPages(3));

        assertEquals(3, metadata.get("pageCount"));
        assertEquals(false, metadata.get("encrypted"));
        assertEquals(false, metadata.get("hasForm"));
        assertEquals(Map.of("width", 101f, "height", 200f), metadata.get("pageSize"));
    }

    @Test
    void corruptContentIsRejected() {
        ProcessingException error = assertThrows(ProcessingException.class,
                                                 () -> operations.pageCount("not a pdf".getBytes()));

        assertThat(error.getMessage()).startsWith("Invalid or corrupt PDF");
    }

    private static byte[] pdfWithPages(int count) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int i = 1; i <= count; i++) {
                document.addPage(new PDPage(new PDRectangle(100 + i, 200)));
            }
            return save(document);
        }
    }

    private static PDOutlineItem bookmark(String title, PDPage page) {
        PDPageFitDestination destination = new PDPageFitDestination();
        destination.setPage(page);
        PDOutlineItem item = new PDOutlineItem();
        item.setTitle(title);
        item.setDestination(destination);
        return item;
    }

    private static List<Float> pageWidths(byte[] pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            List<Float> widths = new ArrayList<>();
            for (PDPage page : document.getPages()) {
                widths.add(page.getMediaBox().getWidth());
            }
            return widths;
        }
    }

    private static byte[] save(PDDocument document) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        document.save(output);
        return output.toByteArray();
    }
}
