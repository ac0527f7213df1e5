package com.eyelevel.docpipeline.service.processor.thumbnail;

import com.eyelevel.docpipeline.exception.ProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Set;

/**
 * Renders PNG thumbnails from raster images with ImageIO and from the first page of a PDF with PDFBox.
 */
@Component
public class ThumbnailRenderer {

    static final Set<String> IMAGE_TYPES = Set.of("image/png", "image/jpeg", "image/gif", "image/bmp");
    static final String PDF_TYPE = "application/pdf";
    private static final float PDF_RENDER_DPI = 96f;

    public record Thumbnail(byte[] png, int width, int height) {
    }

    public boolean supports(String mimeType) {
        return IMAGE_TYPES.contains(mimeType) || PDF_TYPE.equals(mimeType);
    }

    /**
     * Scales the source to fit a square of {@code maxDimension}, keeping the aspect ratio and never enlarging.
     */
    public Thumbnail render(byte[] content, String mimeType, int maxDimension) throws IOException {
        BufferedImage source = PDF_TYPE.equals(mimeType) ? renderFirstPage(content) : readImage(content);
        BufferedImage scaled = fitInside(source, maxDimension);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(scaled, "png", output);
        return new Thumbnail(output.toByteArray(), scaled.getWidth(), scaled.getHeight());
    }

    static BufferedImage fitInside(BufferedImage source, int maxDimension) {
        int width = source.getWidth();
        int height = source.getHeight();
        double scale = Math.min(1.0, Math.min(maxDimension / (double) width, maxDimension / (double) height));
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    private BufferedImage readImage(byte[] content) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
        if (image == null) {
            throw new ProcessingException("Unsupported or corrupt image content");
        }
        return image;
    }

    private BufferedImage renderFirstPage(byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.getNumberOfPages() == 0) {
                throw new ProcessingException("Invalid PDF: document has no pages");
            }
            return new PDFRenderer(document).renderImageWithDPI(0, PDF_RENDER_DPI);
        }
    }
}
