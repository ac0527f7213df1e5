package com.eyelevel.docpipeline.service.processor.pdf;

import com.eyelevel.docpipeline.common.processexec.ProcessExecutor;
import com.eyelevel.docpipeline.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.FileProtectedException;
import com.eyelevel.docpipeline.exception.PdfCompressionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Compresses a PDF with the Ghostscript pdfwrite device.
 * <p>
 * Failures are retried with a fixed delay. When every attempt fails the result is empty and the caller falls
 * back to PDFBox; a password-protected file fails immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GhostscriptCompressor {

    private static final Pattern PASSWORD_ERROR_PATTERN = Pattern.compile("This file requires a password for access",
            Pattern.CASE_INSENSITIVE);
    private static final Map<String, String> QUALITY_PRESETS = Map.of(
            "low", "/screen",
            "medium", "/ebook",
            "high", "/printer");

    private final PipelineProperties properties;
    private final ProcessExecutor processExecutor;

    public boolean isEnabled() {
        return properties.getPdf().getGhostscript().isEnabled();
    }

    /**
     * @return the compressed bytes, or empty when Ghostscript could not produce a smaller file.
     */
    @Retryable(retryFor = {PdfCompressionException.class},
            maxAttemptsExpression = "#{${app.processing.pdf.ghostscript.retry.attempts:3} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.pdf.ghostscript.retry.delay-ms:2000}}"),
            listeners = {"ghostscriptRetryListener"})
    public Optional<byte[]> compress(byte[] content, String quality, String contextInfo) throws InterruptedException {
        PipelineProperties.Pdf.Ghostscript config = properties.getPdf().getGhostscript();
        log.info("[{}] Attempting PDF compression with Ghostscript (Timeout: {}m).", contextInfo,
                 config.getTimeoutMinutes());

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("gs-compress-");
            Path input = workDir.resolve("input.pdf");
            Path output = workDir.resolve("output.pdf");
            Files.write(input, content);

            ProcessResult result = processExecutor.execute(buildCommand(input, output, quality), contextInfo,
                    config.getTimeoutMinutes(), config.getExecutable());
            if (result.exitCode() != 0) {
                if (PASSWORD_ERROR_PATTERN.matcher(result.stderr()).find()) {
                    throw new FileProtectedException("Invalid PDF: file is password protected");
                }
                throw new PdfCompressionException("Ghostscript compression failed. Error: " + result.stderr());
            }

            byte[] compressed = Files.readAllBytes(output);
            if (compressed.length == 0 || compressed.length >= content.length) {
                log.warn("[{}] Ghostscript did not reduce the file size ({} -> {} bytes).", contextInfo,
                         content.length, compressed.length);
                return Optional.empty();
            }
            return Optional.of(compressed);
        } catch (IOException e) {
            throw new PdfCompressionException("Ghostscript compression process failed", e);
        } finally {
            if (workDir != null) {
                try {
                    FileUtils.deleteDirectory(workDir.toFile());
                } catch (IOException e) {
                    log.warn("[{}] Failed to delete temporary compression directory: {}", contextInfo, workDir);
                }
            }
        }
    }

    @Recover
    public Optional<byte[]> recover(PdfCompressionException e, byte[] content, String quality, String contextInfo) {
        log.error("[{}] Ghostscript failed after all retry attempts. Falling back to PDFBox.", contextInfo, e);
        return Optional.empty();
    }

    @Recover
    public Optional<byte[]> recover(FileProtectedException e, byte[] content, String quality, String contextInfo) {
        log.error("[{}] Ghostscript determined the file is password protected. This is a terminal failure.",
                  contextInfo);
        throw e;
    }

    List<String> buildCommand(Path input, Path output, String quality) {
        PipelineProperties.Pdf.Ghostscript config = properties.getPdf().getGhostscript();
        String preset = quality == null ? config.getPreset()
                : QUALITY_PRESETS.getOrDefault(quality.toLowerCase(Locale.ROOT), config.getPreset());
        int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        return List.of(config.getExecutable(), "-sDEVICE=pdfwrite", "-dCompatibilityLevel=1.4",
                "-dPDFSETTINGS=" + preset, "-dNOPAUSE", "-dBATCH", "-dDetectDuplicateImages=true",
                "-dNumRenderingThreads=" + threads, "-sOutputFile=" + output.toAbsolutePath(),
                input.toAbsolutePath().toString());
    }
}
