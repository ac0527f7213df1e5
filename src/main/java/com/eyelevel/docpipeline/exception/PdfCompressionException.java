package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when an external compressor fails to produce a PDF.
 */
public class PdfCompressionException extends ProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public PdfCompressionException(String message) {
        super(message);
    }

    public PdfCompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
