package com.example.labelverifier.service.ocr;

import java.awt.image.BufferedImage;

/**
 * Turns a decoded label image into plain text. Implementations may call native
 * OCR libraries and are the only place where OCR failures originate.
 */
public interface OcrEngine {

    /**
     * @param image decoded label image
     * @return recognized text, never {@code null}
     * @throws OcrProcessingException when the OCR backend fails
     */
    String extractText(BufferedImage image);
}
