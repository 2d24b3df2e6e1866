package com.example.labelverifier.service.ocr;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Locale;

@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ITesseract tesseract;

    public TesseractOcrEngine(ITesseract tesseract) {
        this.tesseract = tesseract;
    }

    @Override
    public String extractText(BufferedImage image) {
        try {
            String raw = tesseract.doOCR(image);
            if (raw == null) {
                return "";
            }
            return raw.replace('\u0000', ' ');
        } catch (TesseractException ex) {
            String message = String.format(Locale.ROOT, "Tesseract failed to read label image: %s", ex.getMessage());
            log.error(message, ex);
            throw new OcrProcessingException(message, ex);
        } catch (Error e) {
            if ("Invalid memory access".equalsIgnoreCase(e.getMessage())) {
                String message = "Tesseract native layer failed. Verify that the tessdata directory contains the configured language data.";
                log.error(message, e);
                throw new OcrProcessingException(message, e);
            }
            throw e;
        }
    }
}
