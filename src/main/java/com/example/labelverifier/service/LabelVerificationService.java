package com.example.labelverifier.service;

import com.example.labelverifier.config.VerificationProperties;
import com.example.labelverifier.model.ExpectedFields;
import com.example.labelverifier.model.VerificationResult;
import com.example.labelverifier.service.ocr.OcrEngine;
import com.example.labelverifier.util.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;

/**
 * Decodes an uploaded label image, reads its text and hands the text to the
 * {@link LabelVerifier}.
 */
@Service
public class LabelVerificationService {

    private static final Logger log = LoggerFactory.getLogger(LabelVerificationService.class);

    private final OcrEngine ocrEngine;
    private final LabelVerifier verifier;
    private final boolean preprocess;

    public LabelVerificationService(OcrEngine ocrEngine, LabelVerifier verifier, VerificationProperties properties) {
        this.ocrEngine = ocrEngine;
        this.verifier = verifier;
        this.preprocess = properties.getOcr().isPreprocess();
    }

    public VerificationResult verify(MultipartFile image, ExpectedFields expected) {
        String fileName = image.getOriginalFilename();
        BufferedImage decoded = decode(image, fileName);
        if (preprocess) {
            decoded = ImagePreprocessor.preprocess(decoded);
        }

        long start = System.nanoTime();
        String rawText = ocrEngine.extractText(decoded);
        log.debug("OCR read {} characters from {} in {} ms",
                rawText.length(), fileName, (System.nanoTime() - start) / 1_000_000);

        try {
            VerificationResult result = verifier.verify(rawText, expected);
            log.info("Verified {}: overall match {}, {} checks", fileName, result.overallMatch(), result.checks().size());
            return result;
        } catch (UnreadableLabelException ex) {
            log.warn("Rejected {}: only {} readable characters", fileName, ex.getTextLength());
            throw ex;
        }
    }

    private BufferedImage decode(MultipartFile image, String fileName) {
        try (InputStream inputStream = image.getInputStream()) {
            BufferedImage bufferedImage = ImageIO.read(inputStream);
            if (bufferedImage == null) {
                throw new IllegalArgumentException("Unable to decode provided image");
            }
            return bufferedImage;
        } catch (IOException e) {
            log.error("Failed to read image {}", fileName, e);
            throw new IllegalArgumentException("Failed to read uploaded image", e);
        }
    }
}
