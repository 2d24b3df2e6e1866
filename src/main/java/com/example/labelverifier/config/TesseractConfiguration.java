package com.example.labelverifier.config;

import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Creates the Tesseract instance used to read label images. The language data
 * directory is looked up in the {@code tesseract.datapath} property, then in
 * {@code TESSDATA_PREFIX}, then in common install locations.
 */
@Configuration
public class TesseractConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseractConfiguration.class);

    // Labels mix headings, columns and fine print, so let Tesseract find the layout.
    private static final int PAGE_SEG_MODE_AUTO = 3;
    private static final int OCR_ENGINE_MODE_LSTM = 1;

    private static final List<String> WELL_KNOWN_LOCATIONS = List.of(
            "/usr/share/tesseract-ocr/5/tessdata",
            "/usr/share/tesseract-ocr/4.00/tessdata",
            "/usr/share/tessdata",
            "/opt/homebrew/share/tessdata",
            "/usr/local/share/tessdata",
            "C:/Program Files/Tesseract-OCR/tessdata");

    @Value("${tesseract.datapath:}")
    private String dataPath;

    @Value("${tesseract.language:eng}")
    private String language;

    @Bean
    public Tesseract tesseract() {
        Path resolvedDataPath = resolveDataPath().orElseThrow(() -> {
            String message = String.format(Locale.ROOT,
                    "Unable to locate Tesseract language data for '%s'. "
                            + "Provide it via the tesseract.datapath property or the TESSDATA_PREFIX environment variable.",
                    language);
            log.error(message);
            return new IllegalStateException(message);
        });

        log.info("Configuring Tesseract data path {} with language {}", resolvedDataPath, language);
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(resolvedDataPath.toString());
        tesseract.setLanguage(language);
        tesseract.setOcrEngineMode(OCR_ENGINE_MODE_LSTM);
        tesseract.setPageSegMode(PAGE_SEG_MODE_AUTO);
        tesseract.setVariable("preserve_interword_spaces", "1");
        return tesseract;
    }

    private Optional<Path> resolveDataPath() {
        List<String> candidates = new ArrayList<>();
        addIfPresent(candidates, dataPath);
        addIfPresent(candidates, System.getenv("TESSDATA_PREFIX"));
        addIfPresent(candidates, System.getProperty("TESSDATA_PREFIX"));
        candidates.addAll(WELL_KNOWN_LOCATIONS);

        return candidates.stream()
                .map(this::validateCandidate)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static void addIfPresent(List<String> candidates, String candidate) {
        if (candidate != null && !candidate.isBlank()) {
            candidates.add(candidate);
        }
    }

    private Optional<Path> validateCandidate(String candidate) {
        Path basePath = Path.of(candidate).normalize();
        if (!Files.isDirectory(basePath)) {
            return Optional.empty();
        }
        String trainedData = primaryLanguage() + ".traineddata";
        if (Files.isRegularFile(basePath.resolve(trainedData))) {
            return Optional.of(basePath);
        }
        Path nested = basePath.resolve("tessdata");
        if (Files.isRegularFile(nested.resolve(trainedData))) {
            return Optional.of(nested);
        }
        log.debug("Tesseract data path candidate '{}' does not contain {}", candidate, trainedData);
        return Optional.empty();
    }

    private String primaryLanguage() {
        int separator = language.indexOf('+');
        return separator < 0 ? language : language.substring(0, separator);
    }
}
