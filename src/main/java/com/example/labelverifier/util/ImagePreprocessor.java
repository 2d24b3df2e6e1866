package com.example.labelverifier.util;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.RescaleOp;

/**
 * Optional clean-up applied to a label photo before OCR: grayscale conversion,
 * upscaling of small images so that fine print reaches a readable glyph size,
 * and a mild contrast stretch. No binarization is applied because labels often
 * print text on coloured or gradient backgrounds.
 */
public final class ImagePreprocessor {

    static final int MIN_WIDTH = 1000;
    private static final double MAX_SCALE = 3.0;

    private ImagePreprocessor() {
    }

    public static BufferedImage preprocess(BufferedImage input) {
        if (input == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        BufferedImage grayscale = toGrayscale(upscale(input));
        return stretchContrast(grayscale);
    }

    static BufferedImage upscale(BufferedImage input) {
        if (input.getWidth() >= MIN_WIDTH) {
            return input;
        }
        double scale = Math.min(MAX_SCALE, (double) MIN_WIDTH / input.getWidth());
        int width = (int) Math.round(input.getWidth() * scale);
        int height = Math.max(1, (int) Math.round(input.getHeight() * scale));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.drawImage(input, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private static BufferedImage toGrayscale(BufferedImage input) {
        BufferedImage grayscale = new BufferedImage(input.getWidth(), input.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = grayscale.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(input, 0, 0, null);
        } finally {
            g.dispose();
        }
        return grayscale;
    }

    private static BufferedImage stretchContrast(BufferedImage input) {
        RescaleOp rescaleOp = new RescaleOp(1.3f, -15f, null);
        rescaleOp.filter(input, input);
        return input;
    }
}
