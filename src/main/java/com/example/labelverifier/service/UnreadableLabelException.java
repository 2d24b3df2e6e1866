package com.example.labelverifier.service;

/**
 * Raised when OCR produced too little text to verify anything. The message is
 * meant for the end user.
 */
public class UnreadableLabelException extends RuntimeException {

    public static final String MESSAGE = "Could not read text from image. Please try a clearer image.";

    private final int textLength;

    public UnreadableLabelException(int textLength) {
        super(MESSAGE);
        this.textLength = textLength;
    }

    public int getTextLength() {
        return textLength;
    }
}
