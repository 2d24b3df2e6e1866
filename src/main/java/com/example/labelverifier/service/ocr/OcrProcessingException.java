package com.example.labelverifier.service.ocr;

public class OcrProcessingException extends RuntimeException {

    public OcrProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
