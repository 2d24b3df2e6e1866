package com.example.labelverifier.controller;

import com.example.labelverifier.model.ErrorResponse;
import com.example.labelverifier.service.UnreadableLabelException;
import com.example.labelverifier.service.ocr.OcrProcessingException;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException exception, HttpServletRequest request) {
        return respond(HttpStatus.valueOf(exception.getStatusCode().value()), exception.getReason(), null, request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "No image file provided", null, request);
    }

    @ExceptionHandler(ServletException.class)
    public ResponseEntity<ErrorResponse> handleServletException(ServletException exception, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        if (exception instanceof org.springframework.web.ErrorResponse errorResponse) {
            status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
        }
        return respond(status, exception.getMessage(), null, request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException exception, HttpServletRequest request) {
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded image is too large", exception.getMessage(), request);
    }

    @ExceptionHandler(UnreadableLabelException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(UnreadableLabelException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, exception.getMessage(), null, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, exception.getMessage(), null, request);
    }

    @ExceptionHandler(OcrProcessingException.class)
    public ResponseEntity<ErrorResponse> handleOcrFailure(OcrProcessingException exception, HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process image", exception.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception exception, HttpServletRequest request) {
        log.error("Unexpected failure while handling {}", request.getRequestURI(), exception);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An error occurred", String.valueOf(exception.getMessage()), request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String details, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), error, details, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
