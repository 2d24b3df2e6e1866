package com.example.labelverifier.controller;

import com.example.labelverifier.model.ErrorResponse;
import com.example.labelverifier.model.ExpectedFields;
import com.example.labelverifier.model.HealthResponse;
import com.example.labelverifier.model.VerificationResult;
import com.example.labelverifier.service.LabelVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Label verification", description = "Checks a beverage label image against submitted regulatory fields")
public class LabelVerificationController {

    private final LabelVerificationService service;

    public LabelVerificationController(LabelVerificationService service) {
        this.service = service;
    }

    @Operation(
            summary = "Verify a label image",
            description = "Reads the label with OCR and compares it with the brand name, product class, "
                    + "alcohol content, optional net contents and the government warning.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Verification completed; see overall_match for the verdict",
                    content = @Content(schema = @Schema(implementation = VerificationResult.class))),
            @ApiResponse(
                    responseCode = "400",
                    description = "No usable image, or no readable text on it",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(
                    responseCode = "500",
                    description = "OCR or unexpected failure",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/verify", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<VerificationResult> verify(
            @Parameter(description = "Photo or scan of the label", required = true)
            @RequestPart(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "brandName", required = false) String brandName,
            @RequestParam(value = "productClass", required = false) String productClass,
            @RequestParam(value = "alcoholContent", required = false) String alcoholContent,
            @RequestParam(value = "netContents", required = false) String netContents) {
        if (image == null) {
            throw new ResponseStatusException(BAD_REQUEST, "No image file provided");
        }
        String fileName = image.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "No image file selected");
        }
        if (image.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Uploaded image is empty");
        }
        ExpectedFields expected = new ExpectedFields(brandName, productClass, alcoholContent, netContents);
        return ResponseEntity.ok(service.verify(image, expected));
    }

    @GetMapping("/health")
    @Operation(summary = "Report service health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.healthy());
    }
}
