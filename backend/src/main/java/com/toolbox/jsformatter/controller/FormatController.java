package com.toolbox.jsformatter.controller;

import com.toolbox.jsformatter.dto.FormatRequest;
import com.toolbox.jsformatter.dto.FormatResult;
import com.toolbox.jsformatter.exception.InvalidOptionsException;
import com.toolbox.jsformatter.format.FormatOptions;
import com.toolbox.jsformatter.service.JsFormatterService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class FormatController {

    private static final Logger logger = LoggerFactory.getLogger(FormatController.class);

    private final JsFormatterService formatterService;

    public FormatController(JsFormatterService formatterService) {
        this.formatterService = formatterService;
    }

    @PostMapping("/format")
    public ResponseEntity<FormatResult> format(@Valid @RequestBody FormatRequest request) {
        logger.info("Received format request (length: {} chars)",
                   request.sourceCode() != null ? request.sourceCode().length() : 0);

        try {
            FormatOptions options = request.toOptions(formatterService.defaultOptions());
            FormatResult result = formatterService.process(request.sourceCode(), options);

            logger.info("Formatting completed - Success: {}, Mode: {}", result.success(), options.mode());

            return ResponseEntity.ok(result);

        } catch (InvalidOptionsException e) {
            logger.warn("Rejected format options: {}", e.getMessage());
            return ResponseEntity.badRequest().body(FormatResult.failure(e.getMessage()));

        } catch (Exception e) {
            logger.error("Unexpected error during formatting: {}", e.getMessage(), e);

            FormatResult errorResult = FormatResult.failure(
                "Internal server error: " + e.getMessage()
            );

            return ResponseEntity.internalServerError().body(errorResult);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("JS Formatter backend is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<FormatResult> handleValidationException(MethodArgumentNotValidException e) {

        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(FormatResult.failure(errorMessage.toString()));
    }
}
