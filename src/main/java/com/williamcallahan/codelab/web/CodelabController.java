package com.williamcallahan.codelab.web;

import com.williamcallahan.codelab.domain.codelab.Codelab;
import com.williamcallahan.codelab.domain.codelab.ParseOptions;
import com.williamcallahan.codelab.domain.codelab.node.CodelabNode;
import com.williamcallahan.codelab.domain.errors.ApiErrorResponse;
import com.williamcallahan.codelab.service.codelab.CodelabParseException;
import com.williamcallahan.codelab.service.codelab.CodelabParserRegistry;
import com.williamcallahan.codelab.service.codelab.UnknownCodelabFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST adapter over the codelab parsers.
 */
@RestController
@RequestMapping("/api/codelabs")
public class CodelabController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(CodelabController.class);
    private static final String DEFAULT_FORMAT = "md";

    private final CodelabParserRegistry parsers;

    public CodelabController(CodelabParserRegistry parsers, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.parsers = parsers;
    }

    /**
     * Parses a complete codelab.
     *
     * @param format source format, {@code md} by default
     * @param request source text and optional metadata pass-through keys
     * @return the parsed codelab
     */
    @PostMapping(value = "/parse",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Codelab> parse(
            @RequestParam(name = "format", defaultValue = DEFAULT_FORMAT) String format,
            @RequestBody CodelabParseRequest request) {
        String content = requireContent(request);
        log.debug("Parsing {} codelab of length {}", format, content.length());
        Codelab codelab = parsers.forFormat(format).parse(content, ParseOptions.passing(request.passMetadata()));
        return ResponseEntity.ok(codelab);
    }

    /**
     * Parses a fragment meant to be imported into another codelab.
     *
     * @param format source format, {@code md} by default
     * @param request fragment source text
     * @return the fragment content
     */
    @PostMapping(value = "/fragment",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<CodelabNode>> parseFragment(
            @RequestParam(name = "format", defaultValue = DEFAULT_FORMAT) String format,
            @RequestBody CodelabParseRequest request) {
        String content = requireContent(request);
        log.debug("Parsing {} fragment of length {}", format, content.length());
        return ResponseEntity.ok(parsers.forFormat(format).parseFragment(content));
    }

    @ExceptionHandler(CodelabParseException.class)
    public ResponseEntity<ApiErrorResponse> handleParseException(CodelabParseException e) {
        log.warn("Codelab parse failed: {}", e.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage(), e.failure().name());
    }

    @ExceptionHandler(UnknownCodelabFormatException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownFormat(UnknownCodelabFormatException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException e) {
        return super.handleValidationException(e);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Unexpected error while parsing codelab: {}", e.getMessage(), e);
        return handleServiceException(e, "parse codelab");
    }

    private static String requireContent(CodelabParseRequest request) {
        if (request == null || request.content() == null) {
            throw new IllegalArgumentException("Request content is required");
        }
        return request.content();
    }
}
