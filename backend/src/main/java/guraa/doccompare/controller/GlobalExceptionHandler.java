package guraa.doccompare.controller;

import guraa.doccompare.exception.ComparisonException;
import guraa.doccompare.exception.ConfigurationException;
import guraa.doccompare.exception.MinimumDocumentsException;
import guraa.doccompare.exception.NoCandidatesException;
import guraa.doccompare.exception.PathNotFoundException;
import guraa.doccompare.exception.ReportNotPersistedException;
import guraa.doccompare.exception.UnsupportedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Problems with the input of a run: nothing was written.
     */
    @ExceptionHandler({PathNotFoundException.class, MinimumDocumentsException.class, NoCandidatesException.class,
            UnsupportedFormatException.class, ConfigurationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadInput(RuntimeException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Malformed request bodies and missing parameters
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, String>> handleMalformedRequest(Exception e) {
        logger.warn("Malformed request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request: " + e.getMessage());
    }

    /**
     * Handle file upload size exceeded exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleMaxSizeException(MaxUploadSizeExceededException e) {
        logger.error("File size exceeded the maximum limit", e);
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "File size exceeds the maximum limit");
    }

    /**
     * The scores were computed but the summary never showed up on disk.
     */
    @ExceptionHandler(ReportNotPersistedException.class)
    public ResponseEntity<Map<String, String>> handleReportNotPersisted(ReportNotPersistedException e) {
        logger.error("Summary report was not persisted: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(ComparisonException.class)
    public ResponseEntity<Map<String, String>> handleComparisonException(ComparisonException e) {
        logger.error("Comparison failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    /**
     * Handle IO exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        logger.error("IO Exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error processing file: " + e.getMessage());
    }

    /**
     * Handle all other exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        logger.error("Unexpected exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", message);
        return ResponseEntity.status(status).body(response);
    }
}
