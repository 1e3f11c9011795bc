package vn.com.fecredit.fileportal.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import vn.com.fecredit.fileportal.exception.AccountExistsException;
import vn.com.fecredit.fileportal.exception.FileAccessDeniedException;
import vn.com.fecredit.fileportal.exception.FileRecordNotFoundException;
import vn.com.fecredit.fileportal.exception.UploadErrorCode;
import vn.com.fecredit.fileportal.exception.UploadException;
import vn.com.fecredit.fileportal.model.ErrorResponse;

import java.io.IOException;
import java.util.stream.Collectors;

/**
 * Renders every failure as an {@link ErrorResponse}. Storage failures are reported without
 * backend detail such as paths or bucket names.
 */
@RestControllerAdvice
public class UploadExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(UploadExceptionHandler.class);

    static final String VALIDATION = "VALIDATION";

    @ExceptionHandler(UploadException.class)
    public ResponseEntity<ErrorResponse> handleUploadException(UploadException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        String message = e.getMessage();
        if (e.getErrorCode() == UploadErrorCode.BACKEND_IO_ERROR) {
            log.warn("Storage failure for upload {}", e.getSessionId(), e);
            message = "Storage backend unavailable";
        } else {
            log.debug("Upload request rejected ({}): {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(message, e.getErrorCode().name(), e.getClientAction().name()));
    }

    @ExceptionHandler(FileRecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleFileNotFound(FileRecordNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), "FILE_NOT_FOUND");
    }

    @ExceptionHandler(FileAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleFileAccessDenied(FileAccessDeniedException e) {
        return error(HttpStatus.FORBIDDEN, e.getMessage(), UploadErrorCode.FORBIDDEN.name());
    }

    @ExceptionHandler(AccountExistsException.class)
    public ResponseEntity<ErrorResponse> handleAccountExists(AccountExistsException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), "USERNAME_TAKEN");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(UploadExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message, VALIDATION);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), VALIDATION);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body", VALIDATION);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException e) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "Chunk exceeds the maximum request size", "PAYLOAD_TOO_LARGE");
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIOException(IOException e) {
        log.debug("Chunk IO error: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Cannot read chunk payload", UploadErrorCode.INVALID_CHUNK.name(), ErrorResponse.ACTION_RETRY_CHUNK));
    }

    static HttpStatus statusOf(UploadErrorCode code) {
        switch (code) {
            case SESSION_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            case INDEX_OUT_OF_RANGE:
            case INVALID_CHUNK:
                return HttpStatus.BAD_REQUEST;
            case CHUNK_CONFLICT:
            case SESSION_CLOSED:
                return HttpStatus.CONFLICT;
            case HASH_MISMATCH:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case BACKEND_IO_ERROR:
                return HttpStatus.BAD_GATEWAY;
            case EXPIRED:
                return HttpStatus.GONE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status).body(new ErrorResponse(message, code, ErrorResponse.ACTION_NONE));
    }
}
