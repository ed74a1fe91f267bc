package fr.imt.pbdeployer.presentation.web;

import fr.imt.pbdeployer.exception.AuthenticationException;
import fr.imt.pbdeployer.exception.CommandTimeoutException;
import fr.imt.pbdeployer.exception.ConnectionException;
import fr.imt.pbdeployer.exception.OperationCancelledException;
import fr.imt.pbdeployer.exception.PbDeployerException;
import fr.imt.pbdeployer.exception.PreconditionException;
import fr.imt.pbdeployer.exception.RemoteCommandException;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import fr.imt.pbdeployer.exception.ServiceNotFoundException;
import fr.imt.pbdeployer.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Turns exceptions raised by the controllers into {@link HttpResponse} errors.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== Domain Exception Handlers =====

    @ExceptionHandler({ResourceNotFoundException.class, ServiceNotFoundException.class})
    public ResponseEntity<HttpResponse<Void>> handleNotFound(PbDeployerException ex) {
        return respond(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(PreconditionException.class)
    public ResponseEntity<HttpResponse<Void>> handlePrecondition(PreconditionException ex) {
        log.warn("Precondition failed: {}", ex.getMessage());
        return respond(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<HttpResponse<Void>> handleValidation(ValidationException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return respond(ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({ConnectionException.class, AuthenticationException.class, RemoteCommandException.class})
    public ResponseEntity<HttpResponse<Void>> handleRemoteFailure(PbDeployerException ex) {
        log.error("Remote operation failed: {}", ex.getMessage(), ex);
        return respond(ex, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler({CommandTimeoutException.class, OperationCancelledException.class})
    public ResponseEntity<HttpResponse<Void>> handleTimeout(PbDeployerException ex) {
        log.error("Remote operation timed out: {}", ex.getMessage());
        return respond(ex, HttpStatus.GATEWAY_TIMEOUT);
    }

    /**
     * Fallback handler for any PbDeployerException not handled above.
     */
    @ExceptionHandler(PbDeployerException.class)
    public ResponseEntity<HttpResponse<Void>> handlePbDeployerException(PbDeployerException ex) {
        log.error("pb-deployer exception: {}", ex.getMessage(), ex);
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // ===== Framework Exception Handlers =====

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<HttpResponse<Void>> handleNoResourceFoundException(NoResourceFoundException ex) {
        log.warn("No resource found: {}", ex.getMessage());
        HttpResponse<Void> errorResponse = HttpResponse.error("Resource Not Found");
        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<HttpResponse<Void>> handleValidationErrors(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.error("Validation error: {}", errorMessage);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ValidationException.ERROR_CODE,
                errorMessage
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<HttpResponse<Void>> handleWrongHttpVerb(HttpRequestMethodNotSupportedException ex) {
        log.error("Wrong HTTP verb: {}", ex.getMessage());
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "Method Not Allowed",
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Missing or malformed JSON body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<HttpResponse<Void>> handleMalformedRequest(HttpMessageNotReadableException ex) {
        log.error("Malformed request: ", ex);
        HttpResponse<Void> errorResponse = HttpResponse.error("Bad Request");
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<HttpResponse<Void>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported Media Type: {}", ex.getContentType());
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "Unsupported Media Type",
                "API only accepts JSON. Please set 'Content-Type: application/json'"
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<HttpResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: ", ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "An internal server error occurred",
                "Please contact support."
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<HttpResponse<Void>> respond(PbDeployerException ex, HttpStatus status) {
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
