package com.ruchira.nest.exception;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.ruchira.nest.dto.MessageDto;
import com.ruchira.nest.dto.ValidationErrorDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.ArrayList;
import java.util.List;

import static com.ruchira.nest.constant.Constants.BASIC_AUTH_SCHEME;
import static com.ruchira.nest.constant.Constants.UNEXPECTED_ERROR_MESSAGE;

/**
 * Centralized exception handler for REST API
 * Every error response has the shape {"detail": ...}
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final String BODY_LOCATION = "body";
    private static final PropertyNamingStrategies.NamingBase BODY_FIELD_NAMING =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    @ExceptionHandler(TransformationException.class)
    public ResponseEntity<MessageDto> handleTransformationException(TransformationException ex) {
        return ResponseEntity.badRequest()
                .body(new MessageDto(String.format("%s:%s", ex.getDetail(), ex.getReason())));
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<MessageDto> handleAuthenticationException(AuthenticationException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, BASIC_AUTH_SCHEME)
                .body(new MessageDto(ex.getMessage()));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<MessageDto> handleBusinessException(BusinessException ex) {
        log.error("Business error: {}", ex.getMessage(), ex);
        return ResponseEntity.internalServerError().body(new MessageDto(UNEXPECTED_ERROR_MESSAGE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MessageDto> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.internalServerError().body(new MessageDto(UNEXPECTED_ERROR_MESSAGE));
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
                                                                  HttpHeaders headers,
                                                                  HttpStatusCode status,
                                                                  WebRequest request) {
        List<ValidationErrorDto> errors = new ArrayList<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            errors.add(new ValidationErrorDto(
                    List.of(BODY_LOCATION, BODY_FIELD_NAMING.translate(fieldError.getField())),
                    fieldError.getDefaultMessage(),
                    "value_error." + fieldError.getCode()));
        }
        for (ObjectError globalError : ex.getBindingResult().getGlobalErrors()) {
            errors.add(new ValidationErrorDto(
                    List.of(BODY_LOCATION),
                    globalError.getDefaultMessage(),
                    "value_error." + globalError.getCode()));
        }
        return unprocessable(errors);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
                                                                  HttpHeaders headers,
                                                                  HttpStatusCode status,
                                                                  WebRequest request) {
        String message = ex.getMostSpecificCause().getMessage();
        return unprocessable(List.of(new ValidationErrorDto(List.of(BODY_LOCATION), message, "value_error.json")));
    }

    /**
     * Framework-level failures (405, 415, ...) keep their status but use the {"detail": ...} body.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex,
                                                             Object body,
                                                             HttpHeaders headers,
                                                             HttpStatusCode statusCode,
                                                             WebRequest request) {
        if (body instanceof ProblemDetail problemDetail) {
            body = new MessageDto(problemDetail.getDetail());
        }
        return super.handleExceptionInternal(ex, body, headers, statusCode, request);
    }

    private ResponseEntity<Object> unprocessable(List<ValidationErrorDto> errors) {
        log.warn("Request body rejected: {}", errors);
        return ResponseEntity.unprocessableEntity().body(new MessageDto(errors));
    }
}
