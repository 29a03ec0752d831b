package com.project.regimen.backend.exception_handling;

import com.project.regimen.backend.exception.CycleDoesNotExistException;
import com.project.regimen.backend.exception.InvalidProgressRequestException;
import com.project.regimen.backend.exception.PlanDoesNotExistException;
import com.project.regimen.backend.exception.UserDoesNotExistException;
import com.project.regimen.backend.exception.ValidationFailureException;
import com.project.regimen.backend.exception.WorkoutDoesNotExistException;
import com.project.regimen.backend.response.ApiResponse;
import com.project.regimen.backend.response.ResponseMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns service exceptions into {@link ApiResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({
            PlanDoesNotExistException.class,
            CycleDoesNotExistException.class,
            WorkoutDoesNotExistException.class,
            UserDoesNotExistException.class
    })
    public ResponseEntity<ApiResponse> handleNotFound(RuntimeException e) {
        log.warn("{}: {}", ResponseMessage.NOT_FOUND, e.getMessage());
        return new ResponseEntity<>(new ApiResponse(e.getMessage()), HttpStatus.NOT_FOUND);
    }

    // field name -> message, first error per field
    @ExceptionHandler(ValidationFailureException.class)
    public ResponseEntity<ApiResponse> handleValidationFailure(ValidationFailureException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : e.getErrors().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.warn("{}: {}", e.getMessage(), fieldErrors);
        return new ResponseEntity<>(new ApiResponse(e.getMessage(), fieldErrors), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({
            InvalidProgressRequestException.class,
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiResponse> handleBadRequest(Exception e) {
        log.warn("{}: {}", ResponseMessage.BAD_REQUEST, e.getMessage());
        return new ResponseEntity<>(new ApiResponse(e.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse> handleNoResource(NoResourceFoundException e) {
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.NOT_FOUND), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.INTERNAL_ERROR), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
