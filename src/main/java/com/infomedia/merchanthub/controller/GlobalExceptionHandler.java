package com.infomedia.merchanthub.controller;

import com.infomedia.merchanthub.exception.DuplicateDomainException;
import com.infomedia.merchanthub.exception.InvalidSubdomainException;
import com.infomedia.merchanthub.exception.InvalidTenantStatusTransitionException;
import com.infomedia.merchanthub.exception.NestedTenantContextException;
import com.infomedia.merchanthub.exception.NoImplementationFoundException;
import com.infomedia.merchanthub.exception.TenantDeletionException;
import com.infomedia.merchanthub.exception.TenantMigrationException;
import com.infomedia.merchanthub.exception.TenantNotActiveException;
import com.infomedia.merchanthub.exception.TenantNotFoundException;
import com.infomedia.merchanthub.exception.TenantProvisioningException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps controller exceptions to RFC 7807 bodies shaped like the ones {@link ErrorController} renders.
 */
@RestControllerAdvice
@Log4j2
public class GlobalExceptionHandler {

    @ExceptionHandler({DuplicateDomainException.class, InvalidTenantStatusTransitionException.class})
    public ProblemDetail handleConflict(RuntimeException ex, HttpServletRequest request) {
        log.debug("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(TenantNotFoundException.class)
    public ProblemDetail handleNotFound(TenantNotFoundException ex, HttpServletRequest request) {
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(TenantNotActiveException.class)
    public ProblemDetail handleNotActive(TenantNotActiveException ex, HttpServletRequest request) {
        return problem(HttpStatus.FORBIDDEN, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidSubdomainException.class)
    public ProblemDetail handleInvalidSubdomain(InvalidSubdomainException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return problem(HttpStatus.BAD_REQUEST, detail.isEmpty() ? "Validation failed" : detail, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, "Malformed request body", request);
    }

    @ExceptionHandler(NoImplementationFoundException.class)
    public ProblemDetail handleNoImplementation(NoImplementationFoundException ex, HttpServletRequest request) {
        log.error("Platform binding misconfigured: {}", ex.getMessage());
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "No implementation is available for this platform", request);
    }

    @ExceptionHandler(TenantProvisioningException.class)
    public ProblemDetail handleProvisioning(TenantProvisioningException ex, HttpServletRequest request) {
        // Cause already logged with its phase by the lifecycle service
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, TenantProvisioningException.MESSAGE, request);
    }

    @ExceptionHandler({TenantDeletionException.class, TenantMigrationException.class})
    public ProblemDetail handleOperatorFailure(RuntimeException ex, HttpServletRequest request) {
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(NestedTenantContextException.class)
    public ProblemDetail handleNestedContext(NestedTenantContextException ex, HttpServletRequest request) {
        log.error("Tenant context misuse", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(), request);
    }

    private static ProblemDetail problem(HttpStatus status, String detail, HttpServletRequest request) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setType(URI.create(ErrorController.toHyphenSeparatedLowercase("status-" + status.getReasonPhrase())));
        pd.setTitle(status.getReasonPhrase());
        pd.setInstance(URI.create(request.getRequestURI()));
        pd.setProperty("timestamp", Instant.now().toString());
        return pd;
    }
}
