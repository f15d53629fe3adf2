package com.infomedia.merchanthub.controller;

import io.swagger.v3.oas.annotations.Hidden;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.web.servlet.error.ErrorAttributes;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.ServletWebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;

/**
 * Renders errors raised outside controllers, such as {@code sendError} calls of the platform and tenant filters.
 */
@Hidden
@RestController
@RequestMapping("${server.error.path:${error.path:/error}}")
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    private final ErrorAttributes errorAttributes;

    public ErrorController(ErrorAttributes errorAttributes) {
        this.errorAttributes = errorAttributes;
    }

    @RequestMapping
    public ResponseEntity<ProblemDetail> error(HttpServletRequest request) {
        Throwable error = errorAttributes.getError(new ServletWebRequest(request));
        Object statusCode = request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE);
        HttpStatus status = statusCode instanceof Integer code
                ? HttpStatus.valueOf(code)
                : HttpStatus.INTERNAL_SERVER_ERROR;

        String originalPath = (String) request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);
        if (originalPath == null) {
            originalPath = request.getRequestURI();
        }

        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detailOf(request, error, status));
        pd.setType(URI.create(toHyphenSeparatedLowercase("status-" + status.getReasonPhrase())));
        pd.setTitle(status.getReasonPhrase());
        pd.setInstance(URI.create(originalPath));
        pd.setProperty("timestamp", Instant.now().toString());

        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(pd);
    }

    private static String detailOf(HttpServletRequest request, Throwable error, HttpStatus status) {
        if (status.is5xxServerError()) {
            return status.getReasonPhrase();
        }
        if (error != null) {
            return error.getMessage();
        }
        // Message given to HttpServletResponse.sendError
        Object message = request.getAttribute(RequestDispatcher.ERROR_MESSAGE);
        if (message instanceof String text && !text.isBlank()) {
            return text;
        }
        return status.getReasonPhrase();
    }

    public static String toHyphenSeparatedLowercase(String input) {
        if (input == null) return "";

        String result = input.trim().toLowerCase(Locale.ROOT);
        result = result.replaceAll("[^a-z0-9\\s-]", "");
        result = result.replaceAll("[\\s-]+", "-");
        return result;
    }
}
