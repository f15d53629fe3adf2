package com.infomedia.merchanthub.platform;

import com.infomedia.merchanthub.exception.InvalidVersionException;
import com.infomedia.merchanthub.exception.MissingPlatformException;
import com.infomedia.merchanthub.exception.UnknownPlatformException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Component
@Order(PlatformFilter.ORDER)
@RequiredArgsConstructor
@Log4j2
public class PlatformFilter extends OncePerRequestFilter {

    public static final int ORDER = 0;
    public static final String INTERNAL_API_PREFIX = "/api/internal/";

    private static final String API_PREFIX = "/api/";

    private final PlatformDetector platformDetector;
    private final PlatformBinder platformBinder;
    private final PlatformProperties properties;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        // Administrative routes are not client traffic and resolve like console invocations
        RequestDescriptor descriptor = request.getRequestURI().startsWith(INTERNAL_API_PREFIX)
                ? RequestDescriptor.forConsole()
                : RequestDescriptor.fromRequest(request, properties.getHeader());

        ResolvedPlatform resolved;
        try {
            resolved = platformDetector.detect(descriptor);
        } catch (InvalidVersionException e) {
            log.error("Rejected request with unroutable API version: {}", e.getMessage());
            response.sendError(HttpServletResponse.SC_NOT_FOUND, e.getMessage());
            return;
        } catch (MissingPlatformException | UnknownPlatformException e) {
            log.debug("Rejected request {}: {}", request.getRequestURI(), e.getMessage());
            response.sendError(HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
            return;
        }

        log.trace("Request {} resolved to {}", request.getRequestURI(), resolved);
        request.setAttribute(PlatformBindings.REQUEST_ATTRIBUTE, new PlatformBindings(platformBinder, resolved));
        filterChain.doFilter(request, response);
    }
}
