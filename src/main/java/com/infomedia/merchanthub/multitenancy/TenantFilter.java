package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.db.entity.Tenant;
import com.infomedia.merchanthub.db.entity.TenantStatus;
import com.infomedia.merchanthub.exception.TenantNotActiveException;
import com.infomedia.merchanthub.exception.TenantNotFoundException;
import com.infomedia.merchanthub.platform.PlatformFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Runs tenant scoped routes inside the context of the tenant owning the request's host.
 * Other routes pass through in the central context.
 */
@Component
@Order(TenantFilter.ORDER)
@RequiredArgsConstructor
@Log4j2
public class TenantFilter extends OncePerRequestFilter {

    public static final int ORDER = PlatformFilter.ORDER + 1;

    private final TenancyProperties properties;
    private final TenantDirectoryService directoryService;
    private final TenantContextManager contextManager;

    private final PathMatcher pathMatcher = new AntPathMatcher();

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        return properties.getTenantRoutePatterns().stream().noneMatch(pattern -> pathMatcher.match(pattern, path));
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String domain = hostOf(request);

        Tenant tenant;
        try {
            tenant = directoryService.getTenant(directoryService.resolveTenant(domain));
        } catch (TenantNotFoundException e) {
            log.debug("No tenant for host {}", domain);
            response.sendError(HttpServletResponse.SC_NOT_FOUND, e.getMessage());
            return;
        }

        if (tenant.getStatus() != TenantStatus.ACTIVE) {
            TenantNotActiveException rejection = new TenantNotActiveException(domain, tenant.getStatus());
            log.debug(rejection.getMessage());
            response.sendError(HttpServletResponse.SC_FORBIDDEN, rejection.getMessage());
            return;
        }

        try (TenantScope ignored = contextManager.enter(tenant.getId())) {
            filterChain.doFilter(request, response);
        }
    }

    static String hostOf(HttpServletRequest request) {
        String host = request.getHeader(HttpHeaders.HOST);
        if (host == null || host.isBlank()) {
            return request.getServerName();
        }
        host = host.trim();
        int portSeparator = host.lastIndexOf(':');
        // Leave bare IPv6 literals alone
        if (portSeparator > host.lastIndexOf(']')) {
            host = host.substring(0, portSeparator);
        }
        return host;
    }
}
