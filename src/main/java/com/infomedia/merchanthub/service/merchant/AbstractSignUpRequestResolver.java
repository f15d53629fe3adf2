package com.infomedia.merchanthub.service.merchant;

import com.infomedia.merchanthub.dto.auth.SignUpRequest;
import com.infomedia.merchanthub.exception.DuplicateDomainException;
import com.infomedia.merchanthub.exception.InvalidSubdomainException;
import com.infomedia.merchanthub.multitenancy.FirstUser;
import com.infomedia.merchanthub.multitenancy.TenancyProperties;
import com.infomedia.merchanthub.multitenancy.TenantDirectoryService;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalises the requested subdomain (trimmed, lower case, whitespace runs as hyphens, anything
 * after the first dot dropped), validates it and appends the configured base domain.
 */
public abstract class AbstractSignUpRequestResolver implements SignUpRequestResolver {

    static final int MAX_SUBDOMAIN_LENGTH = 50;

    private static final Pattern SUBDOMAIN = Pattern.compile("^(?!-)[A-Za-z0-9-]+(?<!-)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TenantDirectoryService directoryService;
    private final TenancyProperties tenancyProperties;

    protected AbstractSignUpRequestResolver(TenantDirectoryService directoryService,
                                            TenancyProperties tenancyProperties) {
        this.directoryService = directoryService;
        this.tenancyProperties = tenancyProperties;
    }

    @Override
    public SignUpCommand resolve(SignUpRequest request) {
        String subdomain = normalizeSubdomain(request.getMerchantSubdomain());

        if (subdomain.isEmpty()) {
            throw new InvalidSubdomainException(String.valueOf(request.getMerchantSubdomain()), "is empty");
        }
        if (subdomain.length() > MAX_SUBDOMAIN_LENGTH) {
            throw new InvalidSubdomainException(subdomain, "is longer than " + MAX_SUBDOMAIN_LENGTH + " characters");
        }
        if (!SUBDOMAIN.matcher(subdomain).matches()) {
            throw new InvalidSubdomainException(subdomain,
                    "may only contain letters, digits and inner hyphens");
        }

        String domain = subdomain + "." + baseDomain();
        if (!directoryService.isDomainUnique(domain)) {
            throw new DuplicateDomainException(domain);
        }

        return new SignUpCommand(
                request.getMerchantName(),
                request.getMerchantDescription(),
                domain,
                new FirstUser(request.getName(), request.getEmail(), request.getPassword())
        );
    }

    static String normalizeSubdomain(String value) {
        if (value == null) {
            return "";
        }
        String normalized = WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        int dot = normalized.indexOf('.');
        return dot >= 0 ? normalized.substring(0, dot) : normalized;
    }

    private String baseDomain() {
        String base = tenancyProperties.getBaseDomain();
        try {
            String host = URI.create("//" + base).getHost();
            return host != null ? host : base;
        } catch (IllegalArgumentException e) {
            return base;
        }
    }
}
