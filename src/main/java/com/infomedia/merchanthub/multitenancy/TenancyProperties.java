package com.infomedia.merchanthub.multitenancy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "merchanthub.tenancy")
public class TenancyProperties {

    /**
     * Schema holding the tenant directory. Used whenever no tenant context is active.
     */
    private String centralSchema = "public";

    private String schemaPrefix = "tenant_";

    private String cachePrefix = "tenant:";

    private String bucketPrefix = "merchanthub-";

    private String queuePrefix = "tenant-jobs-";

    /**
     * Sign-up subdomains are registered as {@code subdomain.baseDomain}.
     */
    private String baseDomain = "example.com";

    /**
     * Request paths served inside the context of the tenant that owns the Host domain.
     */
    private List<String> tenantRoutePatterns = new ArrayList<>(List.of("/api/*/merchant/roles/**"));

    /**
     * Role given to the first user of every new tenant.
     */
    private String elevatedRole = "merchant_admin";

    private boolean migrateOnStartup = false;
}
