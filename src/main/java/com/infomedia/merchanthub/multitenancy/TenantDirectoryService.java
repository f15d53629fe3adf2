package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.db.entity.Domain;
import com.infomedia.merchanthub.db.entity.Tenant;
import com.infomedia.merchanthub.db.entity.TenantStatus;
import com.infomedia.merchanthub.db.repository.DomainRepository;
import com.infomedia.merchanthub.db.repository.TenantRepository;
import com.infomedia.merchanthub.exception.DuplicateDomainException;
import com.infomedia.merchanthub.exception.TenantNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Central lookup of tenants by domain. Always reads and writes the central schema, so it
 * must not be called while a tenant context is active.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class TenantDirectoryService {

    private final DomainRepository domainRepository;
    private final TenantRepository tenantRepository;

    /**
     * Exact, case sensitive match.
     */
    @Transactional(readOnly = true)
    public boolean isDomainUnique(String domain) {
        requireCentral();
        return !domainRepository.existsByDomain(domain);
    }

    /**
     * @throws TenantNotFoundException when no tenant owns the domain, or its tenant is still being provisioned
     */
    @Transactional(readOnly = true)
    public String resolveTenant(String domain) {
        requireCentral();
        return domainRepository.findTenantIdByDomain(domain, TenantStatus.PENDING)
                .orElseThrow(() -> TenantNotFoundException.forDomain(domain));
    }

    @Transactional(readOnly = true)
    public Tenant getTenant(String tenantId) {
        requireCentral();
        return tenantRepository.findByIdAndStatusNot(tenantId, TenantStatus.PENDING)
                .orElseThrow(() -> TenantNotFoundException.forId(tenantId));
    }

    @Transactional(readOnly = true)
    public List<Tenant> listTenants() {
        requireCentral();
        return tenantRepository.findAllByStatusNotOrderByCreatedAtAsc(TenantStatus.PENDING);
    }

    @Transactional
    public Domain registerDomain(String domain, String tenantId) {
        requireCentral();
        if (domainRepository.existsByDomain(domain)) {
            throw new DuplicateDomainException(domain);
        }
        try {
            return domainRepository.saveAndFlush(Domain.builder()
                    .domain(domain)
                    .tenantId(tenantId)
                    .build());
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent registration of the same domain
            log.debug("Unique constraint rejected domain {}", domain);
            throw new DuplicateDomainException(domain, e);
        }
    }

    @Transactional(readOnly = true)
    public List<String> domainsOf(String tenantId) {
        requireCentral();
        return domainRepository.findAllByTenantId(tenantId).stream()
                .map(Domain::getDomain)
                .toList();
    }

    @Transactional
    public int removeDomains(String tenantId) {
        requireCentral();
        int removed = domainRepository.deleteAllByTenantId(tenantId);
        log.info("Removed {} domain(s) of tenant {}", removed, tenantId);
        return removed;
    }

    private static void requireCentral() {
        String tenant = TenantContext.getTenant();
        if (tenant != null) {
            throw new IllegalStateException("Tenant directory accessed inside the context of tenant '" + tenant + "'");
        }
    }
}
