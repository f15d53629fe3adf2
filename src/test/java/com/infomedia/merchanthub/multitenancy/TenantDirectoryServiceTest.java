package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.db.entity.Domain;
import com.infomedia.merchanthub.db.entity.Tenant;
import com.infomedia.merchanthub.db.entity.TenantStatus;
import com.infomedia.merchanthub.db.repository.DomainRepository;
import com.infomedia.merchanthub.db.repository.TenantRepository;
import com.infomedia.merchanthub.exception.DuplicateDomainException;
import com.infomedia.merchanthub.exception.TenantNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TenantDirectoryServiceTest {

    private static final String TENANT_ID = "6f1c2a4e-0d1b-4c55-9a3e-2f7b1e9c0a11";

    private DomainRepository domainRepository;
    private TenantRepository tenantRepository;
    private TenantDirectoryService directoryService;

    @BeforeEach
    void setUp() {
        domainRepository = mock(DomainRepository.class);
        tenantRepository = mock(TenantRepository.class);
        directoryService = new TenantDirectoryService(domainRepository, tenantRepository);
    }

    @AfterEach
    void tearDown() {
        TenantContext.clear();
    }

    @Test
    void domainIsUniqueWhenNoRowHasIt() {
        when(domainRepository.existsByDomain("store1.example.com")).thenReturn(true);

        assertThat(directoryService.isDomainUnique("store1.example.com")).isFalse();
        assertThat(directoryService.isDomainUnique("store2.example.com")).isTrue();
    }

    @Test
    void resolvesTheOwningTenantIgnoringPendingOnes() {
        when(domainRepository.findTenantIdByDomain("store1.example.com", TenantStatus.PENDING))
                .thenReturn(Optional.of(TENANT_ID));

        assertThat(directoryService.resolveTenant("store1.example.com")).isEqualTo(TENANT_ID);
    }

    @Test
    void unknownDomainIsNotFound() {
        when(domainRepository.findTenantIdByDomain("nobody.example.com", TenantStatus.PENDING))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> directoryService.resolveTenant("nobody.example.com"))
                .isInstanceOf(TenantNotFoundException.class)
                .hasMessageContaining("nobody.example.com");
    }

    @Test
    void registersAFreeDomain() {
        when(domainRepository.saveAndFlush(any(Domain.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Domain domain = directoryService.registerDomain("store1.example.com", TENANT_ID);

        assertThat(domain.getDomain()).isEqualTo("store1.example.com");
        assertThat(domain.getTenantId()).isEqualTo(TENANT_ID);
    }

    @Test
    void takenDomainIsADuplicate() {
        when(domainRepository.existsByDomain("store1.example.com")).thenReturn(true);

        assertThatThrownBy(() -> directoryService.registerDomain("store1.example.com", TENANT_ID))
                .isInstanceOf(DuplicateDomainException.class);
        verify(domainRepository, never()).saveAndFlush(any());
    }

    @Test
    void lostUniquenessRaceIsReportedAsADuplicate() {
        when(domainRepository.saveAndFlush(any(Domain.class)))
                .thenThrow(new DataIntegrityViolationException("uk_domains_domain"));

        assertThatThrownBy(() -> directoryService.registerDomain("store1.example.com", TENANT_ID))
                .isInstanceOfSatisfying(DuplicateDomainException.class,
                        e -> assertThat(e.getDomain()).isEqualTo("store1.example.com"))
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void pendingTenantIsNotVisible() {
        when(tenantRepository.findByIdAndStatusNot(TENANT_ID, TenantStatus.PENDING)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> directoryService.getTenant(TENANT_ID)).isInstanceOf(TenantNotFoundException.class);
    }

    @Test
    void listsDomainNamesOfATenant() {
        when(domainRepository.findAllByTenantId(TENANT_ID)).thenReturn(List.of(
                Domain.builder().domain("store1.example.com").tenantId(TENANT_ID).build(),
                Domain.builder().domain("shop.store1.com").tenantId(TENANT_ID).build()));

        assertThat(directoryService.domainsOf(TENANT_ID)).containsExactly("store1.example.com", "shop.store1.com");
    }

    @Test
    void removesEveryDomainOfATenant() {
        when(domainRepository.deleteAllByTenantId(TENANT_ID)).thenReturn(2);

        assertThat(directoryService.removeDomains(TENANT_ID)).isEqualTo(2);
    }

    @Test
    void refusesToRunInsideATenantContext() {
        TenantContextManager manager = new TenantContextManager(new TenantResourceResolver(new TenancyProperties()));

        try (TenantScope ignored = manager.enter(TENANT_ID)) {
            assertThatThrownBy(() -> directoryService.isDomainUnique("store1.example.com"))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> directoryService.listTenants())
                    .isInstanceOf(IllegalStateException.class);
        }
        verify(domainRepository, never()).existsByDomain(any());
    }

    @Test
    void listsProvisionedTenantsOnly() {
        Tenant active = Tenant.builder().id(TENANT_ID).name("Store 1").status(TenantStatus.ACTIVE).build();
        when(tenantRepository.findAllByStatusNotOrderByCreatedAtAsc(TenantStatus.PENDING)).thenReturn(List.of(active));

        assertThat(directoryService.listTenants()).containsExactly(active);
    }
}
