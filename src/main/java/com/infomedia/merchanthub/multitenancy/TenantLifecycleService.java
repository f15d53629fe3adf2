package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.component.modeltools.ModelConverter;
import com.infomedia.merchanthub.db.entity.Tenant;
import com.infomedia.merchanthub.db.entity.TenantStatus;
import com.infomedia.merchanthub.db.repository.TenantRepository;
import com.infomedia.merchanthub.dto.tenant.TenantDto;
import com.infomedia.merchanthub.dto.user.UserDto;
import com.infomedia.merchanthub.exception.DuplicateDomainException;
import com.infomedia.merchanthub.exception.InvalidTenantStatusTransitionException;
import com.infomedia.merchanthub.exception.TenantDeletionException;
import com.infomedia.merchanthub.exception.TenantMigrationException;
import com.infomedia.merchanthub.exception.TenantNotFoundException;
import com.infomedia.merchanthub.exception.TenantProvisioningException;
import com.infomedia.merchanthub.seeding.RoleSeeder;
import com.infomedia.merchanthub.seeding.RoleSeedingProperties;
import com.infomedia.merchanthub.service.TenantFileStorageService;
import com.infomedia.merchanthub.service.TenantUserService;
import liquibase.exception.LiquibaseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Creates, migrates, reseeds and deletes tenants.
 * <p>
 * Creation spans two storage systems: the central schema and the new tenant schema. Only the
 * registration is a single central transaction; every later step is undone by compensation
 * if a following step fails, so a failed creation leaves neither a tenant row, a domain nor a
 * schema behind. Callers only ever see an opaque {@link TenantProvisioningException}; the cause
 * and the phase it happened in go to the log. An {@link Error} is rolled back the same way and
 * then rethrown unchanged.
 * <p>
 * None of the methods may run inside a tenant context.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class TenantLifecycleService {

    private final TenantRepository tenantRepository;
    private final TenantDirectoryService directoryService;
    private final SchemaMigrationService schemaMigrationService;
    private final TenantContextManager contextManager;
    private final TenantResourceResolver resourceResolver;
    private final RoleSeeder roleSeeder;
    private final RoleSeedingProperties seedingProperties;
    private final TenantUserService userService;
    private final TenancyProperties tenancyProperties;
    private final TenantStatusPolicy statusPolicy;
    private final TenantCacheEvictor cacheEvictor;
    private final TenantFileStorageService fileStorageService;
    private final TenantJobDispatcher jobDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final ModelConverter modelConverter;

    /**
     * @throws DuplicateDomainException    when the domain is taken; nothing has been written
     * @throws TenantProvisioningException when any later step failed and was rolled back
     */
    public TenantCreationResult createTenant(CreateTenantCommand command) {
        Tenant tenant;
        try {
            tenant = transactionTemplate.execute(status -> register(command));
        } catch (DuplicateDomainException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Registration of domain {} failed. Nothing was written.", command.domain(), e);
            throw new TenantProvisioningException(e);
        }
        String tenantId = tenant.getId();
        TenantResources resources = resourceResolver.resolve(tenantId);
        log.info("Provisioning tenant {} for domain {}", tenantId, command.domain());

        ProvisioningPhase phase = ProvisioningPhase.CREATE_DATABASE;
        boolean databaseCreated = false;
        try {
            schemaMigrationService.createSchema(resources.databaseName());
            databaseCreated = true;

            UserDto user;
            try (TenantScope ignored = contextManager.enter(tenantId)) {
                phase = ProvisioningPhase.MIGRATE;
                schemaMigrationService.migrateCurrentTenant();

                // Seeding may truncate role_user, so it runs before the first user exists
                if (seedingProperties.isEnabled()) {
                    phase = ProvisioningPhase.SEED_ROLES;
                    roleSeeder.seedRoles(seedingProperties.toStructure());
                }

                phase = ProvisioningPhase.CREATE_FIRST_USER;
                user = userService.createUserWithRole(command.firstUser(), tenancyProperties.getElevatedRole());
            }

            phase = ProvisioningPhase.ACTIVATE;
            Tenant activated = transactionTemplate.execute(status -> activate(tenantId));

            log.info("Tenant {} provisioned with status {}", tenantId, activated.getStatus().getValue());
            return new TenantCreationResult(toDto(activated, List.of(command.domain())), user);
        } catch (Throwable e) {
            log.error("Provisioning of tenant {} failed during {}. Rolling back.", tenantId, phase, e);
            compensate(tenantId, resources, databaseCreated);
            if (e instanceof Error) {
                throw (Error) e;
            }
            throw new TenantProvisioningException(e);
        }
    }

    public TenantDto changeStatus(String tenantId, TenantStatus target) {
        return transactionTemplate.execute(status -> {
            Tenant tenant = tenantRepository.findByIdAndStatusNot(tenantId, TenantStatus.PENDING)
                    .orElseThrow(() -> TenantNotFoundException.forId(tenantId));
            if (!tenant.getStatus().canTransitionTo(target)) {
                throw new InvalidTenantStatusTransitionException(tenantId, tenant.getStatus(), target);
            }
            TenantStatus previous = tenant.getStatus();
            tenant.setStatus(target);
            Tenant saved = tenantRepository.save(tenant);
            log.info("Tenant {} moved from {} to {}", tenantId, previous.getValue(), target.getValue());
            return toDto(saved, directoryService.domainsOf(tenantId));
        });
    }

    /**
     * Removes the domains, the database and the record of a tenant, in that order. Cache entries
     * and stored files are cleaned up afterwards on a best effort basis.
     *
     * @throws TenantDeletionException naming the step that failed; earlier steps stay done
     */
    public void deleteTenant(String tenantId) {
        tenantRepository.findByIdAndStatusNot(tenantId, TenantStatus.PENDING)
                .orElseThrow(() -> TenantNotFoundException.forId(tenantId));
        TenantResources resources = resourceResolver.resolve(tenantId);
        log.warn("Deleting tenant {}", tenantId);

        String phase = "removing domains";
        try {
            transactionTemplate.executeWithoutResult(status -> directoryService.removeDomains(tenantId));
            phase = "dropping database";
            schemaMigrationService.dropSchema(resources.databaseName());
            phase = "deleting tenant record";
            transactionTemplate.executeWithoutResult(status -> tenantRepository.deleteById(tenantId));
        } catch (Exception e) {
            log.error("Deleting tenant {} failed while {}", tenantId, phase, e);
            throw new TenantDeletionException(tenantId, phase, e);
        }

        try {
            cacheEvictor.evict(resources.cacheNamespace());
        } catch (RuntimeException e) {
            log.warn("Could not evict cache namespace {} of deleted tenant {}", resources.cacheNamespace(), tenantId, e);
        }
        try {
            fileStorageService.purgeNamespace(resources.fileNamespace());
        } catch (RuntimeException e) {
            log.warn("Could not purge file namespace {} of deleted tenant {}", resources.fileNamespace(), tenantId, e);
        }
        log.info("Tenant {} deleted", tenantId);
    }

    public void migrateTenant(String tenantId) {
        directoryService.getTenant(tenantId);
        try (TenantScope ignored = contextManager.enter(tenantId)) {
            schemaMigrationService.migrateCurrentTenant();
        } catch (SQLException | LiquibaseException e) {
            throw new TenantMigrationException(tenantId, e);
        }
    }

    /**
     * Migrates every provisioned tenant. A failing tenant is logged and skipped.
     */
    public TenantMigrationSummary migrateAllTenants() {
        List<String> migrated = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (Tenant tenant : directoryService.listTenants()) {
            try {
                migrateTenant(tenant.getId());
                migrated.add(tenant.getId());
            } catch (Exception e) {
                log.error("Failed to migrate tenant: {}", tenant.getId(), e);
                failed.add(tenant.getId());
            }
        }

        log.info("Migrated {} tenant(s), {} failed", migrated.size(), failed.size());
        return new TenantMigrationSummary(migrated, failed);
    }

    public CompletableFuture<Void> reseedRoles(String tenantId) {
        directoryService.getTenant(tenantId);
        return jobDispatcher.dispatch(tenantId, "seed-roles", () -> {
            roleSeeder.seedRoles(seedingProperties.toStructure());
            cacheEvictor.evict(TenantContext.requireCurrent().cacheNamespace());
        });
    }

    public TenantDto getTenant(String tenantId) {
        return toDto(directoryService.getTenant(tenantId), directoryService.domainsOf(tenantId));
    }

    public List<TenantDto> listTenants() {
        return directoryService.listTenants().stream()
                .map(tenant -> toDto(tenant, directoryService.domainsOf(tenant.getId())))
                .toList();
    }

    private Tenant register(CreateTenantCommand command) {
        if (!directoryService.isDomainUnique(command.domain())) {
            throw new DuplicateDomainException(command.domain());
        }
        Tenant tenant = tenantRepository.save(Tenant.builder()
                .id(UUID.randomUUID().toString())
                .name(command.name())
                .description(command.description())
                .status(TenantStatus.PENDING)
                .build());
        directoryService.registerDomain(command.domain(), tenant.getId());
        return tenant;
    }

    private Tenant activate(String tenantId) {
        Tenant tenant = tenantRepository.findById(tenantId)
                .orElseThrow(() -> TenantNotFoundException.forId(tenantId));
        tenant.setStatus(statusPolicy.initialStatus(tenant));
        return tenantRepository.save(tenant);
    }

    private void compensate(String tenantId, TenantResources resources, boolean databaseCreated) {
        if (databaseCreated) {
            try {
                schemaMigrationService.dropSchema(resources.databaseName());
            } catch (Exception cleanupException) {
                log.error("CRITICAL: Failed to drop schema {} of failed tenant {}. Manual database cleanup required.",
                        resources.databaseName(), tenantId, cleanupException);
            }
        }
        try {
            transactionTemplate.executeWithoutResult(status -> {
                directoryService.removeDomains(tenantId);
                tenantRepository.deleteById(tenantId);
            });
            log.info("Rollback of tenant {} complete", tenantId);
        } catch (Exception cleanupException) {
            log.error("CRITICAL: Failed to remove directory entries of failed tenant {}. Manual cleanup required.",
                    tenantId, cleanupException);
        }
    }

    private TenantDto toDto(Tenant tenant, List<String> domains) {
        TenantDto dto = modelConverter.map(tenant, TenantDto.class);
        dto.setDomains(domains);
        return dto;
    }
}
