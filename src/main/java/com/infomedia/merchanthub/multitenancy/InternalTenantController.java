package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.dto.tenant.CreateTenant;
import com.infomedia.merchanthub.dto.tenant.DomainAvailabilityDto;
import com.infomedia.merchanthub.dto.tenant.TenantCreatedDto;
import com.infomedia.merchanthub.dto.tenant.TenantDto;
import com.infomedia.merchanthub.dto.tenant.UpdateTenantStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/internal/tenant")
@RequiredArgsConstructor
@Tag(name = "Tenant Management")
@SecurityRequirement(name = "Internal_Api_Key")
public class InternalTenantController {

    private final TenantLifecycleService lifecycleService;
    private final TenantDirectoryService directoryService;

    @Operation(summary = "List provisioned tenants")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TenantDto> find() {
        return lifecycleService.listTenants();
    }

    @Operation(summary = "Get a provisioned tenant")
    @GetMapping(value = "/{tenantId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public TenantDto get(@PathVariable String tenantId) {
        return lifecycleService.getTenant(tenantId);
    }

    @Operation(summary = "Check whether a domain is still free")
    @GetMapping(value = "/domain-availability", produces = MediaType.APPLICATION_JSON_VALUE)
    public DomainAvailabilityDto checkDomain(@RequestParam String domain) {
        return new DomainAvailabilityDto(domain, directoryService.isDomainUnique(domain));
    }

    @Operation(summary = "Provision a new tenant with its first user")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public TenantCreatedDto create(@Valid @RequestBody CreateTenant createTenant) {
        TenantCreationResult result = lifecycleService.createTenant(new CreateTenantCommand(
                createTenant.getName(),
                createTenant.getDescription(),
                createTenant.getDomain(),
                new FirstUser(
                        createTenant.getFirstUser().getName(),
                        createTenant.getFirstUser().getEmail(),
                        createTenant.getFirstUser().getPassword()
                )
        ));
        return new TenantCreatedDto(result.tenant(), result.user());
    }

    @Operation(summary = "Activate, deactivate or suspend a tenant")
    @PatchMapping(value = "/{tenantId}/status", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public TenantDto changeStatus(@PathVariable String tenantId, @Valid @RequestBody UpdateTenantStatus update) {
        return lifecycleService.changeStatus(tenantId, update.getStatus());
    }

    @Operation(summary = "Deprovision (Delete) a tenant, its domains and all its data")
    @DeleteMapping("/{tenantId}")
    public ResponseEntity<Void> delete(@PathVariable String tenantId) {
        lifecycleService.deleteTenant(tenantId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Apply pending tenant schema migrations")
    @PostMapping("/{tenantId}/migrate")
    public ResponseEntity<Void> migrate(@PathVariable String tenantId) {
        lifecycleService.migrateTenant(tenantId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Apply pending tenant schema migrations to every tenant")
    @PostMapping(value = "/migrate", produces = MediaType.APPLICATION_JSON_VALUE)
    public TenantMigrationSummary migrateAll() {
        return lifecycleService.migrateAllTenants();
    }

    @Operation(summary = "Reseed the baseline roles of a tenant in the background")
    @PostMapping("/{tenantId}/roles/seed")
    public ResponseEntity<Void> reseedRoles(@PathVariable String tenantId) {
        lifecycleService.reseedRoles(tenantId);
        return ResponseEntity.accepted().build();
    }
}
