package com.infomedia.merchanthub.db.repository;

import com.infomedia.merchanthub.db.entity.Domain;
import com.infomedia.merchanthub.db.entity.TenantStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DomainRepository extends JpaRepository<Domain, Long> {

    boolean existsByDomain(String domain);

    List<Domain> findAllByTenantId(String tenantId);

    @Query("select d.tenantId from Domain d, Tenant t where t.id = d.tenantId and d.domain = :domain and t.status <> :excluded")
    Optional<String> findTenantIdByDomain(@Param("domain") String domain, @Param("excluded") TenantStatus excluded);

    @Modifying
    @Query("delete from Domain d where d.tenantId = :tenantId")
    int deleteAllByTenantId(@Param("tenantId") String tenantId);
}
