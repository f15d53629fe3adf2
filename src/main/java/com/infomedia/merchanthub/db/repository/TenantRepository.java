package com.infomedia.merchanthub.db.repository;

import com.infomedia.merchanthub.db.entity.Tenant;
import com.infomedia.merchanthub.db.entity.TenantStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TenantRepository extends JpaRepository<Tenant, String> {

    List<Tenant> findAllByStatusNotOrderByCreatedAtAsc(TenantStatus status);

    Optional<Tenant> findByIdAndStatusNot(String id, TenantStatus status);
}
