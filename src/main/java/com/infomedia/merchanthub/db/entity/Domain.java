package com.infomedia.merchanthub.db.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Host name bound to a tenant. Unique across all tenants, never updated.
 */
@Entity
@Table(name = "domains", uniqueConstraints = @UniqueConstraint(name = "uk_domains_domain", columnNames = "domain"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Domain {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "domain", length = 255, nullable = false, updatable = false)
    private String domain;

    @Column(name = "tenant_id", length = 36, nullable = false, updatable = false)
    private String tenantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(
            name = "tenant_id",
            insertable = false,
            updatable = false,
            foreignKey = @ForeignKey(name = "fk_domains_tenant")
    )
    private Tenant tenant;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
