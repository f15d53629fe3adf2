package com.infomedia.merchanthub.dto.tenant;

import com.infomedia.merchanthub.db.entity.TenantStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for {@link com.infomedia.merchanthub.db.entity.Tenant}
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TenantDto {
    private String id;
    private String name;
    private String description;
    private TenantStatus status;
    private List<String> domains;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
