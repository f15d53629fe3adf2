package com.infomedia.merchanthub.dto.role;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for {@link com.infomedia.merchanthub.db.entity.Role}
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RoleDto {
    private Long id;
    private String name;
    private String displayName;
    private String description;
    private boolean isEditable;
    private List<PermissionDto> permissions;
}
