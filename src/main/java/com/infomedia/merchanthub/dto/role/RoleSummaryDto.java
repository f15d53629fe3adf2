package com.infomedia.merchanthub.dto.role;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Compact role listing for mobile clients: permission slugs only.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
public class RoleSummaryDto {
    private String name;
    private String displayName;
    private List<String> permissions;
}
