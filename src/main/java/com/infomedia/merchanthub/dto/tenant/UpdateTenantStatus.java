package com.infomedia.merchanthub.dto.tenant;

import com.infomedia.merchanthub.db.entity.TenantStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class UpdateTenantStatus {

    @NotNull
    private TenantStatus status;
}
