package com.infomedia.merchanthub.dto.tenant;

import com.infomedia.merchanthub.dto.user.UserDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TenantCreatedDto {
    private TenantDto tenant;
    private UserDto user;
}
