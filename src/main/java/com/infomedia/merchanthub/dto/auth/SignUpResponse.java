package com.infomedia.merchanthub.dto.auth;

import com.infomedia.merchanthub.dto.tenant.TenantDto;
import com.infomedia.merchanthub.dto.user.UserDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SignUpResponse {
    private String platform;
    private TenantDto merchant;
    private UserDto user;
}
