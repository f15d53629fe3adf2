package com.infomedia.merchanthub.dto.user;

import com.infomedia.merchanthub.db.entity.UserStatus;
import com.infomedia.merchanthub.dto.role.RoleDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for {@link com.infomedia.merchanthub.db.entity.User}. Never carries the password hash.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UserDto {
    private Long id;
    private String name;
    private String email;
    private UserStatus status;
    private List<RoleDto> roles;
    private LocalDateTime createdAt;
}
