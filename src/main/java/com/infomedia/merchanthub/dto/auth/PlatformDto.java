package com.infomedia.merchanthub.dto.auth;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PlatformDto {
    private int version;
    private String platform;
    private String message;
}
