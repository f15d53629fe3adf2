package com.infomedia.merchanthub.dto.tenant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DomainAvailabilityDto {
    private String domain;
    private boolean available;
}
