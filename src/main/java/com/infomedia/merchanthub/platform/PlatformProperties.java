package com.infomedia.merchanthub.platform;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "merchanthub.platform")
public class PlatformProperties {

    /**
     * API versions served, in declaration order. The first one is the console fallback.
     */
    private List<Integer> versions = new ArrayList<>(List.of(1));

    /**
     * Platforms accepted in the selector header, in declaration order. The first one is the console fallback.
     */
    private List<Platform> platforms = new ArrayList<>(List.of(Platform.WEB, Platform.MOBILE));

    private String header = "X-Platform";
}
